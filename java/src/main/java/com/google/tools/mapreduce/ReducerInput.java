// Copyright 2011 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce;

import com.google.common.collect.AbstractIterator;

/**
 * Enumerates the reducer's input values for a given key.
 *
 */
public abstract class ReducerInput extends AbstractIterator<String> {

  /**
   * Returns the next value, or {@code null} when there are no more.
   */
  protected abstract String fetchNext();

  @Override
  protected final String computeNext() {
    String value = fetchNext();
    return value == null ? endOfData() : value;
  }
}
