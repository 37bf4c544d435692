// Copyright 2011 Google Inc. All Rights Reserved.
package com.google.tools.mapreduce;


/**
 * A context for mapper execution. Provides everything that might be needed by a mapper function.
 *
 */
public interface MapperContext extends WorkerContext {

  /**
   * Emits a key and a value to the partition that owns {@code key}. Both are retained as given;
   * a {@code null} key or value is silently ignored.
   */
  void emit(String key, String value);
}
