// Copyright 2012 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import com.google.tools.mapreduce.Counters;
import com.google.tools.mapreduce.ReducerContext;

/**
 * Hands out values from the run's {@link PartitionStore}.
 */
class ReducerContextImpl extends BaseContext implements ReducerContext {

  ReducerContextImpl(String jobId, PartitionStore store, Counters counters) {
    super(jobId, store, counters);
  }

  @Override
  public String getNext(String key, int partition) {
    return getStore().getNext(key, partition);
  }
}
