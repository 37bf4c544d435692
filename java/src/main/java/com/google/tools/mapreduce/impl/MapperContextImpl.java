// Copyright 2012 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import static com.google.tools.mapreduce.CounterNames.EMITTED_BYTES;
import static com.google.tools.mapreduce.CounterNames.EMITTED_PAIRS;

import com.google.tools.mapreduce.Counters;
import com.google.tools.mapreduce.MapperContext;

/**
 * Routes emitted pairs into the run's {@link PartitionStore}.
 */
class MapperContextImpl extends BaseContext implements MapperContext {

  MapperContextImpl(String jobId, PartitionStore store, Counters counters) {
    super(jobId, store, counters);
  }

  @Override
  public void emit(String key, String value) {
    long bytes = getStore().emit(key, value);
    if (bytes > 0) {
      incrementCounter(EMITTED_PAIRS);
      incrementCounter(EMITTED_BYTES, bytes);
    }
  }
}
