// Copyright 2012 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.tools.mapreduce.CounterNames.MAPPER_CALLS;
import static com.google.tools.mapreduce.CounterNames.MAPPER_WALLTIME_MILLIS;

import com.google.common.base.Stopwatch;
import com.google.tools.mapreduce.Counters;
import com.google.tools.mapreduce.Mapper;

/**
 * Calls the mapper on one input unit.
 */
class MapTask extends WorkerTask {

  private final Mapper mapper;
  private final String input;

  MapTask(String jobId, Counters counters, Mapper mapper, String input) {
    super(jobId, counters, MAPPER_CALLS, MAPPER_WALLTIME_MILLIS);
    this.mapper = checkNotNull(mapper, "Null mapper");
    this.input = checkNotNull(input, "Null input");
  }

  @Override
  public void run() {
    Stopwatch stopwatch = beginWorkerCall();
    mapper.map(input);
    endWorkerCall(stopwatch);
  }

  @Override
  protected String describe() {
    return input;
  }
}
