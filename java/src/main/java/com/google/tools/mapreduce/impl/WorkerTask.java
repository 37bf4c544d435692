// Copyright 2012 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.base.Stopwatch;
import com.google.tools.mapreduce.Counters;

/**
 * A job submitted to the worker pool on behalf of a mapper or reducer. Times the calls into user
 * code and records them in the run's counters. Exceptions from user code are not caught here; the
 * pool records them and the run fails.
 */
abstract class WorkerTask implements Runnable {

  private final String jobId;
  private final Counters counters;
  private final String workerCallsCounterName;
  private final String workerMillisCounterName;

  WorkerTask(String jobId, Counters counters, String workerCallsCounterName,
      String workerMillisCounterName) {
    this.jobId = checkNotNull(jobId, "Null jobId");
    this.counters = checkNotNull(counters, "Null counters");
    this.workerCallsCounterName =
        checkNotNull(workerCallsCounterName, "Null workerCallsCounterName");
    this.workerMillisCounterName =
        checkNotNull(workerMillisCounterName, "Null workerMillisCounterName");
  }

  /**
   * Describes what this task works on, for logs.
   */
  protected abstract String describe();

  /**
   * Starts timing one call into the worker.
   */
  protected final Stopwatch beginWorkerCall() {
    return Stopwatch.createStarted();
  }

  /**
   * Records one finished call into the worker, timed by {@code stopwatch}.
   */
  protected final void endWorkerCall(Stopwatch stopwatch) {
    stopwatch.stop();
    counters.getCounter(workerCallsCounterName).increment(1);
    counters.getCounter(workerMillisCounterName).increment(stopwatch.elapsed(MILLISECONDS));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + jobId + ", " + describe() + ")";
  }
}
