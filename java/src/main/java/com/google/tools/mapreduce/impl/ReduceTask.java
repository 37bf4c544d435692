// Copyright 2012 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.tools.mapreduce.CounterNames.REDUCER_CALLS;
import static com.google.tools.mapreduce.CounterNames.REDUCER_WALLTIME_MILLIS;

import com.google.common.base.Stopwatch;
import com.google.tools.mapreduce.Counters;
import com.google.tools.mapreduce.Reducer;

import java.util.logging.Logger;

/**
 * Drives the reducer over one partition: while the partition holds pairs, calls the reducer with
 * the smallest remaining key, which pulls that key's values until they run out. Values the
 * reducer leaves unread are dropped so that every key is reduced exactly once.
 */
class ReduceTask extends WorkerTask {

  private static final Logger log = Logger.getLogger(ReduceTask.class.getName());

  private final PartitionStore store;
  private final Reducer reducer;
  private final int partition;

  ReduceTask(String jobId, Counters counters, PartitionStore store, Reducer reducer,
      int partition) {
    super(jobId, counters, REDUCER_CALLS, REDUCER_WALLTIME_MILLIS);
    this.store = checkNotNull(store, "Null store");
    this.reducer = checkNotNull(reducer, "Null reducer");
    this.partition = partition;
  }

  @Override
  public void run() {
    String key;
    while ((key = store.headKey(partition)) != null) {
      Stopwatch stopwatch = beginWorkerCall();
      reducer.reduce(key, partition);
      endWorkerCall(stopwatch);
      int unread = store.discard(key, partition);
      if (unread > 0) {
        log.warning(reducer + " returned with " + unread + " unread values for key " + key
            + " in partition " + partition + "; dropped them");
      }
    }
  }

  @Override
  protected String describe() {
    return "partition " + partition;
  }
}
