package com.google.tools.mapreduce.impl;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.tools.mapreduce.Counter;
import com.google.tools.mapreduce.Counters;
import com.google.tools.mapreduce.WorkerContext;

/**
 * Base class for all Context implementations.
 */
abstract class BaseContext implements WorkerContext {

  private final String jobId;
  private final PartitionStore store;
  private final Counters counters;

  BaseContext(String jobId, PartitionStore store, Counters counters) {
    this.jobId = checkNotNull(jobId, "Null jobId");
    this.store = checkNotNull(store, "Null store");
    this.counters = checkNotNull(counters, "Null counters");
  }

  @Override
  public String getJobId() {
    return jobId;
  }

  @Override
  public int getPartitionCount() {
    return store.getPartitionCount();
  }

  @Override
  public Counters getCounters() {
    return counters;
  }

  @Override
  public Counter getCounter(String name) {
    return counters.getCounter(name);
  }

  @Override
  public void incrementCounter(String name, long delta) {
    counters.getCounter(name).increment(delta);
  }

  @Override
  public void incrementCounter(String name) {
    incrementCounter(name, 1);
  }

  PartitionStore getStore() {
    return store;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + jobId + ")";
  }
}
