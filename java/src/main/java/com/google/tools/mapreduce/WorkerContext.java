// Copyright 2011 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce;

/**
 * Context shared by every job of one phase of a MapReduce run.
 */
public interface WorkerContext {

  /**
   * Returns the id of the run.
   */
  String getJobId();

  /**
   * Returns the number of partitions of the intermediate key space.
   */
  int getPartitionCount();

  /**
   * Returns a {@link Counters} object for doing simple aggregate calculations.
   */
  Counters getCounters();

  /**
   * Returns the {@link Counter} with the given name.
   */
  Counter getCounter(String name);

  /**
   * Increments the {@link Counter} with the given name by {@code delta}.
   */
  void incrementCounter(String name, long delta);

  /**
   * Increments the {@link Counter} with the given name by 1.
   */
  void incrementCounter(String name);
}
