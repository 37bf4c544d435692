// Copyright 2011 Google Inc. All Rights Reserved.
package com.google.tools.mapreduce;

/**
 * Counter is an integer variable that is aggregated across all map and reduce jobs of a run. Can
 * be used to do statistical calculations. Safe to increment from concurrently running jobs.
 *
 */
public interface Counter {

  /**
   * @return counter name.
   */
  String getName();

  /**
   * @return counter value, including contributions from every job that has incremented it so far.
   */
  long getValue();

  /**
   * Increment counter.
   *
   * @param delta increment delta. Can be negative.
   */
  void increment(long delta);
}
