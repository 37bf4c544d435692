// Copyright 2012 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce;

import java.util.List;

/**
 * Result of a {@link MapReduceJob}. The computed data itself is whatever the {@link Reducer}
 * produced; this only reports on the run.
 *
 */
public interface MapReduceResult {

  /**
   * Returns the id of the run.
   */
  String getJobId();

  /**
   * Returns the counter values at the end of the MapReduce.
   */
  Counters getCounters();

  /**
   * Returns, for each partition, the number of bytes accounted to it during the map phase.
   */
  List<Long> getPartitionBytes();
}
