// Copyright 2011 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce;

import com.google.tools.mapreduce.impl.InProcessMapReduce;

import java.util.List;

/**
 * Runs a MapReduce on a fixed pool of threads in the current process.
 *
 * <p>The mapper is called once per input, the reducer once per distinct key emitted. Intermediate
 * pairs are held in memory, hash partitioned, and each partition is reduced by a single job. The
 * call returns after every reducer has returned; the results are whatever the reducer recorded.
 *
 * <p>Example:
 * <pre>{@code
 * MapReduceResult result = MapReduceJob.run(files, new WordCountMapper(),
 *     new CountingReducer(), 5, 10);
 * }</pre>
 *
 */
public final class MapReduceJob {

  private MapReduceJob() {}

  /**
   * Runs the MapReduce described by {@code specification}.
   *
   * @throws MapReduceJobException if a mapper or reducer call throws; the cause is the exception
   *         thrown by the first failing call
   */
  public static MapReduceResult run(MapReduceSpecification specification,
      MapReduceSettings settings) {
    return InProcessMapReduce.runMapReduce(specification, settings);
  }

  /**
   * Runs a MapReduce over {@code inputs} with default settings apart from the number of worker
   * threads and partitions. Map jobs are ordered by the size of the file each input names.
   *
   * @throws IllegalArgumentException if {@code numWorkers} is not positive or
   *         {@code numPartitions} is negative
   */
  public static MapReduceResult run(List<String> inputs, Mapper mapper, Reducer reducer,
      int numWorkers, int numPartitions) {
    MapReduceSpecification specification =
        new MapReduceSpecification.Builder(inputs, mapper, reducer).build();
    MapReduceSettings settings = new MapReduceSettings.Builder()
        .setWorkerCount(numWorkers)
        .setPartitionCount(numPartitions)
        .build();
    return run(specification, settings);
  }
}
