// Copyright 2011 Google Inc. All Rights Reserved.
package com.google.tools.mapreduce;

/**
 * Built-in counter names.
 *
 */
public final class CounterNames {

  /**
   * Number of times map function was called.
   */
  public static final String MAPPER_CALLS = "mapper-calls";

  /**
   * Total time in milliseconds spent in map function, summed over all workers.
   */
  public static final String MAPPER_WALLTIME_MILLIS = "mapper-walltime-msec";

  /**
   * Number of times reduce function was called.
   */
  public static final String REDUCER_CALLS = "reducer-calls";

  /**
   * Total time in milliseconds spent in reduce function, summed over all workers.
   */
  public static final String REDUCER_WALLTIME_MILLIS = "reducer-walltime-msec";

  /**
   * Number of key-value pairs accepted by emit.
   */
  public static final String EMITTED_PAIRS = "emitted-pairs";

  /**
   * Bytes accounted for the emitted pairs, as added to the partitions' byte counts.
   */
  public static final String EMITTED_BYTES = "emitted-bytes";

  private CounterNames() {}
}
