package com.google.tools.mapreduce;

/**
 * Used to determine which partition an intermediate key belongs to.
 * Every value emitted for a key goes to the partition returned here, and each partition is
 * reduced by a single reducer. The only criteria that is required is that the same key and
 * partition count always map to the same partition.
 *
 */
public interface Partitioner {

  /**
   * @param key a non-null intermediate key
   * @param numPartitions the number of partitions, always positive
   * @return a number between 0 and numPartitions-1 inclusive
   */
  int getPartition(String key, int numPartitions);
}
