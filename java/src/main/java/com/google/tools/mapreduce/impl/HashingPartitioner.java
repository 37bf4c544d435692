package com.google.tools.mapreduce.impl;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Charsets;
import com.google.tools.mapreduce.Partitioner;

/**
 * Assigns keys to partitions with the djb2 string hash ({@code h = h * 33 + b}, starting at 5381)
 * over the key's UTF-8 bytes, reduced modulo the partition count. Bytes are added as unsigned
 * values and arithmetic is unsigned 64 bit, so the result only depends on the key and the
 * partition count, never on the platform.
 *
 */
public class HashingPartitioner implements Partitioner {

  private static final long INITIAL_HASH = 5381;

  @Override
  public int getPartition(String key, int numPartitions) {
    checkNotNull(key, "Null key");
    checkArgument(numPartitions > 0, "numPartitions must be positive: %s", numPartitions);
    return (int) Long.remainderUnsigned(hash(key), numPartitions);
  }

  static long hash(String key) {
    long hash = INITIAL_HASH;
    for (byte b : key.getBytes(Charsets.UTF_8)) {
      hash = (hash << 5) + hash + (b & 0xff);
    }
    return hash;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName();
  }
}
