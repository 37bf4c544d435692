// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.tools.mapreduce.Partitioner;

import java.util.List;
import java.util.Map;

/**
 * The intermediate key-value store of one MapReduce run: a fixed number of independently locked
 * {@link Partition}s and the {@link Partitioner} that routes keys to them.
 *
 * <p>{@link #emit} may be called from any number of map jobs at once. The reduce-side operations
 * ({@link #getNext}, {@link #headKey}, {@link #discard}) are unsynchronized and may only be used
 * after the map phase has finished, by the single reduce job that owns the partition.
 */
public final class PartitionStore {

  private final Partitioner partitioner;
  private final ImmutableList<Partition> partitions;

  public PartitionStore(int numPartitions, Partitioner partitioner) {
    checkArgument(numPartitions >= 0, "numPartitions must not be negative: %s", numPartitions);
    this.partitioner = checkNotNull(partitioner, "Null partitioner");
    ImmutableList.Builder<Partition> builder = ImmutableList.builder();
    for (int i = 0; i < numPartitions; i++) {
      builder.add(new Partition(i));
    }
    this.partitions = builder.build();
  }

  public int getPartitionCount() {
    return partitions.size();
  }

  /**
   * Returns the partition that owns {@code key}.
   *
   * @throws IllegalStateException if there are no partitions, or the partitioner returned an index
   *         out of range
   */
  public int getPartition(String key) {
    checkState(!partitions.isEmpty(), "No partitions");
    int index = partitioner.getPartition(key, partitions.size());
    checkState(index >= 0 && index < partitions.size(),
        "%s returned partition %s for key %s, expected [0, %s)", partitioner, index, key,
        partitions.size());
    return index;
  }

  /**
   * Stores a copy of the pair in the partition owning {@code key}. Ignored if {@code key} or
   * {@code value} is null or there are no partitions.
   *
   * @return the bytes added to the owning partition's count, or 0 if the pair was ignored
   */
  public long emit(String key, String value) {
    if (key == null || value == null || partitions.isEmpty()) {
      return 0;
    }
    return partitions.get(getPartition(key)).insert(key, value);
  }

  /**
   * Removes and returns the next value for {@code key} in partition {@code partition}. Returns
   * {@code null} when the partition's head pair does not have this key (the key is exhausted), when
   * {@code key} is null, or when {@code partition} is out of range.
   */
  public String getNext(String key, int partition) {
    if (key == null || partition < 0 || partition >= partitions.size()) {
      return null;
    }
    return partitions.get(partition).pollValue(key);
  }

  /**
   * Returns the smallest key left in {@code partition}, or {@code null} once it is empty.
   */
  public String headKey(int partition) {
    checkElementIndex(partition, partitions.size());
    return partitions.get(partition).headKey();
  }

  /**
   * Drops the values left for {@code key} if it is the head key of {@code partition}.
   *
   * @return the number of values dropped
   */
  public int discard(String key, int partition) {
    checkElementIndex(partition, partitions.size());
    return partitions.get(partition).discard(key);
  }

  /**
   * Returns the bytes ever emitted into {@code partition}.
   */
  public long getBytes(int partition) {
    checkElementIndex(partition, partitions.size());
    return partitions.get(partition).getBytes();
  }

  /**
   * Returns every partition's byte count, indexed by partition.
   */
  public List<Long> getPartitionBytes() {
    ImmutableList.Builder<Long> out = ImmutableList.builder();
    for (Partition partition : partitions) {
      out.add(partition.getBytes());
    }
    return out.build();
  }

  /**
   * Returns the number of pairs currently held by {@code partition}.
   */
  public int size(int partition) {
    checkElementIndex(partition, partitions.size());
    return partitions.get(partition).size();
  }

  /**
   * Returns the pairs currently held by {@code partition}, in consumption order.
   */
  public List<Map.Entry<String, String>> snapshot(int partition) {
    checkElementIndex(partition, partitions.size());
    return partitions.get(partition).snapshot();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + partitions.size() + " partitions, " + partitioner
        + ")";
  }
}
