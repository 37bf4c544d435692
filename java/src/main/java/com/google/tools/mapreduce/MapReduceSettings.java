// Copyright 2011 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Preconditions;
import com.google.tools.mapreduce.impl.FileSizeCostEstimator;
import com.google.tools.mapreduce.impl.HashingPartitioner;

/**
 * Settings that affect how a MapReduce is executed. May affect performance and resource usage,
 * but should not affect the result (unless the result is dependent on the performance or resource
 * usage of the computation). The partition count is the exception: it decides which keys share a
 * reducer.
 *
 */
public class MapReduceSettings {

  public static final int DEFAULT_WORKER_COUNT = 5;
  public static final int DEFAULT_PARTITION_COUNT = 10;

  private final int workerCount;
  private final int partitionCount;
  private final Partitioner partitioner;
  private final InputCostEstimator inputCostEstimator;

  /**
   * Builder for {@link MapReduceSettings}.
   */
  public static class Builder {

    private int workerCount = DEFAULT_WORKER_COUNT;
    private int partitionCount = DEFAULT_PARTITION_COUNT;
    private Partitioner partitioner = new HashingPartitioner();
    private InputCostEstimator inputCostEstimator = new FileSizeCostEstimator();

    public Builder() {}

    public Builder(MapReduceSettings settings) {
      this.workerCount = settings.workerCount;
      this.partitionCount = settings.partitionCount;
      this.partitioner = settings.partitioner;
      this.inputCostEstimator = settings.inputCostEstimator;
    }

    /**
     * Sets the number of worker threads that run map and reduce jobs. Defaults to
     * {@value #DEFAULT_WORKER_COUNT}.
     */
    public Builder setWorkerCount(int workerCount) {
      Preconditions.checkArgument(workerCount > 0, "workerCount must be positive: %s",
          workerCount);
      this.workerCount = workerCount;
      return this;
    }

    /**
     * Sets the number of partitions of the intermediate key space, which is also the number of
     * reduce jobs. Zero is allowed; every emitted pair is then dropped. Defaults to
     * {@value #DEFAULT_PARTITION_COUNT}.
     */
    public Builder setPartitionCount(int partitionCount) {
      Preconditions.checkArgument(partitionCount >= 0, "partitionCount must not be negative: %s",
          partitionCount);
      this.partitionCount = partitionCount;
      return this;
    }

    /**
     * Sets how keys are assigned to partitions. Defaults to {@link HashingPartitioner}.
     */
    public Builder setPartitioner(Partitioner partitioner) {
      this.partitioner = checkNotNull(partitioner, "Null partitioner");
      return this;
    }

    /**
     * Sets how map jobs are ordered. Defaults to {@link FileSizeCostEstimator}, which treats
     * every input as a file path.
     */
    public Builder setInputCostEstimator(InputCostEstimator inputCostEstimator) {
      this.inputCostEstimator = checkNotNull(inputCostEstimator, "Null inputCostEstimator");
      return this;
    }

    public MapReduceSettings build() {
      return new MapReduceSettings(this);
    }
  }

  private MapReduceSettings(Builder builder) {
    workerCount = builder.workerCount;
    partitionCount = builder.partitionCount;
    partitioner = builder.partitioner;
    inputCostEstimator = builder.inputCostEstimator;
  }

  public int getWorkerCount() {
    return workerCount;
  }

  public int getPartitionCount() {
    return partitionCount;
  }

  public Partitioner getPartitioner() {
    return partitioner;
  }

  public InputCostEstimator getInputCostEstimator() {
    return inputCostEstimator;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "("
        + "workerCount=" + workerCount + ", "
        + "partitionCount=" + partitionCount + ", "
        + "partitioner=" + partitioner + ", "
        + "inputCostEstimator=" + inputCostEstimator + ")";
  }
}
