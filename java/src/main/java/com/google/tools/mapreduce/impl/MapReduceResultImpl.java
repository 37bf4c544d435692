// Copyright 2012 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.tools.mapreduce.Counters;
import com.google.tools.mapreduce.MapReduceResult;

import java.util.List;

/**
 * Implementation of {@link MapReduceResult}.
 *
 */
public class MapReduceResultImpl implements MapReduceResult {

  private final String jobId;
  private final Counters counters;
  private final ImmutableList<Long> partitionBytes;

  public MapReduceResultImpl(String jobId, Counters counters, List<Long> partitionBytes) {
    this.jobId = checkNotNull(jobId, "Null jobId");
    this.counters = checkNotNull(counters, "Null counters");
    this.partitionBytes = ImmutableList.copyOf(partitionBytes);
  }

  @Override
  public String getJobId() {
    return jobId;
  }

  @Override
  public Counters getCounters() {
    return counters;
  }

  @Override
  public List<Long> getPartitionBytes() {
    return partitionBytes;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "("
        + jobId + ", "
        + counters + ", "
        + partitionBytes + ")";
  }
}
