// Copyright 2011 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Specification for a MapReduce job. The values here affect what computation is performed in the
 * MapReduce and its side-effects, but not how it is executed; see {@link MapReduceSettings} for
 * that.
 *
 */
public final class MapReduceSpecification {

  public static final String DEFAULT_JOB_NAME = "MapReduceJob";

  /**
   * Builder for {@link MapReduceSpecification}.
   */
  public static class Builder {

    private String jobName = DEFAULT_JOB_NAME;
    private List<String> inputs = ImmutableList.of();
    private Mapper mapper;
    private Reducer reducer;

    public Builder() {}

    public Builder(List<String> inputs, Mapper mapper, Reducer reducer) {
      setInputs(inputs);
      this.mapper = mapper;
      this.reducer = reducer;
    }

    /**
     * @param jobName a descriptive name for the job, used as a prefix of the run id and of the
     *        worker thread names
     */
    public Builder setJobName(String jobName) {
      this.jobName = checkNotNull(jobName, "Null jobName");
      return this;
    }

    /**
     * @param inputs the input units, one map job each. May be empty; may not contain null.
     */
    public Builder setInputs(List<String> inputs) {
      this.inputs = ImmutableList.copyOf(checkNotNull(inputs, "Null inputs"));
      return this;
    }

    /**
     * @param mapper called once for every input unit
     */
    public Builder setMapper(Mapper mapper) {
      this.mapper = mapper;
      return this;
    }

    /**
     * @param reducer called once for every distinct intermediate key
     */
    public Builder setReducer(Reducer reducer) {
      this.reducer = reducer;
      return this;
    }

    public MapReduceSpecification build() {
      return new MapReduceSpecification(this);
    }
  }

  private final String jobName;
  private final ImmutableList<String> inputs;
  private final Mapper mapper;
  private final Reducer reducer;

  private MapReduceSpecification(Builder builder) {
    jobName = builder.jobName;
    inputs = ImmutableList.copyOf(builder.inputs);
    mapper = checkNotNull(builder.mapper, "Null mapper");
    reducer = checkNotNull(builder.reducer, "Null reducer");
  }

  public String getJobName() {
    return jobName;
  }

  public List<String> getInputs() {
    return inputs;
  }

  public Mapper getMapper() {
    return mapper;
  }

  public Reducer getReducer() {
    return reducer;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + jobName + ", " + inputs.size() + " inputs, "
        + mapper + ", " + reducer + ")";
  }
}
