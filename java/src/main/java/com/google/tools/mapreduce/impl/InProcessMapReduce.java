// Copyright 2011 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.primitives.Longs;
import com.google.tools.mapreduce.Counters;
import com.google.tools.mapreduce.InputCostEstimator;
import com.google.tools.mapreduce.MapReduceJobException;
import com.google.tools.mapreduce.MapReduceResult;
import com.google.tools.mapreduce.MapReduceSettings;
import com.google.tools.mapreduce.MapReduceSpecification;
import com.google.tools.mapreduce.Mapper;
import com.google.tools.mapreduce.Reducer;
import com.google.tools.mapreduce.impl.pool.WorkerPool;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Runs a MapReduce on a pool of threads in the current process.
 *
 * <p>One instance is one run and owns everything the run needs: the {@link PartitionStore}, the
 * {@link WorkerPool} and the counters. Map jobs (one per input) are started in ascending order of
 * the input's estimated cost, reduce jobs (one per partition) in ascending order of the bytes
 * emitted into the partition. The pool's quiescence barrier separates the phases, so every emit
 * has completed before any reducer reads a partition.
 *
 */
public class InProcessMapReduce {

  private static final Logger log = Logger.getLogger(InProcessMapReduce.class.getName());

  private static final AtomicInteger RUN_SEQUENCE = new AtomicInteger();

  static final String MAP_STAGE = "map";
  static final String REDUCE_STAGE = "reduce";

  private static final Comparator<Map.Entry<?, Long>> BY_COST =
      new Comparator<Map.Entry<?, Long>>() {
        @Override
        public int compare(Map.Entry<?, Long> a, Map.Entry<?, Long> b) {
          return Longs.compare(a.getValue(), b.getValue());
        }
      };

  private final String id;
  private final MapReduceSpecification mrSpec;
  private final MapReduceSettings settings;
  private final PartitionStore store;
  private final Counters counters = new CountersImpl();

  public InProcessMapReduce(String id, MapReduceSpecification mrSpec,
      MapReduceSettings settings) {
    this.id = checkNotNull(id, "Null id");
    this.mrSpec = checkNotNull(mrSpec, "Null mrSpec");
    this.settings = checkNotNull(settings, "Null settings");
    this.store = new PartitionStore(settings.getPartitionCount(), settings.getPartitioner());
  }

  @Override
  public String toString() {
    return "InProcessMapReduce(" + id + ")";
  }

  /**
   * Runs both phases and tears the pool down, whether or not they succeed.
   *
   * @throws IllegalArgumentException if the settings ask for no worker threads
   * @throws MapReduceJobException if a mapper or reducer threw, or the calling thread was
   *         interrupted while waiting for a phase
   */
  public MapReduceResult run() {
    log.info(this + " started: " + mrSpec + ", " + settings);
    WorkerPool pool = WorkerPool.create(id, settings.getWorkerCount());
    try {
      map(pool);
      reduce(pool);
    } finally {
      pool.shutdown();
    }
    log.info(this + " finished, counters=" + counters);
    return new MapReduceResultImpl(id, counters, store.getPartitionBytes());
  }

  void map(WorkerPool pool) {
    log.info("Map phase started");
    Mapper mapper = mrSpec.getMapper();
    mapper.setContext(new MapperContextImpl(id, store, counters));
    mapper.beginPhase();
    List<Map.Entry<String, Long>> inputs =
        orderInputs(mrSpec.getInputs(), settings.getInputCostEstimator());
    WorkerTask rejected = null;
    for (Map.Entry<String, Long> input : inputs) {
      MapTask task = new MapTask(id, counters, mapper, input.getKey());
      if (!pool.addJob(task, input.getValue())) {
        rejected = task;
        break;
      }
    }
    awaitPhase(pool, MAP_STAGE, rejected);
    mapper.endPhase();
    log.info("Map phase completed, partition bytes=" + store.getPartitionBytes());
  }

  void reduce(WorkerPool pool) {
    log.info("Reduce phase started");
    Reducer reducer = mrSpec.getReducer();
    reducer.setContext(new ReducerContextImpl(id, store, counters));
    reducer.beginPhase();
    WorkerTask rejected = null;
    for (Map.Entry<Integer, Long> partition : orderPartitions(store.getPartitionBytes())) {
      ReduceTask task = new ReduceTask(id, counters, store, reducer, partition.getKey());
      if (!pool.addJob(task, partition.getValue())) {
        rejected = task;
        break;
      }
    }
    awaitPhase(pool, REDUCE_STAGE, rejected);
    reducer.endPhase();
    log.info("Reduce phase completed");
  }

  /**
   * Waits for the phase's jobs and fails the run if one of them threw or was not accepted.
   */
  private void awaitPhase(WorkerPool pool, String stage, WorkerTask rejected) {
    try {
      pool.awaitQuiescence();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MapReduceJobException(stage, e);
    }
    Throwable failure = pool.getFailure();
    if (failure != null) {
      throw new MapReduceJobException(stage, failure);
    }
    if (rejected != null) {
      throw new MapReduceJobException(stage,
          new IllegalStateException(pool + " rejected " + rejected));
    }
  }

  PartitionStore getStore() {
    return store;
  }

  /**
   * Pairs each input with its estimated cost and sorts ascending by cost. Inputs of equal cost
   * keep their given order.
   */
  @VisibleForTesting
  static List<Map.Entry<String, Long>> orderInputs(List<String> inputs,
      InputCostEstimator estimator) {
    List<Map.Entry<String, Long>> out = Lists.newArrayListWithCapacity(inputs.size());
    for (String input : inputs) {
      out.add(Maps.immutableEntry(input, Math.max(0, estimator.estimateCost(input))));
    }
    Collections.sort(out, BY_COST);
    return out;
  }

  /**
   * Pairs each partition index with its byte count and sorts ascending by bytes. Partitions of
   * equal size keep index order.
   */
  @VisibleForTesting
  static List<Map.Entry<Integer, Long>> orderPartitions(List<Long> partitionBytes) {
    List<Map.Entry<Integer, Long>> out = Lists.newArrayListWithCapacity(partitionBytes.size());
    for (int i = 0; i < partitionBytes.size(); i++) {
      out.add(Maps.immutableEntry(i, partitionBytes.get(i)));
    }
    Collections.sort(out, BY_COST);
    return out;
  }

  @VisibleForTesting
  static String newJobId(String jobName) {
    return jobName + "-" + RUN_SEQUENCE.incrementAndGet();
  }

  public static MapReduceResult runMapReduce(MapReduceSpecification mrSpec,
      MapReduceSettings settings) {
    return new InProcessMapReduce(newJobId(mrSpec.getJobName()), mrSpec, settings).run();
  }
}
