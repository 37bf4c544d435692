// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl.pool;

import java.util.ArrayList;
import java.util.List;

/**
 * Jobs kept in ascending cost order at all times. Insertion places a job immediately before the
 * first queued job whose cost is greater than or equal to its own, so among equal costs the job
 * enqueued last is dequeued first.
 *
 * <p>Not thread-safe; {@link WorkerPool} guards it with its lock.
 */
final class JobQueue {

  private final List<Job> jobs = new ArrayList<>();

  void add(Job job) {
    jobs.add(insertionPoint(job.getCost()), job);
  }

  /**
   * Removes and returns the cheapest job, or {@code null} if the queue is empty.
   */
  Job poll() {
    return jobs.isEmpty() ? null : jobs.remove(0);
  }

  boolean isEmpty() {
    return jobs.isEmpty();
  }

  int size() {
    return jobs.size();
  }

  /**
   * Removes all queued jobs and returns how many were dropped.
   */
  int clear() {
    int dropped = jobs.size();
    jobs.clear();
    return dropped;
  }

  /**
   * Returns the costs of the queued jobs, head first.
   */
  long[] costs() {
    long[] costs = new long[jobs.size()];
    for (int i = 0; i < costs.length; i++) {
      costs[i] = jobs.get(i).getCost();
    }
    return costs;
  }

  // Lowest index whose cost is >= cost.
  private int insertionPoint(long cost) {
    int low = 0;
    int high = jobs.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (jobs.get(mid).getCost() < cost) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + jobs.size() + " jobs)";
  }
}
