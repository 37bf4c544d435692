// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl.pool;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A unit of work scheduled on a {@link WorkerPool}: an opaque callback and the cost used to order
 * it in the queue. The cost has no meaning to the pool beyond ordering.
 */
final class Job {

  private final Runnable task;
  private final long cost;

  Job(Runnable task, long cost) {
    this.task = checkNotNull(task, "Null task");
    this.cost = cost;
  }

  Runnable getTask() {
    return task;
  }

  long getCost() {
    return cost;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + task + ", cost=" + cost + ")";
  }
}
