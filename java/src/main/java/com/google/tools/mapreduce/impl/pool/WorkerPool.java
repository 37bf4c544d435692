// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl.pool;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;

import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A fixed set of long-lived worker threads that execute opaque jobs taken from a cost-ordered
 * queue. Cheaper jobs are started first, which approximates shortest-job-first scheduling when the
 * cost is an estimate of the job's duration.
 *
 * <p>The pool knows nothing about MapReduce. Callers submit jobs with {@link #addJob}, block until
 * every submitted job has finished with {@link #awaitQuiescence}, and finally release the threads
 * with {@link #shutdown}.
 *
 * <p>A job that throws does not kill its worker thread. The first failure is recorded and returned
 * by {@link #getFailure}, every job still queued at that point is dropped, and further submissions
 * are rejected. Jobs that are already running finish normally, so quiescence is still reached.
 *
 * <p>{@link #awaitQuiescence} must not race with {@link #addJob}: a caller that waits for the pool
 * to drain is expected to have submitted all of its jobs beforehand, from the same thread.
 */
public final class WorkerPool implements AutoCloseable {

  private static final Logger log = Logger.getLogger(WorkerPool.class.getName());

  /**
   * Lifecycle of a single worker thread.
   */
  public enum WorkerState {
    /** Blocked until a job is queued or the pool stops. */
    WAITING,
    /** Executing a job, without holding the pool lock. */
    RUNNING,
    /** Left the run loop; terminal. */
    EXITED;
  }

  private final String name;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition hasJob = lock.newCondition();
  private final Condition allIdle = lock.newCondition();
  private final JobQueue queue = new JobQueue();
  private final ImmutableList<WorkerThread> workers;
  private final ImmutableList<Thread> threads;

  // Guarded by lock.
  private int activeJobs;
  private boolean stopping;
  private Throwable failure;

  private WorkerPool(String name, int numThreads) {
    this.name = name;
    ThreadFactory threadFactory = new ThreadFactoryBuilder()
        .setNameFormat(name + "-worker-%d")
        .setDaemon(true)
        .build();
    ImmutableList.Builder<WorkerThread> workerBuilder = ImmutableList.builder();
    ImmutableList.Builder<Thread> threadBuilder = ImmutableList.builder();
    for (int i = 0; i < numThreads; i++) {
      WorkerThread worker = new WorkerThread();
      workerBuilder.add(worker);
      threadBuilder.add(threadFactory.newThread(worker));
    }
    this.workers = workerBuilder.build();
    this.threads = threadBuilder.build();
  }

  /**
   * Creates a pool named {@code "worker-pool"}.
   *
   * @see #create(String, int)
   */
  public static WorkerPool create(int numThreads) {
    return create("worker-pool", numThreads);
  }

  /**
   * Starts {@code numThreads} worker threads, each of which immediately begins waiting for jobs.
   *
   * @throws IllegalArgumentException if {@code numThreads} is not positive
   */
  public static WorkerPool create(String name, int numThreads) {
    checkNotNull(name, "Null name");
    checkArgument(numThreads > 0, "A worker pool needs at least one thread, got %s", numThreads);
    WorkerPool pool = new WorkerPool(name, numThreads);
    for (Thread thread : pool.threads) {
      thread.start();
    }
    log.info(pool + " started");
    return pool;
  }

  /**
   * Queues a job in cost order and wakes one idle worker.
   *
   * @return {@code false}, without queuing the job, if the pool is stopping or a previous job has
   *         failed
   */
  public boolean addJob(Runnable task, long cost) {
    Job job = new Job(task, cost);
    lock.lock();
    try {
      if (stopping) {
        log.warning(this + " is stopping, rejected " + job);
        return false;
      }
      if (failure != null) {
        log.warning(this + " has a failed job, rejected " + job);
        return false;
      }
      queue.add(job);
      hasJob.signal();
      log.fine("Queued " + job + ", " + queue.size() + " jobs waiting");
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Blocks until the queue is empty and no worker is executing a job. Returns immediately if the
   * pool is already quiescent.
   */
  public void awaitQuiescence() throws InterruptedException {
    lock.lock();
    try {
      while (!queue.isEmpty() || activeJobs > 0) {
        allIdle.await();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Stops accepting jobs, lets the workers finish what is running and queued, joins every worker
   * thread and drops anything left in the queue. Running jobs are never interrupted. Calling this
   * more than once has no further effect.
   *
   * @throws IllegalStateException if called from one of the pool's own workers
   */
  public void shutdown() {
    checkState(!threads.contains(Thread.currentThread()),
        "%s cannot be shut down from its own worker", this);
    lock.lock();
    try {
      if (stopping) {
        return;
      }
      stopping = true;
      hasJob.signalAll();
    } finally {
      lock.unlock();
    }
    for (Thread thread : threads) {
      Uninterruptibles.joinUninterruptibly(thread);
    }
    int dropped;
    lock.lock();
    try {
      dropped = queue.clear();
    } finally {
      lock.unlock();
    }
    if (dropped > 0) {
      log.warning(this + " dropped " + dropped + " queued jobs on shutdown");
    }
    log.info(this + " shut down");
  }

  @Override
  public void close() {
    shutdown();
  }

  /**
   * Returns the first exception or error thrown by a job, or {@code null} if none has failed.
   * Later failures are attached to it as suppressed exceptions.
   */
  public Throwable getFailure() {
    lock.lock();
    try {
      return failure;
    } finally {
      lock.unlock();
    }
  }

  public String getName() {
    return name;
  }

  public int getNumThreads() {
    return threads.size();
  }

  public int getQueuedJobCount() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }

  public int getActiveJobCount() {
    lock.lock();
    try {
      return activeJobs;
    } finally {
      lock.unlock();
    }
  }

  public boolean isQuiescent() {
    lock.lock();
    try {
      return queue.isEmpty() && activeJobs == 0;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the current state of each worker thread.
   */
  public List<WorkerState> getWorkerStates() {
    ImmutableList.Builder<WorkerState> states = ImmutableList.builder();
    for (WorkerThread worker : workers) {
      states.add(worker.state);
    }
    return states.build();
  }

  /**
   * Costs of the jobs waiting in the queue, head first.
   */
  long[] getQueuedCosts() {
    lock.lock();
    try {
      return queue.costs();
    } finally {
      lock.unlock();
    }
  }

  // Caller holds lock.
  private void recordFailure(Job job, Throwable thrown) {
    if (failure == null) {
      failure = thrown;
      int dropped = queue.clear();
      log.log(Level.SEVERE, job + " failed, dropping " + dropped + " queued jobs", thrown);
    } else {
      failure.addSuppressed(thrown);
      log.log(Level.SEVERE, job + " failed after an earlier failure", thrown);
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + name + ", " + threads.size() + " threads)";
  }

  private class WorkerThread implements Runnable {

    private volatile WorkerState state = WorkerState.WAITING;

    @Override
    public void run() {
      while (true) {
        Job job;
        lock.lock();
        try {
          state = WorkerState.WAITING;
          while (queue.isEmpty() && !stopping) {
            hasJob.awaitUninterruptibly();
          }
          if (queue.isEmpty()) {
            state = WorkerState.EXITED;
            return;
          }
          job = queue.poll();
          activeJobs++;
          state = WorkerState.RUNNING;
        } finally {
          lock.unlock();
        }

        Throwable thrown = null;
        try {
          job.getTask().run();
        } catch (Throwable t) {
          thrown = t;
        }

        lock.lock();
        try {
          activeJobs--;
          if (thrown != null) {
            recordFailure(job, thrown);
          }
          if (queue.isEmpty() && activeJobs == 0) {
            allIdle.signalAll();
          }
        } finally {
          lock.unlock();
        }
      }
    }
  }
}
