// Copyright 2012 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce;

/**
 * Base class for {@link Mapper} and {@link Reducer}.
 *
 * <p>A single worker instance serves every job of its phase, and those jobs run concurrently on
 * the pool's threads, so implementations must be thread-safe. Each phase starts with a call to
 * {@link #setContext} and {@link #beginPhase} on the driving thread, then zero or more calls to
 * {@link Mapper#map} or {@link Reducer#reduce} from the worker threads, then {@link #endPhase} back
 * on the driving thread once every job of the phase has finished.
 *
 * <p>If a phase fails, {@link #endPhase} is not called.
 *
 * <p>An instance must not be used by two runs at the same time, because the context belongs to
 * the run.
 *
 * <p>This class is really an interface that might be evolving.  In order to
 * avoid breaking users when we change the interface, we made it an abstract
 * class.
 *
 * @param <C> type of context required by this worker
 */
public abstract class Worker<C extends WorkerContext> {

  private volatile C context;

  /**
   * Sets the context to be used for the processing that follows. Called before
   * {@link #beginPhase}.
   */
  public void setContext(C context) {
    this.context = context;
  }

  /**
   * Returns the current context, or null if none.
   */
  protected C getContext() {
    return context;
  }

  /**
   * Prepares the worker for a new phase.
   */
  public void beginPhase() {}

  /**
   * Notifies the worker that every job of the current phase has finished.
   */
  public void endPhase() {}
}
