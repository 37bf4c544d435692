// Copyright 2011 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce;

/**
 * Map function for MapReduce computations. A map function is called once per input unit (for
 * example a file name) and generates zero or more key-value pairs for it. It emits the generated
 * pairs to the {@link Reducer} through the {@link MapperContext}.
 *
 * <p>Calls for different inputs run concurrently. An exception thrown from {@link #map} fails the
 * whole run.
 *
 * <p>This class is really an interface that might be evolving. In order to avoid breaking
 * users when we change the interface, we made it an abstract class.</p>
 */
public abstract class Mapper extends Worker<MapperContext> {

  /**
   * Processes a single input unit, emitting output through the context returned by
   * {@link Worker#getContext} or {@link #emit}.
   */
  public abstract void map(String input);

  /**
   * Syntactic sugar for {@code getContext().emit(key, value)}
   */
  protected void emit(String key, String value) {
    getContext().emit(key, value);
  }
}
