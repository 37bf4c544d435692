// Copyright 2011 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce;


/**
 * Context for {@link Reducer} execution.
 *
 */
public interface ReducerContext extends WorkerContext {

  /**
   * Removes and returns the next value for {@code key} from the given partition.
   *
   * @return the next value, or {@code null} once every value for {@code key} has been returned.
   *         Also {@code null} if {@code key} is null or {@code partition} is out of range.
   */
  String getNext(String key, int partition);
}
