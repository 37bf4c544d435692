// Copyright 2011 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce;

/**
 * Reduce function for use in MapReduce. Called once for each distinct key of a partition, in
 * ascending key order (by Unicode code point), together with the index of that partition.
 *
 * <p>An implementation pulls the key's values with {@link #getNext} until it returns {@code null},
 * or iterates over {@link #values}. Values left unread when {@link #reduce} returns are discarded
 * and logged; the reducer is not called a second time for the same key to consume them. A reducer
 * that needs every value must therefore drain them itself.
 * Partitions are reduced concurrently, but the keys of one partition are reduced one at a time by
 * the same thread.
 *
 * <p>Whatever the reducer produces is its own business; the framework defines no output.
 *
 * <p>This class is really an interface that might be evolving.  In order to
 * avoid breaking users when we change the interface, we made it an abstract
 * class.
 */
public abstract class Reducer extends Worker<ReducerContext> {

  /**
   * Processes the values for a given key. {@code key} has at least one value in
   * {@code partition}.
   */
  public abstract void reduce(String key, int partition);

  /**
   * Syntactic sugar for {@code getContext().getNext(key, partition)}
   */
  protected String getNext(String key, int partition) {
    return getContext().getNext(key, partition);
  }

  /**
   * Returns the remaining values of {@code key} in {@code partition} as an iterator. Consuming the
   * iterator consumes the values.
   */
  protected ReducerInput values(String key, int partition) {
    return new GetNextReducerInput(getContext(), key, partition);
  }

  private static class GetNextReducerInput extends ReducerInput {

    private final ReducerContext context;
    private final String key;
    private final int partition;

    GetNextReducerInput(ReducerContext context, String key, int partition) {
      this.context = context;
      this.key = key;
      this.partition = partition;
    }

    @Override
    protected String fetchNext() {
      return context.getNext(key, partition);
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + "(" + key + ", " + partition + ")";
    }
  }
}
