// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.reducers;

import com.google.common.collect.ImmutableSortedMap;
import com.google.tools.mapreduce.Reducer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Counts the values emitted for each key, ignoring their content. After the run,
 * {@link #getCounts} holds one entry per distinct key.
 *
 */
public class CountingReducer extends Reducer {

  private final ConcurrentMap<String, Long> counts = new ConcurrentHashMap<>();

  @Override
  public void reduce(String key, int partition) {
    long count = 0;
    while (getNext(key, partition) != null) {
      count++;
    }
    counts.put(key, count);
  }

  /**
   * Returns the counts gathered so far, sorted by key.
   */
  public Map<String, Long> getCounts() {
    return ImmutableSortedMap.copyOf(counts);
  }
}
