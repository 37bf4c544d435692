// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.reducers;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.primitives.Longs;
import com.google.tools.mapreduce.Reducer;
import com.google.tools.mapreduce.ReducerInput;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

/**
 * Sums the values emitted for each key, parsed as decimal longs. Values that do not parse are
 * skipped and counted in the {@value #UNPARSABLE_VALUES} counter.
 *
 */
public class SummingReducer extends Reducer {

  private static final Logger log = Logger.getLogger(SummingReducer.class.getName());

  public static final String UNPARSABLE_VALUES = "summing-reducer-unparsable-values";

  private final ConcurrentMap<String, Long> sums = new ConcurrentHashMap<>();

  @Override
  public void reduce(String key, int partition) {
    long sum = 0;
    ReducerInput input = values(key, partition);
    while (input.hasNext()) {
      String value = input.next();
      Long parsed = Longs.tryParse(value);
      if (parsed == null) {
        log.fine("Skipping unparsable value " + value + " for key " + key);
        getContext().incrementCounter(UNPARSABLE_VALUES);
      } else {
        sum += parsed;
      }
    }
    sums.put(key, sum);
  }

  /**
   * Returns the sums gathered so far, sorted by key.
   */
  public Map<String, Long> getSums() {
    return ImmutableSortedMap.copyOf(sums);
  }
}
