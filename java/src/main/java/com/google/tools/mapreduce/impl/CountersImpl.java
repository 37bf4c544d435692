// Copyright 2011 Google Inc. All Rights Reserved.
package com.google.tools.mapreduce.impl;

import com.google.common.base.Joiner;
import com.google.common.collect.Iterables;
import com.google.tools.mapreduce.Counter;
import com.google.tools.mapreduce.Counters;

import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe {@link Counters}; map and reduce jobs increment the same instance concurrently.
 */
public class CountersImpl implements Counters {

  private final ConcurrentMap<String, Counter> values = new ConcurrentSkipListMap<>();

  @Override
  public String toString() {
    StringBuilder out = new StringBuilder(getClass().getSimpleName() + "(");
    Joiner.on(',').appendTo(out, values.values());
    out.append(')');
    return out.toString();
  }

  @Override
  public Counter getCounter(String name) {
    Counter counter = values.get(name);
    if (counter == null) {
      Counter created = new CounterImpl(name);
      counter = values.putIfAbsent(name, created);
      if (counter == null) {
        counter = created;
      }
    }
    return counter;
  }

  @Override
  public Iterable<? extends Counter> getCounters() {
    return Iterables.unmodifiableIterable(values.values());
  }

  @Override
  public void addAll(Counters other) {
    for (Counter c : other.getCounters()) {
      getCounter(c.getName()).increment(c.getValue());
    }
  }

  private static class CounterImpl implements Counter {

    private final String name;
    private final AtomicLong value = new AtomicLong();

    CounterImpl(String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name + "=" + value.get();
    }

    @Override
    public String getName() {
      return name;
    }

    @Override
    public long getValue() {
      return value.get();
    }

    @Override
    public void increment(long delta) {
      value.addAndGet(delta);
    }
  }
}
