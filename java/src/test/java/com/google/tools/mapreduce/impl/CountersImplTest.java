// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.tools.mapreduce.Counter;
import com.google.tools.mapreduce.Counters;

import junit.framework.TestCase;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Tests for {@link CountersImpl}
 */
public class CountersImplTest extends TestCase {

  public void testGetCounterCreatesZeroCounter() {
    Counters counters = new CountersImpl();
    Counter counter = counters.getCounter("c");
    assertEquals("c", counter.getName());
    assertEquals(0, counter.getValue());
    assertSame(counter, counters.getCounter("c"));
  }

  public void testCountersAreOrderedByName() {
    Counters counters = new CountersImpl();
    counters.getCounter("b").increment(2);
    counters.getCounter("a").increment(1);
    counters.getCounter("c").increment(3);
    List<String> names = Lists.newArrayList();
    for (Counter counter : counters.getCounters()) {
      names.add(counter.getName());
    }
    assertEquals(ImmutableList.of("a", "b", "c"), names);
    assertEquals("CountersImpl(a=1,b=2,c=3)", counters.toString());
  }

  public void testAddAll() {
    Counters first = new CountersImpl();
    first.getCounter("a").increment(1);
    first.getCounter("b").increment(5);
    Counters second = new CountersImpl();
    second.getCounter("b").increment(2);
    second.getCounter("c").increment(7);
    first.addAll(second);
    assertEquals(1, first.getCounter("a").getValue());
    assertEquals(7, first.getCounter("b").getValue());
    assertEquals(7, first.getCounter("c").getValue());
    assertEquals(2, second.getCounter("b").getValue());
  }

  public void testConcurrentIncrements() throws Exception {
    final Counters counters = new CountersImpl();
    ExecutorService executor = Executors.newFixedThreadPool(8);
    for (int i = 0; i < 8; i++) {
      executor.execute(new Runnable() {
        @Override
        public void run() {
          for (int j = 0; j < 10000; j++) {
            counters.getCounter("shared").increment(1);
          }
        }
      });
    }
    executor.shutdown();
    assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
    assertEquals(80000, counters.getCounter("shared").getValue());
  }
}
