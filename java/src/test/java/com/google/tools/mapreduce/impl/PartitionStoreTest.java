// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.tools.mapreduce.Partitioner;

import junit.framework.TestCase;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Tests for {@link PartitionStore}
 */
public class PartitionStoreTest extends TestCase {

  /**
   * Sends keys to the partition named by their first character: 'a' to 0, 'b' to 1, ...
   */
  private static final Partitioner BY_FIRST_CHAR = new Partitioner() {
    @Override
    public int getPartition(String key, int numPartitions) {
      return (key.charAt(0) - 'a') % numPartitions;
    }
  };

  public void testEmitIgnoresNullKeyOrValue() {
    PartitionStore store = new PartitionStore(1, new HashingPartitioner());
    assertEquals(0, store.emit(null, "1"));
    assertEquals(0, store.emit("a", null));
    assertEquals(0, store.emit(null, null));
    assertEquals(0, store.size(0));
    assertEquals(0, store.getBytes(0));
    assertNull(store.headKey(0));
  }

  public void testEmitWithoutPartitionsIsIgnored() {
    PartitionStore store = new PartitionStore(0, new HashingPartitioner());
    assertEquals(0, store.getPartitionCount());
    assertEquals(0, store.emit("a", "1"));
    assertNull(store.getNext("a", 0));
    assertEquals(ImmutableList.of(), store.getPartitionBytes());
  }

  public void testKeysAreSortedAndValuesKeepInsertionOrder() {
    PartitionStore store = new PartitionStore(1, new HashingPartitioner());
    store.emit("b", "1");
    store.emit("a", "1");
    store.emit("c", "1");
    store.emit("a", "2");
    store.emit("b", "2");
    assertEquals(ImmutableList.of(
        Maps.immutableEntry("a", "1"), Maps.immutableEntry("a", "2"),
        Maps.immutableEntry("b", "1"), Maps.immutableEntry("b", "2"),
        Maps.immutableEntry("c", "1")), store.snapshot(0));
    assertEquals("a", store.headKey(0));
  }

  public void testGetNextSignalsExhaustionAfterLastValue() {
    PartitionStore store = new PartitionStore(1, new HashingPartitioner());
    store.emit("a", "1");
    store.emit("b", "x");
    store.emit("a", "2");
    store.emit("a", "3");
    assertEquals("1", store.getNext("a", 0));
    assertEquals("2", store.getNext("a", 0));
    assertEquals("3", store.getNext("a", 0));
    assertNull(store.getNext("a", 0));
    assertNull(store.getNext("a", 0));
    assertEquals("b", store.headKey(0));
    assertEquals("x", store.getNext("b", 0));
    assertNull(store.getNext("b", 0));
    assertNull(store.headKey(0));
    assertEquals(0, store.size(0));
  }

  public void testGetNextForAnotherKeyDoesNotConsume() {
    PartitionStore store = new PartitionStore(1, new HashingPartitioner());
    store.emit("a", "1");
    store.emit("b", "1");
    assertNull(store.getNext("b", 0));
    assertNull(store.getNext("zzz", 0));
    assertEquals(2, store.size(0));
  }

  public void testGetNextRejectsBadArguments() {
    PartitionStore store = new PartitionStore(2, new HashingPartitioner());
    store.emit("a", "1");
    int partition = store.getPartition("a");
    assertNull(store.getNext(null, partition));
    assertNull(store.getNext("a", -1));
    assertNull(store.getNext("a", 2));
    assertEquals("1", store.getNext("a", partition));
  }

  public void testRoutesKeysWithPartitioner() {
    PartitionStore store = new PartitionStore(3, BY_FIRST_CHAR);
    store.emit("apple", "1");
    store.emit("banana", "1");
    store.emit("cherry", "1");
    store.emit("date", "1");
    assertEquals(
        ImmutableList.of(Maps.immutableEntry("apple", "1"), Maps.immutableEntry("date", "1")),
        store.snapshot(0));
    assertEquals(ImmutableList.of(Maps.immutableEntry("banana", "1")), store.snapshot(1));
    assertEquals(ImmutableList.of(Maps.immutableEntry("cherry", "1")), store.snapshot(2));
  }

  public void testPartitionerOutOfRangeFails() {
    PartitionStore store = new PartitionStore(2, new Partitioner() {
      @Override
      public int getPartition(String key, int numPartitions) {
        return numPartitions;
      }
    });
    try {
      store.emit("a", "1");
      fail();
    } catch (IllegalStateException e) {
      // expected
    }
  }

  public void testByteCountIsMonotonic() {
    PartitionStore store = new PartitionStore(1, new HashingPartitioner());
    assertEquals(4, store.emit("a", "1"));
    assertEquals(10, store.emit("key", "value"));
    assertEquals(14, store.getBytes(0));
    assertEquals("1", store.getNext("a", 0));
    assertEquals(1, store.discard("key", 0));
    assertEquals(0, store.size(0));
    assertEquals(14, store.getBytes(0));
    assertEquals(ImmutableList.of(14L), store.getPartitionBytes());
  }

  public void testByteCountUsesUtf8Length() {
    PartitionStore store = new PartitionStore(1, new HashingPartitioner());
    assertEquals(5, store.emit("é", "1"));
  }

  public void testUnpairedSurrogateIsStored() {
    PartitionStore store = new PartitionStore(1, new HashingPartitioner());
    // The lone surrogate encodes as a single replacement byte.
    assertEquals(6, store.emit("ab\uD800", "1"));
    assertEquals(1, store.size(0));
    assertEquals("ab\uD800", store.headKey(0));
    assertEquals("1", store.getNext("ab\uD800", 0));
  }

  public void testKeysOrderedByCodePoint() {
    PartitionStore store = new PartitionStore(1, new HashingPartitioner());
    String halfwidthStop = "\uFF61";
    String grinningFace = "\uD83D\uDE00";
    store.emit(grinningFace, "1");
    store.emit(halfwidthStop, "1");
    store.emit("z", "1");
    store.emit(halfwidthStop + "a", "1");
    assertEquals(ImmutableList.of(Maps.immutableEntry("z", "1"),
        Maps.immutableEntry(halfwidthStop, "1"), Maps.immutableEntry(halfwidthStop + "a", "1"),
        Maps.immutableEntry(grinningFace, "1")), store.snapshot(0));
    assertEquals("z", store.headKey(0));
  }

  public void testDiscardOnlyAffectsHeadKey() {
    PartitionStore store = new PartitionStore(1, new HashingPartitioner());
    store.emit("a", "1");
    store.emit("a", "2");
    store.emit("b", "1");
    assertEquals(0, store.discard("b", 0));
    assertEquals(2, store.discard("a", 0));
    assertEquals("b", store.headKey(0));
    assertEquals(1, store.size(0));
  }

  public void testConcurrentEmitsIntoOnePartition() throws Exception {
    final int threads = 8;
    final int pairsPerThread = 5000;
    final PartitionStore store = new PartitionStore(1, new HashingPartitioner());
    final CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      ImmutableList.Builder<Future<Long>> futures = ImmutableList.builder();
      for (int t = 0; t < threads; t++) {
        final int thread = t;
        futures.add(executor.submit(new Callable<Long>() {
          @Override
          public Long call() throws Exception {
            start.await();
            long bytes = 0;
            for (int i = 0; i < pairsPerThread; i++) {
              bytes += store.emit("k" + (i % 50), thread + "-" + i);
            }
            return bytes;
          }
        }));
      }
      start.countDown();
      long expectedBytes = 0;
      for (Future<Long> future : futures.build()) {
        expectedBytes += future.get(1, TimeUnit.MINUTES);
      }
      assertEquals(threads * pairsPerThread, store.size(0));
      assertEquals(expectedBytes, store.getBytes(0));

      List<Map.Entry<String, String>> pairs = store.snapshot(0);
      Set<String> values = new HashSet<>();
      String previousKey = "";
      for (Map.Entry<String, String> pair : pairs) {
        assertTrue(previousKey + " > " + pair.getKey(), previousKey.compareTo(pair.getKey()) <= 0);
        previousKey = pair.getKey();
        assertTrue("Duplicate " + pair, values.add(pair.getValue()));
      }
      assertEquals(threads * pairsPerThread, values.size());
    } finally {
      executor.shutdownNow();
    }
  }
}
