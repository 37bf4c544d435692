// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.primitives.Ints;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One shard of the intermediate key space: the emitted pairs whose key belongs here, ordered by
 * key, plus a running count of the bytes ever inserted.
 *
 * <p>During the map phase {@link #insert} is called concurrently and takes the partition's lock.
 * During the reduce phase exactly one reduce job reads and removes pairs through
 * {@link #headKey}, {@link #pollValue} and {@link #discard}; those take no lock. That is only
 * correct while the map phase has fully completed (the pool's quiescence barrier publishes its
 * writes) and no partition is ever given to more than one reduce job.
 *
 * <p>Keys are ordered by Unicode code point, which is the order of their UTF-8 bytes. Values of one
 * key are kept in the order they were inserted.
 */
final class Partition {

  /**
   * Compares strings code point by code point. Unlike {@link String#compareTo}, which compares
   * UTF-16 code units, this sorts supplementary characters after U+E000..U+FFFF.
   */
  static final Comparator<String> CODE_POINT_ORDER = new Comparator<String>() {
    @Override
    public int compare(String a, String b) {
      int i = 0;
      while (i < a.length() && i < b.length()) {
        int ca = a.codePointAt(i);
        int cb = b.codePointAt(i);
        if (ca != cb) {
          return Ints.compare(ca, cb);
        }
        i += Character.charCount(ca);
      }
      return Ints.compare(a.length() - i, b.length() - i);
    }
  };

  private final int index;
  private final ReentrantLock lock = new ReentrantLock();
  private final NavigableMap<String, Deque<String>> pairs = new TreeMap<>(CODE_POINT_ORDER);

  // Guarded by lock during the map phase.
  private long bytes;
  private int size;

  Partition(int index) {
    this.index = index;
  }

  int getIndex() {
    return index;
  }

  /**
   * The bytes accounted for one pair: both strings' UTF-8 lengths plus one terminator each. Unpaired
   * surrogates count as the one-byte replacement the encoder writes for them.
   */
  static long pairBytes(String key, String value) {
    return key.getBytes(Charsets.UTF_8).length + value.getBytes(Charsets.UTF_8).length + 2;
  }

  /**
   * Adds a pair after any pairs already present for the same key.
   *
   * @return the bytes added to this partition's count
   */
  long insert(String key, String value) {
    long added = pairBytes(key, value);
    lock.lock();
    try {
      Deque<String> values = pairs.get(key);
      if (values == null) {
        values = new ArrayDeque<>();
        pairs.put(key, values);
      }
      values.addLast(value);
      size++;
      bytes += added;
    } finally {
      lock.unlock();
    }
    return added;
  }

  /**
   * Returns the smallest key still present, or {@code null} if the partition is empty.
   */
  String headKey() {
    return pairs.isEmpty() ? null : pairs.firstKey();
  }

  /**
   * Removes and returns the head pair's value if the head pair has key {@code key}. Returns
   * {@code null} otherwise, which tells a reducer there are no more values for its key.
   */
  String pollValue(String key) {
    Map.Entry<String, Deque<String>> head = pairs.firstEntry();
    if (head == null || !head.getKey().equals(key)) {
      return null;
    }
    Deque<String> values = head.getValue();
    String value = values.pollFirst();
    if (values.isEmpty()) {
      pairs.pollFirstEntry();
    }
    size--;
    return value;
  }

  /**
   * Removes every remaining value of {@code key} if it is the head key.
   *
   * @return the number of values removed
   */
  int discard(String key) {
    Map.Entry<String, Deque<String>> head = pairs.firstEntry();
    if (head == null || !head.getKey().equals(key)) {
      return 0;
    }
    int removed = head.getValue().size();
    pairs.pollFirstEntry();
    size -= removed;
    return removed;
  }

  /**
   * Returns the bytes of every pair ever inserted. Never decreases.
   */
  long getBytes() {
    lock.lock();
    try {
      return bytes;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of pairs currently held.
   */
  int size() {
    lock.lock();
    try {
      return size;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the pairs currently held, in the order a reducer would consume them.
   */
  ImmutableList<Map.Entry<String, String>> snapshot() {
    ImmutableList.Builder<Map.Entry<String, String>> out = ImmutableList.builder();
    lock.lock();
    try {
      for (Map.Entry<String, Deque<String>> entry : pairs.entrySet()) {
        for (String value : entry.getValue()) {
          out.add(Maps.immutableEntry(entry.getKey(), value));
        }
      }
    } finally {
      lock.unlock();
    }
    return out.build();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + index + ")";
  }
}
