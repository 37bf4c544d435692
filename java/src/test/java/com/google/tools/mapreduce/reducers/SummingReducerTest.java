// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.reducers;

import static org.easymock.EasyMock.createStrictMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;

import com.google.common.collect.ImmutableMap;
import com.google.tools.mapreduce.ReducerContext;

import junit.framework.TestCase;

/**
 * Tests for {@link SummingReducer}
 */
public class SummingReducerTest extends TestCase {

  public void testSumsParsableValues() {
    ReducerContext context = createStrictMock(ReducerContext.class);
    expect(context.getNext("k", 0)).andReturn("1");
    expect(context.getNext("k", 0)).andReturn("oops");
    context.incrementCounter(SummingReducer.UNPARSABLE_VALUES);
    expect(context.getNext("k", 0)).andReturn("41");
    expect(context.getNext("k", 0)).andReturn("-2");
    expect(context.getNext("k", 0)).andReturn(null);
    replay(context);

    SummingReducer reducer = new SummingReducer();
    reducer.setContext(context);
    reducer.reduce("k", 0);

    verify(context);
    assertEquals(ImmutableMap.of("k", 40L), reducer.getSums());
  }

  public void testKeyWithOnlyBadValuesSumsToZero() {
    ReducerContext context = createStrictMock(ReducerContext.class);
    expect(context.getNext("k", 1)).andReturn("1.5");
    context.incrementCounter(SummingReducer.UNPARSABLE_VALUES);
    expect(context.getNext("k", 1)).andReturn(null);
    replay(context);

    SummingReducer reducer = new SummingReducer();
    reducer.setContext(context);
    reducer.reduce("k", 1);

    verify(context);
    assertEquals(ImmutableMap.of("k", 0L), reducer.getSums());
  }
}
