// Copyright 2016 Google Inc. All Rights Reserved.

package com.google.tools.mapreduce.impl;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

import junit.framework.TestCase;

import java.io.File;

/**
 * Tests for {@link FileSizeCostEstimator}
 */
public class FileSizeCostEstimatorTest extends TestCase {

  private File dir;

  @Override
  protected void setUp() throws Exception {
    super.setUp();
    dir = java.nio.file.Files.createTempDirectory("cost").toFile();
  }

  @Override
  protected void tearDown() throws Exception {
    for (File file : dir.listFiles()) {
      assertTrue(file.delete());
    }
    assertTrue(dir.delete());
    super.tearDown();
  }

  public void testFileSize() throws Exception {
    File file = new File(dir, "input.txt");
    Files.asCharSink(file, Charsets.UTF_8).write("héllo");
    assertEquals(6, new FileSizeCostEstimator().estimateCost(file.getPath()));
  }

  public void testEmptyFile() throws Exception {
    File file = new File(dir, "empty.txt");
    Files.touch(file);
    assertEquals(0, new FileSizeCostEstimator().estimateCost(file.getPath()));
  }

  public void testMissingFileCostsNothing() {
    assertEquals(0, new FileSizeCostEstimator().estimateCost(new File(dir, "nope").getPath()));
  }

  public void testInvalidPathCostsNothing() {
    assertEquals(0, new FileSizeCostEstimator().estimateCost("bad\u0000path"));
  }
}
