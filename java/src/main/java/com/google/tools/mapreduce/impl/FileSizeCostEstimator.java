package com.google.tools.mapreduce.impl;

import com.google.tools.mapreduce.InputCostEstimator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.logging.Logger;

/**
 * Treats each input as a file path and uses the file's size in bytes as its cost. Inputs whose
 * size cannot be read cost 0; the mapper is still called for them and decides what a missing file
 * means.
 *
 */
public class FileSizeCostEstimator implements InputCostEstimator {

  private static final Logger log = Logger.getLogger(FileSizeCostEstimator.class.getName());

  @Override
  public long estimateCost(String input) {
    try {
      return Files.size(Paths.get(input));
    } catch (IOException | InvalidPathException e) {
      log.fine("No size for " + input + ", using 0: " + e);
      return 0;
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName();
  }
}
