package com.google.tools.mapreduce;

/**
 * Estimates how expensive it is to map one input unit. Map jobs are started in ascending order of
 * this estimate. Only the relative order matters.
 *
 */
public interface InputCostEstimator {

  /**
   * @return a non-negative cost for {@code input}, or 0 if nothing is known about it
   */
  long estimateCost(String input);
}
