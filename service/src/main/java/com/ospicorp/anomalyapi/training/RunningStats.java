package com.ospicorp.anomalyapi.training;

/**
 * Welford accumulator. Keeps the running mean and the sum of squared deviations from it, so
 * batches with a large mean do not lose precision the way sum-of-squares does.
 */
final class RunningStats {
  private int count;
  private double mean;
  private double m2;
  private double min = Double.POSITIVE_INFINITY;
  private double max = Double.NEGATIVE_INFINITY;

  void add(double value) {
    count++;
    double delta = value - mean;
    mean += delta / count;
    m2 += delta * (value - mean);
    min = Math.min(min, value);
    max = Math.max(max, value);
  }

  int count() {
    return count;
  }

  double mean() {
    return mean;
  }

  double populationStd() {
    return count == 0 ? 0d : Math.sqrt(Math.max(0d, m2) / count);
  }

  double sampleStd() {
    return count < 2 ? 0d : Math.sqrt(Math.max(0d, m2) / (count - 1));
  }

  double min() {
    return min;
  }

  double max() {
    return max;
  }
}
