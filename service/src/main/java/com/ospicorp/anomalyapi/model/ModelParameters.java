package com.ospicorp.anomalyapi.model;

// Numeric slice of a ModelVersion; this is what the cache holds
public record ModelParameters(
    String seriesId,
    int version,
    double mean,
    double std,
    double thresholdMultiplier
) {

  public String label() {
    return VersionLabels.format(version);
  }

  public double upperBound() {
    return mean + thresholdMultiplier * std;
  }
}
