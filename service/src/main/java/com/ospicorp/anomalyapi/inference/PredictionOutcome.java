package com.ospicorp.anomalyapi.inference;

import com.ospicorp.anomalyapi.model.VersionLabels;

public record PredictionOutcome(
    String seriesId,
    int version,
    boolean anomaly,
    double deviation,
    boolean cacheHit
) {

  public String label() {
    return VersionLabels.format(version);
  }
}
