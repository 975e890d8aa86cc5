package com.ospicorp.anomalyapi.model;

import java.time.Instant;

public record ModelVersion(
    String seriesId,
    int version,
    double mean,
    double std,
    double thresholdMultiplier,
    ModelStatus status,
    int trainingPoints,
    Double trainingLatencyMs,
    Instant createdAt
) {

  public String label() {
    return VersionLabels.format(version);
  }

  public boolean isActive() {
    return status == ModelStatus.ACTIVE;
  }

  public ModelParameters parameters() {
    return new ModelParameters(seriesId, version, mean, std, thresholdMultiplier);
  }

  public ModelVersion withStatus(ModelStatus newStatus) {
    return new ModelVersion(seriesId, version, mean, std, thresholdMultiplier, newStatus,
        trainingPoints, trainingLatencyMs, createdAt);
  }
}
