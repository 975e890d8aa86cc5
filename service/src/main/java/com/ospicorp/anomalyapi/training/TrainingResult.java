package com.ospicorp.anomalyapi.training;

import com.ospicorp.anomalyapi.model.ModelStatus;
import com.ospicorp.anomalyapi.model.VersionLabels;

public record TrainingResult(
    String seriesId,
    int version,
    ModelStatus status,
    int pointsUsed,
    double mean,
    double std,
    double thresholdMultiplier,
    double trainingLatencyMs
) {

  public String label() {
    return VersionLabels.format(version);
  }
}
