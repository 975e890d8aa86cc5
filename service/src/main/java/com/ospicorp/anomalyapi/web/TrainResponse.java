package com.ospicorp.anomalyapi.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.anomalyapi.training.TrainingResult;

public record TrainResponse(
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("version") String version,
    @JsonProperty("status") String status,
    @JsonProperty("points_used") int pointsUsed,
    @JsonProperty("mean") double mean,
    @JsonProperty("std") double std,
    @JsonProperty("threshold") double threshold,
    @JsonProperty("training_latency_ms") double trainingLatencyMs
) {

  static TrainResponse from(TrainingResult result) {
    return new TrainResponse(result.seriesId(), result.label(), result.status().name(),
        result.pointsUsed(), result.mean(), result.std(), result.thresholdMultiplier(),
        result.trainingLatencyMs());
  }
}
