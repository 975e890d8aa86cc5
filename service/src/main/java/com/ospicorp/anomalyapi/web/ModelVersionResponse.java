package com.ospicorp.anomalyapi.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.anomalyapi.model.ModelVersion;
import java.time.Instant;

public record ModelVersionResponse(
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("version") String version,
    @JsonProperty("status") String status,
    @JsonProperty("mean") double mean,
    @JsonProperty("std") double std,
    @JsonProperty("threshold") double threshold,
    @JsonProperty("training_points") int trainingPoints,
    @JsonProperty("training_latency_ms") Double trainingLatencyMs,
    @JsonProperty("created_at") Instant createdAt
) {

  static ModelVersionResponse from(ModelVersion version) {
    return new ModelVersionResponse(version.seriesId(), version.label(), version.status().name(),
        version.mean(), version.std(), version.thresholdMultiplier(), version.trainingPoints(),
        version.trainingLatencyMs(), version.createdAt());
  }
}
