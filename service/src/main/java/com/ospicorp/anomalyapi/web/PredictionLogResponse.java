package com.ospicorp.anomalyapi.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.anomalyapi.model.VersionLabels;
import com.ospicorp.anomalyapi.telemetry.PredictionLog;
import java.time.Instant;

public record PredictionLogResponse(
    @JsonProperty("id") Long id,
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("model_version") String modelVersion,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("value") double value,
    @JsonProperty("anomaly") boolean anomaly,
    @JsonProperty("deviation") double deviation,
    @JsonProperty("cache_hit") boolean cacheHit,
    @JsonProperty("fetch_latency_ms") double fetchLatencyMs,
    @JsonProperty("decide_latency_ms") double decideLatencyMs,
    @JsonProperty("created_at") Instant createdAt
) {

  static PredictionLogResponse from(PredictionLog log) {
    return new PredictionLogResponse(log.getId(), log.getSeriesId(),
        VersionLabels.format(log.getModelVersion()), log.getPointTimestamp(), log.getValue(),
        log.isAnomaly(), log.getDeviation(), log.isCacheHit(), log.getFetchLatencyMs(),
        log.getDecideLatencyMs(), log.getCreatedAt());
  }
}
