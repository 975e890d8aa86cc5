package com.ospicorp.anomalyapi.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.anomalyapi.inference.PredictionOutcome;

public record PredictResponse(
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("anomaly") boolean anomaly,
    @JsonProperty("model_version") String modelVersion,
    @JsonProperty("deviation") double deviation,
    @JsonProperty("cache_hit") boolean cacheHit
) {

  static PredictResponse from(PredictionOutcome outcome) {
    return new PredictResponse(outcome.seriesId(), outcome.anomaly(), outcome.label(),
        outcome.deviation(), outcome.cacheHit());
  }
}
