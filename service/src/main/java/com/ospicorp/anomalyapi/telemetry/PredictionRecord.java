package com.ospicorp.anomalyapi.telemetry;

import com.ospicorp.anomalyapi.model.DataPoint;
import java.time.Duration;
import java.time.Instant;

public record PredictionRecord(
    String seriesId,
    int version,
    DataPoint point,
    boolean anomaly,
    double deviation,
    boolean cacheHit,
    Duration fetchLatency,
    Duration decideLatency,
    Instant recordedAt
) {}
