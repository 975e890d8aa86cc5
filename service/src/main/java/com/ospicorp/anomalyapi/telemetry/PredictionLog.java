package com.ospicorp.anomalyapi.telemetry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "prediction_log")
public class PredictionLog {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "series_id", nullable = false, length = 64)
  private String seriesId;

  @Column(name = "model_version", nullable = false)
  private int modelVersion;

  @Column(name = "point_timestamp", nullable = false)
  private long pointTimestamp;

  @Column(nullable = false)
  private double value;

  @Column(nullable = false)
  private boolean anomaly;

  private double deviation;

  @Column(name = "cache_hit", nullable = false)
  private boolean cacheHit;

  @Column(name = "fetch_latency_ms", nullable = false)
  private double fetchLatencyMs;

  @Column(name = "decide_latency_ms", nullable = false)
  private double decideLatencyMs;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected PredictionLog() {
    // JPA default constructor
  }

  static PredictionLog from(PredictionRecord record) {
    PredictionLog log = new PredictionLog();
    log.seriesId = record.seriesId();
    log.modelVersion = record.version();
    log.pointTimestamp = record.point().timestamp();
    log.value = record.point().value();
    log.anomaly = record.anomaly();
    log.deviation = record.deviation();
    log.cacheHit = record.cacheHit();
    log.fetchLatencyMs = record.fetchLatency().toNanos() / 1_000_000d;
    log.decideLatencyMs = record.decideLatency().toNanos() / 1_000_000d;
    log.createdAt = record.recordedAt();
    return log;
  }

  public Long getId() {
    return id;
  }

  public String getSeriesId() {
    return seriesId;
  }

  public int getModelVersion() {
    return modelVersion;
  }

  public long getPointTimestamp() {
    return pointTimestamp;
  }

  public double getValue() {
    return value;
  }

  public boolean isAnomaly() {
    return anomaly;
  }

  public double getDeviation() {
    return deviation;
  }

  public boolean isCacheHit() {
    return cacheHit;
  }

  public double getFetchLatencyMs() {
    return fetchLatencyMs;
  }

  public double getDecideLatencyMs() {
    return decideLatencyMs;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
