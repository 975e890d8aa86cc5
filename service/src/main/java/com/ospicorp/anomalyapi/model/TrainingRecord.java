package com.ospicorp.anomalyapi.model;

import java.time.Instant;
import java.util.List;

// Raw points a version was fitted on; written once with the version, never updated
public record TrainingRecord(
    String seriesId,
    int version,
    List<DataPoint> points,
    TrainingStatistics statistics,
    Instant createdAt
) {

  public TrainingRecord {
    points = List.copyOf(points);
  }

  public String label() {
    return VersionLabels.format(version);
  }
}
