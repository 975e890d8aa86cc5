package com.ospicorp.anomalyapi.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parallel timestamp/value sequences submitted for training. Elements may be null or
 * non-finite until the batch has passed validation.
 */
public record TrainingBatch(List<Long> timestamps, List<Double> values) {

  public TrainingBatch {
    timestamps = timestamps == null ? List.of() : copyOf(timestamps);
    values = values == null ? List.of() : copyOf(values);
  }

  public static TrainingBatch of(List<DataPoint> points) {
    List<Long> ts = new ArrayList<>(points.size());
    List<Double> vs = new ArrayList<>(points.size());
    for (DataPoint point : points) {
      ts.add(point.timestamp());
      vs.add(point.value());
    }
    return new TrainingBatch(ts, vs);
  }

  public int size() {
    return values.size();
  }

  public List<DataPoint> points() {
    int n = Math.min(timestamps.size(), values.size());
    List<DataPoint> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      out.add(new DataPoint(timestamps.get(i), values.get(i)));
    }
    return out;
  }

  // List.copyOf rejects nulls, which the validator has to see
  private static <T> List<T> copyOf(List<T> in) {
    return Collections.unmodifiableList(new ArrayList<>(in));
  }
}
