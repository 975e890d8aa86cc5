package com.ospicorp.anomalyapi.training;

import com.ospicorp.anomalyapi.model.TrainingBatch;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Rejects malformed or degenerate training batches before any state changes. Rules run in
 * a fixed order and the first failure wins.
 */
@Component
public class BatchValidator {

  public static final int MIN_POINTS = 2;

  // relative to max(1, |mean|)
  static final double CONSTANT_TOLERANCE = 1e-12;

  public void validate(TrainingBatch batch, double thresholdMultiplier) {
    List<Long> timestamps = batch.timestamps();
    List<Double> values = batch.values();

    if (timestamps.size() != values.size()) {
      throw new InvalidTrainingBatchException(ValidationFailure.SHAPE_MISMATCH,
          "Timestamps and values must have the same length (got " + timestamps.size()
              + " timestamps and " + values.size() + " values)");
    }
    if (values.size() < MIN_POINTS) {
      throw new InvalidTrainingBatchException(ValidationFailure.INSUFFICIENT_DATA,
          "Insufficient training data (minimum " + MIN_POINTS + " points required, got "
              + values.size() + ")");
    }

    RunningStats stats = new RunningStats();
    for (int i = 0; i < values.size(); i++) {
      Double value = values.get(i);
      if (value == null || !Double.isFinite(value)) {
        throw new InvalidTrainingBatchException(ValidationFailure.INVALID_VALUE,
            "Value at index " + i + " is not a finite number: " + value);
      }
      if (timestamps.get(i) == null) {
        throw new InvalidTrainingBatchException(ValidationFailure.INVALID_VALUE,
            "Timestamp at index " + i + " is missing");
      }
      stats.add(value);
    }

    if (stats.sampleStd() <= CONSTANT_TOLERANCE * Math.max(1d, Math.abs(stats.mean()))) {
      throw new InvalidTrainingBatchException(ValidationFailure.CONSTANT_SERIES,
          "Constant values detected - cannot train model");
    }

    for (int i = 1; i < timestamps.size(); i++) {
      if (timestamps.get(i) < timestamps.get(i - 1)) {
        throw new InvalidTrainingBatchException(ValidationFailure.UNORDERED_TIMESTAMPS,
            "Timestamps must be sorted in ascending order (index " + i + ")");
      }
    }

    if (!Double.isFinite(thresholdMultiplier) || thresholdMultiplier <= 0d) {
      throw new InvalidTrainingBatchException(ValidationFailure.INVALID_THRESHOLD,
          "Threshold must be a positive number, got " + thresholdMultiplier);
    }
  }
}
