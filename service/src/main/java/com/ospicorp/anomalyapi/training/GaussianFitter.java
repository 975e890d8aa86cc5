package com.ospicorp.anomalyapi.training;

import com.ospicorp.anomalyapi.model.TrainingBatch;
import com.ospicorp.anomalyapi.model.TrainingStatistics;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Fits population mean and standard deviation over a validated batch. No windowing and no
 * outlier removal: every point counts.
 */
@Component
public class GaussianFitter {

  public FittedModel fit(TrainingBatch batch, double thresholdMultiplier) {
    List<Double> values = batch.values();
    List<Long> timestamps = batch.timestamps();
    RunningStats stats = new RunningStats();
    for (Double value : values) {
      stats.add(value);
    }
    double std = stats.populationStd();
    if (!(std > 0d)) {
      throw new InvalidTrainingBatchException(ValidationFailure.CONSTANT_SERIES,
          "Standard deviation is zero - cannot detect anomalies");
    }
    TrainingStatistics statistics = new TrainingStatistics(
        stats.count(),
        stats.mean(),
        std,
        stats.min(),
        stats.max(),
        timestamps.get(0),
        timestamps.get(timestamps.size() - 1));
    return new FittedModel(stats.mean(), std, thresholdMultiplier, statistics);
  }
}
