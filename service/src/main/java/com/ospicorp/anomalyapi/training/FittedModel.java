package com.ospicorp.anomalyapi.training;

import com.ospicorp.anomalyapi.model.TrainingStatistics;

public record FittedModel(double mean, double std, double thresholdMultiplier,
    TrainingStatistics statistics) {}
