package com.ospicorp.anomalyapi.model;

public record TrainingStatistics(
    int count,
    double mean,
    double std,
    double min,
    double max,
    long startTime,
    long endTime
) {}
