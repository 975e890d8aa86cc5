package com.ospicorp.anomalyapi.inference;

import com.ospicorp.anomalyapi.model.DataPoint;
import com.ospicorp.anomalyapi.model.ModelParameters;
import org.springframework.stereotype.Component;

/**
 * One-sided threshold rule: a point is anomalous only when it lies strictly above
 * {@code mean + k * std}. Low outliers are never flagged.
 */
@Component
public class InferenceEngine {

  public Verdict decide(DataPoint point, ModelParameters parameters) {
    double value = point.value();
    boolean anomaly = value > parameters.mean() + parameters.thresholdMultiplier() * parameters.std();
    double deviation = (value - parameters.mean()) / parameters.std();
    return new Verdict(anomaly, deviation);
  }
}
