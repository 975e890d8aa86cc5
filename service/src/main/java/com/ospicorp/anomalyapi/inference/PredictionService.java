package com.ospicorp.anomalyapi.inference;

import com.ospicorp.anomalyapi.cache.CacheLookup;
import com.ospicorp.anomalyapi.cache.ModelCache;
import com.ospicorp.anomalyapi.model.DataPoint;
import com.ospicorp.anomalyapi.model.ModelParameters;
import com.ospicorp.anomalyapi.model.VersionSelector;
import com.ospicorp.anomalyapi.support.Deadline;
import com.ospicorp.anomalyapi.telemetry.PredictionRecord;
import com.ospicorp.anomalyapi.telemetry.PredictionTelemetry;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class PredictionService {
  private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

  private final ModelCache cache;
  private final InferenceEngine engine;
  private final PredictionTelemetry telemetry;
  private final Clock clock;
  private final long storeTimeoutMs;

  public PredictionService(ModelCache cache, InferenceEngine engine, PredictionTelemetry telemetry,
      Clock clock, @Value("${anomaly.inference.store-timeout-ms:500}") long storeTimeoutMs) {
    this.cache = cache;
    this.engine = engine;
    this.telemetry = telemetry;
    this.clock = clock;
    this.storeTimeoutMs = storeTimeoutMs;
  }

  /**
   * Classifies one point against the active version, or against the pinned version when the
   * selector names one. Telemetry is handed off and never affects the returned verdict.
   */
  public PredictionOutcome predict(String seriesId, DataPoint point, VersionSelector selector) {
    if (!StringUtils.hasText(seriesId)) {
      throw new IllegalArgumentException("series_id must be provided");
    }
    if (!Double.isFinite(point.value())) {
      throw new IllegalArgumentException("value must be a finite number");
    }

    long fetchStart = System.nanoTime();
    CacheLookup lookup = cache.get(seriesId, selector, Deadline.afterMillis(storeTimeoutMs));
    long decideStart = System.nanoTime();
    ModelParameters parameters = lookup.parameters();
    Verdict verdict = engine.decide(point, parameters);
    long decideEnd = System.nanoTime();

    if (verdict.anomaly()) {
      log.debug("Anomaly on series {} at {}: value {} is {} std from mean ({})", seriesId,
          point.timestamp(), point.value(), verdict.deviation(), parameters.label());
    }

    telemetry.record(new PredictionRecord(
        seriesId,
        parameters.version(),
        point,
        verdict.anomaly(),
        verdict.deviation(),
        lookup.hit(),
        Duration.ofNanos(decideStart - fetchStart),
        Duration.ofNanos(decideEnd - decideStart),
        clock.instant()));

    return new PredictionOutcome(seriesId, parameters.version(), verdict.anomaly(),
        verdict.deviation(), lookup.hit());
  }
}
