package com.ospicorp.anomalyapi.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Latency breakdown and prediction log for inference calls. Fire-and-forget: nothing in
 * here may fail or slow down the request that produced the record.
 *
 * <p>Fetch and decide latencies are stored on every log row. The time spent persisting the
 * row itself is not: it is only known once the row is written, so it is reported in
 * aggregate by the {@code anomaly.predict.log} timer of {@link PredictionLogWriter}.
 */
@Component
public class PredictionTelemetry {
  private static final Logger log = LoggerFactory.getLogger(PredictionTelemetry.class);

  private final PredictionLogWriter writer;
  private final Timer cacheFetchTimer;
  private final Timer storeFetchTimer;
  private final Timer decideTimer;
  private final Counter anomalies;
  private final Counter normals;
  private final Counter dropped;

  public PredictionTelemetry(PredictionLogWriter writer, MeterRegistry registry) {
    this.writer = writer;
    this.cacheFetchTimer = fetchTimer(registry, "cache");
    this.storeFetchTimer = fetchTimer(registry, "store");
    this.decideTimer = Timer.builder("anomaly.predict.decide")
        .description("Time spent applying the threshold rule")
        .register(registry);
    this.anomalies = verdictCounter(registry, "anomaly");
    this.normals = verdictCounter(registry, "normal");
    this.dropped = Counter.builder("anomaly.predict.log.dropped")
        .description("Prediction log rows rejected before reaching the writer")
        .register(registry);
  }

  public void record(PredictionRecord record) {
    try {
      (record.cacheHit() ? cacheFetchTimer : storeFetchTimer).record(record.fetchLatency());
      decideTimer.record(record.decideLatency());
      (record.anomaly() ? anomalies : normals).increment();
      writer.write(record);
    } catch (TaskRejectedException ex) {
      dropped.increment();
      log.debug("Telemetry queue full, dropping prediction log for series {}", record.seriesId());
    } catch (RuntimeException ex) {
      dropped.increment();
      log.warn("Failed to record prediction telemetry for series {}: {}", record.seriesId(),
          ex.getMessage());
    }
  }

  private static Timer fetchTimer(MeterRegistry registry, String source) {
    return Timer.builder("anomaly.predict.fetch")
        .description("Time spent obtaining model parameters")
        .tag("source", source)
        .register(registry);
  }

  private static Counter verdictCounter(MeterRegistry registry, String verdict) {
    return Counter.builder("anomaly.predict.verdicts")
        .description("Inference verdicts")
        .tag("verdict", verdict)
        .register(registry);
  }
}
