package com.ospicorp.anomalyapi.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

// Runs on the telemetry executor; failures end here.
@Component
public class PredictionLogWriter {
  private static final Logger log = LoggerFactory.getLogger(PredictionLogWriter.class);

  private final PredictionLogRepository repository;
  private final Timer writeTimer;
  private final Counter failures;

  public PredictionLogWriter(PredictionLogRepository repository, MeterRegistry registry) {
    this.repository = repository;
    this.writeTimer = Timer.builder("anomaly.predict.log")
        .description("Time spent persisting prediction log rows")
        .register(registry);
    this.failures = Counter.builder("anomaly.predict.log.failures")
        .description("Prediction log rows that could not be persisted")
        .register(registry);
  }

  @Async("telemetryExecutor")
  public void write(PredictionRecord record) {
    long start = System.nanoTime();
    try {
      repository.save(PredictionLog.from(record));
    } catch (RuntimeException ex) {
      failures.increment();
      log.warn("Dropping prediction log for series {} ({}): {}", record.seriesId(),
          record.point().timestamp(), ex.getMessage());
    } finally {
      writeTimer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
    }
  }
}
