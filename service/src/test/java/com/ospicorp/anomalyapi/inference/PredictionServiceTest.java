package com.ospicorp.anomalyapi.inference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ospicorp.anomalyapi.model.DataPoint;
import com.ospicorp.anomalyapi.model.VersionSelector;
import com.ospicorp.anomalyapi.store.ModelNotFoundException;
import com.ospicorp.anomalyapi.support.CoreFixture;
import com.ospicorp.anomalyapi.support.TestBatches;
import com.ospicorp.anomalyapi.telemetry.PredictionLog;
import com.ospicorp.anomalyapi.telemetry.PredictionLogRepository;
import com.ospicorp.anomalyapi.telemetry.PredictionLogWriter;
import com.ospicorp.anomalyapi.telemetry.PredictionTelemetry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

class PredictionServiceTest {

  private static final String SERIES = "sensor_001";

  private final CoreFixture core = new CoreFixture();
  private final PredictionLogRepository repository = mock(PredictionLogRepository.class);
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final PredictionService service = new PredictionService(core.cache, new InferenceEngine(),
      new PredictionTelemetry(new PredictionLogWriter(repository, registry), registry),
      core.clock, 1000);

  @AfterEach
  void tearDown() {
    core.close();
  }

  @Test
  void classifiesAgainstActiveVersion() {
    core.trainingService.train(SERIES, TestBatches.sensor001(), null);

    PredictionOutcome high = service.predict(SERIES, new DataPoint(1700000240L, 55.0),
        VersionSelector.active());
    PredictionOutcome normal = service.predict(SERIES, new DataPoint(1700000300L, 43.0),
        VersionSelector.active());

    assertThat(high.anomaly()).isTrue();
    assertThat(high.label()).isEqualTo("v1");
    assertThat(high.cacheHit()).isFalse();
    assertThat(normal.anomaly()).isFalse();
    assertThat(normal.cacheHit()).isTrue();
  }

  @Test
  void pinnedVersionGivesSameAnswerBeforeAndAfterSupersession() {
    core.trainingService.train(SERIES, TestBatches.sensor001(), null);
    DataPoint point = new DataPoint(1700000240L, 46.0);
    PredictionOutcome before = service.predict(SERIES, point, VersionSelector.pinned(1));

    core.trainingService.train(SERIES, TestBatches.shifted(), null);
    PredictionOutcome after = service.predict(SERIES, point, VersionSelector.pinned(1));
    PredictionOutcome active = service.predict(SERIES, point, VersionSelector.active());

    assertThat(after.anomaly()).isEqualTo(before.anomaly()).isTrue();
    assertThat(after.deviation()).isEqualTo(before.deviation());
    assertThat(active.label()).isEqualTo("v2");
    assertThat(active.anomaly()).isFalse();
  }

  @Test
  void untrainedSeriesIsNotFound() {
    assertThatThrownBy(() -> service.predict("nobody", new DataPoint(1L, 1.0),
        VersionSelector.active()))
        .isInstanceOf(ModelNotFoundException.class);
  }

  @Test
  void nonFiniteValueIsRejected() {
    assertThatThrownBy(() -> service.predict(SERIES, new DataPoint(1L, Double.NaN),
        VersionSelector.active()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void writesPredictionLog() {
    core.trainingService.train(SERIES, TestBatches.sensor001(), null);

    service.predict(SERIES, new DataPoint(1700000240L, 55.0), VersionSelector.active());

    ArgumentCaptor<PredictionLog> saved = ArgumentCaptor.forClass(PredictionLog.class);
    verify(repository).save(saved.capture());
    assertThat(saved.getValue().getSeriesId()).isEqualTo(SERIES);
    assertThat(saved.getValue().getModelVersion()).isEqualTo(1);
    assertThat(saved.getValue().isAnomaly()).isTrue();
    assertThat(saved.getValue().getCreatedAt()).isEqualTo(core.clock.instant());
    assertThat(registry.get("anomaly.predict.verdicts").tag("verdict", "anomaly").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void failingPredictionLogDoesNotAffectVerdict() {
    core.trainingService.train(SERIES, TestBatches.sensor001(), null);
    when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("disk full"));

    PredictionOutcome outcome = service.predict(SERIES, new DataPoint(1700000240L, 55.0),
        VersionSelector.active());

    assertThat(outcome.anomaly()).isTrue();
    assertThat(registry.get("anomaly.predict.log.failures").counter().count()).isEqualTo(1.0);
  }
}
