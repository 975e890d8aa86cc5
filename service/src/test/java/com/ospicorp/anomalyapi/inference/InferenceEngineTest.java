package com.ospicorp.anomalyapi.inference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.anomalyapi.model.DataPoint;
import com.ospicorp.anomalyapi.model.ModelParameters;
import org.junit.jupiter.api.Test;

class InferenceEngineTest {

  private final InferenceEngine engine = new InferenceEngine();
  // upper bound 100 + 3 * 10 = 130
  private final ModelParameters params = new ModelParameters("s1", 1, 100.0, 10.0, 3.0);

  @Test
  void flagsValuesAboveUpperBound() {
    Verdict verdict = engine.decide(new DataPoint(1L, 130.5), params);

    assertThat(verdict.anomaly()).isTrue();
    assertThat(verdict.deviation()).isCloseTo(3.05, within(1e-9));
  }

  @Test
  void valueExactlyOnTheBoundIsNormal() {
    assertThat(engine.decide(new DataPoint(1L, 130.0), params).anomaly()).isFalse();
  }

  @Test
  void lowOutliersAreNeverFlagged() {
    Verdict verdict = engine.decide(new DataPoint(1L, -1000.0), params);

    assertThat(verdict.anomaly()).isFalse();
    assertThat(verdict.deviation()).isCloseTo(-110.0, within(1e-9));
  }

  @Test
  void sensorExampleFromTrainedModel() {
    ModelParameters sensor = new ModelParameters("sensor_001", 1, 42.9, Math.sqrt(0.775), 3.0);

    assertThat(engine.decide(new DataPoint(1700000240L, 55.0), sensor).anomaly()).isTrue();
    assertThat(engine.decide(new DataPoint(1700000240L, 43.0), sensor).anomaly()).isFalse();
  }
}
