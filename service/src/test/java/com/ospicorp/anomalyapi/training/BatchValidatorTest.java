package com.ospicorp.anomalyapi.training;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.anomalyapi.model.TrainingBatch;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchValidatorTest {

  private final BatchValidator validator = new BatchValidator();

  @Test
  void acceptsOrdinaryBatch() {
    TrainingBatch batch = new TrainingBatch(List.of(1L, 2L, 3L, 4L), List.of(42.5, 43.1, 41.8, 44.2));

    assertThatCode(() -> validator.validate(batch, 3.0)).doesNotThrowAnyException();
  }

  @Test
  void mismatchedLengthsAreRejectedBeforeAnythingElse() {
    TrainingBatch batch = new TrainingBatch(List.of(1L), List.of());

    assertRejected(batch, 3.0, ValidationFailure.SHAPE_MISMATCH);
  }

  @Test
  void singlePointIsInsufficient() {
    assertRejected(new TrainingBatch(List.of(1L), List.of(10.0)), 3.0,
        ValidationFailure.INSUFFICIENT_DATA);
  }

  @Test
  void emptyBatchIsInsufficient() {
    assertRejected(new TrainingBatch(null, null), 3.0, ValidationFailure.INSUFFICIENT_DATA);
  }

  @Test
  void nonFiniteValuesAreInvalid() {
    assertRejected(new TrainingBatch(List.of(1L, 2L, 3L), List.of(1.0, Double.NaN, 2.0)), 3.0,
        ValidationFailure.INVALID_VALUE);
    assertRejected(new TrainingBatch(List.of(1L, 2L), List.of(1.0, Double.POSITIVE_INFINITY)), 3.0,
        ValidationFailure.INVALID_VALUE);
    assertRejected(new TrainingBatch(List.of(1L, 2L), Arrays.asList(1.0, null)), 3.0,
        ValidationFailure.INVALID_VALUE);
  }

  @Test
  void missingTimestampIsInvalid() {
    assertRejected(new TrainingBatch(Arrays.asList(1L, null), List.of(1.0, 2.0)), 3.0,
        ValidationFailure.INVALID_VALUE);
  }

  @Test
  void twoIdenticalValuesAreConstant() {
    assertRejected(new TrainingBatch(List.of(1L, 2L), List.of(7.0, 7.0)), 3.0,
        ValidationFailure.CONSTANT_SERIES);
  }

  @Test
  void constantCheckScalesWithMagnitude() {
    TrainingBatch noise = new TrainingBatch(List.of(1L, 2L), List.of(1e9, 1e9 + 1e-6));
    TrainingBatch signal = new TrainingBatch(List.of(1L, 2L), List.of(1e9, 1e9 + 10));

    assertRejected(noise, 3.0, ValidationFailure.CONSTANT_SERIES);
    assertThatCode(() -> validator.validate(signal, 3.0)).doesNotThrowAnyException();
  }

  @Test
  void decreasingTimestampsAreRejected() {
    assertRejected(new TrainingBatch(List.of(1L, 3L, 2L), List.of(1.0, 2.0, 3.0)), 3.0,
        ValidationFailure.UNORDERED_TIMESTAMPS);
  }

  @Test
  void repeatedTimestampsAreAllowed() {
    TrainingBatch batch = new TrainingBatch(List.of(1L, 1L, 2L), List.of(1.0, 2.0, 3.0));

    assertThatCode(() -> validator.validate(batch, 3.0)).doesNotThrowAnyException();
  }

  @Test
  void thresholdMustBePositiveAndFinite() {
    TrainingBatch batch = new TrainingBatch(List.of(1L, 2L), List.of(1.0, 2.0));

    assertRejected(batch, 0.0, ValidationFailure.INVALID_THRESHOLD);
    assertRejected(batch, -1.0, ValidationFailure.INVALID_THRESHOLD);
    assertRejected(batch, Double.NaN, ValidationFailure.INVALID_THRESHOLD);
  }

  @Test
  void rejectionCarriesErrorCodeAndDocsLink() {
    assertThatThrownBy(() -> validator.validate(new TrainingBatch(List.of(1L), List.of(1.0)), 3.0))
        .isInstanceOfSatisfying(InvalidTrainingBatchException.class, ex -> {
          assertThat(ex.errorCode()).isEqualTo(2002);
          assertThat(ex.moreInfo()).endsWith("/2002");
        });
  }

  private void assertRejected(TrainingBatch batch, double threshold, ValidationFailure reason) {
    assertThatThrownBy(() -> validator.validate(batch, threshold))
        .isInstanceOf(InvalidTrainingBatchException.class)
        .extracting(ex -> ((InvalidTrainingBatchException) ex).reason())
        .isEqualTo(reason);
  }
}
