package com.ospicorp.anomalyapi.training;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.anomalyapi.cache.CacheLookup;
import com.ospicorp.anomalyapi.model.ModelStatus;
import com.ospicorp.anomalyapi.model.ModelVersion;
import com.ospicorp.anomalyapi.model.TrainingBatch;
import com.ospicorp.anomalyapi.model.VersionSelector;
import com.ospicorp.anomalyapi.store.VersionManager;
import com.ospicorp.anomalyapi.support.BackendTimeoutException;
import com.ospicorp.anomalyapi.support.CoreFixture;
import com.ospicorp.anomalyapi.support.Deadline;
import com.ospicorp.anomalyapi.support.InMemoryModelStore;
import com.ospicorp.anomalyapi.support.StubTransactionManager;
import com.ospicorp.anomalyapi.support.TestBatches;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.TransactionTimedOutException;

class TrainingServiceTest {

  private final CoreFixture core = new CoreFixture();

  @AfterEach
  void tearDown() {
    core.close();
  }

  @Test
  void firstTrainingCreatesActiveV1() {
    TrainingResult result = core.trainingService.train("sensor_001", TestBatches.sensor001(), null);

    assertThat(result.label()).isEqualTo("v1");
    assertThat(result.status()).isEqualTo(ModelStatus.ACTIVE);
    assertThat(result.pointsUsed()).isEqualTo(4);
    assertThat(result.mean()).isCloseTo(42.9, within(1e-9));
    assertThat(result.std()).isGreaterThan(0.0);
    assertThat(result.thresholdMultiplier()).isEqualTo(3.0);
    assertThat(core.store.loadActive("sensor_001").version()).isEqualTo(1);
  }

  @Test
  void retrainingSupersedesThePreviousVersion() {
    core.trainingService.train("sensor_001", TestBatches.sensor001(), null);
    TrainingResult second = core.trainingService.train("sensor_001", TestBatches.shifted(), 2.0);

    assertThat(second.label()).isEqualTo("v2");
    assertThat(second.thresholdMultiplier()).isEqualTo(2.0);
    assertThat(core.store.listVersions("sensor_001"))
        .extracting(ModelVersion::version, ModelVersion::status)
        .containsExactly(
            tuple(1, ModelStatus.SUPERSEDED),
            tuple(2, ModelStatus.ACTIVE));
  }

  @Test
  void rejectedBatchLeavesNoTrace() {
    TrainingBatch constant = new TrainingBatch(List.of(1L, 2L), List.of(5.0, 5.0));

    assertThatThrownBy(() -> core.trainingService.train("sensor_001", constant, null))
        .isInstanceOf(InvalidTrainingBatchException.class);
    assertThat(core.store.listVersions("sensor_001")).isEmpty();
    assertThat(core.transactions.commits()).isZero();
  }

  @Test
  void blankSeriesIdIsRejected() {
    assertThatThrownBy(() -> core.trainingService.train(" ", TestBatches.sensor001(), null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void servingSeesNewVersionAsSoonAsTrainingReturns() {
    core.trainingService.train("sensor_001", TestBatches.sensor001(), null);
    CacheLookup warm = core.cache.get("sensor_001", VersionSelector.active(),
        Deadline.afterMillis(1000));
    assertThat(warm.parameters().version()).isEqualTo(1);
    assertThat(core.cache.get("sensor_001", VersionSelector.active(), Deadline.afterMillis(1000))
        .hit()).isTrue();

    core.trainingService.train("sensor_001", TestBatches.shifted(), null);

    CacheLookup after = core.cache.get("sensor_001", VersionSelector.active(),
        Deadline.afterMillis(1000));
    assertThat(after.parameters().version()).isEqualTo(2);
    assertThat(after.hit()).isFalse();
  }

  @Test
  void concurrentTrainingsOfOneSeriesGetDistinctOrderedVersions() throws Exception {
    int trainers = 8;
    ExecutorService pool = Executors.newFixedThreadPool(trainers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<TrainingResult>> futures = new ArrayList<>();
      for (int i = 0; i < trainers; i++) {
        Callable<TrainingResult> task = () -> {
          start.await();
          return core.trainingService.train("sensor_001", TestBatches.sensor001(), null);
        };
        futures.add(pool.submit(task));
      }
      start.countDown();

      List<Integer> versions = new ArrayList<>();
      for (Future<TrainingResult> future : futures) {
        versions.add(future.get(10, TimeUnit.SECONDS).version());
      }

      assertThat(versions).doesNotHaveDuplicates().hasSize(trainers);
      List<ModelVersion> stored = core.store.listVersions("sensor_001");
      assertThat(stored).extracting(ModelVersion::version)
          .containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
      assertThat(stored).filteredOn(ModelVersion::isActive)
          .singleElement()
          .extracting(ModelVersion::version)
          .isEqualTo(trainers);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void transactionTimeoutSurfacesAsBackendTimeout() {
    InMemoryModelStore slowStore = new InMemoryModelStore() {
      @Override
      public ModelVersion append(String seriesId, FittedModel fitted, TrainingBatch batch,
          double trainingLatencyMs) {
        throw new TransactionTimedOutException("Transaction timed out: deadline was reached");
      }
    };
    StubTransactionManager transactions = new StubTransactionManager();
    TrainingService service = new TrainingService(new BatchValidator(), new GaussianFitter(),
        slowStore, new VersionManager(slowStore, core.cache, transactions), transactions, 3.0, 1);

    assertThatThrownBy(() -> service.train("sensor_001", TestBatches.sensor001(), null))
        .isInstanceOf(BackendTimeoutException.class)
        .hasMessageContaining("sensor_001");
    assertThat(transactions.rollbacks()).isEqualTo(1);
  }
}
