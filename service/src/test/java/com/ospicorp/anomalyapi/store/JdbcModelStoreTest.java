package com.ospicorp.anomalyapi.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.ospicorp.anomalyapi.model.ModelStatus;
import com.ospicorp.anomalyapi.model.ModelVersion;
import com.ospicorp.anomalyapi.model.TrainingBatch;
import com.ospicorp.anomalyapi.model.TrainingRecord;
import com.ospicorp.anomalyapi.support.Deadline;
import com.ospicorp.anomalyapi.support.PostgresContainerSupport;
import com.ospicorp.anomalyapi.support.TestBatches;
import com.ospicorp.anomalyapi.training.GaussianFitter;
import com.ospicorp.anomalyapi.training.TrainingResult;
import com.ospicorp.anomalyapi.training.TrainingService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JdbcModelStoreTest extends PostgresContainerSupport {

  @Autowired
  private ModelStore store;

  @Autowired
  private TrainingService trainingService;

  @Autowired
  private JdbcTemplate jdbcTemplate;

  private final GaussianFitter fitter = new GaussianFitter();

  @Test
  void appendAssignsIncreasingVersions() {
    TrainingBatch batch = TestBatches.sensor001();

    ModelVersion first = store.append("jdbc.append", fitter.fit(batch, 3.0), batch, 2.5);
    ModelVersion second = store.append("jdbc.append", fitter.fit(batch, 3.0), batch, 2.5);

    assertThat(first.version()).isEqualTo(1);
    assertThat(second.version()).isEqualTo(2);
    assertThat(first.status()).isEqualTo(ModelStatus.PENDING);
    assertThat(first.createdAt()).isNotNull();
    assertThat(store.loadVersion("jdbc.append", 2).trainingLatencyMs()).isEqualTo(2.5);
  }

  @Test
  void trainingRecordKeepsPointOrder() {
    TrainingBatch batch = TestBatches.sensor001();
    ModelVersion stored = store.append("jdbc.record", fitter.fit(batch, 3.0), batch, 1.0);

    TrainingRecord record = store.loadTrainingRecord("jdbc.record", stored.version());

    assertThat(record.points()).isEqualTo(batch.points());
    assertThat(record.statistics().count()).isEqualTo(4);
    assertThat(record.statistics().max()).isEqualTo(44.2);
  }

  @Test
  void trainingActivatesAndSupersedes() {
    trainingService.train("jdbc.train", TestBatches.sensor001(), null);
    trainingService.train("jdbc.train", TestBatches.shifted(), null);

    assertThat(store.listVersions("jdbc.train"))
        .extracting(ModelVersion::version, ModelVersion::status)
        .containsExactly(tuple(1, ModelStatus.SUPERSEDED), tuple(2, ModelStatus.ACTIVE));
    assertThat(store.loadActive("jdbc.train").mean()).isEqualTo(100.0);
  }

  @Test
  void missingRowsAreNotFound() {
    assertThatThrownBy(() -> store.loadActive("jdbc.nothing"))
        .isInstanceOf(ModelNotFoundException.class);
    assertThatThrownBy(() -> store.loadVersion("jdbc.nothing", 1))
        .isInstanceOf(ModelNotFoundException.class);
    assertThatThrownBy(() -> store.loadTrainingRecord("jdbc.nothing", 1))
        .isInstanceOf(ModelNotFoundException.class);
    assertThat(store.listVersions("jdbc.nothing")).isEmpty();
  }

  @Test
  void boundedAndLockingReadsSeeTheSameRows() {
    trainingService.train("jdbc.bounded", TestBatches.sensor001(), null);
    Deadline deadline = Deadline.after(Duration.ofSeconds(2));

    assertThat(store.loadActive("jdbc.bounded", deadline))
        .isEqualTo(store.loadActive("jdbc.bounded"));
    assertThat(store.loadVersion("jdbc.bounded", 1, deadline))
        .isEqualTo(store.loadVersionForUpdate("jdbc.bounded", 1));
    assertThatThrownBy(() -> store.loadVersion("jdbc.bounded", 9, deadline))
        .isInstanceOf(ModelNotFoundException.class);
    assertThatThrownBy(() -> store.loadVersionForUpdate("jdbc.bounded", 9))
        .isInstanceOf(ModelNotFoundException.class);
  }

  @Test
  void transitionIsCompareAndSet() {
    TrainingBatch batch = TestBatches.shifted();
    ModelVersion stored = store.append("jdbc.cas", fitter.fit(batch, 3.0), batch, 1.0);

    assertThat(store.transitionStatus("jdbc.cas", stored.version(), ModelStatus.ACTIVE,
        ModelStatus.SUPERSEDED)).isFalse();
    assertThat(store.transitionStatus("jdbc.cas", stored.version(), ModelStatus.PENDING,
        ModelStatus.SUPERSEDED)).isTrue();
    assertThat(store.loadVersion("jdbc.cas", stored.version()).status())
        .isEqualTo(ModelStatus.SUPERSEDED);
  }

  @Test
  void concurrentTrainingsGetDistinctOrderedVersions() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Callable<TrainingResult>> tasks = new ArrayList<>();
      for (int i = 0; i < 6; i++) {
        tasks.add(() -> trainingService.train("jdbc.race", TestBatches.sensor001(), null));
      }
      List<Integer> versions = new ArrayList<>();
      for (Future<TrainingResult> future : pool.invokeAll(tasks, 60, TimeUnit.SECONDS)) {
        versions.add(future.get().version());
      }

      assertThat(versions).containsExactlyInAnyOrder(1, 2, 3, 4, 5, 6);
    } finally {
      pool.shutdownNow();
    }

    Integer active = jdbcTemplate.queryForObject(
        "SELECT count(*) FROM model_version WHERE series_id = ? AND status = 'ACTIVE'",
        Integer.class, "jdbc.race");
    assertThat(active).isEqualTo(1);
    assertThat(store.loadActive("jdbc.race").version()).isEqualTo(6);
  }
}
