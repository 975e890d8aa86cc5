package com.ospicorp.anomalyapi.training;

import com.ospicorp.anomalyapi.model.ModelVersion;
import com.ospicorp.anomalyapi.model.TrainingBatch;
import com.ospicorp.anomalyapi.store.ActivationOutcome;
import com.ospicorp.anomalyapi.store.ModelPersistenceException;
import com.ospicorp.anomalyapi.store.ModelStore;
import com.ospicorp.anomalyapi.store.VersionManager;
import com.ospicorp.anomalyapi.support.BackendTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Validate, fit, persist and activate in one go. The version row, its training points and
 * the activation commit together; the cache learns about the new version after that commit
 * and before this method returns.
 */
@Service
public class TrainingService {
  private static final Logger log = LoggerFactory.getLogger(TrainingService.class);

  private final BatchValidator validator;
  private final GaussianFitter fitter;
  private final ModelStore store;
  private final VersionManager versionManager;
  private final TransactionTemplate transactions;
  private final double defaultThreshold;

  public TrainingService(BatchValidator validator, GaussianFitter fitter, ModelStore store,
      VersionManager versionManager, PlatformTransactionManager txManager,
      @Value("${anomaly.training.default-threshold:3.0}") double defaultThreshold,
      @Value("${anomaly.training.timeout-seconds:10}") int timeoutSeconds) {
    this.validator = validator;
    this.fitter = fitter;
    this.store = store;
    this.versionManager = versionManager;
    this.defaultThreshold = defaultThreshold;
    this.transactions = new TransactionTemplate(txManager);
    this.transactions.setTimeout(timeoutSeconds);
  }

  /**
   * @param thresholdMultiplier k in {@code mean + k * std}; the configured default when null
   * @throws InvalidTrainingBatchException when the batch is rejected; nothing is stored
   * @throws ModelPersistenceException when the version could not be stored
   * @throws BackendTimeoutException when the store did not finish within the timeout
   */
  public TrainingResult train(String seriesId, TrainingBatch batch, Double thresholdMultiplier) {
    if (!StringUtils.hasText(seriesId)) {
      throw new IllegalArgumentException("series_id must be provided");
    }
    double k = thresholdMultiplier != null ? thresholdMultiplier : defaultThreshold;

    long start = System.nanoTime();
    validator.validate(batch, k);
    FittedModel fitted = fitter.fit(batch, k);
    double trainingLatencyMs = (System.nanoTime() - start) / 1_000_000d;

    Committed committed;
    try {
      committed = transactions.execute(status -> {
        ModelVersion appended = store.append(seriesId, fitted, batch, trainingLatencyMs);
        return new Committed(appended, versionManager.activate(seriesId, appended.version()));
      });
    } catch (TransactionTimedOutException | QueryTimeoutException ex) {
      throw new BackendTimeoutException("Timed out storing model for series " + seriesId, ex);
    } catch (DataAccessException | TransactionException ex) {
      throw new ModelPersistenceException("Failed to store model for series " + seriesId, ex);
    }

    ModelVersion stored = committed.version();
    ActivationOutcome outcome = committed.outcome();
    log.info("Trained {} for series {} on {} points: mean={}, std={}, k={} ({})",
        stored.label(), seriesId, stored.trainingPoints(), stored.mean(), stored.std(), k,
        outcome.status());
    return new TrainingResult(seriesId, stored.version(), outcome.status(),
        stored.trainingPoints(), stored.mean(), stored.std(), stored.thresholdMultiplier(),
        trainingLatencyMs);
  }

  private record Committed(ModelVersion version, ActivationOutcome outcome) {}
}
