package com.ospicorp.anomalyapi.store;

import com.ospicorp.anomalyapi.cache.ModelCache;
import com.ospicorp.anomalyapi.model.ModelStatus;
import com.ospicorp.anomalyapi.model.ModelVersion;
import com.ospicorp.anomalyapi.model.VersionLabels;
import com.ospicorp.anomalyapi.support.StripedLocks;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns the single-active-version invariant. Every status change of a model version goes
 * through here, and the cache is told about a new active version only once the change has
 * committed.
 */
@Service
public class VersionManager {
  private static final Logger log = LoggerFactory.getLogger(VersionManager.class);

  private final ModelStore store;
  private final ModelCache cache;
  private final TransactionTemplate transactions;
  private final StripedLocks seriesLocks = new StripedLocks(256);

  public VersionManager(ModelStore store, ModelCache cache, PlatformTransactionManager txManager) {
    this.store = store;
    this.cache = cache;
    this.transactions = new TransactionTemplate(txManager);
  }

  /**
   * Makes {@code version} the active version of the series, superseding whatever was active.
   * Joins the caller's transaction when there is one. If a newer version is already active,
   * the requested one is superseded instead: the latest version always wins.
   *
   * @throws ModelNotFoundException when the version does not exist
   * @throws IllegalStateException when the version was superseded earlier
   */
  public ActivationOutcome activate(String seriesId, int version) {
    return transactions.execute(status -> {
      // Row lock before the in-process lock. Training already holds the row lock when it
      // gets here, so every path takes the two in the same order.
      store.lockActiveVersion(seriesId);
      ReentrantLock lock = seriesLocks.lockFor(seriesId);
      lock.lock();
      try {
        return transition(seriesId, version);
      } finally {
        lock.unlock();
      }
    });
  }

  private ActivationOutcome transition(String seriesId, int version) {
    OptionalInt current = store.lockActiveVersion(seriesId);
    ModelVersion candidate = store.loadVersionForUpdate(seriesId, version);

    if (candidate.status() == ModelStatus.ACTIVE) {
      return new ActivationOutcome(seriesId, version, ModelStatus.ACTIVE, null);
    }
    if (!candidate.status().canTransitionTo(ModelStatus.ACTIVE)) {
      throw new IllegalStateException("Model version " + candidate.label() + " of series "
          + seriesId + " is " + candidate.status() + " and cannot be activated");
    }

    if (current.isPresent() && current.getAsInt() > version) {
      compareAndSet(seriesId, version, ModelStatus.PENDING, ModelStatus.SUPERSEDED);
      log.info("Series {}: {} superseded on arrival, {} is newer and stays active", seriesId,
          candidate.label(), VersionLabels.format(current.getAsInt()));
      return new ActivationOutcome(seriesId, version, ModelStatus.SUPERSEDED, current.getAsInt());
    }

    Integer previous = null;
    if (current.isPresent()) {
      previous = current.getAsInt();
      compareAndSet(seriesId, previous, ModelStatus.ACTIVE, ModelStatus.SUPERSEDED);
    }
    compareAndSet(seriesId, version, ModelStatus.PENDING, ModelStatus.ACTIVE);
    invalidateAfterCommit(seriesId);

    log.info("Series {}: activated {}{}", seriesId, candidate.label(),
        previous == null ? "" : " (superseded " + VersionLabels.format(previous) + ")");
    return new ActivationOutcome(seriesId, version, ModelStatus.ACTIVE, previous);
  }

  private void compareAndSet(String seriesId, int version, ModelStatus expected,
      ModelStatus target) {
    if (!store.transitionStatus(seriesId, version, expected, target)) {
      throw new ModelPersistenceException("Concurrent status change on "
          + VersionLabels.format(version) + " of series " + seriesId + " (expected " + expected
          + ")");
    }
  }

  private void invalidateAfterCommit(String seriesId) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException("Activation requires transaction synchronization");
    }
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        cache.invalidate(seriesId);
      }
    });
  }
}
