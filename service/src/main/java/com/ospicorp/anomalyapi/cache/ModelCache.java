package com.ospicorp.anomalyapi.cache;

import com.ospicorp.anomalyapi.model.ModelParameters;
import com.ospicorp.anomalyapi.model.ModelVersion;
import com.ospicorp.anomalyapi.model.VersionSelector;
import com.ospicorp.anomalyapi.store.ModelNotFoundException;
import com.ospicorp.anomalyapi.store.ModelStore;
import com.ospicorp.anomalyapi.support.BackendTimeoutException;
import com.ospicorp.anomalyapi.support.BackendUnavailableException;
import com.ospicorp.anomalyapi.support.Deadline;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Cache-aside access to model parameters. The store stays authoritative: a backend that
 * fails is treated as empty, and only store failures reach the caller.
 *
 * <p>The active entry of a series is keyed by the series' invalidation generation, which the
 * backend keeps. Invalidating advances the generation; a load that raced an activation
 * populates the generation it started from, which is no longer read. When the backend could
 * not confirm an invalidation, the series bypasses the cache until a retry succeeds.
 */
@Component
public class ModelCache {
  private static final Logger log = LoggerFactory.getLogger(ModelCache.class);

  private final CacheBackend backend;
  private final ModelStore store;
  private final Executor loader;
  private final Duration activeTtl;
  private final Duration pinnedTtl;
  // series -> failed invalidation attempts not yet followed by a confirmed one
  private final ConcurrentMap<String, Long> unconfirmed = new ConcurrentHashMap<>();

  public ModelCache(CacheBackend backend, ModelStore store,
      @Qualifier("storeLoaderExecutor") Executor loader,
      @Value("${anomaly.cache.active-ttl-seconds:3600}") long activeTtlSeconds,
      @Value("${anomaly.cache.pinned-ttl-seconds:3600}") long pinnedTtlSeconds) {
    this.backend = backend;
    this.store = store;
    this.loader = loader;
    this.activeTtl = Duration.ofSeconds(activeTtlSeconds);
    this.pinnedTtl = Duration.ofSeconds(pinnedTtlSeconds);
  }

  /**
   * Returns the parameters for the selected version, loading them from the store on a miss.
   *
   * @throws ModelNotFoundException when the store has no such version
   * @throws BackendTimeoutException when the store did not answer before the deadline
   * @throws BackendUnavailableException when the store failed
   */
  public CacheLookup get(String seriesId, VersionSelector selector, Deadline deadline) {
    Optional<CacheKey> key = keyFor(seriesId, selector);
    if (key.isEmpty()) {
      return CacheLookup.miss(loadFromStore(seriesId, selector, deadline));
    }
    Optional<ModelParameters> cached = readBackend(key.get());
    if (cached.isPresent()) {
      return CacheLookup.hit(cached.get());
    }
    ModelParameters loaded = loadFromStore(seriesId, selector, deadline);
    populate(key.get(), loaded);
    return CacheLookup.miss(loaded);
  }

  /**
   * Retires the cached active version of the series. Runs after an activation has committed.
   * If the backend cannot be reached, reads of the series go to the store until it can.
   */
  public void invalidate(String seriesId) {
    if (advance(seriesId)) {
      log.debug("Invalidated active model cache entry for series {}", seriesId);
      return;
    }
    unconfirmed.merge(seriesId, 1L, Long::sum);
    log.error("Failed to invalidate cached active model of series {}; serving it from the store"
        + " until the cache is reachable", seriesId);
  }

  // empty when the active entry of the series cannot be trusted right now
  private Optional<CacheKey> keyFor(String seriesId, VersionSelector selector) {
    if (!selector.isActive()) {
      return Optional.of(CacheKey.pinned(seriesId, selector.pinnedVersion()));
    }
    Long failures = unconfirmed.get(seriesId);
    if (failures != null) {
      if (!advance(seriesId)) {
        return Optional.empty();
      }
      if (unconfirmed.remove(seriesId, failures)) {
        log.info("Cache invalidation of series {} confirmed after {} failed attempt(s)",
            seriesId, failures);
      }
    }
    OptionalLong generation = readGeneration(seriesId);
    return generation.isPresent()
        ? Optional.of(CacheKey.active(seriesId, generation.getAsLong()))
        : Optional.empty();
  }

  private boolean advance(String seriesId) {
    long generation;
    try {
      generation = backend.advanceGeneration(seriesId);
    } catch (RuntimeException ex) {
      log.warn("Cache generation update failed for series {}: {}", seriesId, ex.getMessage());
      return false;
    }
    // the old entry is unreachable already, removing it only frees space
    CacheKey retired = CacheKey.active(seriesId, generation - 1);
    try {
      backend.evict(retired);
    } catch (RuntimeException ex) {
      log.debug("Could not remove retired entry {}: {}", retired.asString(), ex.getMessage());
    }
    return true;
  }

  private OptionalLong readGeneration(String seriesId) {
    try {
      return OptionalLong.of(backend.generation(seriesId));
    } catch (RuntimeException ex) {
      log.warn("Cache generation read failed for series {}, using the store: {}", seriesId,
          ex.getMessage());
      return OptionalLong.empty();
    }
  }

  private Optional<ModelParameters> readBackend(CacheKey key) {
    try {
      return backend.get(key);
    } catch (RuntimeException ex) {
      log.warn("Cache read failed for {}, falling back to store: {}", key.asString(),
          ex.getMessage());
      return Optional.empty();
    }
  }

  private ModelParameters loadFromStore(String seriesId, VersionSelector selector,
      Deadline deadline) {
    if (deadline.isExpired()) {
      throw new BackendTimeoutException("Deadline expired before loading model for series "
          + seriesId);
    }
    // FutureTask so that cancel(true) interrupts the loader thread
    FutureTask<ModelParameters> task =
        new FutureTask<>(() -> fetch(seriesId, selector, deadline).parameters());
    try {
      loader.execute(task);
    } catch (RejectedExecutionException ex) {
      throw new BackendUnavailableException("Model loader is saturated", ex);
    }
    try {
      return task.get(deadline.remainingMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      task.cancel(true);
      throw new BackendTimeoutException("Timed out loading model for series " + seriesId
          + " after " + deadline.budget().toMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      task.cancel(true);
      Thread.currentThread().interrupt();
      throw new BackendUnavailableException("Interrupted while loading model for series "
          + seriesId, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof ModelNotFoundException notFound) {
        throw notFound;
      }
      if (cause instanceof BackendTimeoutException timeout) {
        throw timeout;
      }
      if (cause instanceof BackendUnavailableException unavailable) {
        throw unavailable;
      }
      throw new BackendUnavailableException("Model store unavailable for series " + seriesId,
          cause);
    }
  }

  private ModelVersion fetch(String seriesId, VersionSelector selector, Deadline deadline) {
    return selector.isActive()
        ? store.loadActive(seriesId, deadline)
        : store.loadVersion(seriesId, selector.pinnedVersion(), deadline);
  }

  private void populate(CacheKey key, ModelParameters parameters) {
    try {
      backend.put(key, parameters, key.isActive() ? activeTtl : pinnedTtl);
    } catch (RuntimeException ex) {
      log.warn("Cache write failed for {}: {}", key.asString(), ex.getMessage());
    }
  }
}
