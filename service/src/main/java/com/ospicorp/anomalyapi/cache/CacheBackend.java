package com.ospicorp.anomalyapi.cache;

import com.ospicorp.anomalyapi.model.ModelParameters;
import java.time.Duration;
import java.util.Optional;

/**
 * Storage behind {@link ModelCache}. Implementations may throw on infrastructure failure;
 * the cache treats that as a miss or a skipped write.
 *
 * <p>The generation counter must be shared by every process using the same backend and must
 * never expire or go backwards, otherwise a retired active entry could become readable again.
 */
public interface CacheBackend {

  Optional<ModelParameters> get(CacheKey key);

  void put(CacheKey key, ModelParameters parameters, Duration ttl);

  void evict(CacheKey key);

  /** Current generation of the series' active key, 0 before the first invalidation. */
  long generation(String seriesId);

  /** Moves the series to a new generation and returns it. */
  long advanceGeneration(String seriesId);
}
