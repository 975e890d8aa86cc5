package com.ospicorp.anomalyapi.cache;

import com.ospicorp.anomalyapi.model.VersionLabels;

/**
 * Address of a cached parameter set. Active keys carry the series' invalidation generation,
 * so advancing the generation retires every active entry written before it. Pinned keys are
 * never touched by activation and always have generation 0.
 */
public record CacheKey(String seriesId, Integer version, long generation) {
  private static final String PREFIX = "model:";

  public static CacheKey active(String seriesId, long generation) {
    return new CacheKey(seriesId, null, generation);
  }

  public static CacheKey pinned(String seriesId, int version) {
    return new CacheKey(seriesId, version, 0L);
  }

  // counter behind the generation of the active key
  public static String generationKey(String seriesId) {
    return PREFIX + seriesId + ":gen";
  }

  public boolean isActive() {
    return version == null;
  }

  public String asString() {
    return PREFIX + seriesId + ":"
        + (isActive() ? "active:g" + generation : VersionLabels.format(version));
  }
}
