package com.ospicorp.anomalyapi.cache;

import com.ospicorp.anomalyapi.model.ModelParameters;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-process backend: bounded, least-recently-used eviction, per-entry TTL. Split into
 * segments that each hold their own lock, so lookups for unrelated series rarely contend.
 * Generations live beside the entries and are not subject to eviction.
 */
@Component
@ConditionalOnProperty(name = "anomaly.cache.backend", havingValue = "local", matchIfMissing = true)
public class LocalLruCacheBackend implements CacheBackend {
  static final int SEGMENTS = 16;

  private final Segment[] segments = new Segment[SEGMENTS];
  private final Clock clock;

  public LocalLruCacheBackend(@Value("${anomaly.cache.max-entries:10000}") int maxEntries,
      Clock clock) {
    if (maxEntries < SEGMENTS) {
      throw new IllegalArgumentException("anomaly.cache.max-entries must be at least " + SEGMENTS);
    }
    this.clock = clock;
    int perSegment = (maxEntries + SEGMENTS - 1) / SEGMENTS;
    for (int i = 0; i < SEGMENTS; i++) {
      segments[i] = new Segment(perSegment);
    }
  }

  @Override
  public Optional<ModelParameters> get(CacheKey key) {
    return segmentFor(key).get(key, clock.instant());
  }

  @Override
  public void put(CacheKey key, ModelParameters parameters, Duration ttl) {
    segmentFor(key).put(key, new Entry(parameters, clock.instant().plus(ttl)));
  }

  @Override
  public void evict(CacheKey key) {
    segmentFor(key).remove(key);
  }

  @Override
  public long generation(String seriesId) {
    return segmentFor(seriesId).generation(seriesId);
  }

  @Override
  public long advanceGeneration(String seriesId) {
    return segmentFor(seriesId).advance(seriesId);
  }

  public int size() {
    int total = 0;
    for (Segment segment : segments) {
      total += segment.size();
    }
    return total;
  }

  // by series, so both keys of one series share a segment
  private Segment segmentFor(CacheKey key) {
    return segmentFor(key.seriesId());
  }

  private Segment segmentFor(String seriesId) {
    int h = seriesId.hashCode();
    h ^= (h >>> 16);
    return segments[h & (SEGMENTS - 1)];
  }

  private record Entry(ModelParameters parameters, Instant expiresAt) {}

  private static final class Segment {
    private final LinkedHashMap<CacheKey, Entry> entries;
    private final Map<String, Long> generations = new HashMap<>();

    Segment(int capacity) {
      this.entries = new LinkedHashMap<>(16, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<CacheKey, Entry> eldest) {
          return size() > capacity;
        }
      };
    }

    synchronized Optional<ModelParameters> get(CacheKey key, Instant now) {
      Entry entry = entries.get(key);
      if (entry == null) {
        return Optional.empty();
      }
      if (!now.isBefore(entry.expiresAt())) {
        entries.remove(key);
        return Optional.empty();
      }
      return Optional.of(entry.parameters());
    }

    synchronized void put(CacheKey key, Entry entry) {
      entries.put(key, entry);
    }

    synchronized void remove(CacheKey key) {
      entries.remove(key);
    }

    synchronized long generation(String seriesId) {
      return generations.getOrDefault(seriesId, 0L);
    }

    synchronized long advance(String seriesId) {
      long previous = generations.getOrDefault(seriesId, 0L);
      entries.remove(CacheKey.active(seriesId, previous));
      generations.put(seriesId, previous + 1);
      return previous + 1;
    }

    synchronized int size() {
      return entries.size();
    }
  }
}
