package com.ospicorp.anomalyapi.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.anomalyapi.model.ModelParameters;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Shared backend for multi-instance deployments. Values are the JSON form of
 * {@link ModelParameters} and expire through Redis TTLs. The generation of each series is a
 * plain counter key without TTL, advanced with {@code INCR}, so every instance sees the same
 * generation and a load that raced an activation on another instance writes to a key nobody
 * reads anymore.
 */
@Component
@ConditionalOnProperty(name = "anomaly.cache.backend", havingValue = "redis")
public class RedisCacheBackend implements CacheBackend {
  private static final Logger log = LoggerFactory.getLogger(RedisCacheBackend.class);

  private final StringRedisTemplate redis;
  private final ObjectMapper mapper;

  public RedisCacheBackend(StringRedisTemplate redis, ObjectMapper mapper) {
    this.redis = redis;
    this.mapper = mapper;
  }

  @Override
  public Optional<ModelParameters> get(CacheKey key) {
    String json = redis.opsForValue().get(key.asString());
    if (json == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(json, ModelParameters.class));
    } catch (JsonProcessingException ex) {
      log.warn("Discarding unreadable cache entry {}: {}", key.asString(), ex.getOriginalMessage());
      redis.delete(key.asString());
      return Optional.empty();
    }
  }

  @Override
  public void put(CacheKey key, ModelParameters parameters, Duration ttl) {
    String json;
    try {
      json = mapper.writeValueAsString(parameters);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Cannot serialize model parameters for " + key.asString(), ex);
    }
    redis.opsForValue().set(key.asString(), json, ttl);
  }

  @Override
  public void evict(CacheKey key) {
    redis.delete(key.asString());
  }

  @Override
  public long generation(String seriesId) {
    String value = redis.opsForValue().get(CacheKey.generationKey(seriesId));
    if (value == null) {
      return 0L;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException ex) {
      throw new IllegalStateException("Corrupt cache generation for series " + seriesId
          + ": " + value, ex);
    }
  }

  @Override
  public long advanceGeneration(String seriesId) {
    Long next = redis.opsForValue().increment(CacheKey.generationKey(seriesId));
    if (next == null) {
      // only happens inside a pipeline or transaction
      throw new IllegalStateException("INCR returned no value for series " + seriesId);
    }
    return next;
  }
}
