package com.skypulse.ingester.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed cache shared by ingester replicas. One key per region holding a JSON envelope, with
 * the TTL enforced by Redis.
 */
public class RedisRawResponseCache implements RawResponseCache {
  private static final Logger log = LoggerFactory.getLogger(RedisRawResponseCache.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;
  private final Duration ttl;

  public RedisRawResponseCache(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String keyPrefix, Duration ttl) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.keyPrefix = keyPrefix;
    this.ttl = ttl;
  }

  String key(String region) {
    return keyPrefix + region;
  }

  @Override
  public void put(String region, CachedPayload payload) {
    try {
      redisTemplate.opsForValue().set(key(region), objectMapper.writeValueAsString(payload), ttl);
    } catch (JsonProcessingException ex) {
      log.warn("Failed to serialize raw payload for region {}", region, ex);
    } catch (DataAccessException ex) {
      log.warn("Unable to write raw payload for region {} to Redis: {}", region, ex.getMessage());
    }
  }

  @Override
  public Optional<CachedPayload> latest(String region) {
    try {
      String json = redisTemplate.opsForValue().get(key(region));
      if (json == null || json.isBlank()) {
        return Optional.empty();
      }
      return Optional.of(objectMapper.readValue(json, CachedPayload.class));
    } catch (JsonProcessingException ex) {
      log.warn("Discarding unreadable cached payload for region {}", region, ex);
      return Optional.empty();
    } catch (DataAccessException ex) {
      log.warn("Unable to read raw payload for region {} from Redis: {}", region, ex.getMessage());
      return Optional.empty();
    }
  }
}
