package com.skypulse.ingester.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skypulse.ingester.config.ConfigurationException;
import com.skypulse.ingester.config.IngesterProperties;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
public class RawCacheConfig {
  private static final Logger log = LoggerFactory.getLogger(RawCacheConfig.class);
  static final long DEFAULT_TTL_SECONDS = 300L;
  static final String DEFAULT_KEY_PREFIX = "skypulse:raw:";

  @Bean
  public RawResponseCache rawResponseCache(
      IngesterProperties properties,
      Clock clock,
      ObjectMapper objectMapper,
      ObjectProvider<StringRedisTemplate> redisTemplate) {
    IngesterProperties.RawCache config = properties.rawCache();
    String backend = config == null || config.backend() == null
        ? "memory"
        : config.backend().trim().toLowerCase(Locale.ROOT);
    Duration ttl = Duration.ofSeconds(
        config != null && config.ttlSeconds() > 0 ? config.ttlSeconds() : DEFAULT_TTL_SECONDS);

    switch (backend) {
      case "memory":
        log.info("Raw response cache: in-memory, ttl={}s", ttl.toSeconds());
        return new InMemoryRawResponseCache(ttl, clock);
      case "redis":
        String prefix = config.keyPrefix() == null || config.keyPrefix().isBlank()
            ? DEFAULT_KEY_PREFIX
            : config.keyPrefix();
        log.info("Raw response cache: redis, prefix={}, ttl={}s", prefix, ttl.toSeconds());
        return new RedisRawResponseCache(redisTemplate.getObject(), objectMapper, prefix, ttl);
      default:
        throw new ConfigurationException("Unknown ingester.raw-cache.backend: " + backend);
    }
  }
}
