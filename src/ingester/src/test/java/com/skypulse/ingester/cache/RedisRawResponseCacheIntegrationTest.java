package com.skypulse.ingester.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class RedisRawResponseCacheIntegrationTest {

  @Container
  private static final GenericContainer<?> REDIS =
      new GenericContainer<>("redis:7.2-alpine").withExposedPorts(6379);

  private static LettuceConnectionFactory connectionFactory;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private StringRedisTemplate redisTemplate;
  private RedisRawResponseCache cache;

  @BeforeAll
  static void setupRedis() {
    RedisStandaloneConfiguration config =
        new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379));
    connectionFactory = new LettuceConnectionFactory(config);
    connectionFactory.afterPropertiesSet();
  }

  @AfterAll
  static void shutdownRedis() {
    if (connectionFactory != null) {
      connectionFactory.destroy();
    }
  }

  @BeforeEach
  void clearRedis() {
    redisTemplate = new StringRedisTemplate(connectionFactory);
    redisTemplate.afterPropertiesSet();
    try (RedisConnection connection = connectionFactory.getConnection()) {
      connection.serverCommands().flushAll();
    }
    cache = new RedisRawResponseCache(redisTemplate, objectMapper, "skypulse:raw:", Duration.ofSeconds(300));
  }

  @Test
  void storesPayloadUnderRegionKeyWithTtl() {
    CachedPayload payload =
        new CachedPayload("{\"time\":1714557600,\"states\":[]}", Instant.parse("2024-05-01T10:00:00Z"));

    cache.put("europe", payload);

    assertThat(cache.latest("europe")).contains(payload);
    assertThat(redisTemplate.getExpire("skypulse:raw:europe")).isBetween(1L, 300L);
    assertThat(cache.latest("asia")).isEmpty();
  }

  @Test
  void unreadableEntryIsTreatedAsMiss() {
    redisTemplate.opsForValue().set("skypulse:raw:europe", "not-json");

    assertThat(cache.latest("europe")).isEmpty();
  }
}
