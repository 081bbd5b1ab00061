package com.skypulse.ingester.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingester")
public record IngesterProperties(
    long refreshMs,
    long initialDelayMs,
    int workerThreads,
    Budget budget,
    List<RegionConfig> regions,
    RawCache rawCache,
    Airports airports) {

  public record Budget(long dailyLimit, long windowHours, int warn50, int warn80, int warn95) {}

  public record RegionConfig(String name, double latMin, double latMax, double lonMin, double lonMax) {}

  public record RawCache(String backend, long ttlSeconds, String keyPrefix) {}

  public record Airports(List<String> major, int queryCost, long maxWindowHours) {}
}
