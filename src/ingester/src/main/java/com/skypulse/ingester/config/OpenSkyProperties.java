package com.skypulse.ingester.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OpenSky endpoints, credentials and HTTP limits.
 *
 * <p>Credentials come from {@code clientId}/{@code clientSecret} (environment) or from the SSM
 * parameter names in {@code clientIdSsm}/{@code clientSecretSsm}.
 */
@ConfigurationProperties(prefix = "opensky")
public record OpenSkyProperties(
    String baseUrl,
    String tokenUrl,
    String clientId,
    String clientSecret,
    String clientIdSsm,
    String clientSecretSsm,
    long tokenSafetyMarginSeconds,
    long connectTimeoutMs,
    long requestTimeoutMs) {}
