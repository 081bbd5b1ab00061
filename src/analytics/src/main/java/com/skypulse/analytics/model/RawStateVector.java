package com.skypulse.analytics.model;

/**
 * One upstream OpenSky state-vector row, as received.
 *
 * <p>Every field may be {@code null}. Values are kept untouched here; normalization happens in the
 * transform stage.
 */
public record RawStateVector(
    String icao24,
    String callsign,
    String originCountry,
    Long timePosition,
    Long lastContact,
    Double longitude,
    Double latitude,
    Double baroAltitude,
    Boolean onGround,
    Double velocity,
    Double trueTrack,
    Double verticalRate,
    Double geoAltitude,
    String squawk,
    Integer category) {}
