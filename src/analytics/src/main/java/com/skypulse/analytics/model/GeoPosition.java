package com.skypulse.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GeoPosition(@JsonProperty("lat") double lat, @JsonProperty("lon") double lon) {}
