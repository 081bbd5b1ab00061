package com.skypulse.analytics.engine;

import java.util.List;

/** Equal compass slices centred on north: with 8 sectors, N covers [337.5, 22.5). */
public final class CompassSectors {
  private static final List<String> EIGHT = List.of("N", "NE", "E", "SE", "S", "SW", "W", "NW");
  private static final List<String> SIXTEEN = List.of(
      "N", "NNE", "NE", "ENE", "E", "ESE", "SE", "SSE",
      "S", "SSW", "SW", "WSW", "W", "WNW", "NW", "NNW");

  private final List<String> labels;
  private final double width;

  public CompassSectors(int sectors) {
    if (sectors == 8) {
      labels = EIGHT;
    } else if (sectors == 16) {
      labels = SIXTEEN;
    } else {
      throw new IllegalArgumentException("compass sectors must be 8 or 16, got " + sectors);
    }
    width = 360.0 / sectors;
  }

  public List<String> labels() {
    return labels;
  }

  public String sectorOf(double headingDeg) {
    double normalized = headingDeg % 360.0;
    if (normalized < 0) {
      normalized += 360.0;
    }
    int index = (int) Math.floor((normalized + width / 2.0) / width) % labels.size();
    return labels.get(index);
  }
}
