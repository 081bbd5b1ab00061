package com.skypulse.ingester.region;

/**
 * Immutable geographic bounding box of a region query.
 *
 * @param latMin minimum latitude
 * @param latMax maximum latitude
 * @param lonMin minimum longitude
 * @param lonMax maximum longitude
 */
public record BoundingBox(double latMin, double latMax, double lonMin, double lonMax) {
  /**
   * Computes the rectangular area in square degrees, the unit OpenSky bills by.
   *
   * @return area in deg²
   */
  public double areaDeg2() {
    return Math.max(0.0, (latMax - latMin) * (lonMax - lonMin));
  }

  /**
   * Returns the OpenSky credit cost of one {@code /states/all} query over this box.
   *
   * @return 1 to 4 credits
   */
  public int creditCost() {
    double area = areaDeg2();
    if (area <= 25.0) {
      return 1;
    }
    if (area <= 100.0) {
      return 2;
    }
    if (area <= 400.0) {
      return 3;
    }
    return 4;
  }

  boolean isValid() {
    return latMin >= -90.0 && latMax <= 90.0
        && lonMin >= -180.0 && lonMax <= 180.0
        && latMin < latMax && lonMin < lonMax;
  }
}
