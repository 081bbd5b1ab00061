package com.skypulse.ingester.region;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A named, statically configured query area. */
public record Region(
    @JsonProperty("name") String name,
    @JsonProperty("bounding_box") BoundingBox boundingBox) {

  @JsonProperty("estimated_credit_cost")
  public int estimatedCreditCost() {
    return boundingBox.creditCost();
  }
}
