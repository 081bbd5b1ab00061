package com.skypulse.ingester.opensky;

/** OAuth2 client credentials. The secret is kept out of {@link #toString()}. */
public record OpenSkyCredentials(String clientId, String clientSecret) {
  @Override
  public String toString() {
    return "OpenSkyCredentials[clientId=" + clientId + ", clientSecret=***]";
  }
}
