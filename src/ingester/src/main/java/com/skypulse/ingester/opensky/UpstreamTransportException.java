package com.skypulse.ingester.opensky;

/**
 * OpenSky data request failed: I/O error, timeout, or a non-success status.
 *
 * <p>Retryable on the next tick. {@code statusCode} is 0 when no response was received.
 */
public class UpstreamTransportException extends RuntimeException {
  private final int statusCode;
  private final Long retryAfterSeconds;

  public UpstreamTransportException(String message, int statusCode, Long retryAfterSeconds) {
    super(message);
    this.statusCode = statusCode;
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public UpstreamTransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
    this.retryAfterSeconds = null;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isRateLimited() {
    return statusCode == 429;
  }

  public Long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
