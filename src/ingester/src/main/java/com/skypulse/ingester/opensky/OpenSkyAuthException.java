package com.skypulse.ingester.opensky;

/**
 * Token exchange failure.
 *
 * <p>{@code retryable=false} means the credentials were rejected; retrying cannot succeed until the
 * process is restarted with different credentials.
 */
public class OpenSkyAuthException extends RuntimeException {
  private final boolean retryable;

  public OpenSkyAuthException(String message, boolean retryable) {
    super(message);
    this.retryable = retryable;
  }

  public OpenSkyAuthException(String message, boolean retryable, Throwable cause) {
    super(message, cause);
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
