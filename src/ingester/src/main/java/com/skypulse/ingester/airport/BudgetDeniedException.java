package com.skypulse.ingester.airport;

/**
 * An on-demand query was refused by the credit budget.
 *
 * <p>Mapped to HTTP 429 with a retry hint equal to the time until credits are released.
 */
public class BudgetDeniedException extends RuntimeException {
  private final long retryAfterSeconds;

  public BudgetDeniedException(String message, long retryAfterSeconds) {
    super(message);
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
