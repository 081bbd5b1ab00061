package com.skypulse.ingester.api;

/** Unknown region or resource. Mapped to HTTP 404 {@code not_found}. */
public class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }
}
