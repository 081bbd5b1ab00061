package com.skypulse.analytics.transform;

/** Raised when a whole upstream payload is not parseable JSON. */
public class MalformedPayloadException extends RuntimeException {
  public MalformedPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
