package com.skypulse.ingester.api;

import com.skypulse.ingester.airport.BudgetDeniedException;
import com.skypulse.ingester.opensky.OpenSkyAuthException;
import com.skypulse.ingester.opensky.UpstreamTransportException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps API failures to JSON {@code {error, message, timestamp}} payloads.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(BadRequestException.class)
  public ResponseEntity<Map<String, Object>> handleBadRequest(BadRequestException ex) {
    return ResponseEntity.badRequest().body(error("bad_request", ex.getMessage()));
  }

  @ExceptionHandler(NotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", ex.getMessage()));
  }

  @ExceptionHandler(SnapshotNotAvailableException.class)
  public ResponseEntity<Map<String, Object>> handleNotYetAvailable(SnapshotNotAvailableException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_yet_available", ex.getMessage()));
  }

  @ExceptionHandler(BudgetDeniedException.class)
  public ResponseEntity<Map<String, Object>> handleBudgetDenied(BudgetDeniedException ex) {
    return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
        .header("Retry-After", Long.toString(Math.max(0L, ex.getRetryAfterSeconds())))
        .body(error("too_many_requests", ex.getMessage(), ex.getRetryAfterSeconds()));
  }

  /** Upstream OpenSky failures on on-demand queries. */
  @ExceptionHandler({UpstreamTransportException.class, OpenSkyAuthException.class})
  public ResponseEntity<Map<String, Object>> handleUpstream(RuntimeException ex) {
    log.warn("Upstream request failed: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(error("upstream_unavailable", "OpenSky upstream unavailable"));
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<Map<String, Object>> handleMissingRoute(Exception ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("not_found", "resource not found"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
    log.error("Unhandled API failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(error("internal_error", "internal server error"));
  }

  private Map<String, Object> error(String code, String message) {
    return Map.of(
        "error", code,
        "message", message == null ? code : message,
        "timestamp", Instant.now().toString());
  }

  private Map<String, Object> error(String code, String message, long retryAfterSeconds) {
    return Map.of(
        "error", code,
        "message", message == null ? code : message,
        "retryAfterSeconds", Math.max(0L, retryAfterSeconds),
        "timestamp", Instant.now().toString());
  }
}
