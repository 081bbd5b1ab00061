package com.skypulse.ingester.api;

/** The region is known but nothing has been published for it yet. */
public class SnapshotNotAvailableException extends RuntimeException {
  public SnapshotNotAvailableException(String region) {
    super("no snapshot available yet for region " + region);
  }
}
