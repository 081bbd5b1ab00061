package com.skypulse.analytics.transform;

/**
 * Raised for a single upstream row that cannot become a flight record.
 *
 * <p>Always handled inside the transform: the row is logged and dropped.
 */
public class MalformedRecordException extends RuntimeException {
  private final int rowIndex;

  public MalformedRecordException(int rowIndex, String message) {
    super("row " + rowIndex + ": " + message);
    this.rowIndex = rowIndex;
  }

  public int getRowIndex() {
    return rowIndex;
  }
}
