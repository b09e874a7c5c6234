package io.intellixity.relata;

/** Base type for every construction-time failure raised by relata. */
public class RelataException extends RuntimeException {
  public RelataException(String message) {
    super(message);
  }

  public RelataException(String message, Throwable cause) {
    super(message, cause);
  }
}
