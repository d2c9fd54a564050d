package io.intellixity.quarry.core.error;

/** A structural/introspection statement failed on an otherwise healthy connection. */
public final class DriverQueryException extends DriverException {
  public DriverQueryException(String message) {
    super(message);
  }

  public DriverQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
