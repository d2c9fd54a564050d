package io.intellixity.quarry.core.error;

/** Operation has no meaning for the backend. */
public final class UnsupportedDriverOperationException extends DriverException {
  public UnsupportedDriverOperationException(String message) {
    super(message);
  }

  public UnsupportedDriverOperationException(String message, Throwable cause) {
    super(message, cause);
  }
}
