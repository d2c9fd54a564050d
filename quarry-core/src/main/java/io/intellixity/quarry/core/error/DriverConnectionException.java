package io.intellixity.quarry.core.error;

/** Backend (or SSH host) could not be reached or refused authentication. */
public class DriverConnectionException extends DriverException {
  public DriverConnectionException(String message) {
    super(message);
  }

  public DriverConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
