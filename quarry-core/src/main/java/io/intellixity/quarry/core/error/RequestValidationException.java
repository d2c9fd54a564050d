package io.intellixity.quarry.core.error;

/**
 * Raised when a request is malformed. Always thrown before any network call is made.
 */
public class RequestValidationException extends DriverException {
  public RequestValidationException(String message) {
    super(message);
  }

  public RequestValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
