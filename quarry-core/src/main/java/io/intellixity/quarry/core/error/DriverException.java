package io.intellixity.quarry.core.error;

/**
 * Base of every failure raised by a driver, the pool or the tunnel.
 * <p>
 * Query errors from {@code executeQuery} are not thrown; they travel inline in the result.
 */
public class DriverException extends RuntimeException {
  public DriverException(String message) {
    super(message);
  }

  public DriverException(String message, Throwable cause) {
    super(message, cause);
  }
}
