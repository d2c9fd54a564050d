package io.intellixity.quarry.core.error;

/** An explicit connect or tunnel-setup deadline elapsed. */
public final class DriverTimeoutException extends DriverException {
  public DriverTimeoutException(String message) {
    super(message);
  }

  public DriverTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
