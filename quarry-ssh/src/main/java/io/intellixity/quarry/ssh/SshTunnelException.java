package io.intellixity.quarry.ssh;

import io.intellixity.quarry.core.error.DriverConnectionException;

/** Tunnel setup failed: bad address, unreachable host, handshake or authentication. */
public final class SshTunnelException extends DriverConnectionException {
  public SshTunnelException(String message) {
    super(message);
  }

  public SshTunnelException(String message, Throwable cause) {
    super(message, cause);
  }
}
