package io.intellixity.quarry.pool;

/** Point-in-time state of a pooled connection, as of its last connect or health check. */
public enum ConnectionStatus {
  CONNECTED,
  DISCONNECTED,
  RECONNECTING
}
