package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.config.ConnectionConfig;

import java.util.Optional;

/**
 * Where persisted connection definitions live. Consulted on first use and again on every reconnect,
 * so edits to a stored connection take effect without restarting.
 */
@FunctionalInterface
public interface ConnectionConfigSource {
  Optional<ConnectionConfig> find(String connectionId);
}
