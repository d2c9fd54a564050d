package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.config.ConnectionConfig;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryConnectionConfigSource implements ConnectionConfigSource {
  private final Map<String, ConnectionConfig> configs = new ConcurrentHashMap<>();

  public InMemoryConnectionConfigSource() {}

  public InMemoryConnectionConfigSource(Map<String, ConnectionConfig> initial) {
    Objects.requireNonNull(initial, "initial").forEach(this::put);
  }

  public InMemoryConnectionConfigSource put(String connectionId, ConnectionConfig config) {
    configs.put(Objects.requireNonNull(connectionId, "connectionId"), Objects.requireNonNull(config, "config"));
    return this;
  }

  public void remove(String connectionId) {
    configs.remove(connectionId);
  }

  @Override
  public Optional<ConnectionConfig> find(String connectionId) {
    return Optional.ofNullable(configs.get(connectionId));
  }
}
