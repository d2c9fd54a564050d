package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.config.ConnectionConfig;

/** Builds a driver (and its tunnel) for one connect attempt. Failures are unchecked {@code DriverException}s. */
@FunctionalInterface
public interface DriverFactory {
  ResolvedDriver create(ConnectionConfig config);
}
