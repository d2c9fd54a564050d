package io.intellixity.quarry.core.driver;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;

/**
 * Creates drivers for one backend. Implementations are listed in {@code META-INF/quarry.factories}.
 */
public interface DriverProvider {
  DbType type();

  /**
   * Builds a driver without touching the network; underlying resources are created lazily.
   * Invalid local configuration is rejected with a {@link io.intellixity.quarry.core.error.RequestValidationException}.
   */
  DatabaseDriver create(ConnectionConfig config, DriverSettings settings);
}
