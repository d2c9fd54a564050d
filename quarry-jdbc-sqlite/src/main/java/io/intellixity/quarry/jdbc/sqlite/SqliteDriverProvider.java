package io.intellixity.quarry.jdbc.sqlite;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.core.driver.DatabaseDriver;
import io.intellixity.quarry.core.driver.DriverProvider;

public final class SqliteDriverProvider implements DriverProvider {
  @Override public DbType type() { return DbType.SQLITE; }

  @Override
  public DatabaseDriver create(ConnectionConfig config, DriverSettings settings) {
    return new SqliteDriver(config);
  }
}
