package io.intellixity.quarry.clickhouse;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.core.driver.DatabaseDriver;
import io.intellixity.quarry.core.driver.DriverProvider;

public final class ClickHouseDriverProvider implements DriverProvider {
  @Override public DbType type() { return DbType.CLICKHOUSE; }

  @Override
  public DatabaseDriver create(ConnectionConfig config, DriverSettings settings) {
    return new ClickHouseDriver(config, settings);
  }
}
