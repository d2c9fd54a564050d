package io.intellixity.quarry.jdbc.postgres;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.core.driver.DatabaseDriver;
import io.intellixity.quarry.core.driver.DriverProvider;
import io.intellixity.quarry.core.error.DriverException;
import io.intellixity.quarry.core.model.ColumnInfo;
import io.intellixity.quarry.core.model.IndexInfo;
import io.intellixity.quarry.core.model.QueryResult;
import io.intellixity.quarry.core.model.TestConnectionResult;
import io.intellixity.quarry.core.util.QuarryFactoriesLoader;
import io.intellixity.quarry.core.value.Values;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDriverTest {

  private static final DriverSettings FAST = DriverSettings.defaults().withPostgresConnectTimeout(Duration.ofSeconds(2));

  private static int closedPort() throws Exception {
    try (ServerSocket s = new ServerSocket(0)) {
      return s.getLocalPort();
    }
  }

  @Test
  void testConnectionReportsFailureForUnreachablePort() throws Exception {
    ConnectionConfig cfg = ConnectionConfig.of(DbType.POSTGRES, "127.0.0.1", closedPort(), "app", "u", "p");
    try (PostgresDriver d = new PostgresDriver(cfg, FAST)) {
      long start = System.nanoTime();
      TestConnectionResult r = d.testConnection();
      long ms = (System.nanoTime() - start) / 1_000_000;

      assertFalse(r.success());
      assertTrue(r.message().startsWith("Connection failed: "), r.message());
      assertTrue(ms < 10_000, "took " + ms + "ms");
    }
  }

  @Test
  void queriesOnUnreachableServerThrowConnectionClassErrors() throws Exception {
    ConnectionConfig cfg = ConnectionConfig.of(DbType.POSTGRES, "127.0.0.1", closedPort(), "app", "u", "p");
    try (PostgresDriver d = new PostgresDriver(cfg, FAST)) {
      var e = assertThrows(DriverException.class, d::listTables);
      assertTrue(e.getMessage().startsWith("Failed to connect to PostgreSQL: "), e.getMessage());
    }
  }

  @Test
  void emptyStatementIsReportedInline() {
    try (PostgresDriver d = new PostgresDriver(ConnectionConfig.of(DbType.POSTGRES, "h", null, "d", "u", "p"), FAST)) {
      QueryResult r = d.executeQuery("  ");
      assertEquals("Empty query", r.error());
    }
  }

  @Test
  void buildsUrlWithSslModeAndDefaultPort() {
    ConnectionConfig cfg = ConnectionConfig.of(DbType.POSTGRES, "db.local", null, "shop", "u", "p");
    assertEquals("jdbc:postgresql://db.local:5432/shop?sslmode=disable", new PostgresDriver(cfg, FAST).jdbcUrl());
    assertEquals("jdbc:postgresql://db.local:5432/shop?sslmode=require",
        new PostgresDriver(cfg.withSsl(true), FAST).jdbcUrl());
  }

  @Test
  void closedDriverRefusesNewWork() {
    PostgresDriver d = new PostgresDriver(ConnectionConfig.of(DbType.POSTGRES, "h", 1, "d", "u", "p"), FAST);
    d.close();
    d.close();
    assertFalse(d.testConnection().success());
  }

  @Test
  void parsesAggregatedOverviewJson() throws Exception {
    List<ColumnInfo> cols = PostgresDriver.columnsFromJson(Values.mapper().readTree(
        "[{\"name\":\"id\",\"type\":\"integer\",\"nullable\":false,\"default\":\"nextval('s')\",\"primary_key\":true},"
            + "{\"name\":\"note\",\"type\":\"text\",\"nullable\":true,\"default\":null,\"primary_key\":false}]"));
    assertEquals(2, cols.size());
    assertTrue(cols.get(0).primaryKey());
    assertEquals("nextval('s')", cols.get(0).defaultValue());
    assertNull(cols.get(1).defaultValue());

    List<IndexInfo> idx = PostgresDriver.indexesFromJson(Values.mapper().readTree(
        "[{\"name\":\"t_pkey\",\"columns\":[\"id\"],\"unique\":true,\"primary\":true}]"));
    assertEquals(List.of("id"), idx.get(0).columns());
    assertTrue(idx.get(0).primary());
  }

  @Test
  void providerIsDiscoverable() {
    List<DriverProvider> ps = QuarryFactoriesLoader.load(DriverProvider.class);
    DriverProvider p = ps.stream().filter(x -> x.type() == DbType.POSTGRES).findFirst().orElseThrow();
    DatabaseDriver d = p.create(ConnectionConfig.of(DbType.POSTGRES, "h", null, "d", "u", "p"), FAST);
    assertInstanceOf(PostgresDriver.class, d);
    d.close();
  }
}
