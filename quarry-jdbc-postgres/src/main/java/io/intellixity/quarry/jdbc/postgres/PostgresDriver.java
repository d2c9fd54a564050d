package io.intellixity.quarry.jdbc.postgres;

import com.fasterxml.jackson.databind.JsonNode;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.core.error.DriverConnectionException;
import io.intellixity.quarry.core.error.DriverTimeoutException;
import io.intellixity.quarry.core.model.*;
import io.intellixity.quarry.core.value.Values;
import io.intellixity.quarry.jdbc.AbstractJdbcDriver;
import io.intellixity.quarry.jdbc.JdbcValueMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketTimeoutException;
import java.sql.Array;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * PostgreSQL driver over a lazily created HikariCP pool.\n
 *
 * The pool is built on first use under a read/write lock and replaced when a statement fails with
 * a transport error, so the next call reconnects. The replaced pool drains: queries still running
 * on its connections complete before it closes. Hikari validates idle connections before handing
 * them out.\n
 */
public final class PostgresDriver extends AbstractJdbcDriver {
  private static final Logger log = LoggerFactory.getLogger(PostgresDriver.class);

  private final DriverSettings settings;
  private final ReentrantReadWriteLock poolLock = new ReentrantReadWriteLock();
  private final RetiredPools retired = new RetiredPools();
  private HikariDataSource pool;
  private boolean closed;

  public PostgresDriver(ConnectionConfig config, DriverSettings settings) {
    super(config);
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override public DbType type() { return DbType.POSTGRES; }

  @Override protected JdbcValueMapper valueMapper() { return PostgresValueMapper.instance(); }

  @Override
  protected Connection openConnection() throws SQLException {
    retired.sweep();
    return dataSource().getConnection();
  }

  HikariDataSource dataSource() {
    poolLock.readLock().lock();
    try {
      if (pool != null) return pool;
      if (closed) throw new DriverConnectionException("Driver is closed");
    } finally {
      poolLock.readLock().unlock();
    }

    poolLock.writeLock().lock();
    try {
      if (closed) throw new DriverConnectionException("Driver is closed");
      if (pool == null) pool = createPool();
      return pool;
    } finally {
      poolLock.writeLock().unlock();
    }
  }

  String jdbcUrl() {
    String db = config.database() == null || config.database().isBlank() ? "postgres" : config.database();
    return "jdbc:postgresql://" + config.effectiveHost() + ":" + config.effectivePort() + "/" + db
        + "?sslmode=" + (config.ssl() ? "require" : "disable");
  }

  private HikariDataSource createPool() {
    long connectSeconds = Math.max(1, settings.postgresConnectTimeout().toSeconds());

    HikariConfig hc = new HikariConfig();
    hc.setPoolName("quarry-pg-" + (config.name() == null ? config.effectiveHost() : config.name()));
    hc.setJdbcUrl(jdbcUrl());
    hc.setUsername(config.username());
    hc.setPassword(config.password());
    hc.setMaximumPoolSize(settings.postgresMaxPoolSize());
    hc.setMinimumIdle(1);
    hc.setIdleTimeout(settings.postgresIdleTimeout().toMillis());
    hc.setConnectionTimeout(settings.postgresAcquireTimeout().toMillis());
    // a single attempt; the connect itself is bounded by the driver timeouts below
    hc.setInitializationFailTimeout(1);
    hc.addDataSourceProperty("connectTimeout", String.valueOf(connectSeconds));
    hc.addDataSourceProperty("loginTimeout", String.valueOf(connectSeconds));

    long start = System.nanoTime();
    try {
      HikariDataSource ds = new HikariDataSource(hc);
      log.info("quarry.pg pool_created name={} host={} port={} durationMs={}",
          hc.getPoolName(), config.effectiveHost(), config.effectivePort(), elapsedMs(start));
      return ds;
    } catch (RuntimeException e) {
      if (isTimeout(e)) {
        throw new DriverTimeoutException("Connection timed out after " + connectSeconds + " seconds", e);
      }
      throw new DriverConnectionException("Failed to connect to PostgreSQL: " + rootMessage(e), e);
    }
  }

  @Override
  protected void onTransportFailure(Throwable cause) {
    log.warn("quarry.pg pool_reset name={} reason={}", config.name(), cause.getMessage());
    resetPool();
  }

  void resetPool() {
    HikariDataSource old;
    poolLock.writeLock().lock();
    try {
      old = pool;
      pool = null;
    } finally {
      poolLock.writeLock().unlock();
    }
    if (old != null) retired.retire(old);
  }

  @Override
  public List<TableInfo> listTables() {
    return query("list_tables", PostgresQueries.LIST_TABLES,
        rs -> new TableInfo(rs.getString("schema"), rs.getString("name"), rs.getString("type")));
  }

  @Override
  public TableStructure getTableStructure(String schema, String table) {
    List<ColumnInfo> columns = query("columns", PostgresQueries.COLUMNS,
        rs -> new ColumnInfo(rs.getString("name"), rs.getString("type"), rs.getBoolean("nullable"),
            rs.getString("default_value"), rs.getBoolean("primary_key")),
        schema, table);

    List<IndexInfo> indexes = query("indexes", PostgresQueries.INDEXES,
        rs -> new IndexInfo(rs.getString("name"), stringArray(rs.getArray("columns")),
            rs.getBoolean("is_unique"), rs.getBoolean("is_primary")),
        schema, table);

    List<ForeignKeyInfo> fks = query("foreign_keys", PostgresQueries.FOREIGN_KEYS,
        rs -> new ForeignKeyInfo(rs.getString("name"), rs.getString("column_name"),
            rs.getString("references_table"), rs.getString("references_column")),
        schema, table);

    return new TableStructure(columns, indexes, fks);
  }

  @Override
  public SchemaOverview getSchemaOverview() {
    List<TableWithStructure> tables = query("schema_overview", PostgresQueries.SCHEMA_OVERVIEW, rs -> {
      TableInfo t = new TableInfo(rs.getString("schema"), rs.getString("name"), rs.getString("type"));
      TableStructure s = new TableStructure(
          columnsFromJson(Values.parseOrText(rs.getString("columns"))),
          indexesFromJson(Values.parseOrText(rs.getString("indexes"))),
          foreignKeysFromJson(Values.parseOrText(rs.getString("foreign_keys"))));
      return new TableWithStructure(t, s);
    });
    return new SchemaOverview(tables);
  }

  @Override
  public void close() {
    poolLock.writeLock().lock();
    try {
      closed = true;
    } finally {
      poolLock.writeLock().unlock();
    }
    resetPool();
    // the pool manager closes a driver only after its last lease, so nothing is in flight here
    retired.closeAll();
  }

  static List<ColumnInfo> columnsFromJson(JsonNode arr) {
    List<ColumnInfo> out = new ArrayList<>();
    for (JsonNode c : arr) {
      out.add(new ColumnInfo(c.path("name").asText(), c.path("type").asText(), c.path("nullable").asBoolean(),
          c.path("default").isNull() || c.path("default").isMissingNode() ? null : c.path("default").asText(),
          c.path("primary_key").asBoolean()));
    }
    return out;
  }

  static List<IndexInfo> indexesFromJson(JsonNode arr) {
    List<IndexInfo> out = new ArrayList<>();
    for (JsonNode i : arr) {
      List<String> cols = new ArrayList<>();
      for (JsonNode c : i.path("columns")) cols.add(c.asText());
      out.add(new IndexInfo(i.path("name").asText(), cols, i.path("unique").asBoolean(), i.path("primary").asBoolean()));
    }
    return out;
  }

  static List<ForeignKeyInfo> foreignKeysFromJson(JsonNode arr) {
    List<ForeignKeyInfo> out = new ArrayList<>();
    for (JsonNode f : arr) {
      out.add(new ForeignKeyInfo(f.path("name").asText(), f.path("column").asText(),
          f.path("references_table").asText(), f.path("references_column").asText()));
    }
    return out;
  }

  private static List<String> stringArray(Array a) throws SQLException {
    if (a == null) return List.of();
    Object raw = a.getArray();
    if (raw instanceof String[] s) return Arrays.asList(s);
    if (raw instanceof Object[] o) {
      List<String> out = new ArrayList<>(o.length);
      for (Object x : o) out.add(String.valueOf(x));
      return out;
    }
    return List.of();
  }

  private static boolean isTimeout(Throwable t) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (c instanceof SocketTimeoutException) return true;
      String m = c.getMessage();
      if (m != null && m.toLowerCase(Locale.ROOT).contains("timed out")) return true;
      if (c.getCause() == c) break;
    }
    return false;
  }

  private static String rootMessage(Throwable t) {
    Throwable c = t;
    while (c.getCause() != null && c.getCause() != c) c = c.getCause();
    return c.getMessage() == null ? c.toString() : c.getMessage();
  }
}
