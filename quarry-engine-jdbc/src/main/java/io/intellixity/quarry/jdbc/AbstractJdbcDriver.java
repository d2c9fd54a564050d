package io.intellixity.quarry.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.driver.DatabaseDriver;
import io.intellixity.quarry.core.driver.SortSpec;
import io.intellixity.quarry.core.driver.TableDataRequest;
import io.intellixity.quarry.core.error.DriverConnectionException;
import io.intellixity.quarry.core.error.DriverException;
import io.intellixity.quarry.core.error.DriverQueryException;
import io.intellixity.quarry.core.model.QueryResult;
import io.intellixity.quarry.core.model.TableDataResponse;
import io.intellixity.quarry.core.model.TestConnectionResult;
import io.intellixity.quarry.core.mutation.SqlLiterals;
import io.intellixity.quarry.core.util.Filters;
import io.intellixity.quarry.core.util.TransportErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-generic driver base.\n
 *
 * Provides the parts every SQL backend shares:\n
 * - connection test via {@code SELECT 1}\n
 * - raw statement execution with inline error capture\n
 * - paged table reads (count + LIMIT/OFFSET) with optional filter and sort\n
 *
 * Backends supply connections, the type dispatch table and the introspection queries.\n
 */
public abstract class AbstractJdbcDriver implements DatabaseDriver {
  private static final Logger log = LoggerFactory.getLogger(AbstractJdbcDriver.class);

  protected final ConnectionConfig config;

  protected AbstractJdbcDriver(ConnectionConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /** A connection the caller closes. May throw {@link DriverException} when the backend is unreachable. */
  protected abstract Connection openConnection() throws SQLException;

  protected abstract JdbcValueMapper valueMapper();

  /** Called when a statement failed because the transport is gone; the next call must get a fresh resource. */
  protected void onTransportFailure(Throwable cause) {}

  protected String quoteIdent(String ident) { return SqlLiterals.quoteIdent(ident); }

  protected String tableRef(String schema, String table) {
    if (schema == null || schema.isBlank()) return quoteIdent(table);
    return quoteIdent(schema) + "." + quoteIdent(table);
  }

  @Override
  public TestConnectionResult testConnection() {
    try (Connection c = openConnection(); Statement st = c.createStatement()) {
      st.execute("SELECT 1");
      return TestConnectionResult.ok("Connection successful!");
    } catch (SQLException e) {
      if (TransportErrors.isTransportFailure(e)) onTransportFailure(e);
      return TestConnectionResult.failed("Connection failed: " + e.getMessage());
    } catch (DriverException e) {
      return TestConnectionResult.failed("Connection failed: " + e.getMessage());
    }
  }

  @Override
  public QueryResult executeQuery(String sql) {
    long start = System.nanoTime();
    if (sql == null || sql.isBlank()) return QueryResult.failure("Empty query", 0);
    debugSql("QUERY", sql);
    try (Connection c = openConnection(); Statement st = c.createStatement()) {
      List<JsonNode> rows;
      long rowCount;
      if (st.execute(sql)) {
        try (ResultSet rs = st.getResultSet()) {
          rows = JdbcRowReader.readAll(rs, valueMapper());
        }
        rowCount = rows.size();
      } else {
        rows = List.of();
        rowCount = Math.max(st.getUpdateCount(), 0);
      }
      long ms = elapsedMs(start);
      debugDone("QUERY", rowCount, ms);
      return QueryResult.success(rows, rowCount, ms);
    } catch (SQLException e) {
      // a broken transport is not a statement error; the caller has to reconnect
      if (TransportErrors.isTransportFailure(e)) throw failure("QUERY", e);
      log.debug("quarry.jdbc_failed op=QUERY db={} error={}", type(), e.getMessage());
      return QueryResult.failure(e.getMessage(), elapsedMs(start));
    }
  }

  @Override
  public TableDataResponse getTableData(TableDataRequest req) {
    String from = tableRef(req.schema(), req.table());
    String filter = Filters.normalize(req.filter());
    String where = filter == null ? "" : " WHERE " + filter;

    String countSql = "SELECT COUNT(*) FROM " + from + where;
    List<Long> counts = query("COUNT", countSql, rs -> rs.getLong(1));
    long total = counts.isEmpty() ? 0 : counts.get(0);

    StringBuilder sql = new StringBuilder("SELECT * FROM ").append(from).append(where);
    SortSpec sort = req.sort();
    if (sort != null && !sort.column().isBlank()) {
      sql.append(" ORDER BY ").append(quoteIdent(sort.column())).append(' ').append(sort.direction().name());
    }
    sql.append(" LIMIT ? OFFSET ?");

    JdbcValueMapper mapper = valueMapper();
    List<JsonNode> rows = new ArrayList<>();
    long start = System.nanoTime();
    debugSql("SELECT", sql.toString());
    try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
      ps.setInt(1, req.limit());
      ps.setLong(2, req.offset());
      try (ResultSet rs = ps.executeQuery()) {
        rows.addAll(JdbcRowReader.readAll(rs, mapper));
      }
    } catch (SQLException e) {
      throw failure("get_table_data", e);
    }
    debugDone("SELECT", rows.size(), elapsedMs(start));
    return new TableDataResponse(rows, total, req.page(), req.limit());
  }

  /** Runs an introspection query with positional binds on a connection of its own. */
  protected <T> List<T> query(String op, String sql, JdbcRowMapper<T> mapper, Object... binds) {
    return withConnection(op, c -> query(c, op, sql, mapper, binds));
  }

  protected <T> List<T> query(Connection c, String op, String sql, JdbcRowMapper<T> mapper, Object... binds)
      throws SQLException {
    long start = System.nanoTime();
    debugSql(op, sql);
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      for (int i = 0; i < binds.length; i++) ps.setObject(i + 1, binds[i]);
      List<T> out = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) out.add(mapper.map(rs));
      }
      debugDone(op, out.size(), elapsedMs(start));
      return out;
    }
  }

  /** Borrows one connection for several statements; SQL failures are classified via {@link #failure}. */
  protected <T> T withConnection(String op, JdbcWork<T> work) {
    try (Connection c = openConnection()) {
      return work.run(c);
    } catch (SQLException e) {
      throw failure(op, e);
    }
  }

  /** Classifies a statement failure and invalidates the resource when the transport broke. */
  protected DriverException failure(String op, SQLException e) {
    if (TransportErrors.isTransportFailure(e)) {
      onTransportFailure(e);
      return new DriverConnectionException(op + " failed: " + e.getMessage(), e);
    }
    return new DriverQueryException(op + " failed: " + e.getMessage(), e);
  }

  protected static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private void debugSql(String op, String sql) {
    if (!log.isDebugEnabled()) return;
    log.debug("quarry.jdbc op={} db={} name={} sql={}", op, type(), config.name(), sql);
  }

  private void debugDone(String op, long rows, long ms) {
    if (!log.isDebugEnabled()) return;
    log.debug("quarry.jdbc_done op={} db={} durationMs={} rows={}", op, type(), ms, rows);
  }
}
