package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.driver.DatabaseDriver;
import io.intellixity.quarry.core.driver.TableDataRequest;
import io.intellixity.quarry.core.model.*;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/** Scriptable driver: each operation delegates to a replaceable lambda and counts its calls. */
final class StubDriver implements DatabaseDriver {
  final ConnectionConfig config;
  final AtomicInteger tests = new AtomicInteger();
  final AtomicInteger listCalls = new AtomicInteger();
  final AtomicInteger closes = new AtomicInteger();

  volatile Supplier<TestConnectionResult> onTest = () -> TestConnectionResult.ok("Connection successful!");
  volatile Supplier<List<TableInfo>> onList = () -> List.of(new TableInfo("public", "t", "BASE TABLE"));
  volatile Supplier<QueryResult> onQuery = () -> QueryResult.success(List.of(), 0, 0);

  volatile String lastSql;

  StubDriver(ConnectionConfig config) {
    this.config = config;
  }

  @Override public DbType type() { return config.dbType(); }

  @Override
  public TestConnectionResult testConnection() {
    tests.incrementAndGet();
    return onTest.get();
  }

  @Override
  public List<TableInfo> listTables() {
    listCalls.incrementAndGet();
    return onList.get();
  }

  @Override
  public TableDataResponse getTableData(TableDataRequest request) {
    return new TableDataResponse(List.of(), 0, request.page(), request.limit());
  }

  @Override
  public TableStructure getTableStructure(String schema, String table) {
    return TableStructure.empty();
  }

  @Override
  public QueryResult executeQuery(String sql) {
    lastSql = sql;
    return onQuery.get();
  }

  @Override
  public SchemaOverview getSchemaOverview() {
    return SchemaOverview.empty();
  }

  @Override
  public void close() {
    closes.incrementAndGet();
  }

  boolean closed() { return closes.get() > 0; }
}
