package io.intellixity.quarry.core.driver;

import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.model.*;

import java.util.List;

/**
 * Capability contract implemented once per backend.
 * <p>
 * Implementations are thread-safe; concurrent calls share the driver's underlying resource.
 * Failures surface as {@link io.intellixity.quarry.core.error.DriverException}s, except for
 * {@link #testConnection()} and the statement errors of {@link #executeQuery(String)}, which are reported inline.
 */
public interface DatabaseDriver extends AutoCloseable {
  DbType type();

  /** Never throws; reports success or failure with a message. */
  TestConnectionResult testConnection();

  List<TableInfo> listTables();

  TableDataResponse getTableData(TableDataRequest request);

  TableStructure getTableStructure(String schema, String table);

  QueryResult executeQuery(String sql);

  SchemaOverview getSchemaOverview();

  /** Releases the underlying resource. Idempotent. */
  @Override
  void close();
}
