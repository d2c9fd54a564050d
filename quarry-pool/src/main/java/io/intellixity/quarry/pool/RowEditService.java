package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.error.DriverConnectionException;
import io.intellixity.quarry.core.model.QueryResult;
import io.intellixity.quarry.core.mutation.ColumnValue;
import io.intellixity.quarry.core.mutation.RowEdit;
import io.intellixity.quarry.core.mutation.RowKey;
import io.intellixity.quarry.core.mutation.SqlMutationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Row edits against a pooled connection. The SQL is built (and validated) before anything is sent;
 * execution goes through {@link PoolManager#executeQuery} so it gets the same retry policy.
 */
public final class RowEditService {
  private static final Logger log = LoggerFactory.getLogger(RowEditService.class);

  private final PoolManager pool;

  public RowEditService(PoolManager pool) {
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  public QueryResult updateRow(String id, String schema, String table, RowKey key, List<ColumnValue> sets) {
    return apply(id, new RowEdit.Update(dbType(id), schema, table, key, sets));
  }

  public QueryResult insertRow(String id, String schema, String table, List<ColumnValue> values) {
    return apply(id, new RowEdit.Insert(dbType(id), schema, table, values));
  }

  public QueryResult deleteRow(String id, String schema, String table, RowKey key) {
    return apply(id, new RowEdit.Delete(dbType(id), schema, table, key));
  }

  public QueryResult apply(String id, RowEdit edit) {
    String sql = SqlMutationBuilder.build(edit);
    if (log.isDebugEnabled()) {
      log.debug("quarry.pool op=row_edit id={} kind={} table={} sql={}",
          id, edit.getClass().getSimpleName(), edit.table(), sql);
    }
    return pool.executeQuery(id, sql);
  }

  private DbType dbType(String id) {
    return pool.knownConfig(id)
        .map(c -> c.dbType())
        .orElseThrow(() -> new DriverConnectionException("Connection not found: " + id));
  }
}
