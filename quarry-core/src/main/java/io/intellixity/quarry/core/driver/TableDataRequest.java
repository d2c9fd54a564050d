package io.intellixity.quarry.core.driver;

import io.intellixity.quarry.core.error.RequestValidationException;

/**
 * Paged read of one table. Pages are 1-indexed; {@code filter} is a backend-native boolean expression.
 */
public record TableDataRequest(String schema, String table, int page, int limit, String filter, SortSpec sort) {
  public TableDataRequest {
    if (table == null || table.isBlank()) throw new RequestValidationException("Table name is required");
    if (page < 1) throw new RequestValidationException("page must be >= 1 (got " + page + ")");
    if (limit < 1) throw new RequestValidationException("limit must be >= 1 (got " + limit + ")");
  }

  public static TableDataRequest of(String schema, String table, int page, int limit) {
    return new TableDataRequest(schema, table, page, limit, null, null);
  }

  public TableDataRequest withFilter(String filter) {
    return new TableDataRequest(schema, table, page, limit, filter, sort);
  }

  public TableDataRequest withSort(SortSpec sort) {
    return new TableDataRequest(schema, table, page, limit, filter, sort);
  }

  public long offset() { return (long) (page - 1) * limit; }
}
