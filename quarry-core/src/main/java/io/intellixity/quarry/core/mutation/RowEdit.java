package io.intellixity.quarry.core.mutation;

import io.intellixity.quarry.core.config.DbType;

import java.util.List;

/** Structured row edit turned into SQL text by {@link SqlMutationBuilder}. */
public interface RowEdit {
  DbType dbType();
  String schema();
  String table();

  record Update(DbType dbType, String schema, String table, RowKey key, List<ColumnValue> sets) implements RowEdit {
    public Update {
      sets = sets == null ? List.of() : List.copyOf(sets);
    }
  }

  record Insert(DbType dbType, String schema, String table, List<ColumnValue> values) implements RowEdit {
    public Insert {
      values = values == null ? List.of() : List.copyOf(values);
    }
  }

  record Delete(DbType dbType, String schema, String table, RowKey key) implements RowEdit {}
}
