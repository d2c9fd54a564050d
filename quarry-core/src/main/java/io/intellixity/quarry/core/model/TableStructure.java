package io.intellixity.quarry.core.model;

import java.util.List;

public record TableStructure(List<ColumnInfo> columns, List<IndexInfo> indexes, List<ForeignKeyInfo> foreignKeys) {
  private static final TableStructure EMPTY = new TableStructure(List.of(), List.of(), List.of());

  public TableStructure {
    columns = (columns == null) ? List.of() : List.copyOf(columns);
    indexes = (indexes == null) ? List.of() : List.copyOf(indexes);
    foreignKeys = (foreignKeys == null) ? List.of() : List.copyOf(foreignKeys);
  }

  public static TableStructure empty() { return EMPTY; }
}
