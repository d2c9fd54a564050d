package io.intellixity.quarry.core.model;

import java.util.List;

/** Batch form of listTables + getTableStructure for upfront introspection. */
public record SchemaOverview(List<TableWithStructure> tables) {
  public SchemaOverview {
    tables = (tables == null) ? List.of() : List.copyOf(tables);
  }

  public static SchemaOverview empty() { return new SchemaOverview(List.of()); }
}
