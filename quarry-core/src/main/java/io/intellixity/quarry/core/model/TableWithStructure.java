package io.intellixity.quarry.core.model;

import java.util.Objects;

public record TableWithStructure(TableInfo table, TableStructure structure) {
  public TableWithStructure {
    Objects.requireNonNull(table, "table");
    structure = (structure == null) ? TableStructure.empty() : structure;
  }
}
