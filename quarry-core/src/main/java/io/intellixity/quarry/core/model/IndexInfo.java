package io.intellixity.quarry.core.model;

import java.util.List;

public record IndexInfo(String name, List<String> columns, boolean unique, boolean primary) {
  public IndexInfo {
    columns = (columns == null) ? List.of() : List.copyOf(columns);
  }
}
