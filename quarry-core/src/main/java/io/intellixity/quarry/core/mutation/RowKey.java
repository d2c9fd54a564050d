package io.intellixity.quarry.core.mutation;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.quarry.core.value.Values;

import java.util.ArrayList;
import java.util.List;

/** Primary-key columns and their values, matched by position. */
public record RowKey(List<String> columns, List<JsonNode> values) {
  public RowKey {
    columns = (columns == null) ? List.of() : List.copyOf(columns);
    values = (values == null) ? List.of() : List.copyOf(values);
  }

  public static RowKey of(String column, Object value) {
    return new RowKey(List.of(column), List.of(Values.of(value)));
  }

  public static RowKey of(List<String> columns, List<?> values) {
    List<JsonNode> vs = new ArrayList<>();
    if (values != null) for (Object v : values) vs.add(Values.of(v));
    return new RowKey(columns, vs);
  }

  public boolean isValid() { return !columns.isEmpty() && columns.size() == values.size(); }
}
