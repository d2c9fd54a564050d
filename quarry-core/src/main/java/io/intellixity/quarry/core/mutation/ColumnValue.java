package io.intellixity.quarry.core.mutation;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.quarry.core.value.Values;

/**
 * One column assignment of a row edit. When {@code rawSql} is set the value is a SQL fragment
 * (e.g. {@code now()}) that must pass {@link RawSqlWhitelist}.
 */
public record ColumnValue(String column, JsonNode value, boolean rawSql) {
  public ColumnValue {
    value = (value == null) ? Values.nul() : value;
  }

  public static ColumnValue of(String column, Object value) {
    return new ColumnValue(column, Values.of(value), false);
  }

  public static ColumnValue raw(String column, String sql) {
    return new ColumnValue(column, Values.text(sql), true);
  }

  /**
   * Reads the wire form {@code {"column": "...", "value": ..., "isRawSql": true}}.
   */
  public static ColumnValue fromJson(JsonNode node) {
    if (node == null || !node.isObject()) throw new MutationValidationException("Each update must be an object");
    JsonNode column = node.get("column");
    if (column == null || !column.isTextual()) throw new MutationValidationException("Missing column name");
    if (!node.has("value")) throw new MutationValidationException("Missing value");
    JsonNode value = node.get("value");
    boolean raw = node.path("isRawSql").asBoolean(false);
    if (raw && !value.isTextual()) throw new MutationValidationException("Raw SQL value must be a string");
    return new ColumnValue(column.textValue(), value, raw);
  }
}
