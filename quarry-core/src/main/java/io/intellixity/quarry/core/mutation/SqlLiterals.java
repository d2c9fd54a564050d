package io.intellixity.quarry.core.mutation;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.quarry.core.value.Values;

/**
 * Identifier quoting and literal rendering for SQL text built without bind parameters.
 */
public final class SqlLiterals {
  private SqlLiterals() {}

  /** Doubles embedded double quotes: {@code a"b} becomes {@code a""b}. */
  public static String escapeIdent(String ident) {
    return ident.replace("\"", "\"\"");
  }

  public static String quoteIdent(String ident) {
    return "\"" + escapeIdent(ident) + "\"";
  }

  public static String quoteString(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  /**
   * null → NULL, booleans → TRUE/FALSE, numbers verbatim, strings single-quoted,
   * arrays and objects as quoted JSON text.
   */
  public static String formatLiteral(JsonNode v) {
    if (v == null || v.isNull() || v.isMissingNode()) return "NULL";
    if (v.isBoolean()) return v.booleanValue() ? "TRUE" : "FALSE";
    if (v.isNumber()) return v.toString();
    if (v.isTextual()) return quoteString(v.textValue());
    return quoteString(Values.toJson(v));
  }
}
