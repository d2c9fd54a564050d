package io.intellixity.quarry.core.mutation;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.quarry.core.config.DbType;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link RowEdit}s as SQL text.\n
 *
 * Every check runs before the first identifier or literal is rendered, so a rejected edit never
 * produces partial SQL. SQLite targets are addressed by table name only; the other backends use
 * {@code "schema"."table"}.\n
 */
public final class SqlMutationBuilder {
  private SqlMutationBuilder() {}

  public static String build(RowEdit edit) {
    if (edit instanceof RowEdit.Update u) return update(u);
    if (edit instanceof RowEdit.Insert i) return insert(i);
    if (edit instanceof RowEdit.Delete d) return delete(d);
    throw new IllegalArgumentException("Unsupported row edit: " + edit.getClass().getName());
  }

  public static String update(RowEdit.Update u) {
    requireTable(u.table());
    requireKey(u.key());
    if (u.sets().isEmpty()) throw new MutationValidationException("No updates provided");
    List<String> sets = assignments(u.sets());
    return "UPDATE " + tableRef(u.dbType(), u.schema(), u.table())
        + " SET " + String.join(", ", sets)
        + " WHERE " + where(u.key());
  }

  public static String insert(RowEdit.Insert i) {
    requireTable(i.table());
    if (i.values().isEmpty()) throw new MutationValidationException("No values provided");
    List<String> cols = new ArrayList<>();
    List<String> vals = new ArrayList<>();
    for (ColumnValue cv : i.values()) {
      requireColumn(cv.column());
      vals.add(value(cv));
      cols.add(SqlLiterals.quoteIdent(cv.column()));
    }
    return "INSERT INTO " + tableRef(i.dbType(), i.schema(), i.table())
        + " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", vals) + ")";
  }

  public static String delete(RowEdit.Delete d) {
    requireTable(d.table());
    requireKey(d.key());
    return "DELETE FROM " + tableRef(d.dbType(), d.schema(), d.table()) + " WHERE " + where(d.key());
  }

  public static String tableRef(DbType dbType, String schema, String table) {
    if (dbType == DbType.SQLITE || schema == null || schema.isBlank()) return SqlLiterals.quoteIdent(table);
    return SqlLiterals.quoteIdent(schema) + "." + SqlLiterals.quoteIdent(table);
  }

  /** Literal or validated raw fragment for one assignment. */
  public static String value(ColumnValue cv) {
    if (!cv.rawSql()) return SqlLiterals.formatLiteral(cv.value());
    if (!cv.value().isTextual()) throw new MutationValidationException("Raw SQL value must be a string");
    try {
      return RawSqlWhitelist.validate(cv.value().textValue());
    } catch (MutationValidationException e) {
      throw new MutationValidationException("Invalid raw SQL value: " + e.getMessage(), e);
    }
  }

  private static List<String> assignments(List<ColumnValue> sets) {
    List<String> out = new ArrayList<>(sets.size());
    for (ColumnValue cv : sets) {
      requireColumn(cv.column());
      out.add(SqlLiterals.quoteIdent(cv.column()) + " = " + value(cv));
    }
    return out;
  }

  private static String where(RowKey key) {
    List<String> terms = new ArrayList<>(key.columns().size());
    for (int i = 0; i < key.columns().size(); i++) {
      JsonNode v = key.values().get(i);
      terms.add(SqlLiterals.quoteIdent(key.columns().get(i)) + " = " + SqlLiterals.formatLiteral(v));
    }
    return String.join(" AND ", terms);
  }

  private static void requireKey(RowKey key) {
    if (key == null || !key.isValid()) throw new MutationValidationException("Primary key columns and values must match");
    for (String c : key.columns()) requireColumn(c);
  }

  private static void requireTable(String table) {
    if (table == null || table.isBlank()) throw new MutationValidationException("Table name is required");
  }

  private static void requireColumn(String column) {
    if (column == null || column.isEmpty()) throw new MutationValidationException("Missing column name");
  }
}
