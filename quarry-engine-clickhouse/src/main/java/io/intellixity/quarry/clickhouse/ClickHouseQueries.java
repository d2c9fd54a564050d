package io.intellixity.quarry.clickhouse;

/** System-table queries. {@code %s} slots take an already-quoted string literal. */
final class ClickHouseQueries {
  private ClickHouseQueries() {}

  static final String LIST_TABLES =
      "SELECT database, name, engine FROM system.tables WHERE database = %s ORDER BY name";

  static final String COLUMNS = """
      SELECT name, type, default_kind, default_expression, is_in_primary_key
      FROM system.columns
      WHERE database = %s AND table = %s
      ORDER BY position""";

  static final String INDEXES = """
      SELECT name, expr, type
      FROM system.data_skipping_indices
      WHERE database = %s AND table = %s""";

  static final String OVERVIEW_COLUMNS = """
      SELECT
          c.database AS schema,
          c.table AS name,
          t.engine AS type,
          groupArray(tuple(c.name, c.type, c.default_kind, c.default_expression, c.is_in_primary_key)) AS columns_raw
      FROM system.columns c
      JOIN system.tables t ON c.database = t.database AND c.table = t.name
      WHERE c.database = %s
      GROUP BY c.database, c.table, t.engine
      ORDER BY c.database, c.table""";

  static final String OVERVIEW_INDEXES = """
      SELECT database, table, groupArray(tuple(name, expr, type)) AS indexes_raw
      FROM system.data_skipping_indices
      WHERE database = %s
      GROUP BY database, table""";
}
