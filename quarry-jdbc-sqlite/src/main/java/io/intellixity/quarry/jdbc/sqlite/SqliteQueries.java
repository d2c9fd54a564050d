package io.intellixity.quarry.jdbc.sqlite;

final class SqliteQueries {
  private SqliteQueries() {}

  static final String LIST_TABLES = """
      SELECT name, type FROM sqlite_master
      WHERE type IN ('table', 'view') AND name NOT LIKE 'sqlite_%'
      ORDER BY name
      """;

  static final String TABLE_INFO = "SELECT name, type, \"notnull\", dflt_value, pk FROM pragma_table_info(?) ORDER BY cid";
  static final String INDEX_LIST = "SELECT name, \"unique\", origin FROM pragma_index_list(?) ORDER BY name";
  static final String INDEX_INFO = "SELECT name FROM pragma_index_info(?) ORDER BY seqno";
  static final String FOREIGN_KEY_LIST = "SELECT id, \"from\", \"table\", \"to\" FROM pragma_foreign_key_list(?) ORDER BY id, seq";

  static final String OVERVIEW_COLUMNS = """
      SELECT
          m.name AS table_name,
          p.name AS column_name,
          p.type AS data_type,
          p."notnull" AS not_null,
          p.dflt_value AS default_value,
          p.pk AS primary_key
      FROM sqlite_master m
      CROSS JOIN pragma_table_info(m.name) p
      WHERE m.type = 'table' AND m.name NOT LIKE 'sqlite_%'
      ORDER BY m.name, p.cid
      """;

  static final String OVERVIEW_FOREIGN_KEYS = """
      SELECT
          m.name AS table_name,
          f."from" AS column_name,
          f."table" AS references_table,
          f."to" AS references_column
      FROM sqlite_master m
      CROSS JOIN pragma_foreign_key_list(m.name) f
      WHERE m.type = 'table' AND m.name NOT LIKE 'sqlite_%'
      ORDER BY m.name, f.id, f.seq
      """;

  static final String OVERVIEW_INDEXES = """
      SELECT
          m.name AS table_name,
          i.name AS index_name,
          i."unique" AS is_unique,
          i.origin AS origin
      FROM sqlite_master m
      CROSS JOIN pragma_index_list(m.name) i
      WHERE m.type = 'table' AND m.name NOT LIKE 'sqlite_%'
      ORDER BY m.name, i.name
      """;
}
