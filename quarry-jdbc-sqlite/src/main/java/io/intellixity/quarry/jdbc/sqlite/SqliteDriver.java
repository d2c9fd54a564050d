package io.intellixity.quarry.jdbc.sqlite;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.error.RequestValidationException;
import io.intellixity.quarry.core.model.*;
import io.intellixity.quarry.jdbc.AbstractJdbcDriver;
import io.intellixity.quarry.jdbc.JdbcValueMapper;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteOpenMode;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.*;

/**
 * File-backed SQLite driver. Every call opens its own connection in read-write-create mode, so a
 * missing database file is created on first use. SQLite has no schemas; everything lives in "main".
 */
public final class SqliteDriver extends AbstractJdbcDriver {
  public static final String SCHEMA = "main";

  private final String url;

  public SqliteDriver(ConnectionConfig config) {
    super(config);
    String path = config.filePath();
    if (path == null || path.isBlank()) {
      throw new RequestValidationException("File path is required for SQLite connections");
    }
    this.url = "jdbc:sqlite:" + path;
  }

  @Override public DbType type() { return DbType.SQLITE; }

  @Override protected JdbcValueMapper valueMapper() { return SqliteValueMapper.instance(); }

  @Override
  protected Connection openConnection() throws SQLException {
    SQLiteConfig cfg = new SQLiteConfig();
    cfg.setOpenMode(SQLiteOpenMode.READWRITE);
    cfg.setOpenMode(SQLiteOpenMode.CREATE);
    return cfg.createConnection(url);
  }

  @Override
  protected String tableRef(String schema, String table) {
    return quoteIdent(table);
  }

  @Override
  public List<TableInfo> listTables() {
    return query("list_tables", SqliteQueries.LIST_TABLES,
        rs -> new TableInfo(SCHEMA, rs.getString("name"), rs.getString("type")));
  }

  @Override
  public TableStructure getTableStructure(String schema, String table) {
    return withConnection("get_table_structure", c -> {
      List<ColumnInfo> columns = query(c, "table_info", SqliteQueries.TABLE_INFO,
          rs -> new ColumnInfo(rs.getString("name"), upper(rs.getString("type")), rs.getInt("notnull") == 0,
              rs.getString("dflt_value"), rs.getInt("pk") > 0),
          table);

      List<IndexInfo> indexes = new ArrayList<>();
      List<String[]> raw = query(c, "index_list", SqliteQueries.INDEX_LIST,
          rs -> new String[]{rs.getString("name"), String.valueOf(rs.getInt("unique")), rs.getString("origin")},
          table);
      for (String[] r : raw) {
        indexes.add(new IndexInfo(r[0], indexColumns(c, r[0]), !"0".equals(r[1]), "pk".equals(r[2])));
      }

      List<ForeignKeyInfo> fks = query(c, "foreign_key_list", SqliteQueries.FOREIGN_KEY_LIST,
          rs -> new ForeignKeyInfo("fk_" + rs.getInt("id"), rs.getString("from"), rs.getString("table"), rs.getString("to")),
          table);

      return new TableStructure(columns, indexes, fks);
    });
  }

  @Override
  public SchemaOverview getSchemaOverview() {
    return withConnection("get_schema_overview", c -> {
      Map<String, TableParts> tables = new LinkedHashMap<>();
      for (TableInfo t : query(c, "list_tables", SqliteQueries.LIST_TABLES,
          rs -> new TableInfo(SCHEMA, rs.getString("name"), rs.getString("type")))) {
        tables.put(t.name(), new TableParts(t));
      }

      query(c, "overview_columns", SqliteQueries.OVERVIEW_COLUMNS, rs -> {
        TableParts p = tables.get(rs.getString("table_name"));
        if (p != null) {
          p.columns.add(new ColumnInfo(rs.getString("column_name"), upper(rs.getString("data_type")),
              rs.getInt("not_null") == 0, rs.getString("default_value"), rs.getInt("primary_key") > 0));
        }
        return p;
      });

      query(c, "overview_foreign_keys", SqliteQueries.OVERVIEW_FOREIGN_KEYS, rs -> {
        String tableName = rs.getString("table_name");
        String column = rs.getString("column_name");
        TableParts p = tables.get(tableName);
        if (p != null) {
          p.foreignKeys.add(new ForeignKeyInfo("fk_" + tableName + "_" + column, column,
              rs.getString("references_table"), rs.getString("references_column")));
        }
        return p;
      });

      List<String[]> idx = query(c, "overview_indexes", SqliteQueries.OVERVIEW_INDEXES,
          rs -> new String[]{rs.getString("table_name"), rs.getString("index_name"),
              String.valueOf(rs.getInt("is_unique")), rs.getString("origin")});
      for (String[] r : idx) {
        TableParts p = tables.get(r[0]);
        if (p != null) p.indexes.add(new IndexInfo(r[1], indexColumns(c, r[1]), !"0".equals(r[2]), "pk".equals(r[3])));
      }

      List<TableWithStructure> out = new ArrayList<>(tables.size());
      for (TableParts p : tables.values()) {
        out.add(new TableWithStructure(p.table, new TableStructure(p.columns, p.indexes, p.foreignKeys)));
      }
      return new SchemaOverview(out);
    });
  }

  @Override
  public void close() {
    // connections are per call
  }

  private List<String> indexColumns(Connection c, String index) throws SQLException {
    return query(c, "index_info", SqliteQueries.INDEX_INFO, rs -> rs.getString("name"), index);
  }

  private static String upper(String type) {
    return type == null ? "" : type.toUpperCase(Locale.ROOT);
  }

  private static final class TableParts {
    final TableInfo table;
    final List<ColumnInfo> columns = new ArrayList<>();
    final List<IndexInfo> indexes = new ArrayList<>();
    final List<ForeignKeyInfo> foreignKeys = new ArrayList<>();

    TableParts(TableInfo table) { this.table = table; }
  }
}
