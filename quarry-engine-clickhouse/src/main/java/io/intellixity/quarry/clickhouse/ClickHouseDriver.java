package io.intellixity.quarry.clickhouse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.core.driver.DatabaseDriver;
import io.intellixity.quarry.core.driver.SortSpec;
import io.intellixity.quarry.core.driver.TableDataRequest;
import io.intellixity.quarry.core.error.*;
import io.intellixity.quarry.core.model.*;
import io.intellixity.quarry.core.mutation.SqlLiterals;
import io.intellixity.quarry.core.util.Filters;
import io.intellixity.quarry.core.value.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * ClickHouse driver over the HTTP interface.\n
 *
 * Every statement is one POST to {@code http(s)://host:port/?database=...} with basic auth. Reads are
 * sent with {@code FORMAT JSONEachRow} appended (unless the statement names a format already) and the
 * reply is parsed one JSON object per line. A non-2xx reply carries the server's error text in its body.
 * There is no connection state to keep, so nothing needs invalidating after a failure.\n
 */
public final class ClickHouseDriver implements DatabaseDriver {
  private static final Logger log = LoggerFactory.getLogger(ClickHouseDriver.class);

  public static final String DEFAULT_DATABASE = "default";
  public static final String DEFAULT_USER = "default";
  public static final String COMMAND_OK = "Query executed successfully";

  private static final List<String> READ_PREFIXES = List.of("SELECT", "SHOW", "DESCRIBE", "WITH");

  private final ConnectionConfig config;
  private final DriverSettings settings;
  private final HttpClient http;
  private final URI endpoint;
  private final String authorization;
  private final String database;

  private volatile boolean closed;

  public ClickHouseDriver(ConnectionConfig config, DriverSettings settings) {
    this.config = Objects.requireNonNull(config, "config");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.database = blankTo(config.database(), DEFAULT_DATABASE);
    this.endpoint = endpoint(config, database);
    String user = blankTo(config.username(), DEFAULT_USER);
    String pw = config.password() == null ? "" : config.password();
    this.authorization = "Basic " + Base64.getEncoder()
        .encodeToString((user + ":" + pw).getBytes(StandardCharsets.UTF_8));
    this.http = HttpClient.newBuilder()
        .connectTimeout(settings.clickhouseRequestTimeout())
        .build();
  }

  static URI endpoint(ConnectionConfig config, String database) {
    String scheme = config.ssl() ? "https" : "http";
    return URI.create(scheme + "://" + config.effectiveHost() + ":" + config.effectivePort()
        + "/?database=" + URLEncoder.encode(database, StandardCharsets.UTF_8));
  }

  URI endpoint() { return endpoint; }

  String database() { return database; }

  @Override public DbType type() { return DbType.CLICKHOUSE; }

  @Override
  public TestConnectionResult testConnection() {
    try {
      read("SELECT 1");
      return TestConnectionResult.ok("Connection successful!");
    } catch (DriverException e) {
      return TestConnectionResult.failed("Connection failed: " + e.getMessage());
    }
  }

  @Override
  public List<TableInfo> listTables() {
    List<TableInfo> out = new ArrayList<>();
    for (JsonNode row : read(String.format(ClickHouseQueries.LIST_TABLES, SqlLiterals.quoteString(database)))) {
      out.add(new TableInfo(row.path("database").asText(""), row.path("name").asText(""),
          row.path("engine").asText("table")));
    }
    return out;
  }

  @Override
  public TableDataResponse getTableData(TableDataRequest req) {
    String from = quoteIdent(req.table());
    String filter = Filters.normalize(req.filter());
    String where = filter == null ? "" : " WHERE " + filter;

    List<JsonNode> countRows = read("SELECT count() AS count FROM " + from + where);
    long total = countRows.isEmpty() ? 0 : asLong(countRows.get(0).path("count"));

    StringBuilder sql = new StringBuilder("SELECT * FROM ").append(from).append(where);
    SortSpec sort = req.sort();
    if (sort != null) {
      sql.append(" ORDER BY ").append(quoteIdent(sort.column())).append(' ').append(sort.direction().name());
    }
    sql.append(" LIMIT ").append(req.limit()).append(" OFFSET ").append(req.offset());

    return new TableDataResponse(read(sql.toString()), total, req.page(), req.limit());
  }

  @Override
  public TableStructure getTableStructure(String schema, String table) {
    String db = SqlLiterals.quoteString(database);
    String tbl = SqlLiterals.quoteString(table);

    List<ColumnInfo> columns = new ArrayList<>();
    for (JsonNode c : read(String.format(ClickHouseQueries.COLUMNS, db, tbl))) {
      columns.add(column(c.path("name").asText(""), c.path("type").asText(""),
          c.path("default_kind").asText(""), c.path("default_expression").asText(""),
          asLong(c.path("is_in_primary_key")) == 1));
    }

    List<IndexInfo> indexes = new ArrayList<>();
    for (JsonNode i : optionalRead("data_skipping_indices", String.format(ClickHouseQueries.INDEXES, db, tbl))) {
      indexes.add(skippingIndex(i.path("name").asText(""), i.path("expr").asText("")));
    }
    return new TableStructure(columns, indexes, List.of());
  }

  @Override
  public SchemaOverview getSchemaOverview() {
    String db = SqlLiterals.quoteString(database);
    List<JsonNode> tableRows = read(String.format(ClickHouseQueries.OVERVIEW_COLUMNS, db));

    Map<String, List<IndexInfo>> indexesByTable = new HashMap<>();
    for (JsonNode row : optionalRead("data_skipping_indices", String.format(ClickHouseQueries.OVERVIEW_INDEXES, db))) {
      List<IndexInfo> list = new ArrayList<>();
      for (JsonNode t : row.path("indexes_raw")) {
        if (t.size() >= 3) list.add(skippingIndex(t.get(0).asText(""), t.get(1).asText("")));
      }
      indexesByTable.put(key(row.path("database").asText(""), row.path("table").asText("")), list);
    }

    List<TableWithStructure> tables = new ArrayList<>();
    for (JsonNode row : tableRows) {
      String schema = row.path("schema").asText("");
      String name = row.path("name").asText("");
      List<ColumnInfo> columns = new ArrayList<>();
      for (JsonNode t : row.path("columns_raw")) {
        if (t.size() < 5) continue;
        columns.add(column(t.get(0).asText(""), t.get(1).asText(""), t.get(2).asText(""),
            t.get(3).asText(""), asLong(t.get(4)) == 1));
      }
      List<IndexInfo> indexes = indexesByTable.getOrDefault(key(schema, name), List.of());
      tables.add(new TableWithStructure(
          new TableInfo(schema, name, row.path("type").asText("table")),
          new TableStructure(columns, indexes, List.of())));
    }
    return new SchemaOverview(tables);
  }

  @Override
  public QueryResult executeQuery(String sql) {
    long start = System.nanoTime();
    if (sql == null || sql.isBlank()) return QueryResult.failure("Empty query", elapsedMs(start));
    try {
      if (isRead(sql)) {
        List<JsonNode> rows = read(sql);
        return QueryResult.success(rows, rows.size(), elapsedMs(start));
      }
      post(sql);
      return QueryResult.success(List.of(Values.object().put("result", COMMAND_OK)), 0, elapsedMs(start));
    } catch (DriverQueryException e) {
      // statement rejected by the server; transport and timeout failures propagate to the caller
      return QueryResult.failure(e.getMessage(), elapsedMs(start));
    }
  }

  @Override
  public void close() {
    closed = true;
  }

  static boolean isRead(String sql) {
    String head = sql.trim().toUpperCase(Locale.ROOT);
    for (String p : READ_PREFIXES) {
      if (head.startsWith(p)) return true;
    }
    return false;
  }

  /** Trims, drops trailing semicolons and appends the row format unless one is present. */
  static String asJsonEachRow(String sql) {
    String s = sql.trim();
    while (s.endsWith(";")) s = s.substring(0, s.length() - 1).trim();
    if (s.toUpperCase(Locale.ROOT).contains("FORMAT ")) return s;
    return s + " FORMAT JSONEachRow";
  }

  static String quoteIdent(String ident) {
    return "`" + ident.replace("\\", "\\\\").replace("`", "\\`") + "`";
  }

  private List<JsonNode> read(String sql) {
    String body = post(asJsonEachRow(sql));
    List<JsonNode> rows = new ArrayList<>();
    for (String line : body.split("\n")) {
      if (line.isBlank()) continue;
      try {
        rows.add(Values.mapper().readTree(line));
      } catch (JsonProcessingException e) {
        throw new DriverQueryException("Unreadable ClickHouse row: " + e.getOriginalMessage(), e);
      }
    }
    return rows;
  }

  /** Secondary metadata; older servers may lack the table, which only means there is nothing to show. */
  private List<JsonNode> optionalRead(String what, String sql) {
    try {
      return read(sql);
    } catch (DriverQueryException e) {
      log.debug("quarry.clickhouse skipped={} reason={}", what, e.getMessage());
      return List.of();
    }
  }

  private String post(String sql) {
    if (closed) throw new DriverConnectionException("Driver is closed");
    if (log.isDebugEnabled()) {
      log.debug("quarry.clickhouse op=POST name={} sql={}", config.name(), sql);
    }
    HttpRequest request = HttpRequest.newBuilder(endpoint)
        .timeout(settings.clickhouseRequestTimeout())
        .header("Authorization", authorization)
        .header("Content-Type", "text/plain; charset=utf-8")
        .POST(HttpRequest.BodyPublishers.ofString(sql, StandardCharsets.UTF_8))
        .build();
    long start = System.nanoTime();
    HttpResponse<String> response;
    try {
      response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (HttpTimeoutException e) {
      throw new DriverTimeoutException(
          "Request timed out after " + settings.clickhouseRequestTimeout().toSeconds() + " seconds", e);
    } catch (IOException e) {
      throw new DriverConnectionException("Failed to reach ClickHouse: " + message(e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DriverConnectionException("Interrupted while waiting for ClickHouse", e);
    }
    if (response.statusCode() / 100 != 2) {
      String err = response.body() == null ? "" : response.body().trim();
      log.debug("quarry.clickhouse_error status={} body={}", response.statusCode(), err);
      throw new DriverQueryException(err.isEmpty() ? "HTTP " + response.statusCode() : err);
    }
    if (log.isDebugEnabled()) {
      log.debug("quarry.clickhouse_done status={} durationMs={}", response.statusCode(), elapsedMs(start));
    }
    return response.body() == null ? "" : response.body();
  }

  private static ColumnInfo column(String name, String type, String defaultKind, String defaultExpr, boolean pk) {
    String dflt = defaultExpr.isEmpty() ? null : defaultKind + " " + defaultExpr;
    return new ColumnInfo(name, type, type.startsWith("Nullable"), dflt, pk);
  }

  private static IndexInfo skippingIndex(String name, String expr) {
    return new IndexInfo(name, List.of(expr), false, false);
  }

  /** ClickHouse quotes 64-bit integers in JSON output, so counts arrive as strings or numbers. */
  static long asLong(JsonNode n) {
    return n == null ? 0 : n.asLong(0);
  }

  private static String key(String schema, String table) { return schema + "." + table; }

  private static String blankTo(String s, String dflt) { return s == null || s.isBlank() ? dflt : s; }

  private static String message(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
