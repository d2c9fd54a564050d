package io.intellixity.quarry.core.config;

import io.intellixity.quarry.core.error.RequestValidationException;

import java.util.Locale;

public enum DbType {
  POSTGRES("postgres", 5432),
  SQLITE("sqlite", 0),
  REDIS("redis", 6379),
  CLICKHOUSE("clickhouse", 8123);

  private final String id;
  private final int defaultPort;

  DbType(String id, int defaultPort) {
    this.id = id;
    this.defaultPort = defaultPort;
  }

  public String id() { return id; }

  /** Port used when a config leaves it unset; 0 for file-backed SQLite. */
  public int defaultPort() { return defaultPort; }

  /** Accepts the persisted spellings, including the {@code postgresql} and {@code sqlite3} aliases. */
  public static DbType parse(String raw) {
    if (raw == null) throw new RequestValidationException("Unsupported database type: null");
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "postgres", "postgresql" -> POSTGRES;
      case "sqlite", "sqlite3" -> SQLITE;
      case "redis" -> REDIS;
      case "clickhouse" -> CLICKHOUSE;
      default -> throw new RequestValidationException("Unsupported database type: " + raw);
    };
  }
}
