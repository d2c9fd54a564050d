package io.intellixity.quarry.jdbc.sqlite;

import io.intellixity.quarry.core.value.Values;
import io.intellixity.quarry.jdbc.JdbcColumnReader;
import io.intellixity.quarry.jdbc.JdbcColumnReaders;
import io.intellixity.quarry.jdbc.JdbcValueMapper;

/**
 * Dispatch on SQLite declared types. Declared types are advisory in SQLite, so everything not listed
 * is read by its storage class.
 */
public final class SqliteValueMapper {
  private SqliteValueMapper() {}

  static final JdbcColumnReader BLOB_SIZE = (rs, i) -> {
    byte[] v = rs.getBytes(i);
    return v == null ? Values.nul() : Values.text("[" + v.length + " bytes]");
  };

  static final JdbcColumnReader BOOLEAN = (rs, i) -> {
    Object v = rs.getObject(i);
    if (v == null) return Values.nul();
    if (v instanceof Boolean b) return Values.of(b);
    if (v instanceof Number n) return Values.of(n.longValue() != 0);
    return Values.of(Boolean.parseBoolean(v.toString().trim()) || "1".equals(v.toString().trim()));
  };

  /** Storage-class driven: INTEGER → long, REAL → double, TEXT → string, BLOB → size. */
  static final JdbcColumnReader DYNAMIC = (rs, i) -> {
    Object v = rs.getObject(i);
    if (v == null) return Values.nul();
    if (v instanceof Integer n) return Values.of(n.longValue());
    if (v instanceof byte[] b) return Values.text("[" + b.length + " bytes]");
    return Values.of(v);
  };

  private static final JdbcValueMapper INSTANCE = JdbcValueMapper.builder()
      .on(JdbcColumnReaders.LONG, "integer", "int", "bigint", "smallint", "tinyint", "mediumint")
      .on(JdbcColumnReaders.DOUBLE, "real", "double", "float")
      .on(JdbcColumnReaders.STRING, "text", "varchar", "char", "clob")
      .on(BLOB_SIZE, "blob")
      .on(BOOLEAN, "boolean", "bool")
      .on(JdbcColumnReaders.STRING, "datetime", "date", "time", "timestamp")
      .on(DYNAMIC, "null")
      .fallback(DYNAMIC)
      .build();

  public static JdbcValueMapper instance() { return INSTANCE; }
}
