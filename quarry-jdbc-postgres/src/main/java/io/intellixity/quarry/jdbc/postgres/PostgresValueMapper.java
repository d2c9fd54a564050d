package io.intellixity.quarry.jdbc.postgres;

import io.intellixity.quarry.core.value.Values;
import io.intellixity.quarry.jdbc.JdbcColumnReader;
import io.intellixity.quarry.jdbc.JdbcColumnReaders;
import io.intellixity.quarry.jdbc.JdbcValueMapper;
import org.postgresql.util.PGobject;

/** Dispatch table keyed by {@code pg_type.typname} as reported by the PostgreSQL JDBC driver. */
public final class PostgresValueMapper {
  private PostgresValueMapper() {}

  /** PGobject-backed types (interval, inet, money, ...) and arrays render as their text form. */
  static final JdbcColumnReader TEXT_FORM = (rs, i) -> {
    Object v = rs.getObject(i);
    if (v == null) return Values.nul();
    if (v instanceof PGobject pg) return Values.text(pg.getValue());
    return Values.text(rs.getString(i));
  };

  private static final JdbcValueMapper INSTANCE = JdbcValueMapper.builder()
      .on(JdbcColumnReaders.INT, "int2", "int4")
      .on(JdbcColumnReaders.LONG, "int8")
      .on(JdbcColumnReaders.FLOAT, "float4")
      .on(JdbcColumnReaders.DOUBLE, "float8")
      .on(JdbcColumnReaders.DECIMAL, "numeric")
      .on(JdbcColumnReaders.BOOL, "bool")
      .on(JdbcColumnReaders.STRING, "text", "varchar", "char", "bpchar", "name", "uuid")
      .on(JdbcColumnReaders.STRING, "timestamp", "timestamptz", "date", "time", "timetz")
      .on(JdbcColumnReaders.JSON, "json", "jsonb")
      .on(JdbcColumnReaders.HEX_BYTES, "bytea")
      .fallback(TEXT_FORM)
      .build();

  public static JdbcValueMapper instance() { return INSTANCE; }
}
