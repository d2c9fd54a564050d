package io.intellixity.quarry.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.quarry.core.value.Values;

import java.math.BigDecimal;

/** Stock readers; SQL NULL always becomes a null value. */
public final class JdbcColumnReaders {
  private JdbcColumnReaders() {}

  public static final JdbcColumnReader INT = (rs, i) -> {
    int v = rs.getInt(i);
    return rs.wasNull() ? Values.nul() : Values.of(v);
  };

  public static final JdbcColumnReader LONG = (rs, i) -> {
    long v = rs.getLong(i);
    return rs.wasNull() ? Values.nul() : Values.of(v);
  };

  public static final JdbcColumnReader FLOAT = (rs, i) -> {
    float v = rs.getFloat(i);
    return rs.wasNull() ? Values.nul() : Values.of(v);
  };

  public static final JdbcColumnReader DOUBLE = (rs, i) -> {
    double v = rs.getDouble(i);
    return rs.wasNull() ? Values.nul() : Values.of(v);
  };

  public static final JdbcColumnReader DECIMAL = (rs, i) -> {
    BigDecimal v = rs.getBigDecimal(i);
    return Values.of(v);
  };

  public static final JdbcColumnReader BOOL = (rs, i) -> {
    boolean v = rs.getBoolean(i);
    return rs.wasNull() ? Values.nul() : Values.of(v);
  };

  public static final JdbcColumnReader STRING = (rs, i) -> Values.text(rs.getString(i));

  public static final JdbcColumnReader JSON = (rs, i) -> {
    String v = rs.getString(i);
    return v == null ? Values.nul() : Values.parseOrText(v);
  };

  /** {@code \x}-prefixed lower-case hex. */
  public static final JdbcColumnReader HEX_BYTES = (rs, i) -> {
    byte[] v = rs.getBytes(i);
    return Values.of(v);
  };

  /** Whatever the driver hands back, converted best-effort. */
  public static final JdbcColumnReader OBJECT = (rs, i) -> {
    Object v = rs.getObject(i);
    if (v instanceof JsonNode n) return n;
    return Values.of(v);
  };
}
