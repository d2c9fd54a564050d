package io.intellixity.quarry.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.quarry.core.value.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Per-backend dispatch table from native column type name to reader.\n
 *
 * Unknown types go to the fallback reader. A column that cannot be read at all becomes the
 * placeholder {@code <typename>} so one odd column never drops the row.\n
 */
public final class JdbcValueMapper {
  private static final Logger log = LoggerFactory.getLogger(JdbcValueMapper.class);

  private final Map<String, JdbcColumnReader> readers;
  private final JdbcColumnReader fallback;

  private JdbcValueMapper(Map<String, JdbcColumnReader> readers, JdbcColumnReader fallback) {
    this.readers = Map.copyOf(readers);
    this.fallback = fallback;
  }

  public static Builder builder() { return new Builder(); }

  public JsonNode read(ResultSet rs, int column, String typeName) {
    JdbcColumnReader r = readerFor(typeName);
    try {
      JsonNode v = r.read(rs, column);
      return v == null ? Values.nul() : v;
    } catch (SQLException | RuntimeException e) {
      log.debug("quarry.jdbc unreadable column index={} type={} error={}", column, typeName, e.toString());
      return Values.text("<" + typeName + ">");
    }
  }

  JdbcColumnReader readerFor(String typeName) {
    if (typeName == null) return fallback;
    return readers.getOrDefault(typeName.toLowerCase(Locale.ROOT), fallback);
  }

  public static final class Builder {
    private final Map<String, JdbcColumnReader> readers = new HashMap<>();
    private JdbcColumnReader fallback = JdbcColumnReaders.OBJECT;

    private Builder() {}

    /** Type names are matched case-insensitively. */
    public Builder on(JdbcColumnReader reader, String... typeNames) {
      Objects.requireNonNull(reader, "reader");
      for (String t : typeNames) readers.put(t.toLowerCase(Locale.ROOT), reader);
      return this;
    }

    public Builder fallback(JdbcColumnReader reader) {
      this.fallback = Objects.requireNonNull(reader, "reader");
      return this;
    }

    public JdbcValueMapper build() { return new JdbcValueMapper(readers, fallback); }
  }
}
