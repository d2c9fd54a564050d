package io.intellixity.quarry.jdbc;

import java.sql.ResultSet;
import java.sql.SQLException;

/** Maps the current row of an introspection query. */
@FunctionalInterface
public interface JdbcRowMapper<T> {
  T map(ResultSet rs) throws SQLException;
}
