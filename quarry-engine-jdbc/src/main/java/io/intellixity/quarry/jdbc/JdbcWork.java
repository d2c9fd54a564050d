package io.intellixity.quarry.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/** Unit of work run against one borrowed connection. */
@FunctionalInterface
public interface JdbcWork<T> {
  T run(Connection c) throws SQLException;
}
