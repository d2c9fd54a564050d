package io.intellixity.quarry.jdbc;

import com.fasterxml.jackson.databind.JsonNode;

import java.sql.ResultSet;
import java.sql.SQLException;

/** Reads one column of the current row as a generic value. */
@FunctionalInterface
public interface JdbcColumnReader {
  JsonNode read(ResultSet rs, int column) throws SQLException;
}
