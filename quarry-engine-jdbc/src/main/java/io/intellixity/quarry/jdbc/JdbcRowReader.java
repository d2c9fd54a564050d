package io.intellixity.quarry.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.quarry.core.value.Values;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** Turns a result set into generic row objects keyed by column label. */
public final class JdbcRowReader {
  private final ResultSet rs;
  private final JdbcValueMapper mapper;
  private String[] labels;
  private String[] types;

  public JdbcRowReader(ResultSet rs, JdbcValueMapper mapper) {
    this.rs = rs;
    this.mapper = mapper;
  }

  public static List<JsonNode> readAll(ResultSet rs, JdbcValueMapper mapper) throws SQLException {
    JdbcRowReader reader = new JdbcRowReader(rs, mapper);
    List<JsonNode> out = new ArrayList<>();
    while (rs.next()) out.add(reader.current());
    return out;
  }

  public ObjectNode current() throws SQLException {
    if (labels == null) describe();
    ObjectNode row = Values.object();
    for (int i = 0; i < labels.length; i++) {
      row.set(labels[i], mapper.read(rs, i + 1, types[i]));
    }
    return row;
  }

  private void describe() throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    labels = new String[n];
    types = new String[n];
    for (int i = 1; i <= n; i++) {
      labels[i - 1] = md.getColumnLabel(i);
      types[i - 1] = md.getColumnTypeName(i);
    }
  }
}
