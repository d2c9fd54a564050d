package io.intellixity.quarry.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Outcome of a raw statement. Backend errors are carried in {@code error} rather than thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResult(List<JsonNode> data, long rowCount, String error, Long timeTakenMs) {
  public QueryResult {
    data = (data == null) ? List.of() : List.copyOf(data);
  }

  public static QueryResult success(List<JsonNode> data, long rowCount, long timeTakenMs) {
    return new QueryResult(data, rowCount, null, timeTakenMs);
  }

  public static QueryResult failure(String error, long timeTakenMs) {
    return new QueryResult(List.of(), 0, error, timeTakenMs);
  }

  public boolean failed() { return error != null; }
}
