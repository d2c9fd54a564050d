package io.intellixity.quarry.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** One page of rows. {@code total} counts all matching rows, ignoring paging. */
public record TableDataResponse(List<JsonNode> data, long total, int page, int limit) {
  public TableDataResponse {
    data = (data == null) ? List.of() : List.copyOf(data);
  }
}
