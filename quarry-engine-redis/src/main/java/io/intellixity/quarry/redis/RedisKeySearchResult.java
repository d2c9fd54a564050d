package io.intellixity.quarry.redis;

import java.util.List;

/**
 * One bounded slice of a key scan.\n
 *
 * {@code complete} is true only when the scan reached the end of the keyspace. Otherwise pass
 * {@code cursor} back to continue where this slice stopped.\n
 */
public record RedisKeySearchResult(List<RedisKeyInfo> keys, int total, String cursor, boolean complete) {
  public RedisKeySearchResult {
    keys = (keys == null) ? List.of() : List.copyOf(keys);
  }
}
