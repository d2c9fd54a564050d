package io.intellixity.quarry.redis;

import io.lettuce.core.api.StatefulRedisConnection;

/** Opens the single multiplexed connection a {@link RedisDriver} shares across calls. */
@FunctionalInterface
public interface RedisConnector {
  StatefulRedisConnection<String, String> connect();

  /** Releases client-level resources (event loops). Called once when the driver closes. */
  default void shutdown() {}
}
