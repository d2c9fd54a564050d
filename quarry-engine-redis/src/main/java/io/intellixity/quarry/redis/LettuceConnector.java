package io.intellixity.quarry.redis;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DriverSettings;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/** Lettuce-backed connector built from a {@link ConnectionConfig}. */
public final class LettuceConnector implements RedisConnector {
  private static final Logger log = LoggerFactory.getLogger(LettuceConnector.class);

  private final RedisClient client;

  public LettuceConnector(ConnectionConfig config, DriverSettings settings) {
    Duration timeout = settings.redisConnectTimeout();
    this.client = RedisClient.create(uri(config, timeout));
    this.client.setOptions(ClientOptions.builder()
        .autoReconnect(false)
        .socketOptions(SocketOptions.builder().connectTimeout(timeout).build())
        .build());
  }

  static RedisURI uri(ConnectionConfig config, Duration timeout) {
    RedisURI.Builder b = RedisURI.builder()
        .withHost(config.effectiveHost())
        .withPort(config.effectivePort())
        .withSsl(config.ssl())
        .withDatabase(database(config.database()))
        .withTimeout(timeout);
    String password = config.password();
    if (password != null && !password.isEmpty()) {
      String user = config.username();
      if (user != null && !user.isBlank() && !"default".equals(user)) {
        b.withAuthentication(user, password);
      } else {
        b.withPassword(password.toCharArray());
      }
    }
    return b.build();
  }

  static int database(String raw) {
    if (raw == null || raw.isBlank()) return 0;
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      log.warn("quarry.redis invalid_database value={} using=0", raw);
      return 0;
    }
  }

  @Override
  public StatefulRedisConnection<String, String> connect() {
    return client.connect();
  }

  @Override
  public void shutdown() {
    client.shutdown();
  }
}
