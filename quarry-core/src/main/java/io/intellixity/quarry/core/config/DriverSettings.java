package io.intellixity.quarry.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeouts and caps shared by driver construction and the drivers themselves.
 */
public record DriverSettings(
    Duration tunnelTimeout,
    Duration sshKeepAlive,
    Duration postgresConnectTimeout,
    int postgresMaxPoolSize,
    Duration postgresIdleTimeout,
    Duration postgresAcquireTimeout,
    Duration redisConnectTimeout,
    int redisScanMaxIterations,
    int redisScanCount,
    Duration clickhouseRequestTimeout
) {
  public DriverSettings {
    Objects.requireNonNull(tunnelTimeout, "tunnelTimeout");
    Objects.requireNonNull(sshKeepAlive, "sshKeepAlive");
    Objects.requireNonNull(postgresConnectTimeout, "postgresConnectTimeout");
    Objects.requireNonNull(postgresIdleTimeout, "postgresIdleTimeout");
    Objects.requireNonNull(postgresAcquireTimeout, "postgresAcquireTimeout");
    Objects.requireNonNull(redisConnectTimeout, "redisConnectTimeout");
    Objects.requireNonNull(clickhouseRequestTimeout, "clickhouseRequestTimeout");
    if (postgresMaxPoolSize < 1) throw new IllegalArgumentException("postgresMaxPoolSize must be >= 1");
    if (redisScanMaxIterations < 1) throw new IllegalArgumentException("redisScanMaxIterations must be >= 1");
    if (redisScanCount < 1) throw new IllegalArgumentException("redisScanCount must be >= 1");
  }

  public static DriverSettings defaults() {
    return new DriverSettings(
        Duration.ofSeconds(20),
        Duration.ofSeconds(15),
        Duration.ofSeconds(15),
        5,
        Duration.ofSeconds(600),
        Duration.ofSeconds(30),
        Duration.ofSeconds(10),
        50,
        1000,
        Duration.ofSeconds(60)
    );
  }

  public DriverSettings withTunnelTimeout(Duration d) {
    return new DriverSettings(d, sshKeepAlive, postgresConnectTimeout, postgresMaxPoolSize, postgresIdleTimeout,
        postgresAcquireTimeout, redisConnectTimeout, redisScanMaxIterations, redisScanCount, clickhouseRequestTimeout);
  }

  public DriverSettings withRedisScan(int maxIterations, int count) {
    return new DriverSettings(tunnelTimeout, sshKeepAlive, postgresConnectTimeout, postgresMaxPoolSize, postgresIdleTimeout,
        postgresAcquireTimeout, redisConnectTimeout, maxIterations, count, clickhouseRequestTimeout);
  }

  public DriverSettings withPostgresConnectTimeout(Duration d) {
    return new DriverSettings(tunnelTimeout, sshKeepAlive, d, postgresMaxPoolSize, postgresIdleTimeout,
        postgresAcquireTimeout, redisConnectTimeout, redisScanMaxIterations, redisScanCount, clickhouseRequestTimeout);
  }
}
