package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.core.config.SshConfig;
import io.intellixity.quarry.core.driver.DatabaseDriver;
import io.intellixity.quarry.core.driver.DriverProvider;
import io.intellixity.quarry.core.error.DriverConnectionException;
import io.intellixity.quarry.core.error.DriverTimeoutException;
import io.intellixity.quarry.core.error.UnsupportedDriverOperationException;
import io.intellixity.quarry.jdbc.sqlite.SqliteDriver;
import io.intellixity.quarry.ssh.SshTunnelException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class StandardDriverFactoryTest {

  private static DriverProvider stubProvider(DbType type, AtomicReference<ConnectionConfig> seen) {
    return new DriverProvider() {
      @Override public DbType type() { return type; }
      @Override public DatabaseDriver create(ConnectionConfig config, DriverSettings settings) {
        seen.set(config);
        return new StubDriver(config);
      }
    };
  }

  private static final StandardDriverFactory.TunnelOpener NO_TUNNELS = (ssh, host, port, s) -> {
    throw new AssertionError("tunnel not expected");
  };

  @Test
  void missingProviderIsUnsupported() {
    StandardDriverFactory f = new StandardDriverFactory(DriverSettings.defaults(), List.of(), NO_TUNNELS);

    UnsupportedDriverOperationException e = assertThrows(UnsupportedDriverOperationException.class,
        () -> f.create(ConnectionConfig.of(DbType.REDIS, "h", null, null, null, null)));

    assertEquals("Unsupported database type: redis", e.getMessage());
  }

  @Test
  void directConnectionKeepsTheConfiguredEndpoint() {
    AtomicReference<ConnectionConfig> seen = new AtomicReference<>();
    StandardDriverFactory f = new StandardDriverFactory(DriverSettings.defaults(),
        List.of(stubProvider(DbType.POSTGRES, seen)), NO_TUNNELS);
    ConnectionConfig cfg = ConnectionConfig.of(DbType.POSTGRES, "db.internal", 6543, "app", "u", "p");

    ResolvedDriver r = f.create(cfg);

    assertFalse(r.tunneled());
    assertSame(cfg, seen.get());
  }

  @Test
  void sqliteNeverTunnels() {
    AtomicReference<ConnectionConfig> seen = new AtomicReference<>();
    StandardDriverFactory f = new StandardDriverFactory(DriverSettings.defaults(),
        List.of(stubProvider(DbType.SQLITE, seen)), NO_TUNNELS);
    ConnectionConfig cfg = ConnectionConfig.sqlite("/tmp/x.db")
        .withSsh(SshConfig.withPassword("bastion", 22, "me", "pw"));

    assertFalse(f.create(cfg).tunneled());
  }

  @Test
  void tunnelFailureIsAConnectionError() {
    AtomicInteger opens = new AtomicInteger();
    StandardDriverFactory f = new StandardDriverFactory(DriverSettings.defaults(),
        List.of(stubProvider(DbType.POSTGRES, new AtomicReference<>())), (ssh, host, port, s) -> {
          opens.incrementAndGet();
          assertEquals("db.internal", host);
          assertEquals(5432, port);
          throw new SshTunnelException("SSH authentication failed - check credentials");
        });
    ConnectionConfig cfg = ConnectionConfig.of(DbType.POSTGRES, "db.internal", null, "app", "u", "p")
        .withSsh(SshConfig.withPassword("bastion", 22, "me", "pw"));

    DriverConnectionException e = assertThrows(DriverConnectionException.class, () -> f.create(cfg));

    assertEquals("SSH tunnel failed: SSH authentication failed - check credentials", e.getMessage());
    assertEquals(1, opens.get());
  }

  @Test
  void slowTunnelTimesOut() throws InterruptedException {
    CountDownLatch never = new CountDownLatch(1);
    DriverSettings settings = DriverSettings.defaults().withTunnelTimeout(Duration.ofSeconds(1));
    StandardDriverFactory f = new StandardDriverFactory(settings,
        List.of(stubProvider(DbType.POSTGRES, new AtomicReference<>())), (ssh, host, port, s) -> {
          try {
            never.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          throw new SshTunnelException("Failed to connect to SSH server: gave up");
        });
    ConnectionConfig cfg = ConnectionConfig.of(DbType.POSTGRES, "db.internal", 5432, "app", "u", "p")
        .withSsh(SshConfig.withPassword("bastion", 22, "me", "pw"));

    try {
      DriverTimeoutException e = assertThrows(DriverTimeoutException.class, () -> f.create(cfg));
      assertEquals("SSH tunnel connection timed out after 1 seconds", e.getMessage());
    } finally {
      never.countDown();
    }
  }

  @Test
  void providersAreDiscoveredFromTheClasspath() {
    StandardDriverFactory f = new StandardDriverFactory(DriverSettings.defaults());

    assertTrue(f.supportedTypes().contains(DbType.SQLITE));
    try (ResolvedDriver r = f.create(ConnectionConfig.sqlite("build-never-opened.db"))) {
      assertInstanceOf(SqliteDriver.class, r.driver());
    }
  }
}
