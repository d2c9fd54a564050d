package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.core.config.SshConfig;
import io.intellixity.quarry.core.driver.DriverProvider;
import io.intellixity.quarry.core.error.DriverConnectionException;
import io.intellixity.quarry.core.error.DriverException;
import io.intellixity.quarry.core.error.DriverTimeoutException;
import io.intellixity.quarry.core.error.UnsupportedDriverOperationException;
import io.intellixity.quarry.core.util.QuarryFactoriesLoader;
import io.intellixity.quarry.ssh.SshTunnel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Default {@link DriverFactory}: picks the {@link DriverProvider} registered for the backend and, when
 * SSH is enabled, points the driver at the local end of a fresh tunnel.\n
 *
 * Tunnel setup runs under a hard deadline ({@link DriverSettings#tunnelTimeout()}). A tunnel that
 * completes after the deadline has no owner and is closed as soon as it arrives.\n
 */
public final class StandardDriverFactory implements DriverFactory {
  private static final Logger log = LoggerFactory.getLogger(StandardDriverFactory.class);

  /** Opens a tunnel to {@code remoteHost:remotePort}; blocking. */
  @FunctionalInterface
  public interface TunnelOpener {
    SshTunnel open(SshConfig ssh, String remoteHost, int remotePort, DriverSettings settings);
  }

  private static final TunnelOpener SSH = (ssh, host, port, s) ->
      SshTunnel.open(ssh, host, port, s.tunnelTimeout(), s.sshKeepAlive());

  private static final ExecutorService TUNNEL_SETUP = Executors.newCachedThreadPool(r -> {
    Thread t = new Thread(r, "quarry-tunnel-setup");
    t.setDaemon(true);
    return t;
  });

  private final DriverSettings settings;
  private final Map<DbType, DriverProvider> providers;
  private final TunnelOpener tunnels;

  public StandardDriverFactory(DriverSettings settings) {
    this(settings, QuarryFactoriesLoader.load(DriverProvider.class), SSH);
  }

  public StandardDriverFactory(DriverSettings settings, List<DriverProvider> providers, TunnelOpener tunnels) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.tunnels = Objects.requireNonNull(tunnels, "tunnels");
    EnumMap<DbType, DriverProvider> byType = new EnumMap<>(DbType.class);
    for (DriverProvider p : Objects.requireNonNull(providers, "providers")) {
      DriverProvider prev = byType.putIfAbsent(p.type(), p);
      if (prev != null) {
        log.warn("quarry.pool duplicate_provider type={} kept={} ignored={}",
            p.type().id(), prev.getClass().getName(), p.getClass().getName());
      }
    }
    this.providers = Collections.unmodifiableMap(byType);
  }

  public Set<DbType> supportedTypes() { return providers.keySet(); }

  @Override
  public ResolvedDriver create(ConnectionConfig config) {
    Objects.requireNonNull(config, "config");
    DriverProvider provider = providers.get(config.dbType());
    if (provider == null) {
      throw new UnsupportedDriverOperationException("Unsupported database type: " + config.dbType().id());
    }
    if (!config.sshEnabled() || config.dbType() == DbType.SQLITE) {
      return ResolvedDriver.direct(provider.create(config, settings));
    }

    SshTunnel tunnel = openTunnel(config);
    try {
      ConnectionConfig local = config.withEndpoint(SshTunnel.LOCAL_HOST, tunnel.localPort());
      return new ResolvedDriver(provider.create(local, settings), tunnel);
    } catch (RuntimeException e) {
      tunnel.close();
      throw e;
    }
  }

  private SshTunnel openTunnel(ConnectionConfig config) {
    String remoteHost = config.effectiveHost();
    int remotePort = config.effectivePort();
    CompletableFuture<SshTunnel> pending = CompletableFuture.supplyAsync(
        () -> tunnels.open(config.ssh(), remoteHost, remotePort, settings), TUNNEL_SETUP);
    long seconds = settings.tunnelTimeout().toSeconds();
    try {
      return pending.get(settings.tunnelTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      pending.thenAccept(late -> {
        log.info("quarry.pool late_tunnel_closed localPort={}", late.localPort());
        late.close();
      });
      throw new DriverTimeoutException("SSH tunnel connection timed out after " + seconds + " seconds", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      String msg = cause instanceof DriverException ? cause.getMessage() : String.valueOf(cause);
      throw new DriverConnectionException("SSH tunnel failed: " + msg, cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      pending.thenAccept(SshTunnel::close);
      throw new DriverConnectionException("SSH tunnel failed: interrupted", e);
    }
  }
}
