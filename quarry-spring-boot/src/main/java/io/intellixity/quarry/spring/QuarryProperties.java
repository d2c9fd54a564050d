package io.intellixity.quarry.spring;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.core.config.SshConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code quarry.*} settings: driver timeouts and caps, plus optional statically declared connections
 * keyed by connection id ({@code quarry.connections.<id>.*}).
 */
@ConfigurationProperties(prefix = "quarry")
public class QuarryProperties {
  private static final DriverSettings DEFAULTS = DriverSettings.defaults();

  private Duration tunnelTimeout = DEFAULTS.tunnelTimeout();
  private Duration sshKeepAlive = DEFAULTS.sshKeepAlive();
  private final Postgres postgres = new Postgres();
  private final Redis redis = new Redis();
  private final ClickHouse clickhouse = new ClickHouse();
  private final Map<String, Connection> connections = new LinkedHashMap<>();

  public Duration getTunnelTimeout() { return tunnelTimeout; }
  public void setTunnelTimeout(Duration tunnelTimeout) { this.tunnelTimeout = tunnelTimeout; }
  public Duration getSshKeepAlive() { return sshKeepAlive; }
  public void setSshKeepAlive(Duration sshKeepAlive) { this.sshKeepAlive = sshKeepAlive; }
  public Postgres getPostgres() { return postgres; }
  public Redis getRedis() { return redis; }
  public ClickHouse getClickhouse() { return clickhouse; }
  public Map<String, Connection> getConnections() { return connections; }

  public DriverSettings toDriverSettings() {
    return new DriverSettings(tunnelTimeout, sshKeepAlive,
        postgres.connectTimeout, postgres.maxPoolSize, postgres.idleTimeout, postgres.acquireTimeout,
        redis.connectTimeout, redis.scanMaxIterations, redis.scanCount,
        clickhouse.requestTimeout);
  }

  public Map<String, ConnectionConfig> toConnectionConfigs() {
    Map<String, ConnectionConfig> out = new LinkedHashMap<>();
    connections.forEach((id, c) -> out.put(id, c.toConfig(id)));
    return out;
  }

  public static class Postgres {
    private Duration connectTimeout = DEFAULTS.postgresConnectTimeout();
    private int maxPoolSize = DEFAULTS.postgresMaxPoolSize();
    private Duration idleTimeout = DEFAULTS.postgresIdleTimeout();
    private Duration acquireTimeout = DEFAULTS.postgresAcquireTimeout();

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    public Duration getIdleTimeout() { return idleTimeout; }
    public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
    public Duration getAcquireTimeout() { return acquireTimeout; }
    public void setAcquireTimeout(Duration acquireTimeout) { this.acquireTimeout = acquireTimeout; }
  }

  public static class Redis {
    private Duration connectTimeout = DEFAULTS.redisConnectTimeout();
    /** Upper bound on SCAN round trips per key search. */
    private int scanMaxIterations = DEFAULTS.redisScanMaxIterations();
    private int scanCount = DEFAULTS.redisScanCount();

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public int getScanMaxIterations() { return scanMaxIterations; }
    public void setScanMaxIterations(int scanMaxIterations) { this.scanMaxIterations = scanMaxIterations; }
    public int getScanCount() { return scanCount; }
    public void setScanCount(int scanCount) { this.scanCount = scanCount; }
  }

  public static class ClickHouse {
    private Duration requestTimeout = DEFAULTS.clickhouseRequestTimeout();

    public Duration getRequestTimeout() { return requestTimeout; }
    public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
  }

  public static class Connection {
    /** Backend name or alias: postgres, postgresql, sqlite, sqlite3, redis, clickhouse. */
    private String type;
    private String name;
    private String host;
    private Integer port;
    private String database;
    private String username;
    private String password;
    private boolean ssl;
    private String filePath;
    private final Ssh ssh = new Ssh();

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public boolean isSsl() { return ssl; }
    public void setSsl(boolean ssl) { this.ssl = ssl; }
    public String getFilePath() { return filePath; }
    public void setFilePath(String filePath) { this.filePath = filePath; }
    public Ssh getSsh() { return ssh; }

    ConnectionConfig toConfig(String id) {
      return new ConnectionConfig(name == null ? id : name, DbType.parse(type), host, port, database,
          username, password, ssl, filePath, ssh.toConfig());
    }
  }

  public static class Ssh {
    private boolean enabled;
    private String host;
    private Integer port;
    private String user;
    private String password;
    private String keyPath;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }
    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getKeyPath() { return keyPath; }
    public void setKeyPath(String keyPath) { this.keyPath = keyPath; }

    SshConfig toConfig() {
      return enabled ? new SshConfig(true, host, port, user, password, keyPath) : SshConfig.disabled();
    }
  }
}
