package io.intellixity.quarry.core.config;

import java.util.Objects;

/**
 * Immutable snapshot of one persisted connection, captured per connect attempt.
 */
public record ConnectionConfig(
    String name,
    DbType dbType,
    String host,
    Integer port,
    String database,
    String username,
    String password,
    boolean ssl,
    String filePath,
    SshConfig ssh
) {
  public ConnectionConfig {
    Objects.requireNonNull(dbType, "dbType");
    ssh = (ssh == null) ? SshConfig.disabled() : ssh;
  }

  public static ConnectionConfig of(DbType type, String host, Integer port, String database, String username, String password) {
    return new ConnectionConfig(null, type, host, port, database, username, password, false, null, null);
  }

  public static ConnectionConfig sqlite(String filePath) {
    return new ConnectionConfig(null, DbType.SQLITE, null, null, null, null, null, false, filePath, null);
  }

  /** Configured port, or the backend default (5432, 6379, 8123) when unset. */
  public int effectivePort() { return port == null || port <= 0 ? dbType.defaultPort() : port; }

  public String effectiveHost() { return host == null || host.isBlank() ? "localhost" : host; }

  public boolean sshEnabled() { return ssh.enabled(); }

  public ConnectionConfig withSsh(SshConfig ssh) {
    return new ConnectionConfig(name, dbType, host, port, database, username, password, ssl, filePath, ssh);
  }

  public ConnectionConfig withSsl(boolean ssl) {
    return new ConnectionConfig(name, dbType, host, port, database, username, password, ssl, filePath, ssh);
  }

  /** Same connection, pointed at another endpoint (the local end of a tunnel). */
  public ConnectionConfig withEndpoint(String host, int port) {
    return new ConnectionConfig(name, dbType, host, port, database, username, password, ssl, filePath, ssh);
  }

  @Override
  public String toString() {
    return "ConnectionConfig[name=" + name + ", dbType=" + dbType + ", host=" + host + ", port=" + port
        + ", database=" + database + ", username=" + username + ", password=" + (password == null ? null : "***")
        + ", ssl=" + ssl + ", filePath=" + filePath + ", ssh=" + ssh + "]";
  }
}
