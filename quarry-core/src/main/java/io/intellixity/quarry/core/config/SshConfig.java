package io.intellixity.quarry.core.config;

/**
 * SSH hop used to reach a backend. A key is tried first when {@code keyPath} is set,
 * then the password.
 */
public record SshConfig(boolean enabled, String host, Integer port, String user, String password, String keyPath) {
  public static final int DEFAULT_PORT = 22;

  private static final SshConfig DISABLED = new SshConfig(false, null, null, null, null, null);

  public static SshConfig disabled() { return DISABLED; }

  public static SshConfig withPassword(String host, int port, String user, String password) {
    return new SshConfig(true, host, port, user, password, null);
  }

  public static SshConfig withKey(String host, int port, String user, String keyPath) {
    return new SshConfig(true, host, port, user, null, keyPath);
  }

  public int effectivePort() { return port == null || port <= 0 ? DEFAULT_PORT : port; }
  public boolean hasKey() { return keyPath != null && !keyPath.isBlank(); }
  public boolean hasPassword() { return password != null && !password.isEmpty(); }

  @Override
  public String toString() {
    return "SshConfig[enabled=" + enabled + ", host=" + host + ", port=" + port + ", user=" + user
        + ", password=" + (password == null ? null : "***") + ", keyPath=" + keyPath + "]";
  }
}
