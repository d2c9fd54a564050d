package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.driver.DatabaseDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * A driver plus the tunnel it talks through, if any. The tunnel is closed after the driver.
 */
public record ResolvedDriver(DatabaseDriver driver, Closeable tunnel) implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ResolvedDriver.class);

  public ResolvedDriver {
    Objects.requireNonNull(driver, "driver");
  }

  public static ResolvedDriver direct(DatabaseDriver driver) {
    return new ResolvedDriver(driver, null);
  }

  public boolean tunneled() { return tunnel != null; }

  @Override
  public void close() {
    try {
      driver.close();
    } finally {
      if (tunnel != null) {
        try {
          tunnel.close();
        } catch (IOException e) {
          log.warn("quarry.pool tunnel_close_failed reason={}", e.getMessage());
        }
      }
    }
  }
}
