package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.driver.DatabaseDriver;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One in-flight use of a pooled driver. While the lease is open the driver and its SSH tunnel stay
 * up, even if the pool replaces or drops the entry meanwhile. Close it when done; closing twice is a
 * no-op.
 */
public final class DriverLease implements AutoCloseable {
  private final PoolEntry entry;
  private final AtomicBoolean released = new AtomicBoolean();

  DriverLease(PoolEntry entry) {
    this.entry = entry;
  }

  public DatabaseDriver driver() { return entry.driver(); }
  public ConnectionConfig config() { return entry.config(); }
  public String id() { return entry.id(); }

  PoolEntry entry() { return entry; }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) entry.release();
  }
}
