package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.driver.DatabaseDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One cached connection: driver, optional tunnel, the config it was built from, and its last known
 * status.\n
 *
 * Entries are reference counted. The pool holds one reference while the entry is mapped and every
 * in-flight operation holds a {@link DriverLease}. Removing the entry from the pool only drops
 * the pool's reference; driver and tunnel are closed when the count reaches zero.\n
 */
public final class PoolEntry {
  private static final Logger log = LoggerFactory.getLogger(PoolEntry.class);

  private final String id;
  private final ResolvedDriver resolved;
  private final ConnectionConfig config;
  private final AtomicInteger refs = new AtomicInteger(1);
  private final AtomicBoolean retired = new AtomicBoolean();

  private volatile ConnectionStatus status;
  private volatile String lastError;
  private volatile long lastUsedMillis;

  PoolEntry(String id, ResolvedDriver resolved, ConnectionConfig config, ConnectionStatus status,
            String lastError, long nowMillis) {
    this.id = id;
    this.resolved = resolved;
    this.config = config;
    this.status = status;
    this.lastError = lastError;
    this.lastUsedMillis = nowMillis;
  }

  public String id() { return id; }
  public DatabaseDriver driver() { return resolved.driver(); }
  public ConnectionConfig config() { return config; }
  public ConnectionStatus status() { return status; }
  public String lastError() { return lastError; }
  public long lastUsedMillis() { return lastUsedMillis; }
  public boolean tunneled() { return resolved.tunneled(); }

  void status(ConnectionStatus status, String lastError) {
    this.status = status;
    this.lastError = lastError;
  }

  void touch(long nowMillis) { this.lastUsedMillis = nowMillis; }

  /** Callers hold the pool's map lock or an existing lease, so the entry cannot be retired meanwhile. */
  DriverLease lease() {
    refs.incrementAndGet();
    return new DriverLease(this);
  }

  /** Drops the pool's reference. Idempotent. */
  void retire() {
    if (retired.compareAndSet(false, true)) release();
  }

  boolean retired() { return retired.get(); }

  void release() {
    int left = refs.decrementAndGet();
    if (left == 0) {
      log.debug("quarry.pool op=close_entry id={} tunneled={}", id, resolved.tunneled());
      resolved.close();
    } else if (left < 0) {
      throw new IllegalStateException("PoolEntry released too often: " + id);
    }
  }
}
