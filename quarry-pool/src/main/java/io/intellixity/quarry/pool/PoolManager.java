package io.intellixity.quarry.pool;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.driver.DatabaseDriver;
import io.intellixity.quarry.core.driver.TableDataRequest;
import io.intellixity.quarry.core.error.*;
import io.intellixity.quarry.core.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Caches one driver (plus optional SSH tunnel) per connection id and owns reconnect, health-check and
 * retry policy.\n
 *
 * Two maps, two locks:\n
 * - {@code entries} (id to {@link PoolEntry}) under a read/write lock, held only for map reads and
 *   writes, never across network calls\n
 * - {@code connectLocks} (id to per-id mutex) under its own read/write lock; the per-id mutex is held
 *   for the whole connect/reconnect so exactly one attempt per id is in flight\n
 *
 * The operation wrappers ({@link #listTables}, {@link #executeQuery}, ...) connect on demand, run the
 * call on the cached driver and, if it fails, rebuild the entry from freshly read config and retry
 * exactly once. The second failure goes to the caller unchanged.\n
 *
 * Drivers handed out directly ({@link #getConnection}, {@link #connect}, {@link #reconnect},
 * {@link #getCached}) come wrapped in a {@link DriverLease}; the driver and its tunnel stay open until
 * the lease is closed, even if the entry is replaced meanwhile.\n
 *
 * Construct one per process and {@link #close()} it on shutdown; closing tears down every tunnel.\n
 */
public final class PoolManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PoolManager.class);

  private final DriverFactory factory;
  private final ConnectionConfigSource configs;
  private final LongSupplier nowMillis;

  private final ReentrantReadWriteLock entriesLock = new ReentrantReadWriteLock();
  private final Map<String, PoolEntry> entries = new HashMap<>();

  private final ReentrantReadWriteLock connectLocksLock = new ReentrantReadWriteLock();
  private final Map<String, ReentrantLock> connectLocks = new HashMap<>();

  private volatile boolean closed;

  public PoolManager(DriverFactory factory, ConnectionConfigSource configs) {
    this(factory, configs, System::currentTimeMillis);
  }

  public PoolManager(DriverFactory factory, ConnectionConfigSource configs, LongSupplier nowMillis) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.configs = Objects.requireNonNull(configs, "configs");
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  // ---- connect / disconnect ----

  /** Leases the cached driver when it is {@code CONNECTED}; otherwise connects with {@code config}. */
  public DriverLease getConnection(String id, ConnectionConfig config) {
    DriverLease cached = leaseConnected(id);
    if (cached != null) return cached;

    ReentrantLock lock = lockConnect(id);
    try {
      cached = leaseConnected(id);
      if (cached != null) return cached;
      return connect(id, config);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Builds a fresh driver, tests it and stores it, replacing (and retiring) any previous entry.
   * A failed connection test is still stored, as {@code DISCONNECTED} with its message, and then
   * reported as a {@link DriverConnectionException}.
   */
  public DriverLease connect(String id, ConnectionConfig config) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(config, "config");
    ReentrantLock lock = lockConnect(id);
    try {
      ensureOpen();
      write(() -> {
        PoolEntry prev = entries.get(id);
        if (prev != null) prev.status(ConnectionStatus.RECONNECTING, prev.lastError());
        return null;
      });

      long start = System.nanoTime();
      ResolvedDriver resolved;
      try {
        resolved = factory.create(config);
      } catch (DriverException e) {
        markDisconnected(id, e.getMessage());
        log.warn("quarry.pool op=connect id={} db={} status=FAILED reason={}", id, config.dbType().id(), e.getMessage());
        throw e;
      }

      TestConnectionResult test;
      try {
        test = resolved.driver().testConnection();
      } catch (RuntimeException e) {
        resolved.close();
        markDisconnected(id, e.getMessage());
        throw e;
      }

      ConnectionStatus status = test.success() ? ConnectionStatus.CONNECTED : ConnectionStatus.DISCONNECTED;
      PoolEntry fresh = new PoolEntry(id, resolved, config, status, test.success() ? null : test.message(),
          nowMillis.getAsLong());
      // leased before it is published so a concurrent disconnect cannot close it under the caller
      DriverLease lease = fresh.lease();
      PoolEntry prev = write(() -> closed ? fresh : entries.put(id, fresh));
      if (prev == fresh) {
        fresh.retire();
        lease.close();
        throw new DriverConnectionException("Pool is closed");
      }
      if (prev != null) prev.retire();

      log.info("quarry.pool op=connect id={} db={} status={} tunneled={} durationMs={}",
          id, config.dbType().id(), status, resolved.tunneled(), (System.nanoTime() - start) / 1_000_000);
      if (!test.success()) {
        lease.close();
        throw new DriverConnectionException(test.message());
      }
      return lease;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Makes sure an entry exists for {@code id}, connecting with the stored config if not. An existing
   * entry is accepted whatever its status; the retry path deals with stale ones.
   */
  public void ensureConnection(String id) {
    if (entry(id) != null) return;
    ReentrantLock lock = lockConnect(id);
    try {
      if (entry(id) != null) return;
      connect(id, storedConfig(id, null)).close();
    } finally {
      lock.unlock();
    }
  }

  /** Drops the entry and connects again, re-reading the config (falling back to the cached one). */
  public DriverLease reconnect(String id) {
    ReentrantLock lock = lockConnect(id);
    try {
      PoolEntry stale = entry(id);
      ConnectionConfig fallback = stale == null ? null : stale.config();
      removeEntry(id);
      return connect(id, storedConfig(id, fallback));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the entry. Its driver and tunnel close once the last lease is closed. The id's connect
   * mutex is dropped too unless a connect is running.
   */
  public void disconnect(String id) {
    removeEntry(id);
    dropConnectLock(id);
  }

  private void removeEntry(String id) {
    PoolEntry removed = write(() -> entries.remove(id));
    if (removed != null) {
      removed.retire();
      log.info("quarry.pool op=disconnect id={}", id);
    }
  }

  // ---- status ----

  public ConnectionStatus getStatus(String id) {
    PoolEntry e = entry(id);
    return e == null ? ConnectionStatus.DISCONNECTED : e.status();
  }

  public Optional<String> getLastError(String id) {
    PoolEntry e = entry(id);
    return e == null ? Optional.empty() : Optional.ofNullable(e.lastError());
  }

  public void touch(String id) {
    PoolEntry e = entry(id);
    if (e != null) e.touch(nowMillis.getAsLong());
  }

  public Optional<Long> getLastUsed(String id) {
    PoolEntry e = entry(id);
    return e == null ? Optional.empty() : Optional.of(e.lastUsedMillis());
  }

  public void markDisconnected(String id, String error) {
    write(() -> {
      PoolEntry e = entries.get(id);
      if (e != null) e.status(ConnectionStatus.DISCONNECTED, error);
      return null;
    });
  }

  /** Re-tests the cached driver in place and records the outcome. Never recreates the driver. */
  public TestConnectionResult healthCheck(String id) {
    DriverLease lease = lease(id, false);
    if (lease == null) return TestConnectionResult.failed("Connection not found");
    try (lease) {
      TestConnectionResult r = lease.driver().testConnection();
      PoolEntry checked = lease.entry();
      write(() -> {
        if (entries.get(id) == checked) {
          checked.status(r.success() ? ConnectionStatus.CONNECTED : ConnectionStatus.DISCONNECTED,
              r.success() ? null : r.message());
        }
        return null;
      });
      log.debug("quarry.pool op=health_check id={} success={}", id, r.success());
      return r;
    }
  }

  /** Leases the cached driver, whatever its status, without connecting. */
  public Optional<DriverLease> getCached(String id) {
    return Optional.ofNullable(lease(id, false));
  }

  public Optional<ConnectionConfig> getConfig(String id) {
    PoolEntry e = entry(id);
    return e == null ? Optional.empty() : Optional.of(e.config());
  }

  /** Cached config if connected, else the stored one. No network access. */
  public Optional<ConnectionConfig> knownConfig(String id) {
    Optional<ConnectionConfig> cached = getConfig(id);
    return cached.isPresent() ? cached : configs.find(id);
  }

  public Set<String> connectionIds() {
    return read(() -> Set.copyOf(entries.keySet()));
  }

  // ---- operations with retry-once ----

  public List<TableInfo> listTables(String id) {
    return withRetry(id, "list_tables", DatabaseDriver::listTables);
  }

  public TableDataResponse getTableData(String id, TableDataRequest request) {
    Objects.requireNonNull(request, "request");
    return withRetry(id, "get_table_data", d -> d.getTableData(request));
  }

  public TableStructure getTableStructure(String id, String schema, String table) {
    return withRetry(id, "get_table_structure", d -> d.getTableStructure(schema, table));
  }

  public QueryResult executeQuery(String id, String sql) {
    return withRetry(id, "execute_query", d -> d.executeQuery(sql));
  }

  public SchemaOverview getSchemaOverview(String id) {
    return withRetry(id, "get_schema_overview", DatabaseDriver::getSchemaOverview);
  }

  /**
   * Runs a backend-specific call (e.g. Redis key operations) with the same connect-and-retry-once
   * policy. Fails with {@link UnsupportedDriverOperationException} when the connection is not a
   * {@code type}.
   */
  public <D extends DatabaseDriver, T> T withDriver(String id, Class<D> type, Function<? super D, ? extends T> fn) {
    Objects.requireNonNull(type, "type");
    return withRetry(id, "with_driver", d -> {
      if (!type.isInstance(d)) {
        throw new UnsupportedDriverOperationException(
            "Connection " + id + " is " + d.type().id() + ", not " + type.getSimpleName());
      }
      return fn.apply(type.cast(d));
    });
  }

  private <T> T withRetry(String id, String op, Function<DatabaseDriver, T> fn) {
    ensureConnection(id);
    try {
      return run(id, fn);
    } catch (RequestValidationException | UnsupportedDriverOperationException e) {
      throw e;
    } catch (DriverException e) {
      log.warn("quarry.pool op={} id={} retry=1 reason={}", op, id, e.getMessage());
      reconnect(id).close();
      return run(id, fn);
    }
  }

  private <T> T run(String id, Function<DatabaseDriver, T> fn) {
    DriverLease lease = lease(id, true);
    if (lease == null) throw new DriverConnectionException("Connection not found: " + id);
    try (lease) {
      return fn.apply(lease.driver());
    }
  }

  // ---- lifecycle ----

  /** Retires every entry; tunnels close as soon as their drivers are idle. */
  @Override
  public void close() {
    List<PoolEntry> all = write(() -> {
      closed = true;
      List<PoolEntry> out = new ArrayList<>(entries.values());
      entries.clear();
      return out;
    });
    for (PoolEntry e : all) e.retire();
    connectLocksLock.writeLock().lock();
    try {
      connectLocks.clear();
    } finally {
      connectLocksLock.writeLock().unlock();
    }
    log.info("quarry.pool op=close entries={}", all.size());
  }

  // ---- internals ----

  private void ensureOpen() {
    if (closed) throw new DriverConnectionException("Pool is closed");
  }

  private ConnectionConfig storedConfig(String id, ConnectionConfig fallback) {
    Optional<ConnectionConfig> found = configs.find(id);
    if (found.isPresent()) return found.get();
    if (fallback != null) return fallback;
    throw new DriverConnectionException("Connection not found: " + id);
  }

  private PoolEntry entry(String id) {
    return read(() -> entries.get(id));
  }

  private DriverLease leaseConnected(String id) {
    return read(() -> {
      PoolEntry e = entries.get(id);
      return e != null && e.status() == ConnectionStatus.CONNECTED ? e.lease() : null;
    });
  }

  private DriverLease lease(String id, boolean touch) {
    return read(() -> {
      PoolEntry e = entries.get(id);
      if (e == null) return null;
      if (touch) e.touch(nowMillis.getAsLong());
      return e.lease();
    });
  }

  /**
   * Locks the id's connect mutex. A mutex dropped by {@link #disconnect} between lookup and
   * acquisition is stale, so the lookup is repeated until the locked mutex is still the mapped one.
   */
  private ReentrantLock lockConnect(String id) {
    while (true) {
      ReentrantLock l = connectLock(id);
      l.lock();
      if (currentConnectLock(id) == l) return l;
      l.unlock();
    }
  }

  private ReentrantLock currentConnectLock(String id) {
    connectLocksLock.readLock().lock();
    try {
      return connectLocks.get(id);
    } finally {
      connectLocksLock.readLock().unlock();
    }
  }

  private void dropConnectLock(String id) {
    connectLocksLock.writeLock().lock();
    try {
      ReentrantLock l = connectLocks.get(id);
      if (l != null && l.tryLock()) {
        try {
          connectLocks.remove(id);
        } finally {
          l.unlock();
        }
      }
    } finally {
      connectLocksLock.writeLock().unlock();
    }
  }

  int connectLockCount() {
    connectLocksLock.readLock().lock();
    try {
      return connectLocks.size();
    } finally {
      connectLocksLock.readLock().unlock();
    }
  }

  /** The per-id connect mutex, created on first use. */
  private ReentrantLock connectLock(String id) {
    connectLocksLock.readLock().lock();
    try {
      ReentrantLock l = connectLocks.get(id);
      if (l != null) return l;
    } finally {
      connectLocksLock.readLock().unlock();
    }
    connectLocksLock.writeLock().lock();
    try {
      return connectLocks.computeIfAbsent(id, k -> new ReentrantLock());
    } finally {
      connectLocksLock.writeLock().unlock();
    }
  }

  private <T> T read(Supplier<T> s) {
    entriesLock.readLock().lock();
    try {
      return s.get();
    } finally {
      entriesLock.readLock().unlock();
    }
  }

  private <T> T write(Supplier<T> s) {
    entriesLock.writeLock().lock();
    try {
      return s.get();
    } finally {
      entriesLock.writeLock().unlock();
    }
  }
}
