package io.intellixity.quarry.redis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.core.driver.DatabaseDriver;
import io.intellixity.quarry.core.driver.TableDataRequest;
import io.intellixity.quarry.core.error.*;
import io.intellixity.quarry.core.model.*;
import io.intellixity.quarry.core.util.TransportErrors;
import io.intellixity.quarry.core.value.Values;
import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.ScoredValue;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.output.NestedMultiOutput;
import io.lettuce.core.protocol.CommandArgs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Redis driver over one multiplexed Lettuce connection.\n
 *
 * Redis has no tables: {@link #listTables()} reports a single synthetic keyspace and the structural
 * calls return empty results. Keys are browsed and edited through the key operations below.
 * The connection is opened lazily and discarded on any connection-class error so the next call
 * reconnects.\n
 */
public final class RedisDriver implements DatabaseDriver {
  private static final Logger log = LoggerFactory.getLogger(RedisDriver.class);

  /** TTL reported for keys without expiry. */
  public static final long NO_EXPIRY = -1;
  public static final String STREAM_PLACEHOLDER = "<stream data - use XREAD command>";

  private final ConnectionConfig config;
  private final DriverSettings settings;
  private final RedisConnector connector;

  private StatefulRedisConnection<String, String> connection;
  private boolean closed;

  public RedisDriver(ConnectionConfig config, DriverSettings settings) {
    this(config, settings, new LettuceConnector(config, settings));
  }

  public RedisDriver(ConnectionConfig config, DriverSettings settings, RedisConnector connector) {
    this.config = Objects.requireNonNull(config, "config");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.connector = Objects.requireNonNull(connector, "connector");
  }

  @Override public DbType type() { return DbType.REDIS; }

  private synchronized StatefulRedisConnection<String, String> connection() {
    if (closed) throw new DriverConnectionException("Driver is closed");
    if (connection != null && connection.isOpen()) return connection;
    if (connection != null) dropConnection();
    try {
      connection = connector.connect();
      log.debug("quarry.redis connected host={} port={}", config.effectiveHost(), config.effectivePort());
      return connection;
    } catch (RedisException e) {
      if (isTimeout(e)) {
        throw new DriverTimeoutException(
            "Connection timed out after " + settings.redisConnectTimeout().toSeconds() + " seconds", e);
      }
      throw new DriverConnectionException("Failed to connect to Redis: " + message(e), e);
    }
  }

  private synchronized void invalidate(StatefulRedisConnection<String, String> broken) {
    if (connection == broken) dropConnection();
  }

  private void dropConnection() {
    StatefulRedisConnection<String, String> c = connection;
    connection = null;
    if (c != null) c.close();
  }

  /** Runs one command set; connection-class failures drop the shared connection. */
  private <T> T call(String op, Function<RedisCommands<String, String>, T> fn) {
    StatefulRedisConnection<String, String> c = connection();
    try {
      return fn.apply(c.sync());
    } catch (RedisCommandExecutionException e) {
      throw new DriverQueryException("Redis command failed: " + message(e), e);
    } catch (RedisException e) {
      if (isConnectionClass(e)) {
        log.warn("quarry.redis connection_reset op={} reason={}", op, message(e));
        invalidate(c);
        throw new DriverConnectionException("Redis " + op + " failed: " + message(e), e);
      }
      throw new DriverQueryException("Redis " + op + " failed: " + message(e), e);
    }
  }

  @Override
  public TestConnectionResult testConnection() {
    try {
      String pong = call("ping", RedisCommands::ping);
      return "PONG".equalsIgnoreCase(pong)
          ? TestConnectionResult.ok("Connection successful!")
          : TestConnectionResult.failed("Connection failed: unexpected PING reply " + pong);
    } catch (DriverException e) {
      return TestConnectionResult.failed("Connection failed: " + e.getMessage());
    }
  }

  @Override
  public List<TableInfo> listTables() {
    return List.of(new TableInfo("redis", "keys", "keyspace"));
  }

  @Override
  public TableDataResponse getTableData(TableDataRequest request) {
    return new TableDataResponse(List.of(), 0, request.page(), request.limit());
  }

  @Override
  public TableStructure getTableStructure(String schema, String table) {
    return TableStructure.empty();
  }

  @Override
  public SchemaOverview getSchemaOverview() {
    return SchemaOverview.empty();
  }

  /**
   * {@code INFO [section]} yields {@code {"info": text}}; anything else is split on whitespace and
   * sent as a raw command. Server errors are reported inline.
   */
  @Override
  public QueryResult executeQuery(String query) {
    long start = System.nanoTime();
    String q = query == null ? "" : query.trim();
    if (q.isEmpty()) return QueryResult.failure("Empty query", 0);
    String[] parts = q.split("\\s+");

    StatefulRedisConnection<String, String> c = connection();
    try {
      JsonNode row;
      if (parts[0].equalsIgnoreCase("INFO")) {
        String info = parts.length > 1 ? c.sync().info(parts[1]) : c.sync().info();
        ObjectNode o = Values.object();
        o.put("info", info);
        row = o;
      } else {
        CommandArgs<String, String> args = new CommandArgs<>(StringCodec.UTF8);
        for (int i = 1; i < parts.length; i++) args.add(parts[i]);
        List<Object> reply = c.sync().dispatch(new RawCommand(parts[0]), new NestedMultiOutput<>(StringCodec.UTF8), args);
        row = replyValue(reply);
      }
      return QueryResult.success(List.of(row), 1, elapsedMs(start));
    } catch (RedisException e) {
      if (isConnectionClass(e)) invalidate(c);
      return QueryResult.failure("Redis command failed: " + message(e), elapsedMs(start));
    }
  }

  /** Single-element replies are unwrapped to their scalar. */
  static JsonNode replyValue(List<Object> reply) {
    if (reply == null) return Values.nul();
    if (reply.size() == 1 && !(reply.get(0) instanceof List<?>)) return Values.of(reply.get(0));
    return Values.of(reply);
  }

  // ---- key operations ----

  /**
   * Bounded, resumable key scan. Runs at most {@code redisScanMaxIterations} SCAN calls and stops once
   * {@code limit} keys are collected. Pass the returned cursor back to continue; "0" (or null) starts over.
   */
  public RedisKeySearchResult searchKeys(String pattern, int limit, String cursor, ScanProgressListener listener) {
    if (limit < 1) throw new RequestValidationException("limit must be >= 1 (got " + limit + ")");
    ScanProgressListener progress = listener == null ? ScanProgressListener.NONE : listener;
    String match = pattern == null || pattern.isBlank() ? "*" : pattern;
    int maxIterations = settings.redisScanMaxIterations();
    ScanArgs args = ScanArgs.Builder.matches(match).limit(settings.redisScanCount());

    return call("search_keys", cmd -> {
      ScanPosition pos = ScanPosition.parse(cursor);
      List<String> found = new ArrayList<>();
      String next = null;
      boolean complete = false;

      for (int iteration = 1; iteration <= maxIterations; iteration++) {
        KeyScanCursor<String> batch = cmd.scan(ScanCursor.of(pos.cursor()), args);
        List<String> keys = batch.getKeys();
        int from = Math.min(pos.skip(), keys.size());
        List<String> fresh = keys.subList(from, keys.size());
        List<String> take = fresh.subList(0, Math.min(limit - found.size(), fresh.size()));
        found.addAll(take);
        progress.onBatch(iteration, maxIterations, found.size(), List.copyOf(take));

        if (take.size() < fresh.size()) {
          next = new ScanPosition(pos.cursor(), from + take.size()).token();
          break;
        }
        if (batch.isFinished()) {
          next = ScanPosition.START.token();
          complete = true;
          break;
        }
        pos = new ScanPosition(batch.getCursor(), 0);
        if (found.size() >= limit) break;
      }
      if (next == null) next = pos.token();

      List<RedisKeyInfo> infos = new ArrayList<>(found.size());
      for (String k : found) infos.add(keyInfo(cmd, k));
      log.debug("quarry.redis op=search_keys pattern={} found={} complete={} cursor={}", match, infos.size(), complete, next);
      return new RedisKeySearchResult(infos, infos.size(), next, complete);
    });
  }

  public RedisKeySearchResult searchKeys(String pattern, int limit) {
    return searchKeys(pattern, limit, null, ScanProgressListener.NONE);
  }

  public RedisKeyDetails getKeyDetails(String key) {
    return call("get_key_details", cmd -> {
      Long exists = cmd.exists(key);
      if (exists == null || exists == 0) throw new DriverQueryException("Key '" + key + "' does not exist");
      String type = cmd.type(key);
      long ttl = ttlOf(cmd.ttl(key));
      JsonNode value;
      Long length;
      switch (type) {
        case "string" -> {
          value = Values.text(cmd.get(key));
          length = cmd.strlen(key);
        }
        case "list" -> {
          value = Values.of(cmd.lrange(key, 0, -1));
          length = cmd.llen(key);
        }
        case "set" -> {
          value = Values.of(new ArrayList<>(cmd.smembers(key)));
          length = cmd.scard(key);
        }
        case "zset" -> {
          ArrayNode arr = Values.array();
          for (ScoredValue<String> sv : cmd.zrangeWithScores(key, 0, -1)) {
            ObjectNode o = Values.object();
            o.put("member", sv.getValue());
            o.put("score", sv.getScore());
            arr.add(o);
          }
          value = arr;
          length = cmd.zcard(key);
        }
        case "hash" -> {
          value = Values.of(new TreeMap<>(cmd.hgetall(key)));
          length = cmd.hlen(key);
        }
        case "stream" -> {
          value = Values.text(STREAM_PLACEHOLDER);
          length = cmd.xlen(key);
        }
        default -> {
          value = Values.nul();
          length = null;
        }
      }
      return new RedisKeyDetails(key, type, ttl, value, memoryUsage(cmd, key), length, cmd.objectEncoding(key));
    });
  }

  public boolean deleteKey(String key) {
    return call("delete_key", cmd -> orZero(cmd.del(key)) > 0);
  }

  /** {@code ttlSeconds} null or non-positive stores without expiry. */
  public void setKey(String key, String value, Long ttlSeconds) {
    call("set_key", cmd -> {
      if (ttlSeconds != null && ttlSeconds > 0) return cmd.setex(key, ttlSeconds, value);
      return cmd.set(key, value);
    });
  }

  public void setListKey(String key, List<String> values, Long ttlSeconds) {
    call("set_list_key", cmd -> {
      cmd.del(key);
      if (!values.isEmpty()) cmd.rpush(key, values.toArray(new String[0]));
      return applyTtl(cmd, key, ttlSeconds);
    });
  }

  public void setSetKey(String key, Collection<String> members, Long ttlSeconds) {
    call("set_set_key", cmd -> {
      cmd.del(key);
      if (!members.isEmpty()) cmd.sadd(key, members.toArray(new String[0]));
      return applyTtl(cmd, key, ttlSeconds);
    });
  }

  public void setHashKey(String key, Map<String, String> fields, Long ttlSeconds) {
    call("set_hash_key", cmd -> {
      cmd.del(key);
      if (!fields.isEmpty()) cmd.hset(key, fields);
      return applyTtl(cmd, key, ttlSeconds);
    });
  }

  public void setZsetKey(String key, Map<String, Double> members, Long ttlSeconds) {
    call("set_zset_key", cmd -> {
      cmd.del(key);
      if (!members.isEmpty()) {
        List<ScoredValue<String>> svs = new ArrayList<>(members.size());
        for (Map.Entry<String, Double> e : members.entrySet()) svs.add(ScoredValue.just(e.getValue(), e.getKey()));
        @SuppressWarnings("unchecked")
        ScoredValue<String>[] arr = svs.toArray(new ScoredValue[0]);
        cmd.zadd(key, arr);
      }
      return applyTtl(cmd, key, ttlSeconds);
    });
  }

  /** Non-positive or null TTL removes the expiry. Returns whether the key existed. */
  public boolean updateTtl(String key, Long ttlSeconds) {
    return call("update_ttl", cmd -> {
      if (orZero(cmd.exists(key)) == 0) return false;
      applyTtl(cmd, key, ttlSeconds);
      return true;
    });
  }

  @Override
  public synchronized void close() {
    if (closed) return;
    closed = true;
    dropConnection();
    connector.shutdown();
  }

  private static Boolean applyTtl(RedisCommands<String, String> cmd, String key, Long ttlSeconds) {
    if (ttlSeconds != null && ttlSeconds > 0) return cmd.expire(key, ttlSeconds);
    return cmd.persist(key);
  }

  private static RedisKeyInfo keyInfo(RedisCommands<String, String> cmd, String key) {
    return new RedisKeyInfo(key, cmd.type(key), ttlOf(cmd.ttl(key)), memoryUsage(cmd, key));
  }

  private static Long memoryUsage(RedisCommands<String, String> cmd, String key) {
    try {
      return cmd.memoryUsage(key);
    } catch (RedisCommandExecutionException e) {
      // servers without MEMORY USAGE (or with it renamed) report no size
      log.debug("quarry.redis memory_usage_unavailable key={} reason={}", key, e.getMessage());
      return null;
    }
  }

  private static long orZero(Long v) { return v == null ? 0 : v; }

  /** A missing TTL reply reads as -1, no expiry. */
  static long ttlOf(Long v) { return v == null ? NO_EXPIRY : v; }

  private static boolean isConnectionClass(RedisException e) {
    return e instanceof RedisConnectionException
        || e instanceof RedisCommandTimeoutException
        || TransportErrors.isTransportFailure(e);
  }

  private static boolean isTimeout(Throwable t) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      String n = c.getClass().getSimpleName();
      if (n.contains("Timeout")) return true;
      String m = c.getMessage();
      if (m != null && m.toLowerCase(Locale.ROOT).contains("timed out")) return true;
      if (c.getCause() == c) break;
    }
    return false;
  }

  private static String message(Throwable t) {
    return t.getMessage() == null ? t.toString() : t.getMessage();
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
