package io.intellixity.quarry.redis;

import io.intellixity.quarry.core.config.ConnectionConfig;
import io.intellixity.quarry.core.config.DbType;
import io.intellixity.quarry.core.config.DriverSettings;
import io.intellixity.quarry.core.driver.TableDataRequest;
import io.intellixity.quarry.core.error.DriverConnectionException;
import io.intellixity.quarry.core.error.DriverQueryException;
import io.intellixity.quarry.core.model.QueryResult;
import io.intellixity.quarry.core.model.TableInfo;
import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.ScoredValue;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
final class RedisDriverTest {

  @Mock StatefulRedisConnection<String, String> connection;
  @Mock RedisCommands<String, String> commands;

  private final AtomicInteger connects = new AtomicInteger();
  private final ConnectionConfig config = ConnectionConfig.of(DbType.REDIS, "cache", null, "0", null, null);

  @BeforeEach
  void setUp() {
    lenient().when(connection.sync()).thenReturn(commands);
    lenient().when(connection.isOpen()).thenReturn(true);
    lenient().when(commands.type(anyString())).thenReturn("string");
    lenient().when(commands.ttl(anyString())).thenReturn(-1L);
    lenient().when(commands.memoryUsage(anyString())).thenReturn(48L);
  }

  private RedisDriver driver(DriverSettings settings) {
    return new RedisDriver(config, settings, () -> {
      connects.incrementAndGet();
      return connection;
    });
  }

  private static KeyScanCursor<String> batch(String next, boolean finished, String... keys) {
    KeyScanCursor<String> c = new KeyScanCursor<>();
    c.getKeys().addAll(List.of(keys));
    c.setCursor(next);
    c.setFinished(finished);
    return c;
  }

  @Test
  void searchStopsAtLimitAndReturnsContinuationCursor() {
    when(commands.scan(any(ScanCursor.class), any(ScanArgs.class)))
        .thenAnswer(inv -> batch("0", true, "k1", "k2", "k3", "k4", "k5"));
    RedisDriver d = driver(DriverSettings.defaults());

    RedisKeySearchResult first = d.searchKeys("k*", 2, null, null);

    assertEquals(2, first.keys().size());
    assertEquals(2, first.total());
    assertFalse(first.complete());
    assertEquals("k1", first.keys().get(0).key());
    assertEquals(48L, first.keys().get(0).size());
    assertEquals(-1L, first.keys().get(0).ttl());
  }

  @Test
  void resumingWalksTheRestWithoutGapsOrRepeats() {
    when(commands.scan(any(ScanCursor.class), any(ScanArgs.class)))
        .thenAnswer(inv -> batch("0", true, "k1", "k2", "k3", "k4", "k5"));
    RedisDriver d = driver(DriverSettings.defaults());

    List<String> seen = new ArrayList<>();
    String cursor = null;
    RedisKeySearchResult r;
    int calls = 0;
    do {
      r = d.searchKeys("k*", 2, cursor, null);
      r.keys().forEach(k -> seen.add(k.key()));
      cursor = r.cursor();
      calls++;
    } while (!r.complete() && calls < 10);

    assertEquals(List.of("k1", "k2", "k3", "k4", "k5"), seen);
    assertEquals(3, calls);
    assertEquals("0", r.cursor());
  }

  @Test
  void followsServerCursorAcrossBatches() {
    when(commands.scan(any(ScanCursor.class), any(ScanArgs.class))).thenAnswer(inv -> {
      ScanCursor c = inv.getArgument(0);
      return switch (c.getCursor()) {
        case "0" -> batch("7", false, "a", "b");
        case "7" -> batch("9", false, "c");
        default -> batch("0", true, "d", "e");
      };
    });
    RedisDriver d = driver(DriverSettings.defaults());

    List<Integer> iterations = new ArrayList<>();
    RedisKeySearchResult r = d.searchKeys("*", 3, "0", (i, max, found, keys) -> iterations.add(found));

    assertEquals(3, r.keys().size());
    assertEquals("9", r.cursor());
    assertFalse(r.complete());
    assertEquals(List.of(2, 3), iterations);
  }

  @Test
  void iterationCapBoundsTheScan() {
    when(commands.scan(any(ScanCursor.class), any(ScanArgs.class))).thenAnswer(inv -> batch("42", false));
    RedisDriver d = driver(DriverSettings.defaults().withRedisScan(3, 10));

    AtomicInteger batches = new AtomicInteger();
    RedisKeySearchResult r = d.searchKeys("*", 100, null, (i, max, found, keys) -> {
      assertEquals(3, max);
      batches.incrementAndGet();
    });

    assertEquals(3, batches.get());
    assertTrue(r.keys().isEmpty());
    assertFalse(r.complete());
    assertEquals("42", r.cursor());
  }

  @Test
  void infoIsWrappedAndRawCommandsAreDispatched() {
    when(commands.info()).thenReturn("# Server\nredis_version:7.2.0");
    doReturn(List.of("OK")).when(commands).dispatch(any(), any(), any());
    RedisDriver d = driver(DriverSettings.defaults());

    QueryResult info = d.executeQuery("INFO");
    assertEquals("# Server\nredis_version:7.2.0", info.data().get(0).get("info").textValue());

    QueryResult set = d.executeQuery("set greeting hello");
    assertNull(set.error());
    assertEquals(1, set.rowCount());
    assertEquals("OK", set.data().get(0).textValue());
  }

  @Test
  void commandErrorsAreInline() {
    doThrow(new RedisCommandExecutionException("ERR unknown command 'FOO'"))
        .when(commands).dispatch(any(), any(), any());
    RedisDriver d = driver(DriverSettings.defaults());

    QueryResult r = d.executeQuery("FOO bar");
    assertEquals("Redis command failed: ERR unknown command 'FOO'", r.error());
    assertEquals("Empty query", d.executeQuery("   ").error());
  }

  @Test
  void connectionErrorDropsTheConnection() {
    when(commands.ping()).thenThrow(new RedisConnectionException("Connection closed")).thenReturn("PONG");
    RedisDriver d = driver(DriverSettings.defaults());

    assertFalse(d.testConnection().success());
    assertTrue(d.testConnection().success());
    assertEquals(2, connects.get());
    verify(connection).close();
  }

  @Test
  void failedConnectIsAConnectionError() {
    RedisDriver d = new RedisDriver(config, DriverSettings.defaults(), () -> {
      throw new RedisConnectionException("Unable to connect to cache:6379");
    });
    var e = assertThrows(DriverConnectionException.class, () -> d.deleteKey("x"));
    assertTrue(e.getMessage().startsWith("Failed to connect to Redis"), e.getMessage());
  }

  @Test
  void keyDetailsByType() {
    when(commands.exists("board")).thenReturn(1L);
    when(commands.type("board")).thenReturn("zset");
    when(commands.ttl("board")).thenReturn(120L);
    when(commands.zrangeWithScores("board", 0, -1))
        .thenReturn(List.of(ScoredValue.just(1.5, "ann"), ScoredValue.just(3.0, "bob")));
    when(commands.zcard("board")).thenReturn(2L);
    when(commands.objectEncoding("board")).thenReturn("listpack");
    RedisDriver d = driver(DriverSettings.defaults());

    RedisKeyDetails details = d.getKeyDetails("board");

    assertEquals("zset", details.type());
    assertEquals(120L, details.ttl());
    assertEquals(2L, details.length());
    assertEquals("bob", details.value().get(1).get("member").textValue());
    assertEquals(3.0, details.value().get(1).get("score").doubleValue());
    assertEquals("listpack", details.encoding());
  }

  @Test
  void missingTtlReplyMeansNoExpiry() {
    when(commands.exists("board")).thenReturn(1L);
    when(commands.type("board")).thenReturn("zset");
    when(commands.ttl("board")).thenReturn(null);
    when(commands.zrangeWithScores("board", 0, -1)).thenReturn(List.of());
    when(commands.zcard("board")).thenReturn(0L);
    when(commands.objectEncoding("board")).thenReturn("listpack");
    RedisDriver d = driver(DriverSettings.defaults());

    assertEquals(RedisDriver.NO_EXPIRY, d.getKeyDetails("board").ttl());
    assertEquals(-1L, RedisDriver.ttlOf(null));
    assertEquals(0L, RedisDriver.ttlOf(0L));
  }

  @Test
  void missingKeyIsReported() {
    when(commands.exists("ghost")).thenReturn(0L);
    RedisDriver d = driver(DriverSettings.defaults());

    var e = assertThrows(DriverQueryException.class, () -> d.getKeyDetails("ghost"));
    assertEquals("Key 'ghost' does not exist", e.getMessage());
  }

  @Test
  void writesWithAndWithoutTtl() {
    RedisDriver d = driver(DriverSettings.defaults());

    d.setKey("a", "1", 30L);
    d.setKey("b", "2", null);
    d.setHashKey("h", Map.of("f", "v"), 0L);

    verify(commands).setex("a", 30L, "1");
    verify(commands).set("b", "2");
    verify(commands).del("h");
    verify(commands).hset("h", Map.of("f", "v"));
    verify(commands).persist("h");
  }

  @Test
  void keyspaceIsTheOnlyTable() {
    RedisDriver d = driver(DriverSettings.defaults());
    assertEquals(List.of(new TableInfo("redis", "keys", "keyspace")), d.listTables());
    assertTrue(d.getTableStructure("redis", "keys").columns().isEmpty());
    assertTrue(d.getSchemaOverview().tables().isEmpty());
    assertEquals(0, d.getTableData(TableDataRequest.of("redis", "keys", 1, 100)).total());
    assertEquals(0, connects.get());
  }

  @Test
  void buildsUriWithDatabaseAndDefaultPort() {
    ConnectionConfig c = ConnectionConfig.of(DbType.REDIS, "cache", null, "3", null, "pw");
    RedisURI uri = LettuceConnector.uri(c, Duration.ofSeconds(10));
    assertEquals(6379, uri.getPort());
    assertEquals(3, uri.getDatabase());
    assertArrayEquals("pw".toCharArray(), uri.getPassword());
    assertEquals(0, LettuceConnector.database("not-a-number"));
  }
}
