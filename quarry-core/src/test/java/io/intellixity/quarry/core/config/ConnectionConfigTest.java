package io.intellixity.quarry.core.config;

import io.intellixity.quarry.core.error.RequestValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionConfigTest {

  @Test
  void parsesAliases() {
    assertEquals(DbType.POSTGRES, DbType.parse("PostgreSQL"));
    assertEquals(DbType.POSTGRES, DbType.parse("postgres"));
    assertEquals(DbType.SQLITE, DbType.parse("sqlite3"));
    assertEquals(DbType.CLICKHOUSE, DbType.parse(" clickhouse "));
    var e = assertThrows(RequestValidationException.class, () -> DbType.parse("oracle"));
    assertEquals("Unsupported database type: oracle", e.getMessage());
  }

  @Test
  void appliesPerBackendDefaultPorts() {
    assertEquals(5432, ConnectionConfig.of(DbType.POSTGRES, "h", null, "d", "u", "p").effectivePort());
    assertEquals(6379, ConnectionConfig.of(DbType.REDIS, "h", 0, null, null, null).effectivePort());
    assertEquals(8123, ConnectionConfig.of(DbType.CLICKHOUSE, "h", null, null, null, null).effectivePort());
    assertEquals(9000, ConnectionConfig.of(DbType.CLICKHOUSE, "h", 9000, null, null, null).effectivePort());
    assertEquals(22, SshConfig.withPassword("bastion", 0, "u", "p").effectivePort());
  }

  @Test
  void withEndpointKeepsEverythingElse() {
    ConnectionConfig c = ConnectionConfig.of(DbType.POSTGRES, "db.internal", 5432, "app", "u", "p")
        .withSsh(SshConfig.withPassword("bastion", 22, "ops", "pw"));
    ConnectionConfig local = c.withEndpoint("127.0.0.1", 40123);
    assertEquals("127.0.0.1", local.host());
    assertEquals(40123, local.effectivePort());
    assertEquals("app", local.database());
    assertTrue(local.sshEnabled());
  }

  @Test
  void toStringMasksSecrets() {
    ConnectionConfig c = ConnectionConfig.of(DbType.POSTGRES, "h", 1, "d", "u", "s3cret")
        .withSsh(SshConfig.withPassword("b", 22, "ops", "t0psecret"));
    assertFalse(c.toString().contains("s3cret"));
    assertFalse(c.toString().contains("t0psecret"));
  }
}
