package io.intellixity.quarry.core.mutation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class RawSqlWhitelistTest {

  @Test
  void acceptsExactEntries() {
    assertEquals("now()", RawSqlWhitelist.validate("now()"));
    assertEquals("generateUUIDv4()", RawSqlWhitelist.validate("generateUUIDv4()"));
    assertEquals("datetime('now', 'localtime')", RawSqlWhitelist.validate("datetime('now', 'localtime')"));
    assertEquals("'{}'::jsonb", RawSqlWhitelist.validate("'{}'::jsonb"));
  }

  @Test
  void trimsBeforeMatching() {
    assertEquals("current_date", RawSqlWhitelist.validate("  current_date \n"));
  }

  @Test
  void caseInsensitiveSubset() {
    assertTrue(RawSqlWhitelist.isAllowed("NOW()"));
    assertTrue(RawSqlWhitelist.isAllowed("Null"));
    assertTrue(RawSqlWhitelist.isAllowed("GENERATEUUIDV4()"));
    // casts are only allowed verbatim
    assertTrue(RawSqlWhitelist.isAllowed("now()::date"));
    assertFalse(RawSqlWhitelist.isAllowed("NOW()::DATE"));
  }

  @Test
  void rejectsEmpty() {
    var e = assertThrows(MutationValidationException.class, () -> RawSqlWhitelist.validate("   "));
    assertEquals("Raw SQL value cannot be empty", e.getMessage());
  }

  @Test
  void rejectsStackedStatementAsDangerous() {
    var e = assertThrows(MutationValidationException.class, () -> RawSqlWhitelist.validate("now(); DROP TABLE x"));
    assertEquals("Raw SQL value contains potentially dangerous pattern: 'drop'. "
        + "Only whitelisted SQL functions are allowed.", e.getMessage());
  }

  @Test
  void reportsFirstDangerousPatternInListOrder() {
    var e = assertThrows(MutationValidationException.class, () -> RawSqlWhitelist.validate("1 -- comment"));
    assertTrue(e.getMessage().contains("'--'"), e.getMessage());
  }

  @Test
  void selectIsFlaggedBeforeGenericRejection() {
    var e = assertThrows(MutationValidationException.class, () -> RawSqlWhitelist.validate("SELECT 1"));
    assertTrue(e.getMessage().contains("dangerous pattern: 'select'"), e.getMessage());
  }

  @Test
  void rejectsUnknownFunctionGenerically() {
    var e = assertThrows(MutationValidationException.class, () -> RawSqlWhitelist.validate("random()"));
    assertEquals("Raw SQL value 'random()' is not in the whitelist of allowed functions. "
        + "Only predefined SQL functions are allowed for security.", e.getMessage());
  }
}
