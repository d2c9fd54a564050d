package io.intellixity.quarry.core.mutation;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Allow-list for raw SQL fragments used as column values.\n
 *
 * A fragment is accepted only when it equals an allowed entry exactly, or (for the
 * case-insensitive subset) after lower-casing. Anything else is rejected; fragments that contain a
 * dangerous keyword or comment marker get a more specific message.\n
 *
 * The list is mirrored by clients and must change in lock-step with them.\n
 */
public final class RawSqlWhitelist {
  public static final Set<String> ALLOWED = Set.of(
      // postgres
      "now()", "current_timestamp", "localtimestamp", "current_date", "now()::date",
      "current_time", "localtime", "gen_random_uuid()", "uuid_generate_v4()",
      "DEFAULT", "TRUE", "FALSE",
      "'{}'::json", "'[]'::json", "'{}'::jsonb", "'[]'::jsonb",
      // sqlite
      "datetime('now')", "datetime('now', 'localtime')", "date('now')", "date('now', 'localtime')",
      "time('now')", "time('now', 'localtime')",
      "NULL", "1", "0",
      // clickhouse
      "now64()", "today()", "yesterday()", "generateUUIDv4()", "true", "false", "'{}'"
  );

  public static final Set<String> ALLOWED_IGNORE_CASE = Set.of(
      "true", "false", "null", "default",
      "now()", "current_timestamp", "localtimestamp", "current_date", "current_time", "localtime",
      "gen_random_uuid()", "uuid_generate_v4()",
      "datetime('now')", "datetime('now', 'localtime')", "date('now')", "date('now', 'localtime')",
      "time('now')", "time('now', 'localtime')",
      "now64()", "today()", "yesterday()", "generateuuidv4()"
  );

  /** Checked in order; the first hit is reported. */
  public static final List<String> DANGEROUS_PATTERNS = List.of(
      "drop", "delete", "truncate", "alter", "create", "insert", "update", "exec", "execute",
      "union", "select", "from", "where", "having", "grant", "revoke", "commit", "rollback",
      "begin", "transaction",
      ";", "--", "/*", "*/",
      "xp_", "sp_", "script", "javascript"
  );

  private RawSqlWhitelist() {}

  public static boolean isAllowed(String raw) {
    if (raw == null) return false;
    String v = raw.trim();
    return ALLOWED.contains(v) || ALLOWED_IGNORE_CASE.contains(v.toLowerCase(Locale.ROOT));
  }

  /**
   * Returns the trimmed fragment when allowed.
   *
   * @throws MutationValidationException when the fragment is empty, dangerous, or not allowed
   */
  public static String validate(String raw) {
    String v = raw == null ? "" : raw.trim();
    if (v.isEmpty()) throw new MutationValidationException("Raw SQL value cannot be empty");
    if (isAllowed(v)) return v;

    String lower = v.toLowerCase(Locale.ROOT);
    for (String p : DANGEROUS_PATTERNS) {
      if (lower.contains(p)) {
        throw new MutationValidationException("Raw SQL value contains potentially dangerous pattern: '" + p
            + "'. Only whitelisted SQL functions are allowed.");
      }
    }
    throw new MutationValidationException("Raw SQL value '" + v
        + "' is not in the whitelist of allowed functions. Only predefined SQL functions are allowed for security.");
  }
}
