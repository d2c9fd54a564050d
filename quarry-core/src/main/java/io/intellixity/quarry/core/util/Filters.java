package io.intellixity.quarry.core.util;

/** Clean-up of user-typed filter expressions before they are appended to a WHERE clause. */
public final class Filters {
  private Filters() {}

  /**
   * Replaces typographic quotes (as inserted by OS auto-correction) with ASCII ones and
   * unescapes {@code \'}. Returns null for a null or blank filter.
   */
  public static String normalize(String filter) {
    if (filter == null || filter.isBlank()) return null;
    return filter
        .replace('‘', '\'')
        .replace('’', '\'')
        .replace('“', '"')
        .replace('”', '"')
        .replace("\\'", "'")
        .trim();
  }
}
