package io.intellixity.quarry.redis;

import io.intellixity.quarry.core.error.RequestValidationException;

/**
 * Continuation token: the SCAN cursor that produced the current batch plus how many keys of that
 * batch were already returned, encoded as {@code cursor} or {@code cursor:skip}.
 */
record ScanPosition(String cursor, int skip) {
  static final ScanPosition START = new ScanPosition("0", 0);

  static ScanPosition parse(String token) {
    if (token == null || token.isBlank()) return START;
    String t = token.trim();
    int sep = t.indexOf(':');
    try {
      if (sep < 0) {
        Long.parseUnsignedLong(t);
        return new ScanPosition(t, 0);
      }
      String c = t.substring(0, sep);
      Long.parseUnsignedLong(c);
      int skip = Integer.parseInt(t.substring(sep + 1));
      if (skip < 0) throw new NumberFormatException("negative skip");
      return new ScanPosition(c, skip);
    } catch (NumberFormatException e) {
      throw new RequestValidationException("Invalid scan cursor: " + token, e);
    }
  }

  String token() { return skip == 0 ? cursor : cursor + ":" + skip; }
}
