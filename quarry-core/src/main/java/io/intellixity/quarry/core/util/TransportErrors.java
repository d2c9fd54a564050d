package io.intellixity.quarry.core.util;

import java.util.List;
import java.util.Locale;

/**
 * Recognizes errors that mean the transport under a pooled resource is gone, as opposed to a
 * statement the backend rejected.
 */
public final class TransportErrors {
  private static final List<String> PATTERNS = List.of(
      "connection reset by peer",
      "connection reset",
      "broken pipe",
      "connection closed",
      "server closed the connection",
      "this connection has been closed",
      "an i/o error occurred"
  );

  private TransportErrors() {}

  public static boolean isTransportFailure(String message) {
    if (message == null) return false;
    String m = message.toLowerCase(Locale.ROOT);
    for (String p : PATTERNS) {
      if (m.contains(p)) return true;
    }
    return false;
  }

  /** Checks the message of {@code t} and of every cause. */
  public static boolean isTransportFailure(Throwable t) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (isTransportFailure(c.getMessage())) return true;
      if (c.getCause() == c) break;
    }
    return false;
  }
}
