package io.intellixity.quarry.core.driver;

import java.util.Locale;
import java.util.Objects;

public record SortSpec(String column, Direction direction) {
  public SortSpec {
    Objects.requireNonNull(column, "column");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction {
    ASC, DESC;

    /** Lenient parse of "asc"/"desc"; anything else is ascending. */
    public static Direction parse(String raw) {
      return raw != null && raw.trim().toLowerCase(Locale.ROOT).equals("desc") ? DESC : ASC;
    }
  }
}
