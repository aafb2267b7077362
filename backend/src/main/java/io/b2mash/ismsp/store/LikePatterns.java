package io.b2mash.ismsp.store;

import java.util.Locale;

/**
 * Substring patterns for SQLite {@code LIKE}. Callers append {@link #ESCAPE_CLAUSE} after the
 * pattern so {@code %}, {@code _} and the escape character itself match literally.
 */
public final class LikePatterns {

  public static final String ESCAPE_CLAUSE = " ESCAPE '\\'";

  private LikePatterns() {}

  /** {@code %value%} with wildcards escaped, lower-cased for comparison with {@code lower(..)}. */
  public static String containing(String value) {
    return "%" + escape(value.toLowerCase(Locale.ROOT)) + "%";
  }

  static String escape(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }
}
