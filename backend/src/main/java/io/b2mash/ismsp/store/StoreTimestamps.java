package io.b2mash.ismsp.store;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Timestamp text format shared with SQLite's {@code strftime('%Y-%m-%d %H:%M:%S','now')}. Values
 * are UTC and sort lexicographically in time order, so the first ten characters are the date.
 */
public final class StoreTimestamps {

  public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  /** SQL expression producing the current time in {@link #FORMAT}. */
  public static final String SQL_NOW = "strftime('%Y-%m-%d %H:%M:%S', 'now')";

  private StoreTimestamps() {}

  public static LocalDateTime now(Clock clock) {
    return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
  }

  public static LocalDate today(Clock clock) {
    return LocalDate.now(clock);
  }

  public static String format(LocalDateTime timestamp) {
    return FORMAT.format(timestamp);
  }

  /**
   * Parses stored timestamps. Rows written by older tools may use an ISO {@code T} separator or
   * carry fractional seconds; both are accepted and fractions dropped.
   */
  public static LocalDateTime parse(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    var normalized = value.trim().replace('T', ' ');
    if (normalized.length() == 10) {
      return LocalDate.parse(normalized).atStartOfDay();
    }
    if (normalized.length() > 19) {
      normalized = normalized.substring(0, 19);
    }
    return LocalDateTime.parse(normalized, FORMAT);
  }
}
