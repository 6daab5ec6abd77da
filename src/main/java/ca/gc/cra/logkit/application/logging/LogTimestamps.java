package ca.gc.cra.logkit.application.logging;

import ca.gc.cra.logkit.config.LogDefaults;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Renders file dates and record timestamps in an explicit zone, never the JVM default.
 *
 * @since 0.1.0
 */
public final class LogTimestamps {
  private static final DateTimeFormatter RECORD_TIME = DateTimeFormatter.ofPattern(LogDefaults.RECORD_TIME_PATTERN);
  private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern(LogDefaults.FILE_DATE_PATTERN);

  private LogTimestamps() {
    // Utility
  }

  /**
   * Resolves a zone id.
   *
   * @param zoneId zone id such as {@code Asia/Jakarta}
   * @return resolved zone
   * @throws IllegalArgumentException if the id is blank or unknown
   */
  public static ZoneId resolveZone(String zoneId) {
    if (zoneId == null || zoneId.isBlank()) {
      throw new IllegalArgumentException("zone must not be blank");
    }
    try {
      return ZoneId.of(zoneId.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("unknown time zone: " + zoneId, ex);
    }
  }

  /**
   * Formats a record timestamp as {@code yyyy/MM/dd HH:mm:ss} in {@code zone}.
   *
   * @param epochMillis record instant
   * @param zone rendering zone
   * @return formatted timestamp
   */
  public static String formatRecordTime(long epochMillis, ZoneId zone) {
    Objects.requireNonNull(zone, "zone");
    return RECORD_TIME.format(Instant.ofEpochMilli(epochMillis).atZone(zone));
  }

  /**
   * Formats the calendar day naming the log file, as {@code yyyy-MM-dd} in {@code zone}.
   *
   * @param epochMillis instant whose local day is wanted
   * @param zone rendering zone
   * @return formatted date
   */
  public static String formatFileDate(long epochMillis, ZoneId zone) {
    Objects.requireNonNull(zone, "zone");
    return FILE_DATE.format(LocalDate.ofInstant(Instant.ofEpochMilli(epochMillis), zone));
  }
}
