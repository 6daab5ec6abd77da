package ca.gc.cra.logkit.application.logging;

import ca.gc.cra.logkit.config.LogDefaults;
import ca.gc.cra.logkit.validation.Strings;
import java.nio.file.Path;
import java.time.ZoneId;

/**
 * Derives the log directory and the dated file name {@code [<prefix>-]<yyyy-MM-dd>.log}.
 *
 * @since 0.1.0
 */
public final class LogFileNames {
  private LogFileNames() {
    // Utility
  }

  /**
   * Resolves the directory, substituting {@link LogDefaults#DIRECTORY} for an empty value.
   *
   * @param directory configured directory; {@code null} or blank selects the default
   * @return directory path, relative when the input is relative
   */
  public static Path resolveDirectory(String directory) {
    if (directory == null || directory.isBlank()) {
      return Path.of(LogDefaults.DIRECTORY);
    }
    return Path.of(directory);
  }

  /**
   * Builds the file name for the calendar day of {@code epochMillis} in {@code zone}.
   *
   * @param prefix optional prefix; empty for none
   * @param epochMillis current instant
   * @param zone zone deciding the calendar day
   * @return file name such as {@code svc-2024-03-05.log}
   * @throws IllegalArgumentException if the prefix contains path separators or control characters
   */
  public static String fileName(String prefix, long epochMillis, ZoneId zone) {
    String safePrefix = Strings.requireFileNameSegment("prefix", prefix);
    String name = LogTimestamps.formatFileDate(epochMillis, zone) + '.' + LogDefaults.FILE_EXTENSION;
    return safePrefix.isEmpty() ? name : safePrefix + '-' + name;
  }

  /**
   * Joins the directory and the dated file name.
   *
   * @param directory resolved directory
   * @param prefix optional prefix
   * @param epochMillis current instant
   * @param zone zone deciding the calendar day
   * @return primary output path
   */
  public static Path outputFile(Path directory, String prefix, long epochMillis, ZoneId zone) {
    return directory.resolve(fileName(prefix, epochMillis, zone));
  }
}
