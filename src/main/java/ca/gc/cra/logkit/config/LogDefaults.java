package ca.gc.cra.logkit.config;

/**
 * Defaults applied when options leave a value unset.
 *
 * @since 0.1.0
 */
public final class LogDefaults {
  /** Directory used when the caller passes an empty directory. */
  public static final String DIRECTORY = "log";
  /** Zone used for file dates and record timestamps. */
  public static final String ZONE = "Asia/Jakarta";
  /** Extension of dated log files. */
  public static final String FILE_EXTENSION = "log";
  /** Pattern naming the dated log file. */
  public static final String FILE_DATE_PATTERN = "yyyy-MM-dd";
  /** Pattern rendering record timestamps. */
  public static final String RECORD_TIME_PATTERN = "yyyy/MM/dd HH:mm:ss";

  private LogDefaults() {
    // Constants
  }
}
