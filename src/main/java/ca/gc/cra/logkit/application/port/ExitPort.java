package ca.gc.cra.logkit.application.port;

/**
 * Terminates the process after a fatal record has been written and flushed.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ExitPort {
  /** Status used after fatal records. */
  int FATAL_STATUS = 1;

  /**
   * Terminates the process.
   *
   * @param status exit status
   */
  void exit(int status);

  /** Exits the JVM through {@link System#exit(int)}. */
  ExitPort SYSTEM = System::exit;
}
