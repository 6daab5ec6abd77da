package ca.gc.cra.logkit.infrastructure.logback;

import ch.qos.logback.core.status.Status;
import ch.qos.logback.core.status.StatusListener;
import java.io.PrintStream;

/**
 * Prints warnings and errors raised inside a logger's engine (failed writes, unopenable files) on standard error.
 * Informational statuses are ignored.
 */
public final class StderrStatusListener implements StatusListener {
  private static final String PREFIX = "[logkit] ";

  @Override
  public void addStatusEvent(Status status) {
    if (status.getLevel() < Status.WARN) {
      return;
    }
    PrintStream err = System.err;
    err.println(PREFIX + (status.getLevel() == Status.ERROR ? "ERROR " : "WARN ") + status.getMessage());
    Throwable cause = status.getThrowable();
    if (cause != null) {
      cause.printStackTrace(err);
    }
  }
}
