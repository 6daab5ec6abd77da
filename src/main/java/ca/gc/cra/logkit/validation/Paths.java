package ca.gc.cra.logkit.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Log directory preparation.
 * <p><strong>Why:</strong> File sinks cannot start without a writable directory, and a missing directory is the
 * most common deployment mistake.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the directory and any missing parents.</li>
 *   <li>Reject paths that exist but are not writable directories.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; concurrent creation of the same directory is tolerated by
 * {@link Files#createDirectories}.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures {@code path} exists as a writable directory, creating it with its parents when absent.
   *
   * @param path candidate directory; must not be {@code null}
   * @return the same path, unchanged, so callers keep relative paths relative
   * @throws IllegalArgumentException if the path contains control characters, cannot be created, or is not a
   *         writable directory
   */
  public static Path ensureWritableDirectory(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }

    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Files.createDirectories(normalized);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + normalized + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is not a directory: " + normalized);
    }
    if (!Files.isWritable(normalized)) {
      throw new IllegalArgumentException("directory is not writable: " + normalized);
    }
    return path;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
