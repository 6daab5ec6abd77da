package ca.gc.cra.logkit.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String validation used when deriving log file names.
 * <p><strong>Why:</strong> A prefix becomes part of a file name; separators or control characters would write the
 * log somewhere other than the configured directory.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates text that is embedded in a file name. Empty input is allowed and returned unchanged.
   *
   * <p><strong>Concurrency:</strong> Safe for concurrent use.</p>
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate segment; {@code null} is treated as empty
   * @return the segment, or {@code ""} for {@code null}
   * @throws IllegalArgumentException if the segment contains a path separator, control characters, or is
   *         {@code .}/{@code ..}
   */
  public static String requireFileNameSegment(String name, String value) {
    if (value == null || value.isEmpty()) {
      return "";
    }
    if (containsControl(value)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    if (value.indexOf('/') >= 0 || value.indexOf('\\') >= 0) {
      throw new IllegalArgumentException(message(name, "must not contain path separators"));
    }
    if (value.equals(".") || value.equals("..")) {
      throw new IllegalArgumentException(message(name, "must not be a relative path segment"));
    }
    return value;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
