package ca.gc.cra.logkit.domain.log;

import java.util.Objects;

/**
 * Typed key/value pair attached to a record.
 *
 * @param key field name; never blank
 * @param value field value; may be {@code null}
 * @param cause throwable carried by {@link #error(Throwable)} fields, otherwise {@code null}
 * @since 0.1.0
 */
public record Field(String key, Object value, Throwable cause) {

  /** Key used by {@link #error(Throwable)}. */
  public static final String ERROR_KEY = "error";

  public Field {
    Objects.requireNonNull(key, "key");
    if (key.isBlank()) {
      throw new IllegalArgumentException("field key must not be blank");
    }
  }

  public static Field string(String key, String value) {
    return new Field(key, value, null);
  }

  public static Field number(String key, Number value) {
    return new Field(key, value, null);
  }

  public static Field bool(String key, boolean value) {
    return new Field(key, value, null);
  }

  /**
   * Wraps an arbitrary value; maps, iterables, numbers and booleans keep their shape in JSON output, anything else
   * is rendered with {@link String#valueOf(Object)}.
   */
  public static Field any(String key, Object value) {
    return new Field(key, value, null);
  }

  /**
   * Records an error under {@link #ERROR_KEY}, using its text as the value.
   *
   * @param error error to record; {@code null} yields a {@code null} value
   * @return error field
   */
  public static Field error(Throwable error) {
    return named(ERROR_KEY, error);
  }

  public static Field named(String key, Throwable error) {
    return new Field(key, error == null ? null : errorText(error), error);
  }

  /**
   * Returns the text of an error: its message, or its class name when the message is absent.
   *
   * @param error error; must not be {@code null}
   * @return error text
   */
  public static String errorText(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isEmpty() ? error.getClass().getName() : message;
  }
}
