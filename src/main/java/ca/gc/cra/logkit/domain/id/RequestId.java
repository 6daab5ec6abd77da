package ca.gc.cra.logkit.domain.id;

import java.util.Objects;

/**
 * Parsed view of a request identifier.
 *
 * @param host hostname part; may itself contain dots or hyphens
 * @param random ten-character random segment
 * @param sequence process-local sequence number
 * @since 0.1.0
 */
public record RequestId(String host, String random, long sequence) {

  public RequestId {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(random, "random");
    if (sequence < 1) {
      throw new IllegalArgumentException("sequence must be positive (was " + sequence + ")");
    }
  }

  /**
   * Parses the text produced by {@link RequestIdGenerator#next()}.
   *
   * @param text identifier text
   * @return parsed identifier
   * @throws IllegalArgumentException if the text does not have the {@code <host>.<random>-<sequence>} shape
   */
  public static RequestId parse(String text) {
    Objects.requireNonNull(text, "text");
    int dash = text.lastIndexOf('-');
    if (dash < 0 || dash == text.length() - 1) {
      throw new IllegalArgumentException("request id must end with -<sequence>: " + text);
    }
    String digits = text.substring(dash + 1);
    for (int i = 0; i < digits.length(); i++) {
      if (!Character.isDigit(digits.charAt(i))) {
        throw new IllegalArgumentException("request id sequence must be numeric: " + text);
      }
    }
    int dot = dash - RequestIdGenerator.RANDOM_LENGTH - 1;
    if (dot < 1 || text.charAt(dot) != '.') {
      throw new IllegalArgumentException("request id must have <host>.<random> before the sequence: " + text);
    }
    String random = text.substring(dot + 1, dash);
    for (int i = 0; i < random.length(); i++) {
      char c = random.charAt(i);
      if (!((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))) {
        throw new IllegalArgumentException("request id random segment must be alphanumeric: " + text);
      }
    }
    long sequence;
    try {
      sequence = Long.parseLong(digits);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("request id sequence out of range: " + text, ex);
    }
    return new RequestId(text.substring(0, dot), random, sequence);
  }

  @Override
  public String toString() {
    return host + '.' + random + '-' + RequestIdGenerator.padSequence(sequence);
  }
}
