package ca.gc.cra.logkit.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads {@link LogSettings} from a YAML document, merging the {@code common} section with a named profile.
 *
 * <pre>
 * common:
 *   directory: log
 *   zone: Asia/Jakarta
 * production:
 *   prefix: billing
 *   withTrace: true
 *   outputs: [stdout]
 * </pre>
 *
 * <p>Profile values override {@code common}. {@code outputs} accepts a sequence or a comma-separated string.</p>
 */
public final class LogOptionsLoader {
  static final String KEY_DIRECTORY = "directory";
  static final String KEY_PREFIX = "prefix";
  static final String KEY_DEVELOPMENT = "development";
  static final String KEY_WITH_TRACE = "withTrace";
  static final String KEY_REF_ID = "refId";
  static final String KEY_OUTPUTS = "outputs";
  static final String KEY_ZONE = "zone";

  private static final Set<String> KNOWN_KEYS = Set.of(
      KEY_DIRECTORY, KEY_PREFIX, KEY_DEVELOPMENT, KEY_WITH_TRACE, KEY_REF_ID, KEY_OUTPUTS, KEY_ZONE);

  private LogOptionsLoader() {}

  /**
   * Loads settings from {@code path} for the given profile.
   *
   * @param path location of the YAML document
   * @param profile section merged over {@code common} (for example {@code development} or {@code production})
   * @return settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure or a value is invalid
   */
  public static Optional<LogSettings> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedProfile = profile.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(new LogSettings("", "", LogOptions.defaults()));
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, Object> merged = new LinkedHashMap<>();
      Object commonSection = findSection(root, "common");
      if (commonSection != null) {
        merged.putAll(asMap(commonSection, "common"));
      }
      Object profileSection = findSection(root, normalizedProfile);
      if (profileSection != null) {
        merged.putAll(asMap(profileSection, normalizedProfile));
      }
      return Optional.of(toSettings(merged));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML logging config at " + path, ex);
    }
  }

  static LogSettings toSettings(Map<String, Object> values) {
    for (String key : values.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        throw new IllegalArgumentException("unknown logging option: " + key);
      }
    }
    LogOptions options = LogOptions.builder()
        .development(parseBoolean(KEY_DEVELOPMENT, values.get(KEY_DEVELOPMENT)))
        .withTrace(parseBoolean(KEY_WITH_TRACE, values.get(KEY_WITH_TRACE)))
        .refId(text(values.get(KEY_REF_ID)))
        .outputs(parseOutputs(values.get(KEY_OUTPUTS)))
        .zone(text(values.get(KEY_ZONE)))
        .build();
    return new LogSettings(text(values.get(KEY_DIRECTORY)), text(values.get(KEY_PREFIX)), options);
  }

  private static boolean parseBoolean(String key, Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean flag) {
      return flag;
    }
    String raw = value.toString().trim().toLowerCase(Locale.ROOT);
    return switch (raw) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off", "" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
    };
  }

  private static List<String> parseOutputs(Object value) {
    List<String> outputs = new ArrayList<>();
    if (value == null) {
      return outputs;
    }
    if (value instanceof Iterable<?> items) {
      for (Object item : items) {
        if (item == null || item instanceof Map<?, ?> || item instanceof Iterable<?>) {
          throw new IllegalArgumentException(KEY_OUTPUTS + " entries must be plain strings");
        }
        addOutput(outputs, item.toString());
      }
      return outputs;
    }
    if (value instanceof Map<?, ?>) {
      throw new IllegalArgumentException(KEY_OUTPUTS + " must be a sequence or a comma-separated string");
    }
    for (String part : value.toString().split(",")) {
      addOutput(outputs, part);
    }
    return outputs;
  }

  private static void addOutput(List<String> outputs, String raw) {
    String trimmed = raw.trim();
    if (!trimmed.isEmpty()) {
      outputs.add(trimmed);
    }
  }

  private static String text(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
      throw new IllegalArgumentException("expected a scalar value but found " + value);
    }
    return value.toString();
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey() != null
          && entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }
}
