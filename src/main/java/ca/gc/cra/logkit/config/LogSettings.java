package ca.gc.cra.logkit.config;

import java.util.Objects;

/**
 * Directory, prefix and options loaded together from a configuration file.
 *
 * @param directory log directory; empty selects {@link LogDefaults#DIRECTORY}
 * @param prefix file prefix; empty for none
 * @param options logger options
 * @since 0.1.0
 */
public record LogSettings(String directory, String prefix, LogOptions options) {

  public LogSettings {
    directory = directory == null ? "" : directory;
    prefix = prefix == null ? "" : prefix;
    Objects.requireNonNull(options, "options");
  }
}
