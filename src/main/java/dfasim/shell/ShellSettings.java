package dfasim.shell;

import dfasim.Automaton;
import dfasim.validate.SecurityScanner;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Settings shared by the interactive shells.
 *
 * <p>Defaults come from {@code dfasim.properties} on the classpath. Any key can
 * be overridden with a system property of the same name.
 *
 * @param storeDirectory directory against which file names are resolved
 * @param trapState name of the state substituted for undefined targets
 * @param maxPathLength longest URL path not reported as excessive
 * @param maxQueryLength longest URL query not reported as excessive
 */
public record ShellSettings(
  Path storeDirectory,
  String trapState,
  int maxPathLength,
  int maxQueryLength
) {

  static final String RESOURCE = "dfasim.properties";

  static final String STORE_DIR = "dfasim.store.dir";
  static final String TRAP_STATE = "dfasim.trap.state";
  static final String MAX_PATH_LENGTH = "dfasim.url.max-path-length";
  static final String MAX_QUERY_LENGTH = "dfasim.url.max-query-length";

  /**
   * Settings used when nothing is configured.
   */
  public static ShellSettings defaults() {
    return new ShellSettings(
      Path.of("."),
      Automaton.DEFAULT_TRAP_STATE,
      SecurityScanner.DEFAULT_MAX_PATH_LENGTH,
      SecurityScanner.DEFAULT_MAX_QUERY_LENGTH
    );
  }

  /**
   * Load the classpath defaults, then apply system property overrides.
   *
   * @return settings
   */
  public static ShellSettings load() {
    final var properties = new Properties();
    try (InputStream in = ShellSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in != null) {
        properties.load(in);
      }
    } catch (IOException error) {
      throw new UncheckedIOException("Could not read " + RESOURCE, error);
    }
    for (String key : System.getProperties().stringPropertyNames()) {
      if (key.startsWith("dfasim.")) {
        properties.setProperty(key, System.getProperty(key));
      }
    }
    return from(properties);
  }

  /**
   * Read settings out of properties, falling back to {@link #defaults()}.
   *
   * @param properties configured values
   * @return settings
   * @throws IllegalArgumentException if a length is not a non-negative integer
   */
  public static ShellSettings from(Properties properties) {
    final ShellSettings defaults = defaults();
    return new ShellSettings(
      Path.of(properties.getProperty(STORE_DIR, defaults.storeDirectory().toString())),
      properties.getProperty(TRAP_STATE, defaults.trapState()),
      length(properties, MAX_PATH_LENGTH, defaults.maxPathLength()),
      length(properties, MAX_QUERY_LENGTH, defaults.maxQueryLength())
    );
  }

  /**
   * Scanner honouring the configured length limits.
   */
  public SecurityScanner securityScanner() {
    return new SecurityScanner(maxPathLength, maxQueryLength);
  }

  private static int length(Properties properties, String key, int fallback) {
    final String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      final int parsed = Integer.parseInt(value.trim());
      if (parsed < 0) {
        throw new IllegalArgumentException(key + " must not be negative, got " + parsed);
      }
      return parsed;
    } catch (NumberFormatException error) {
      throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", error);
    }
  }
}
