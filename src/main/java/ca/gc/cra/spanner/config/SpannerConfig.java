package ca.gc.cra.spanner.config;

import ca.gc.cra.spanner.application.store.EventManager;
import ca.gc.cra.spanner.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.spanner.validation.Numbers;
import ca.gc.cra.spanner.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * <strong>What:</strong> Effective spanner settings.
 * <p><strong>Sources:</strong> built-in defaults, overlaid by YAML ({@code common} plus one profile section),
 * overlaid by {@code spanner.*} system properties. Keys:</p>
 * <ul>
 *   <li>{@code maxEvents}: store capacity, default {@value EventManager#DEFAULT_MAX_EVENTS}</li>
 *   <li>{@code capture.logging}: attach the Logback appender to the root logger, default {@code true}</li>
 *   <li>{@code capture.callerData}: record caller file/line on captured log events, default {@code false}</li>
 *   <li>{@code snapshot.description}: description written into exported snapshots, default none</li>
 *   <li>{@code metrics.exporter}: {@code otlp} or {@code none}, default {@code none}</li>
 *   <li>{@code metrics.endpoint}: OTLP gRPC endpoint</li>
 *   <li>{@code metrics.intervalSeconds}: export interval, default 30</li>
 * </ul>
 *
 * @param maxEvents store capacity
 * @param captureLogging whether log output is captured
 * @param includeCallerData whether caller data becomes the source location
 * @param snapshotDescription default snapshot description; {@code null} for none
 * @param metrics metrics exporter settings
 * @since Spanner 0.1.0
 */
public record SpannerConfig(
    int maxEvents,
    boolean captureLogging,
    boolean includeCallerData,
    String snapshotDescription,
    MetricsSettings metrics) {

  static final String SYSTEM_PROPERTY_PREFIX = "spanner.";
  private static final int MAX_INTERVAL_SECONDS = 86_400;

  public SpannerConfig {
    Numbers.requireRange("maxEvents", maxEvents, 1, Integer.MAX_VALUE);
    snapshotDescription = Strings.blankToNull(snapshotDescription);
    Objects.requireNonNull(metrics, "metrics");
  }

  public static SpannerConfig defaults() {
    return new SpannerConfig(EventManager.DEFAULT_MAX_EVENTS, true, false, null, MetricsSettings.disabled());
  }

  public Optional<String> description() {
    return Optional.ofNullable(snapshotDescription);
  }

  /**
   * Loads {@code path} for {@code profile} and applies {@code spanner.*} system property overrides.
   *
   * @param path YAML file; a missing file leaves the defaults in place
   * @param profile YAML profile section
   * @return effective configuration
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when a value is invalid
   */
  public static SpannerConfig load(Path path, String profile) throws IOException {
    return resolve(YamlConfigLoader.load(path, profile), System.getProperties());
  }

  /**
   * Merges YAML settings and system properties over the defaults.
   *
   * @param yaml flattened YAML settings, if any
   * @param properties system properties; only {@code spanner.*} keys are read
   * @return effective configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static SpannerConfig resolve(Optional<Map<String, String>> yaml, Properties properties) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> merged = new LinkedHashMap<>(yaml.orElse(Map.of()));
    if (properties != null) {
      for (String name : properties.stringPropertyNames()) {
        if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
          merged.put(name.substring(SYSTEM_PROPERTY_PREFIX.length()), properties.getProperty(name));
        }
      }
    }
    return fromMap(merged);
  }

  /**
   * Builds configuration from flattened key/value pairs; absent or blank keys keep their defaults.
   *
   * @param options flattened settings
   * @return configuration
   * @throws IllegalArgumentException when a value is invalid
   */
  public static SpannerConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SpannerConfig defaults = defaults();
    int maxEvents = Numbers.parseInt(
        "maxEvents", options.get("maxEvents"), defaults.maxEvents(), 1, Integer.MAX_VALUE);
    boolean captureLogging = parseBoolean(options.get("capture.logging"), defaults.captureLogging());
    boolean callerData = parseBoolean(options.get("capture.callerData"), defaults.includeCallerData());
    String description = Strings.blankToNull(options.get("snapshot.description"));

    MetricsSettings.Exporter exporter = MetricsSettings.Exporter.parse(
        Optional.ofNullable(Strings.blankToNull(options.get("metrics.exporter")))
            .orElse(defaults.metrics().exporter().name()));
    String endpoint = Optional.ofNullable(Strings.blankToNull(options.get("metrics.endpoint")))
        .orElse(MetricsSettings.DEFAULT_ENDPOINT);
    int intervalSeconds = Numbers.parseInt(
        "metrics.intervalSeconds",
        options.get("metrics.intervalSeconds"),
        (int) MetricsSettings.DEFAULT_INTERVAL.getSeconds(),
        1,
        MAX_INTERVAL_SECONDS);

    return new SpannerConfig(
        maxEvents,
        captureLogging,
        callerData,
        description,
        new MetricsSettings(exporter, endpoint, Duration.ofSeconds(intervalSeconds)));
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (!trimmed.equalsIgnoreCase("true") && !trimmed.equalsIgnoreCase("false")) {
      throw new IllegalArgumentException("Expected true or false but got '" + value + "'");
    }
    return Boolean.parseBoolean(trimmed);
  }
}
