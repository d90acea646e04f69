package ca.gc.cra.spanner.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Exporter settings for {@link OpenTelemetryMetricsAdapter}.
 *
 * @param exporter exporter kind
 * @param endpoint OTLP gRPC endpoint; ignored for {@link Exporter#NONE}
 * @param interval export interval; must be positive
 * @since Spanner 0.1.0
 */
public record MetricsSettings(Exporter exporter, String endpoint, Duration interval) {
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  public MetricsSettings {
    Objects.requireNonNull(exporter, "exporter");
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
  }

  /**
   * Settings with exporting disabled.
   *
   * @return disabled settings
   */
  public static MetricsSettings disabled() {
    return new MetricsSettings(Exporter.NONE, DEFAULT_ENDPOINT, DEFAULT_INTERVAL);
  }

  /** Supported exporters. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses an exporter name case-insensitively.
     *
     * @param raw {@code otlp} or {@code none}
     * @return exporter
     * @throws IllegalArgumentException for any other value
     */
    public static Exporter parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none", "" -> NONE;
        default -> throw new IllegalArgumentException("Unknown metrics exporter: " + raw);
      };
    }
  }
}
