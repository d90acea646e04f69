package ca.gc.cra.spanner.infrastructure.metrics;

import ca.gc.cra.spanner.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Metrics adapter forwarding store, bus and snapshot counters to OpenTelemetry.
 * <p><strong>Naming:</strong> each key becomes one instrument; keys are lower-cased and characters outside
 * {@code [a-z0-9_.-]} replaced, with the raw key kept under the {@code spanner.metric.key} attribute.</p>
 * <p><strong>Thread-safety:</strong> Instruments are cached in concurrent maps; safe from every emitting
 * thread.</p>
 *
 * @since Spanner 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("spanner.metric.key");
  private static final String FALLBACK_METRIC_NAME = "spanner.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter exporting as {@code settings} describe; falls back to a noop meter when the exporter
   * is disabled or cannot be built.
   *
   * @param settings exporter settings
   */
  public OpenTelemetryMetricsAdapter(MetricsSettings settings) {
    this(OpenTelemetryBootstrap.initialize(settings));
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    CounterInstrument instrument =
        counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    HistogramInstrument instrument =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  /**
   * Pushes pending measurements to the exporter, waiting up to five seconds.
   */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private CounterInstrument createCounter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("Spanner counter for " + key)
        .build();
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("Spanner observation for " + key)
        .build();
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
