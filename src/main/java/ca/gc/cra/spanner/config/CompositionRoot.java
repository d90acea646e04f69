package ca.gc.cra.spanner.config;

import ca.gc.cra.spanner.application.capture.EventFactory;
import ca.gc.cra.spanner.application.capture.SpanTracker;
import ca.gc.cra.spanner.application.port.ClockPort;
import ca.gc.cra.spanner.application.port.MetricsPort;
import ca.gc.cra.spanner.application.registry.EventRegistry;
import ca.gc.cra.spanner.application.snapshot.SnapshotService;
import ca.gc.cra.spanner.application.store.EventManager;
import ca.gc.cra.spanner.infrastructure.logback.SpannerAppender;
import ca.gc.cra.spanner.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.spanner.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.spanner.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.spanner.infrastructure.snapshot.FileSnapshotStorage;
import ca.gc.cra.spanner.infrastructure.snapshot.JsonSnapshotCodec;
import ca.gc.cra.spanner.logging.LoggingConfigurator;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires spanner's use cases to concrete adapters from a {@link SpannerConfig}.
 * <p><strong>Graph:</strong> config &rarr; metrics &rarr; registry (initialized with the configured capacity)
 * &rarr; span tracker and event factory &rarr; snapshot service &rarr; Logback appender.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} attaches the appender when log capture is enabled;
 * {@link #close()} detaches it, closes the store's bus and shuts metrics down.</p>
 * <p><strong>Thread-safety:</strong> Build and start on one thread; the wired components are themselves
 * thread-safe.</p>
 *
 * @since Spanner 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final SpannerConfig config;
  private final MetricsPort metrics;
  private final EventRegistry registry;
  private final SpanTracker spans;
  private final EventFactory events;
  private final SnapshotService snapshots;
  private final SpannerAppender appender;
  private boolean started;

  public CompositionRoot(SpannerConfig config) {
    this(config, ClockPort.SYSTEM);
  }

  /**
   * @param config effective configuration
   * @param clock clock shared by span tracking, event capture and snapshot metadata
   */
  public CompositionRoot(SpannerConfig config, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = createMetrics(config.metrics());
    this.registry = new EventRegistry(metrics);
    registry.initialize(config.maxEvents());
    this.spans = new SpanTracker(clock);
    this.events = new EventFactory(clock, spans);
    this.snapshots = new SnapshotService(
        new JsonSnapshotCodec(), new FileSnapshotStorage(), clock, metrics, config.snapshotDescription());
    this.appender = new SpannerAppender(registry, events);
    appender.setIncludeCallerData(config.includeCallerData());
  }

  private static MetricsPort createMetrics(MetricsSettings settings) {
    if (settings.exporter() == MetricsSettings.Exporter.NONE) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(settings);
  }

  /**
   * Attaches log capture when {@link SpannerConfig#captureLogging()} is set. Idempotent.
   *
   * @return this root
   */
  public CompositionRoot start() {
    if (started) {
      return this;
    }
    started = true;
    if (config.captureLogging() && LoggingConfigurator.attachToRoot(appender)) {
      log.info("Capturing log output into a store of {} events", config.maxEvents());
    }
    return this;
  }

  public SpannerConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public EventRegistry registry() {
    return registry;
  }

  /**
   * @return the store installed at construction
   */
  public EventManager manager() {
    return registry.manager().orElseThrow();
  }

  public SpanTracker spans() {
    return spans;
  }

  public EventFactory events() {
    return events;
  }

  public SnapshotService snapshots() {
    return snapshots;
  }

  public SpannerAppender appender() {
    return appender;
  }

  @Override
  public void close() {
    if (started && config.captureLogging()) {
      LoggingConfigurator.detachFromRoot(appender);
    }
    registry.manager().ifPresent(EventManager::close);
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}
