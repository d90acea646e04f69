package ca.gc.cra.spanner.application.port;

/**
 * <strong>What:</strong> Port abstracting Spanner metrics emission.
 * <p><strong>Why:</strong> Lets the bus, store and snapshot service count deliveries, evictions and exports
 * without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Outbound port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from every emitting
 * thread.</p>
 * <p><strong>Performance:</strong> Calls sit on the emit hot path; they must be non-blocking and amortized O(1).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since Spanner 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code store.evicted}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
