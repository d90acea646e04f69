package ca.gc.cra.spanner.infrastructure.metrics;

import ca.gc.cra.spanner.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Selected when the configured exporter is {@code none}.
 *
 * @since Spanner 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
