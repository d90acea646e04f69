/**
 * Metrics adapters that bridge spanner's {@code MetricsPort} to OpenTelemetry or a no-op implementation.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and cache instruments per key.</p>
 * <p><strong>Metrics:</strong> Publishes under {@code store.*}, {@code events.bus.*}, {@code snapshot.*} and
 * {@code registry.*}.</p>
 */
package ca.gc.cra.spanner.infrastructure.metrics;
