/**
 * In-process publish/subscribe bus with callback subscriptions and pull-style streams.
 * <p><strong>Concurrency:</strong> Emission is safe from any thread; handlers run on the emitting thread in
 * subscription order.</p>
 * <p><strong>Metrics:</strong> Publishes {@code <bus>.bus.emitted} and {@code <bus>.bus.handler.failures}.</p>
 */
package ca.gc.cra.spanner.application.bus;
