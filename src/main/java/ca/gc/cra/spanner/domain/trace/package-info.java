/**
 * Trace data model: levels, spans, event payloads, captured events and the query predicate.
 * <p><strong>Role:</strong> Domain layer; no framework dependencies.</p>
 * <p><strong>Concurrency:</strong> {@code Event} and frozen {@code SpanInfo} snapshots are immutable and safe to
 * share; active spans are confined to the thread that entered them.</p>
 */
package ca.gc.cra.spanner.domain.trace;
