/**
 * Configuration loading and composition root wiring.
 * <p><strong>Concurrency:</strong> Configuration records are immutable; safe to share.</p>
 */
package ca.gc.cra.spanner.config;
