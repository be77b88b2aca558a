/**
 * Configuration aggregates and composition root wiring for the keyscan CLI.
 * <p><strong>Role:</strong> Application bootstrap layer merging defaults, YAML and CLI values and selecting the
 * matcher, reporter and metrics adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Paths are normalized through {@code ca.gc.cra.keyscan.validation} utilities.</p>
 */
package ca.gc.cra.keyscan.config;
