/**
 * Metrics adapters implementing {@link ca.gc.cra.keyscan.application.port.MetricsPort}.
 * <p><strong>Role:</strong> Bridges scan counters and phase timings to OpenTelemetry.</p>
 * <p><strong>Concurrency:</strong> Adapters accept concurrent updates from scan workers.</p>
 * <p><strong>Security:</strong> Metric names and attributes never carry key material.</p>
 */
package ca.gc.cra.keyscan.infrastructure.metrics;
