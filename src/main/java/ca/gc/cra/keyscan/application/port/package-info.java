/**
 * <strong>Purpose:</strong> Ports the scan pipeline depends on: big-integer arithmetic, composite matching, progress
 * reporting, metrics, dump loading and result output.
 * <p><strong>Pipeline role:</strong> Implemented by adapters in {@code ca.gc.cra.keyscan.infrastructure} and wired by
 * {@code ca.gc.cra.keyscan.config.CompositionRoot}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.keyscan.application.port;
