/**
 * <strong>Purpose:</strong> Logging helpers: runtime verbosity and key-material redaction.
 * <p><strong>Security:</strong> Full primes and moduli are written only by result reporters, never to logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.keyscan.logging;
