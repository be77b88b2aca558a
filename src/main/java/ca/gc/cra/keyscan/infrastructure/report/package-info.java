/**
 * {@link ca.gc.cra.keyscan.application.port.ResultReporter} adapters for text and JSON output.
 * <p><strong>Security:</strong> These are the only components that write full primes and moduli.</p>
 */
package ca.gc.cra.keyscan.infrastructure.report;
