/**
 * {@link ca.gc.cra.keyscan.application.port.DumpReader} adapters.
 * <p><strong>Security:</strong> Dumps may hold live key material; readers never log their contents.</p>
 */
package ca.gc.cra.keyscan.infrastructure.dump;
