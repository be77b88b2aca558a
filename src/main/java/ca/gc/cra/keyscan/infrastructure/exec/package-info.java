/**
 * Executor factories for scan worker pools.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the fork-join pools used by the window scanner,
 * the composite index builder and the matchers.</p>
 * <p><strong>Concurrency:</strong> Provides thread-safe factory methods that return managed pools.</p>
 * <p><strong>Security:</strong> Thread names never include key material.</p>
 */
package ca.gc.cra.keyscan.infrastructure.exec;
