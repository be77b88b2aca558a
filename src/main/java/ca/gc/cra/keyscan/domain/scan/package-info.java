/**
 * <strong>Purpose:</strong> Immutable value types describing dumps, windows, prime pairs and matches.
 * <p><strong>Pipeline role:</strong> Shared vocabulary between the window scanner, the composite index and the
 * matcher strategies.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across scan workers.
 * <p><strong>Security:</strong> {@link ca.gc.cra.keyscan.domain.scan.MatchResult} and
 * {@link ca.gc.cra.keyscan.domain.scan.CompositeCandidate} carry private key material; log them through
 * {@code ca.gc.cra.keyscan.logging.Logs} only.
 *
 * @since 0.1.0
 */
package ca.gc.cra.keyscan.domain.scan;
