/**
 * Composite matcher strategies.
 * <p><strong>Role:</strong> Implementations of {@link ca.gc.cra.keyscan.application.port.CompositeMatcher} that
 * search a dump for composite encodings: a direct windowed lookup, an Aho-Corasick automaton and a Rabin
 * rolling-hash separator scan. All three return identical result sets for the same index.</p>
 * <p><strong>Concurrency:</strong> Each call partitions the dump and scans partitions on a dedicated fork-join pool;
 * partitions overlap by the longest key length minus one.</p>
 * <p><strong>Security:</strong> Matched key material is only logged through fingerprints.</p>
 */
package ca.gc.cra.keyscan.infrastructure.match;
