/**
 * Application-level pipeline that turns a memory dump into recovered RSA factor pairs.
 * <p>{@link ca.gc.cra.keyscan.application.pipeline.KeyScanUseCase} chains the window scanner, the prime volume
 * guard, the composite index builder and a matcher strategy. Each run owns a fresh worker pool; workers follow
 * the {@code keyscan-worker-*} naming convention.</p>
 * <p>The pipeline accepts a validated {@code ca.gc.cra.keyscan.config.ScanConfig} and surfaces counters through
 * {@link ca.gc.cra.keyscan.application.port.MetricsPort}. Fatal preconditions surface as
 * {@link ca.gc.cra.keyscan.application.pipeline.ScanAbortedException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.keyscan.application.pipeline;
