/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Pipeline role:</strong> Rejects invalid options before a dump is loaded or a worker pool is created.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}
 * or {@link java.io.IOException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.keyscan.validation;
