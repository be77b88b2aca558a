/**
 * CLI entry points that bootstrap the keyscan pipeline.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and telemetry,
 * and invokes the scan use case.</p>
 * <p><strong>Concurrency:</strong> CLI commands run single-threaded during setup; the pipeline spawns its own
 * workers.</p>
 * <p><strong>Security:</strong> Results on stdout contain private key material; logs only carry fingerprints.</p>
 */
package ca.gc.cra.keyscan.api;
