/**
 * {@link ca.gc.cra.keyscan.application.port.ScanObserver} adapters that surface scan progress through logging and
 * metrics.
 */
package ca.gc.cra.keyscan.infrastructure.events;
