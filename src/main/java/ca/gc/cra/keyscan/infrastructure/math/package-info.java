/**
 * Arbitrary-precision arithmetic adapters for {@link ca.gc.cra.keyscan.application.port.PrimalityPort}.
 */
package ca.gc.cra.keyscan.infrastructure.math;
