/**
 * Ports consumed by the LOGVAULT application layer: sinks, formatters, clocks and metrics export.
 * <p><strong>Role:</strong> Seams between the facade/async pipeline and the file, console and telemetry
 * adapters in {@code infrastructure}.</p>
 */
package ca.gc.cra.logvault.application.port;
