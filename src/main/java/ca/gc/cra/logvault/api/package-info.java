/**
 * Public entry point of LOGVAULT.
 * <p><strong>Role:</strong> {@link ca.gc.cra.logvault.api.LogEngine} wires the pipeline from a
 * {@link ca.gc.cra.logvault.config.LogConfig}; {@link ca.gc.cra.logvault.api.StructuredLogger} is the emit API
 * shared by the engine and every derived view.</p>
 * <p><strong>Concurrency:</strong> Engines and views are safe to share across threads. Views are immutable and
 * cheap to derive per request.</p>
 */
package ca.gc.cra.logvault.api;
