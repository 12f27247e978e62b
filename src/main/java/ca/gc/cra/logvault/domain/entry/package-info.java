/**
 * Entry model for LOGVAULT: levels, destination tags, closed field values and the immutable {@code LogEntry}.
 * <p><strong>Role:</strong> Domain layer shared by the facade, the async writer and the file adapters; free of
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable and safe to share across producer and consumer threads.</p>
 */
package ca.gc.cra.logvault.domain.entry;
