/**
 * Size- and age-based rotation of destination files with numbered backups ({@code <name>.log.1} is the newest).
 * <p><strong>Concurrency:</strong> Each {@link ca.gc.cra.logvault.infrastructure.rotation.RotatingFileWriter}
 * serializes writes, rotations and archive publication on its own monitor.</p>
 */
package ca.gc.cra.logvault.infrastructure.rotation;
