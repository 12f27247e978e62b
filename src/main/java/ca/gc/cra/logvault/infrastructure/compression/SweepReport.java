package ca.gc.cra.logvault.infrastructure.compression;

/**
 * Outcome of one compression sweep.
 *
 * @param compressed files replaced by a verified archive
 * @param deferred files skipped because they were too young or renamed during compression
 * @param failed files whose archive step failed; they are retried on the next sweep
 * @param bytesSaved original bytes minus archive bytes for the compressed files
 * @since 0.1.0
 */
public record SweepReport(int compressed, int deferred, int failed, long bytesSaved) {
  static final SweepReport EMPTY = new SweepReport(0, 0, 0, 0L);
}
