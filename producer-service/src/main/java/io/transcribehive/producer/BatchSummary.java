package io.transcribehive.producer;

/**
 * Result of one producer run.
 *
 * @param enqueued work items confirmed by the broker
 * @param failed objects skipped because no reference could be created for them
 * @param skippedDuplicates keys listed more than once in this run
 * @param aborted whether the run stopped before the listing was exhausted
 * @param abortReason why the run stopped, {@code null} for complete runs
 */
public record BatchSummary(int enqueued, int failed, int skippedDuplicates, boolean aborted, String abortReason) {

  static BatchSummary completed(int enqueued, int failed, int skippedDuplicates) {
    return new BatchSummary(enqueued, failed, skippedDuplicates, false, null);
  }

  static BatchSummary aborted(int enqueued, int failed, int skippedDuplicates, String reason) {
    return new BatchSummary(enqueued, failed, skippedDuplicates, true, reason);
  }

  public int exitCode() {
    return aborted ? 1 : 0;
  }
}
