package replacer.report;

import replacer.model.BatchStatus;
import replacer.model.ChangeEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Result of a replacement run, persisted as JSON for resumable reruns.
 *
 * @param runId the run id
 * @param oldField qualified name of the replaced field
 * @param newField qualified name of the replacement
 * @param dryRun whether the run was a preview
 * @param batchSize batch size used for partitioning
 * @param startedAt run start
 * @param finishedAt run end
 * @param batches every batch of the run, attempted or not
 * @param entries per-report outcomes
 * @param counters aggregate counts
 * @param runError run-level failure (auth, missing field), or null
 * @param cancelled true if cancellation stopped the run between batches
 */
public record RunSummary(
        String runId,
        String oldField,
        String newField,
        boolean dryRun,
        int batchSize,
        Instant startedAt,
        Instant finishedAt,
        List<BatchSummary> batches,
        List<ChangeEntry> entries,
        Counters counters,
        String runError,
        boolean cancelled
) {
    /**
     * Aggregate counts of a run.
     *
     * @param scanned reports whose definition was examined
     * @param matched reports containing at least one reference
     * @param replaced reports whose replacement was deployed and confirmed
     * @param skipped reports left out as malformed
     * @param failed reports in failed batches
     */
    public record Counters(int scanned, int matched, int replaced, int skipped, int failed) {
        public static final Counters ZERO = new Counters(0, 0, 0, 0, 0);
    }

    public RunSummary {
        batches = batches == null ? List.of() : List.copyOf(batches);
        entries = entries == null ? List.of() : List.copyOf(entries);
        if (counters == null) counters = Counters.ZERO;
    }

    /**
     * True when no batch failed and the run neither errored nor was cancelled.
     */
    public boolean succeeded() {
        return runError == null && !cancelled && countBatches(BatchStatus.FAILED) == 0;
    }

    public List<BatchSummary> batchesIn(BatchStatus status) {
        return batches.stream().filter(b -> b.status() == status).toList();
    }

    public long countBatches(BatchStatus status) {
        return batches.stream().filter(b -> b.status() == status).count();
    }

    public Optional<BatchSummary> batch(int batchId) {
        return batches.stream().filter(b -> b.batchId() == batchId).findFirst();
    }

    public Optional<ChangeEntry> entry(String reportId) {
        return entries.stream().filter(e -> e.reportId().equals(reportId)).findFirst();
    }
}
