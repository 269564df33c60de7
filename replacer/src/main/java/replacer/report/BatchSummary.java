package replacer.report;

import replacer.model.BatchJob;
import replacer.model.BatchStatus;

import java.util.List;

/**
 * Final state of one batch, as kept in the run summary.
 *
 * @param batchId 1-based batch number
 * @param status the state the batch ended in; PENDING if it was never attempted
 * @param reportIds the batch's reports in order
 * @param failureMessage why the batch failed, or null
 * @param deployId the remote deploy id, or null if nothing was deployed
 */
public record BatchSummary(int batchId, BatchStatus status, List<String> reportIds, String failureMessage, String deployId) {

    public BatchSummary {
        reportIds = reportIds == null ? List.of() : List.copyOf(reportIds);
    }

    public static BatchSummary of(BatchJob job) {
        return new BatchSummary(job.batchId(), job.status(), job.reportIds(), job.failureMessage(), job.deployId());
    }
}
