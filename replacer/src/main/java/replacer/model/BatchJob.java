package replacer.model;

import replacer.engine.BatchStateMachine;

import java.util.List;
import java.util.Objects;

/**
 * Unit of orchestration: a contiguous slice of the candidate reports.
 *
 * <p>The report list is fixed at creation. Status changes go through
 * {@link BatchStateMachine}, so an illegal transition fails fast. A batch is owned by the
 * orchestrator thread; it is not shared with rewrite workers.
 */
public final class BatchJob {

    private final int batchId;
    private final List<ReportDescriptor> reports;
    private BatchStatus status = BatchStatus.PENDING;
    private String failureMessage;
    private String deployId;

    public BatchJob(int batchId, List<ReportDescriptor> reports) {
        if (batchId <= 0) throw new IllegalArgumentException("batchId must be positive: " + batchId);
        this.batchId = batchId;
        this.reports = List.copyOf(Objects.requireNonNull(reports, "reports"));
    }

    public int batchId() { return batchId; }

    public List<ReportDescriptor> reports() { return reports; }

    public int size() { return reports.size(); }

    public BatchStatus status() { return status; }

    /** Failure detail when {@link #status()} is FAILED, otherwise null. */
    public String failureMessage() { return failureMessage; }

    /** Remote deploy id once a deploy was started, otherwise null. */
    public String deployId() { return deployId; }

    /** Report ids in batch order. */
    public List<String> reportIds() {
        return reports.stream().map(ReportDescriptor::reportId).toList();
    }

    /**
     * Moves the batch to the next state.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(BatchStatus next) {
        this.status = BatchStateMachine.transition(status, next);
    }

    /**
     * Moves the batch to FAILED and records why.
     */
    public void fail(String message) {
        transitionTo(BatchStatus.FAILED);
        this.failureMessage = message;
    }

    public void recordDeployId(String deployId) {
        this.deployId = deployId;
    }

    @Override
    public String toString() {
        return "BatchJob{id=" + batchId + ", size=" + reports.size() + ", status=" + status + '}';
    }
}
