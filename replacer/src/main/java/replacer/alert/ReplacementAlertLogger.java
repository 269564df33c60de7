package replacer.alert;

import replacer.config.AlertLevel;
import replacer.metrics.RunMetrics;
import replacer.model.BatchStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for replacement events.
 *
 * <p>Entries start with an event marker (RUN_STARTED, BATCH_CONFIRMED, BATCH_FAILED, ...)
 * followed by key=value pairs, so log aggregators can parse and alert on them.
 *
 * <h2>Log Levels:</h2>
 * <ul>
 *   <li>INFO: run started, batch started, batch state changes, batch confirmed, run completed</li>
 *   <li>WARN: transient failure retried, run cancelled</li>
 *   <li>ERROR: batch failed, run failed</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  replacement - RUN_STARTED run=20251019T120000Z old=Account.OldField__c new=Account.NewField__c dry_run=false
 * 12:00:00.100 INFO  replacement - BATCH_STARTED run=20251019T120000Z batch=1 reports=100
 * 12:00:04.200 WARN  replacement - BATCH_RETRY run=20251019T120000Z batch=1 operation=retrieve attempt=1 delay_ms=1000 error="REQUEST_LIMIT_EXCEEDED"
 * 12:00:09.900 INFO  replacement - BATCH_CONFIRMED run=20251019T120000Z batch=1 deploy=0Af000000000001 replaced=37
 * </pre>
 *
 * <p>An instance is bound to one alert level; the orchestrator creates one per run from its
 * configuration.
 */
public final class ReplacementAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("replacement");

    private final AlertLevel alertLevel;

    public ReplacementAlertLogger(AlertLevel alertLevel) {
        this.alertLevel = alertLevel != null ? alertLevel : AlertLevel.WARNING;
    }

    public AlertLevel alertLevel() {
        return alertLevel;
    }

    private boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public void runStarted(String runId, String oldField, String newField, boolean dryRun) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED run={} old={} new={} dry_run={}", runId, oldField, newField, dryRun);
        }
    }

    public void batchStarted(String runId, int batchId, int reports) {
        if (shouldLogInfo()) {
            log.info("BATCH_STARTED run={} batch={} reports={}", runId, batchId, reports);
        }
    }

    public void batchState(String runId, int batchId, BatchStatus from, BatchStatus to) {
        if (shouldLogInfo()) {
            log.info("BATCH_STATE run={} batch={} from={} to={}", runId, batchId, from, to);
        }
    }

    /**
     * Log a transient failure that will be retried.
     *
     * @param attempt the attempt that failed, 1-based
     * @param delayMs the delay before the next attempt
     */
    public void batchRetry(String runId, int batchId, String operation, int attempt, long delayMs, Throwable error) {
        if (shouldLogWarn()) {
            log.warn("BATCH_RETRY run={} batch={} operation={} attempt={} delay_ms={} error=\"{}\"",
                    runId, batchId, operation, attempt, delayMs, messageOf(error));
        }
    }

    public void batchConfirmed(String runId, int batchId, String deployId, int replaced) {
        if (shouldLogInfo()) {
            log.info("BATCH_CONFIRMED run={} batch={} deploy={} replaced={}",
                    runId, batchId, deployId != null ? deployId : "none", replaced);
        }
    }

    public void batchFailed(String runId, int batchId, BatchStatus failedIn, String reason) {
        log.error("BATCH_FAILED run={} batch={} state={} error=\"{}\"", runId, batchId, failedIn, reason);
    }

    public void runCompleted(String runId, RunMetrics metrics, int replaced, int failed) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED run={} duration_ms={} batches={} confirmed={} replaced={} failed={}",
                    runId,
                    metrics.totalDurationMs(),
                    metrics.batchesTotal(),
                    metrics.batchesConfirmed(),
                    replaced,
                    failed);
        }
    }

    public void runFailed(String runId, Throwable error) {
        log.error("RUN_FAILED run={} error=\"{}\"", runId, messageOf(error));
    }

    public void runCancelled(String runId, int completedBatches, int remainingBatches) {
        if (shouldLogWarn()) {
            log.warn("RUN_CANCELLED run={} completed_batches={} remaining_batches={}",
                    runId, completedBatches, remainingBatches);
        }
    }

    private static String messageOf(Throwable error) {
        return error != null && error.getMessage() != null ? error.getMessage() : "Unknown error";
    }
}
