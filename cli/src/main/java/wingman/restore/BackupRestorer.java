package wingman.restore;

import replacer.backup.BackupManager;
import replacer.config.ReplacerConfig;
import replacer.connector.OrgConnector;
import replacer.engine.BackoffCalculator;
import replacer.engine.RetryPolicy;
import replacer.engine.Sleeper;
import replacer.exceptions.ConnectorException;
import replacer.exceptions.DeployValidationException;
import replacer.exceptions.ReplaceException;
import replacer.model.BackupRecord;
import replacer.model.DeployResult;
import replacer.model.OrgContext;
import replacer.model.ReportDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deploys the pre-mutation snapshots of a run back to the org.
 *
 * <p>Uses the same retry and deploy-polling settings as a replacement run.
 */
public class BackupRestorer {

    private static final Logger log = LoggerFactory.getLogger(BackupRestorer.class);

    /**
     * @param runId the run whose snapshots were used
     * @param restored the snapshots, ordered by report id
     * @param deployId remote deploy id, null for a dry run
     */
    public record Outcome(String runId, List<BackupRecord> restored, String deployId) {
    }

    private final OrgConnector connector;
    private final BackupManager backups;
    private final ReplacerConfig config;
    private final Sleeper sleeper;
    private final RetryPolicy retry;

    public BackupRestorer(OrgConnector connector, BackupManager backups, ReplacerConfig config, Sleeper sleeper) {
        this.connector = connector;
        this.backups = backups;
        this.config = config;
        this.sleeper = sleeper;
        this.retry = new RetryPolicy(config.maxAttempts(), config.connectorTimeout(),
                new BackoffCalculator(config.backoffBase().toMillis(), config.backoffMax().toMillis(),
                        config.backoffJitter()),
                sleeper);
    }

    /**
     * Restores every snapshot of the run.
     *
     * @param dryRun list the snapshots without deploying them
     * @throws ReplaceException if the run has no snapshots, they cannot be read, or the deploy fails
     */
    public Outcome restore(OrgContext ctx, String runId, boolean dryRun) throws ReplaceException {
        List<BackupRecord> records;
        List<ReportDescriptor> reports = new ArrayList<>();
        try {
            records = new ArrayList<>(backups.listRun(runId));
            records.sort(Comparator.comparing(BackupRecord::reportId));
            for (BackupRecord record : records) {
                reports.add(backups.restore(record));
            }
        } catch (IOException e) {
            throw new ReplaceException("Cannot read backups of run " + runId + ": " + e.getMessage(), "restore", null, e);
        }
        if (records.isEmpty()) {
            throw new ReplaceException("No backups found for run " + runId);
        }
        if (dryRun) {
            log.info("Dry run: {} report(s) of run {} would be restored", records.size(), runId);
            return new Outcome(runId, records, null);
        }

        RetryPolicy.RetryListener listener = (op, attempt, delayMs, error) ->
                log.warn("Restore {}: attempt {} failed ({}), retrying in {}ms", op, attempt, error.getMessage(), delayMs);
        String deployId = retry.executeOnceAfterTimeout("startDeploy", () -> connector.startDeploy(ctx, reports), listener);
        log.info("Restoring {} report(s) of run {} in deploy {}", reports.size(), runId, deployId);

        DeployResult result = await(ctx, deployId, listener);
        if (!result.isSuccess()) {
            throw new DeployValidationException("Restore deploy " + deployId + " ended " + result.status(),
                    deployId, result.componentFailures());
        }
        return new Outcome(runId, records, deployId);
    }

    private DeployResult await(OrgContext ctx, String deployId, RetryPolicy.RetryListener listener)
            throws ConnectorException {
        Duration waited = Duration.ZERO;
        while (true) {
            DeployResult result = retry.execute("checkDeploy", () -> connector.checkDeploy(ctx, deployId), listener);
            if (result.status().isTerminal()) {
                return result;
            }
            if (waited.compareTo(config.deployMaxWait()) >= 0) {
                throw new ConnectorException("Restore deploy " + deployId + " still " + result.status()
                        + " after " + waited.toSeconds() + "s", "restore", null, null);
            }
            try {
                sleeper.sleep(config.deployPollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectorException("Interrupted while waiting for deploy " + deployId, e);
            }
            waited = waited.plus(config.deployPollInterval());
        }
    }
}
