package replacer.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import replacer.alert.ReplacementAlertLogger;
import replacer.backup.BackupManager;
import replacer.config.ReplacerConfig;
import replacer.connector.OrgConnector;
import replacer.exceptions.ConnectorException;
import replacer.exceptions.ConnectorTimeoutException;
import replacer.exceptions.DeployValidationException;
import replacer.exceptions.MalformedReportException;
import replacer.exceptions.MetadataNotFoundException;
import replacer.exceptions.OrgAuthException;
import replacer.exceptions.ReplaceException;
import replacer.locate.ReportLocator;
import replacer.manifest.PackageManifestWriter;
import replacer.metrics.RunMetrics;
import replacer.metrics.RunMetrics.Phase;
import replacer.metrics.RunMetricsCollector;
import replacer.model.BatchJob;
import replacer.model.BatchStatus;
import replacer.model.ChangeEntry;
import replacer.model.ChangeOutcome;
import replacer.model.DeployResult;
import replacer.model.OrgContext;
import replacer.model.ReplacementPlan;
import replacer.model.ReportDescriptor;
import replacer.report.BatchSummary;
import replacer.report.ChangeReport;
import replacer.report.RunSummary;
import replacer.report.RunSummaryStore;
import replacer.rewrite.ReferenceRewriter;
import replacer.rewrite.RewriteResult;
import replacer.workspace.RunWorkspace;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a replacement run end to end.
 *
 * <p>The run:
 * <ol>
 *   <li>checks that both fields exist and locates the candidate reports</li>
 *   <li>partitions the candidates into batches of {@code plan.batchSize()}</li>
 *   <li>for each batch, in order: retrieve, rewrite (in parallel), then either report the
 *       preview (dry run) or back up every well-formed report, deploy the changed ones and
 *       poll the deploy to completion</li>
 *   <li>persists the {@link RunSummary} and writes the final deploy manifest</li>
 * </ol>
 *
 * <p>Batch state moves only through {@link BatchStateMachine}. A batch always reaches a
 * terminal state before the next one starts. Confirmed batches are never rolled back.
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>Field missing or auth failure before batching: thrown to the caller, nothing is modified.</li>
 *   <li>Transient connector failures and timeouts: retried with backoff, then the batch fails.</li>
 *   <li>Malformed report: recorded for that report, which is excluded from the deploy.</li>
 *   <li>Any other batch failure: the batch fails and the run halts, unless
 *       {@link ReplacerConfig#continueOnError()} is set. Auth failures always halt.</li>
 * </ul>
 *
 * <p>An orchestrator can run several plans one after the other but not concurrently.
 */
public final class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final OrgConnector connector;
    private final BackupManager backups;
    private final ReferenceRewriter rewriter;
    private final ReportLocator locator;
    private final RunWorkspace workspace;
    private final RunSummaryStore summaryStore;
    private final ReplacerConfig config;
    private final Clock clock;
    private final Sleeper sleeper;
    private final RetryPolicy retry;
    private final ReplacementAlertLogger alerts;

    private BatchOrchestrator(Builder b) {
        this.connector = Objects.requireNonNull(b.connector, "connector");
        this.config = b.config != null ? b.config : ReplacerConfig.DEFAULTS;
        this.workspace = b.workspace != null ? b.workspace : new RunWorkspace(config.workspaceDir());
        this.backups = Objects.requireNonNull(b.backups, "backups");
        this.rewriter = b.rewriter != null ? b.rewriter : new ReferenceRewriter();
        this.locator = new ReportLocator(connector);
        this.summaryStore = new RunSummaryStore(workspace);
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.sleeper = b.sleeper != null ? b.sleeper : Sleeper.SYSTEM;
        BackoffCalculator backoff = b.backoff != null ? b.backoff
                : new BackoffCalculator(config.backoffBase().toMillis(), config.backoffMax().toMillis(),
                config.backoffJitter());
        this.retry = new RetryPolicy(config.maxAttempts(), config.connectorTimeout(), backoff, sleeper);
        this.alerts = new ReplacementAlertLogger(config.alertLevel());
    }

    public static Builder builder() {
        return new Builder();
    }

    public ReplacerConfig config() {
        return config;
    }

    public RunWorkspace workspace() {
        return workspace;
    }

    /**
     * Runs the plan from scratch.
     *
     * @see #run(OrgContext, ReplacementPlan, RunSummary, RunCancellation)
     */
    public RunSummary run(OrgContext ctx, ReplacementPlan plan) throws ReplaceException {
        return run(ctx, plan, null, new RunCancellation());
    }

    /**
     * Runs the plan.
     *
     * @param ctx the org to work against
     * @param plan what to replace
     * @param previous summary of an earlier run of the same plan; its confirmed batches are
     *                 skipped when they hold the same reports. May be null.
     * @param cancellation checked between batches
     * @return the run summary; batch failures are reported here, not thrown
     * @throws MetadataNotFoundException if either field does not exist
     * @throws OrgAuthException if the org rejects the credentials before batching starts
     * @throws ReplaceException if the candidates cannot be located or the workspace cannot be prepared
     */
    public RunSummary run(OrgContext ctx, ReplacementPlan plan, RunSummary previous, RunCancellation cancellation)
            throws ReplaceException {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(cancellation, "cancellation");
        try {
            return start(ctx, plan, previous, cancellation);
        } finally {
            cancellation.markFinished();
        }
    }

    private RunSummary start(OrgContext ctx, ReplacementPlan plan, RunSummary previous,
                             RunCancellation cancellation) throws ReplaceException {
        String runId;
        try {
            workspace.create();
            runId = workspace.newRunId(clock);
        } catch (IOException e) {
            throw new ReplaceException("Cannot prepare workspace " + workspace.root() + ": " + e.getMessage(),
                    "workspace", null, e);
        }

        Instant startedAt = clock.instant();
        RunMetricsCollector metrics = new RunMetricsCollector(clock).start(runId);
        RunContext run = new RunContext(runId, ctx, plan, metrics);
        try {
            return execute(run, startedAt, previous, cancellation);
        } finally {
            run.close();
        }
    }

    private RunSummary execute(RunContext run, Instant startedAt, RunSummary previous, RunCancellation cancellation)
            throws ReplaceException {
        String runId = run.runId;
        OrgContext ctx = run.ctx;
        ReplacementPlan plan = run.plan;
        RunMetricsCollector metrics = run.metrics;
        alerts.runStarted(runId, plan.oldField().qualifiedName(), plan.newField().qualifiedName(), plan.dryRun());
        log.info("Run {}: replacing {} with {} in org '{}'{}", runId, plan.oldField(), plan.newField(),
                ctx.targetOrg(), plan.dryRun() ? " (dry run)" : "");

        List<ReportDescriptor> candidates;
        try {
            candidates = metrics.timed(Phase.LOCATE, () -> locate(run));
        } catch (ReplaceException | ConnectorTimeoutException e) {
            alerts.runFailed(runId, e);
            throw e;
        }

        List<BatchJob> batches = BatchPartitioner.partition(candidates, plan.batchSize());
        metrics.batchesTotal(batches.size());
        log.info("Run {}: {} candidate report(s) in {} batch(es) of up to {}", runId, candidates.size(),
                batches.size(), plan.batchSize());

        Map<Integer, BatchSummary> confirmedBefore = confirmedBatches(previous, plan);
        String runError = null;
        boolean cancelled = false;
        int completed = 0;

        for (BatchJob job : batches) {
            if (cancellation.isRequested() || Thread.currentThread().isInterrupted()) {
                cancelled = true;
                alerts.runCancelled(runId, completed, batches.size() - completed);
                break;
            }
            BatchSummary earlier = confirmedBefore.get(job.batchId());
            if (earlier != null && earlier.reportIds().equals(job.reportIds())) {
                skip(run, job, previous.runId());
                completed++;
                continue;
            }

            BatchFailure failure = processBatch(run, job);
            completed++;
            if (failure == null) {
                continue;
            }
            metrics.batchFailed();
            if (failure.error() instanceof OrgAuthException) {
                runError = failure.error().getMessage();
                log.error("Run {}: authentication failed in batch {}, halting", runId, job.batchId());
                break;
            }
            if (!config.continueOnError()) {
                log.warn("Run {}: batch {} failed, halting ({} batch(es) not attempted)", runId, job.batchId(),
                        batches.size() - completed);
                break;
            }
        }

        if (!plan.dryRun()) {
            writeFinalManifest(run);
        }

        RunMetrics runMetrics = metrics.reportsScanned(run.report.counters().scanned()).finish();
        RunSummary summary = new RunSummary(
                runId,
                plan.oldField().qualifiedName(),
                plan.newField().qualifiedName(),
                plan.dryRun(),
                plan.batchSize(),
                startedAt,
                clock.instant(),
                batches.stream().map(BatchSummary::of).toList(),
                run.report.entries(),
                run.report.counters(),
                runError,
                cancelled);

        try {
            summaryStore.save(summary);
        } catch (IOException e) {
            log.error("Run {}: could not persist run summary; resume will not be possible", runId, e);
        }

        log.info("Run metrics: {}", runMetrics.summary());
        if (runError != null) {
            alerts.runFailed(runId, new ReplaceException(runError));
        } else {
            alerts.runCompleted(runId, runMetrics, summary.counters().replaced(), summary.counters().failed());
        }
        return summary;
    }

    private List<ReportDescriptor> locate(RunContext run) throws ConnectorException {
        OrgContext ctx = run.ctx;
        RetryPolicy.RetryListener listener = retryListener(run, 0);
        retry.execute("fieldExists", () -> {
            locator.requireField(ctx, run.plan.newField());
            return null;
        }, listener);
        return retry.execute("locate", () -> locator.locate(ctx, run.plan.oldField()), listener);
    }

    private static Map<Integer, BatchSummary> confirmedBatches(RunSummary previous, ReplacementPlan plan) {
        Map<Integer, BatchSummary> confirmed = new HashMap<>();
        if (previous == null) {
            return confirmed;
        }
        if (!previous.oldField().equals(plan.oldField().qualifiedName())
                || !previous.newField().equals(plan.newField().qualifiedName())) {
            log.warn("Previous run {} replaced {} with {}; not resuming from it",
                    previous.runId(), previous.oldField(), previous.newField());
            return confirmed;
        }
        for (BatchSummary b : previous.batches()) {
            if (b.status() == BatchStatus.CONFIRMED || b.status() == BatchStatus.SKIPPED) {
                confirmed.put(b.batchId(), b);
            }
        }
        return confirmed;
    }

    private void skip(RunContext run, BatchJob job, String previousRunId) {
        advance(run, job, BatchStatus.SKIPPED);
        for (ReportDescriptor report : job.reports()) {
            run.report.record(new ChangeEntry(report.reportId(), report.fullName(), job.batchId(), 0, 0,
                    ChangeOutcome.SKIPPED, "confirmed by run " + previousRunId));
        }
        log.info("Run {}: batch {} already confirmed by run {}, skipping", run.runId, job.batchId(), previousRunId);
    }

    /**
     * Takes one batch to a terminal state.
     *
     * @return null on success, otherwise the failure
     */
    private BatchFailure processBatch(RunContext run, BatchJob job) {
        alerts.batchStarted(run.runId, job.batchId(), job.size());
        Map<String, Rewritten> rewritten = new LinkedHashMap<>();
        try {
            List<ReportDescriptor> retrieved = retrieve(run, job);
            advance(run, job, BatchStatus.RETRIEVED);

            rewritten.putAll(run.metrics.timed(Phase.REWRITE, () -> rewriteAll(run, retrieved)));
            advance(run, job, BatchStatus.REWRITTEN);

            if (run.plan.dryRun()) {
                advance(run, job, BatchStatus.DRY_RUN_REPORTED);
                recordOutcomes(run, job, rewritten, ChangeOutcome.PREVIEWED, false);
                return null;
            }

            run.metrics.timed(Phase.BACKUP, () -> backUp(run, job, rewritten.values()));
            advance(run, job, BatchStatus.BACKED_UP);

            List<ReportDescriptor> changed = rewritten.values().stream()
                    .filter(Rewritten::changed)
                    .map(Rewritten::updated)
                    .toList();
            if (changed.isEmpty()) {
                advance(run, job, BatchStatus.CONFIRMED);
                recordOutcomes(run, job, rewritten, ChangeOutcome.REPLACED, true);
                run.metrics.batchConfirmed();
                alerts.batchConfirmed(run.runId, job.batchId(), null, 0);
                return null;
            }

            run.metrics.timed(Phase.DEPLOY, () -> deploy(run, job, changed));
            advance(run, job, BatchStatus.CONFIRMED);
            recordOutcomes(run, job, rewritten, ChangeOutcome.REPLACED, true);
            run.metrics.batchConfirmed();
            changed.forEach(r -> run.replacedFullNames.add(r.fullName()));
            alerts.batchConfirmed(run.runId, job.batchId(), job.deployId(), changed.size());
            return null;
        } catch (ReplaceException | ConnectorTimeoutException e) {
            return fail(run, job, rewritten, e);
        } catch (RuntimeException e) {
            log.error("Run {}: unexpected error in batch {}", run.runId, job.batchId(), e);
            return fail(run, job, rewritten, e);
        }
    }

    private List<ReportDescriptor> retrieve(RunContext run, BatchJob job) throws ReplaceException {
        writeManifest(workspace.retrieveManifest(job.batchId()), job.reports(), run.ctx.apiVersion());
        List<ReportDescriptor> retrieved = run.metrics.timed(Phase.RETRIEVE, () ->
                retry.execute("retrieve", () -> connector.retrieve(run.ctx, job.reports()),
                        retryListener(run, job.batchId())));

        Map<String, ReportDescriptor> byId = new HashMap<>();
        for (ReportDescriptor r : retrieved) {
            if (r.isRetrieved()) byId.put(r.reportId(), r);
        }
        List<String> missing = new ArrayList<>();
        List<ReportDescriptor> ordered = new ArrayList<>(job.size());
        for (ReportDescriptor requested : job.reports()) {
            ReportDescriptor r = byId.get(requested.reportId());
            if (r == null) {
                missing.add(requested.fullName());
            } else {
                ordered.add(r);
            }
        }
        if (!missing.isEmpty()) {
            throw new MetadataNotFoundException("Retrieve returned no definition for " + missing);
        }
        return ordered;
    }

    private Map<String, Rewritten> rewriteAll(RunContext run, List<ReportDescriptor> reports)
            throws ReplaceException {
        List<Future<Rewritten>> futures = new ArrayList<>(reports.size());
        for (ReportDescriptor report : reports) {
            futures.add(run.rewritePool().submit(() -> rewriteOne(run, report)));
        }
        Map<String, Rewritten> results = new LinkedHashMap<>();
        for (Future<Rewritten> future : futures) {
            try {
                Rewritten r = future.get();
                results.put(r.original().reportId(), r);
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new ReplaceException("Interrupted while rewriting", "rewrite", null, e);
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new ReplaceException("Rewrite failed: " + cause.getMessage(), "rewrite", null, cause);
            }
        }
        return results;
    }

    private Rewritten rewriteOne(RunContext run, ReportDescriptor report) {
        try {
            RewriteResult result = rewriter.rewrite(report, run.plan);
            run.report.scanned(report.reportId());
            return new Rewritten(report, result, null);
        } catch (MalformedReportException e) {
            run.report.scanned(report.reportId());
            log.warn("Run {}: skipping malformed report {} ({}): {}", run.runId, report.reportId(),
                    report.fullName(), e.getRawMessage());
            return new Rewritten(report, null, e);
        }
    }

    private void backUp(RunContext run, BatchJob job, Iterable<Rewritten> reports) throws ReplaceException {
        for (Rewritten r : reports) {
            if (r.malformed() != null) continue;
            try {
                backups.snapshot(run.runId, r.original());
            } catch (IOException e) {
                throw new ReplaceException("Backup of " + r.original().fullName() + " failed: " + e.getMessage(),
                        "backup", r.original().reportId(), e);
            }
        }
        log.debug("Run {}: batch {} backed up", run.runId, job.batchId());
    }

    private void deploy(RunContext run, BatchJob job, List<ReportDescriptor> changed) throws ReplaceException {
        for (ReportDescriptor report : changed) {
            if (!backups.hasDurableBackup(run.runId, report.reportId())) {
                throw new ReplaceException("Refusing to deploy " + report.fullName() + " without a durable backup",
                        "deploy", report.reportId(), null);
            }
        }
        writeManifest(workspace.deployManifest(job.batchId()), changed, run.ctx.apiVersion());

        RetryPolicy.RetryListener listener = retryListener(run, job.batchId());
        String deployId = retry.executeOnceAfterTimeout("startDeploy",
                () -> connector.startDeploy(run.ctx, changed), listener);
        job.recordDeployId(deployId);
        advance(run, job, BatchStatus.DEPLOYED);

        DeployResult result = awaitDeploy(run, deployId, listener);
        if (!result.isSuccess()) {
            throw new DeployValidationException("Deploy " + deployId + " ended " + result.status(),
                    deployId, result.componentFailures());
        }
    }

    private DeployResult awaitDeploy(RunContext run, String deployId, RetryPolicy.RetryListener listener)
            throws ConnectorException {
        Instant start = clock.instant();
        Duration waited = Duration.ZERO;
        while (true) {
            DeployResult result = retry.execute("checkDeploy", () -> connector.checkDeploy(run.ctx, deployId), listener);
            if (result.status().isTerminal()) {
                return result;
            }
            Duration elapsed = Duration.between(start, clock.instant());
            if (elapsed.compareTo(waited) < 0) elapsed = waited;
            if (elapsed.compareTo(config.deployMaxWait()) >= 0) {
                throw new ConnectorException("Deploy " + deployId + " still " + result.status() + " after "
                        + elapsed.toSeconds() + "s", "deploy", null, null);
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

    private BatchFailure fail(RunContext run, BatchJob job, Map<String, Rewritten> rewritten, Exception error) {
        BatchStatus failedIn = job.status();
        String message = describe(error);
        job.fail(message);
        alerts.batchState(run.runId, job.batchId(), failedIn, BatchStatus.FAILED);
        alerts.batchFailed(run.runId, job.batchId(), failedIn, message);

        for (ReportDescriptor report : job.reports()) {
            Rewritten r = rewritten.get(report.reportId());
            if (r != null && r.malformed() != null) {
                run.report.record(malformedEntry(job, r));
            } else {
                int found = r != null ? r.result().referencesFound() : 0;
                run.report.record(new ChangeEntry(report.reportId(), report.fullName(), job.batchId(),
                        found, 0, ChangeOutcome.FAILED, message));
            }
        }
        return new BatchFailure(failedIn, error);
    }

    private static String describe(Exception error) {
        if (error instanceof DeployValidationException dve && !dve.getDiagnostics().isEmpty()) {
            return dve.getMessage();
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Records one entry per report of a batch that reached a good terminal state.
     *
     * @param matchOutcome outcome of reports with references
     * @param applied whether references were actually replaced remotely
     */
    private static void recordOutcomes(RunContext run, BatchJob job, Map<String, Rewritten> rewritten,
                                       ChangeOutcome matchOutcome, boolean applied) {
        for (Rewritten r : rewritten.values()) {
            ReportDescriptor report = r.original();
            if (r.malformed() != null) {
                run.report.record(malformedEntry(job, r));
            } else if (r.changed()) {
                int found = r.result().referencesFound();
                run.report.record(new ChangeEntry(report.reportId(), report.fullName(), job.batchId(),
                        found, applied ? r.result().referencesReplaced() : 0, matchOutcome, null));
            } else {
                run.report.record(new ChangeEntry(report.reportId(), report.fullName(), job.batchId(),
                        0, 0, ChangeOutcome.NO_MATCH, null));
            }
        }
    }

    private static ChangeEntry malformedEntry(BatchJob job, Rewritten r) {
        ReportDescriptor report = r.original();
        return new ChangeEntry(report.reportId(), report.fullName(), job.batchId(),
                r.malformed().getReferencesFound(), 0, ChangeOutcome.MALFORMED, r.malformed().getRawMessage());
    }

    private void advance(RunContext run, BatchJob job, BatchStatus next) {
        BatchStatus from = job.status();
        job.transitionTo(next);
        alerts.batchState(run.runId, job.batchId(), from, next);
    }

    private RetryPolicy.RetryListener retryListener(RunContext run, int batchId) {
        return (operation, attempt, delayMs, error) -> {
            run.metrics.retried();
            alerts.batchRetry(run.runId, batchId, operation, attempt, delayMs, error);
        };
    }

    private static void writeManifest(Path file, List<ReportDescriptor> reports, String apiVersion)
            throws ReplaceException {
        try {
            PackageManifestWriter.write(file, reports.stream().map(ReportDescriptor::fullName).toList(), apiVersion);
        } catch (IOException e) {
            throw new ReplaceException("Cannot write manifest " + file + ": " + e.getMessage(), "manifest", null, e);
        }
    }

    private void writeFinalManifest(RunContext run) {
        if (run.replacedFullNames.isEmpty()) {
            log.info("Run {}: no report was updated, final package.xml not written", run.runId);
            return;
        }
        try {
            PackageManifestWriter.write(workspace.finalDeployManifest(), run.replacedFullNames, run.ctx.apiVersion());
        } catch (IOException e) {
            log.error("Run {}: could not write {}", run.runId, workspace.finalDeployManifest(), e);
        }
    }

    /** A report after the rewrite step: either a result or the malformed-markup error. */
    private record Rewritten(ReportDescriptor original, RewriteResult result, MalformedReportException malformed) {
        boolean changed() {
            return result != null && result.changed();
        }

        ReportDescriptor updated() {
            return original.withDefinition(result.newContent());
        }
    }

    private record BatchFailure(BatchStatus failedIn, Exception error) {
    }

    /** State of one run. Only the orchestrator thread touches it, except for the change report. */
    private final class RunContext {
        final String runId;
        final OrgContext ctx;
        final ReplacementPlan plan;
        final RunMetricsCollector metrics;
        final ChangeReport report = new ChangeReport();
        final List<String> replacedFullNames = new ArrayList<>();
        private ExecutorService pool;

        RunContext(String runId, OrgContext ctx, ReplacementPlan plan, RunMetricsCollector metrics) {
            this.runId = runId;
            this.ctx = ctx;
            this.plan = plan;
            this.metrics = metrics;
        }

        ExecutorService rewritePool() {
            if (pool == null) {
                AtomicInteger counter = new AtomicInteger();
                pool = Executors.newFixedThreadPool(config.rewriteWorkers(), r -> {
                    Thread t = new Thread(r, "replacer-rewrite-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
            }
            return pool;
        }

        void close() {
            if (pool != null) {
                pool.shutdownNow();
            }
        }
    }

    /**
     * Builder for {@link BatchOrchestrator}. The connector and backup manager are required.
     */
    public static final class Builder {
        private OrgConnector connector;
        private BackupManager backups;
        private ReferenceRewriter rewriter;
        private RunWorkspace workspace;
        private ReplacerConfig config;
        private Clock clock;
        private Sleeper sleeper;
        private BackoffCalculator backoff;

        public Builder connector(OrgConnector connector) {
            this.connector = connector;
            return this;
        }

        public Builder backups(BackupManager backups) {
            this.backups = backups;
            return this;
        }

        public Builder rewriter(ReferenceRewriter rewriter) {
            this.rewriter = rewriter;
            return this;
        }

        /** Defaults to {@link ReplacerConfig#workspaceDir()}. */
        public Builder workspace(RunWorkspace workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder config(ReplacerConfig config) {
            this.config = config;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /** Defaults to one built from the configuration's backoff settings. */
        public Builder backoff(BackoffCalculator backoff) {
            this.backoff = backoff;
            return this;
        }

        public BatchOrchestrator build() {
            return new BatchOrchestrator(this);
        }
    }
}
