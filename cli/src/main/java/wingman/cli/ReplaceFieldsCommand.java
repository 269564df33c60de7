package wingman.cli;

import replacer.backup.FileBackupManager;
import replacer.config.ReplacerConfig;
import replacer.engine.BatchOrchestrator;
import replacer.engine.RunCancellation;
import replacer.model.BatchStatus;
import replacer.model.ReplacementPlan;
import replacer.report.ChangeReportPrinter;
import replacer.report.RunSummary;
import replacer.report.RunSummaryStore;
import replacer.workspace.RunWorkspace;
import wingman.local.LocalReportsConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

@Command(name = "replace-fields", description = "Replace a field reference across every report of an org")
class ReplaceFieldsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplaceFieldsCommand.class);

    // label for runs over local files when no org is set
    static final String LOCAL_ORG = "local";

    // how long a shutdown waits for the current batch to finish and the summary to print
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(120);

    @ParentCommand
    WingmanCommand parent;

    @Spec
    CommandSpec spec;

    @Option(names = {"-o", "--org"}, description = "Org alias (overrides the global --org)")
    String org;

    @Option(names = "--old-field", required = true, description = "Field to replace, e.g. Account.OldField__c")
    String oldField;

    @Option(names = "--new-field", required = true, description = "Replacement field, e.g. Account.NewField__c")
    String newField;

    @Option(names = "--dry-run", description = "Show what would change without backing up or deploying")
    boolean dryRun;

    @Option(names = {"-b", "--batch-size"}, description = "Reports per batch")
    Integer batchSize;

    @Option(names = "--continue-on-error", description = "Keep going after a failed batch")
    boolean continueOnError;

    @Option(names = "--resume", description = "Summary of an earlier run; its confirmed batches are skipped")
    Path resume;

    @Option(names = "--workspace", description = "Workspace directory")
    Path workspaceDir;

    @Option(names = {"-r", "--reports-path"},
            description = "Rewrite report files under this directory instead of the org; --org becomes optional")
    Path reportsPath;

    @Override
    public Integer call() throws Exception {
        String targetOrg = reportsPath != null ? localOrg() : parent.resolveOrg(org, spec);
        ReplacerConfig config = config();
        ReplacementPlan plan;
        try {
            plan = ReplacementPlan.of(oldField, newField, dryRun, config.batchSize());
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }

        RunWorkspace workspace = new RunWorkspace(config.workspaceDir());
        RunSummary previous = loadPrevious(workspace);
        BatchOrchestrator orchestrator = BatchOrchestrator.builder()
                .connector(reportsPath != null ? new LocalReportsConnector(reportsPath) : parent.connector(workspace))
                .backups(new FileBackupManager(workspace.backupRoot(), parent.clock()))
                .workspace(workspace)
                .config(config)
                .clock(parent.clock())
                .sleeper(parent.sleeper())
                .build();

        RunCancellation cancellation = new RunCancellation();
        InterruptGuard guard = new InterruptGuard(cancellation, SHUTDOWN_GRACE);
        Thread hook = new Thread(guard, "wingman-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            RunSummary summary = orchestrator.run(config.orgContext(targetOrg), plan, previous, cancellation);
            PrintWriter out = spec.commandLine().getOut();
            new ChangeReportPrinter(out).print(summary);
            out.println("Summary: " + workspace.summaryFile(summary.runId()));
            out.flush();
            return summary.succeeded() ? 0 : 1;
        } finally {
            guard.reported();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM shutting down, hook left in place");
            }
        }
    }

    private String localOrg() {
        String resolved = parent.optionalOrg(org);
        return resolved != null ? resolved : LOCAL_ORG;
    }

    private ReplacerConfig config() {
        ReplacerConfig.Builder builder = parent.config(spec).toBuilder();
        try {
            if (batchSize != null) builder.batchSize(batchSize);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "--batch-size: " + e.getMessage());
        }
        if (continueOnError) builder.continueOnError(true);
        if (workspaceDir != null) builder.workspaceDir(workspaceDir);
        return builder.build();
    }

    private RunSummary loadPrevious(RunWorkspace workspace) {
        if (resume == null) return null;
        try {
            RunSummary previous = new RunSummaryStore(workspace).load(resume);
            log.info("Resuming after run {} ({} confirmed batch(es))", previous.runId(),
                    previous.countBatches(BatchStatus.CONFIRMED));
            return previous;
        } catch (IOException e) {
            throw new ParameterException(spec.commandLine(), "Cannot read --resume summary " + resume + ": " + e.getMessage());
        }
    }
}
