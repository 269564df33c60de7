package replacer.engine;

import replacer.backup.FileBackupManager;
import replacer.config.ReplacerConfig;
import replacer.exceptions.MetadataNotFoundException;
import replacer.exceptions.OrgAuthException;
import replacer.exceptions.RateLimitException;
import replacer.fixtures.InMemoryOrgConnector;
import replacer.fixtures.Reports;
import replacer.fixtures.TickClock;
import replacer.model.BackupRecord;
import replacer.model.BatchStatus;
import replacer.model.ChangeEntry;
import replacer.model.ChangeOutcome;
import replacer.model.OrgContext;
import replacer.model.ReplacementPlan;
import replacer.report.BatchSummary;
import replacer.report.RunSummary;
import replacer.report.RunSummaryStore;
import replacer.workspace.RunWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BatchOrchestrator")
class BatchOrchestratorTest {

    private static final String OLD = "AccountName.OldField__c";
    private static final String NEW = "AccountName.NewField__c";
    private static final OrgContext CTX = OrgContext.of("dev-sandbox");

    @TempDir
    Path tempDir;

    private TickClock clock;
    private InMemoryOrgConnector org;
    private RunWorkspace workspace;
    private FileBackupManager backups;
    private final List<Duration> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new TickClock();
        org = new InMemoryOrgConnector(clock).withField(OLD).withField(NEW);
        workspace = new RunWorkspace(tempDir.resolve("report-migration"));
        backups = new FileBackupManager(workspace.backupRoot(), clock);
        for (int i = 1; i <= 5; i++) {
            org.withReport("00O" + i, "Sales_Reports/Report_" + i, Reports.definition(OLD, "AccountName.Name"));
        }
    }

    private ReplacerConfig.Builder config() {
        return ReplacerConfig.builder()
                .rewriteWorkers(2)
                .maxAttempts(3)
                .backoffBaseMillis(10)
                .backoffMaxMillis(100)
                .backoffJitter(0.0)
                .deployPollInterval(Duration.ofSeconds(5))
                .deployMaxWait(Duration.ofSeconds(60));
    }

    private BatchOrchestrator orchestrator(ReplacerConfig config) {
        return BatchOrchestrator.builder()
                .connector(org)
                .backups(backups)
                .workspace(workspace)
                .config(config)
                .clock(clock)
                .sleeper(sleeps::add)
                .build();
    }

    private static ReplacementPlan plan(boolean dryRun) {
        return ReplacementPlan.of(OLD, NEW, dryRun, 2);
    }

    private static List<BatchStatus> statuses(RunSummary summary) {
        return summary.batches().stream().map(BatchSummary::status).toList();
    }

    private static Map<String, ChangeOutcome> outcomes(RunSummary summary) {
        return summary.entries().stream().collect(Collectors.toMap(ChangeEntry::reportId, ChangeEntry::outcome));
    }

    @Nested
    @DisplayName("full run")
    class FullRun {

        @Test
        @DisplayName("should replace the field in every report, in batches of 2, 2 and 1")
        void shouldReplaceInEveryReport() throws Exception {
            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false));

            assertThat(summary.batches()).extracting(b -> b.reportIds().size()).containsExactly(2, 2, 1);
            assertThat(statuses(summary)).containsOnly(BatchStatus.CONFIRMED);
            assertThat(summary.succeeded()).isTrue();
            for (int i = 1; i <= 5; i++) {
                assertThat(org.definition("00O" + i)).contains(NEW).doesNotContain(OLD);
            }
            assertThat(summary.counters()).isEqualTo(new RunSummary.Counters(5, 5, 5, 0, 0));
            assertThat(summary.entries()).allSatisfy(e -> {
                assertThat(e.outcome()).isEqualTo(ChangeOutcome.REPLACED);
                assertThat(e.referencesReplaced()).isEqualTo(1);
            });
            assertThat(org.deployCalls()).hasSize(3);
        }

        @Test
        @DisplayName("should write batch manifests, the final manifest and the run summary")
        void shouldWriteWorkspaceFiles() throws Exception {
            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false));

            assertThat(workspace.retrieveManifest(1)).exists();
            assertThat(workspace.retrieveManifest(3)).exists();
            assertThat(workspace.deployManifest(2)).exists();
            assertThat(Files.readString(workspace.finalDeployManifest()))
                    .contains("<members>Sales_Reports/Report_1</members>")
                    .contains("<members>Sales_Reports/Report_5</members>")
                    .contains("<version>65.0</version>");

            RunSummary persisted = new RunSummaryStore(workspace).load(summary.runId());
            assertThat(persisted).isEqualTo(summary);
        }

        @Test
        @DisplayName("should back up every deployed report before its deploy call")
        void shouldBackUpBeforeDeploy() throws Exception {
            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false));

            Map<String, BackupRecord> records = backups.listRun(summary.runId()).stream()
                    .collect(Collectors.toMap(BackupRecord::reportId, Function.identity()));
            assertThat(records).hasSize(5);
            for (InMemoryOrgConnector.DeployCall call : org.deployCalls()) {
                for (String reportId : call.reportIds()) {
                    assertThat(records.get(reportId).timestamp()).isBefore(call.at());
                    assertThat(records.get(reportId).originalContent()).contains(OLD);
                }
            }
        }

        @Test
        @DisplayName("should poll the deploy until it finishes")
        void shouldPollDeploy() throws Exception {
            org.pollsUntilDone(3);

            RunSummary summary = orchestrator(config().build()).run(CTX, ReplacementPlan.of(OLD, NEW, false, 5));

            assertThat(statuses(summary)).containsExactly(BatchStatus.CONFIRMED);
            assertThat(org.callCount("checkDeploy")).isEqualTo(3);
            assertThat(sleeps).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should fail the batch when the deploy does not finish in time")
        void shouldFailWhenDeployNeverFinishes() throws Exception {
            org.neverFinishDeploys();

            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false));

            assertThat(statuses(summary)).containsExactly(BatchStatus.FAILED, BatchStatus.PENDING, BatchStatus.PENDING);
            assertThat(summary.batch(1).orElseThrow().failureMessage()).contains("IN_PROGRESS");
        }
    }

    @Nested
    @DisplayName("dry run")
    class DryRun {

        @Test
        @DisplayName("should neither back up nor deploy")
        void shouldNeitherBackUpNorDeploy() throws Exception {
            RunSummary summary = orchestrator(config().build()).run(CTX, plan(true));

            assertThat(statuses(summary)).containsOnly(BatchStatus.DRY_RUN_REPORTED);
            assertThat(org.callCount("startDeploy")).isZero();
            assertThat(backups.listRun(summary.runId())).isEmpty();
            assertThat(org.definition("00O1")).contains(OLD);
            assertThat(workspace.finalDeployManifest()).doesNotExist();
        }

        @Test
        @DisplayName("should preview every matching report")
        void shouldPreviewMatches() throws Exception {
            RunSummary summary = orchestrator(config().build()).run(CTX, plan(true));

            assertThat(summary.entries()).hasSize(5).allSatisfy(e -> {
                assertThat(e.outcome()).isEqualTo(ChangeOutcome.PREVIEWED);
                assertThat(e.referencesFound()).isEqualTo(1);
                assertThat(e.referencesReplaced()).isZero();
            });
            assertThat(summary.counters().replaced()).isZero();
            assertThat(summary.succeeded()).isTrue();
        }
    }

    @Nested
    @DisplayName("per-report outcomes")
    class PerReport {

        @Test
        @DisplayName("should skip a malformed report and deploy the rest of its batch")
        void shouldSkipMalformedReport() throws Exception {
            org.withReport("00O2", "Sales_Reports/Report_2", "<Report><field>" + OLD + "</Report>");

            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false));

            assertThat(statuses(summary)).containsOnly(BatchStatus.CONFIRMED);
            assertThat(outcomes(summary)).containsEntry("00O2", ChangeOutcome.MALFORMED);
            assertThat(org.deployCalls().get(0).reportIds()).containsExactly("00O1");
            assertThat(backups.hasDurableBackup(summary.runId(), "00O2")).isFalse();
            assertThat(summary.counters().skipped()).isEqualTo(1);
            assertThat(summary.counters().replaced()).isEqualTo(4);
        }

        @Test
        @DisplayName("should record reports without references when the search returns a superset")
        void shouldRecordNoMatchForSuperset() throws Exception {
            org.searchReturnsAll(true)
                    .withReport("00O6", "Sales_Reports/Unrelated_A", Reports.definition("AccountName.Name"))
                    .withReport("00O7", "Sales_Reports/Unrelated_B", Reports.definition("AccountName.OldField__cX"));

            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false));

            assertThat(outcomes(summary))
                    .containsEntry("00O6", ChangeOutcome.NO_MATCH)
                    .containsEntry("00O7", ChangeOutcome.NO_MATCH);
            assertThat(summary.counters().scanned()).isEqualTo(7);
            assertThat(summary.counters().matched()).isEqualTo(5);
            // batch 4 holds 00O7 only: nothing changed, confirmed without a deploy
            assertThat(statuses(summary)).containsOnly(BatchStatus.CONFIRMED);
            assertThat(org.deployCalls()).hasSize(3);
            assertThat(org.definition("00O7")).contains("AccountName.OldField__cX");
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should halt when the deploy of batch 2 is rejected")
        void shouldHaltOnDeployRejection() throws Exception {
            org.rejectDeploy(2, "Sales_Reports/Report_3: Unknown field AccountName.NewField__c");

            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false));

            assertThat(statuses(summary)).containsExactly(BatchStatus.CONFIRMED, BatchStatus.FAILED, BatchStatus.PENDING);
            assertThat(summary.batch(2).orElseThrow().failureMessage()).contains("Unknown field");
            assertThat(summary.succeeded()).isFalse();
            assertThat(outcomes(summary))
                    .containsEntry("00O1", ChangeOutcome.REPLACED)
                    .containsEntry("00O3", ChangeOutcome.FAILED)
                    .doesNotContainKey("00O5");
            assertThat(org.callCount("retrieve")).isEqualTo(2);
            assertThat(org.definition("00O3")).contains(OLD);
        }

        @Test
        @DisplayName("should carry on past a failed batch when configured to")
        void shouldContinueOnError() throws Exception {
            org.rejectDeploy(2, "Sales_Reports/Report_3: Unknown field");

            RunSummary summary = orchestrator(config().continueOnError(true).build()).run(CTX, plan(false));

            assertThat(statuses(summary)).containsExactly(BatchStatus.CONFIRMED, BatchStatus.FAILED, BatchStatus.CONFIRMED);
            assertThat(summary.counters().failed()).isEqualTo(2);
            assertThat(summary.counters().replaced()).isEqualTo(3);
        }

        @Test
        @DisplayName("should retry a rate-limited retrieve and succeed")
        void shouldRetryTransientFailure() throws Exception {
            org.failNext("retrieve", new RateLimitException("REQUEST_LIMIT_EXCEEDED"));

            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false));

            assertThat(statuses(summary)).containsOnly(BatchStatus.CONFIRMED);
            assertThat(org.callCount("retrieve")).isEqualTo(4);
            assertThat(sleeps).contains(Duration.ofMillis(10));
        }

        @Test
        @DisplayName("should fail the batch once retries are exhausted")
        void shouldFailAfterRetriesExhausted() throws Exception {
            for (int i = 0; i < 3; i++) {
                org.failNext("retrieve", new RateLimitException("REQUEST_LIMIT_EXCEEDED"));
            }

            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false));

            assertThat(statuses(summary)).containsExactly(BatchStatus.FAILED, BatchStatus.PENDING, BatchStatus.PENDING);
            assertThat(summary.batch(1).orElseThrow().failureMessage()).contains("REQUEST_LIMIT_EXCEEDED");
            assertThat(org.callCount("startDeploy")).isZero();
        }

        @Test
        @DisplayName("should fail the batch without a second deploy when starting the deploy times out")
        void shouldNotRestartTimedOutDeploy() throws Exception {
            org.timeOutNext("startDeploy");

            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false));

            assertThat(statuses(summary)).containsExactly(BatchStatus.FAILED, BatchStatus.PENDING, BatchStatus.PENDING);
            assertThat(org.callCount("startDeploy")).isEqualTo(1);
            assertThat(summary.batch(1).orElseThrow().failureMessage()).contains("startDeploy");
        }

        @Test
        @DisplayName("should halt on an auth failure even with continue-on-error")
        void shouldHaltOnAuthFailure() throws Exception {
            org.failNext("startDeploy", new OrgAuthException("INVALID_SESSION_ID: Session expired"));

            RunSummary summary = orchestrator(config().continueOnError(true).build()).run(CTX, plan(false));

            assertThat(statuses(summary)).containsExactly(BatchStatus.FAILED, BatchStatus.PENDING, BatchStatus.PENDING);
            assertThat(summary.runError()).contains("Session expired");
        }

        @Test
        @DisplayName("should throw before batching when the org rejects the credentials")
        void shouldThrowOnEarlyAuthFailure() {
            org.failNext("fieldExists", new OrgAuthException("No authorization found"));

            assertThatThrownBy(() -> orchestrator(config().build()).run(CTX, plan(false)))
                    .isInstanceOf(OrgAuthException.class);
            assertThat(org.callCount("retrieve")).isZero();
        }

        @Test
        @DisplayName("should throw when the old field does not exist")
        void shouldThrowWhenOldFieldMissing() {
            InMemoryOrgConnector bare = new InMemoryOrgConnector(clock).withField(NEW);
            BatchOrchestrator orchestrator = BatchOrchestrator.builder()
                    .connector(bare).backups(backups).workspace(workspace)
                    .config(config().build()).clock(clock).sleeper(sleeps::add).build();

            assertThatThrownBy(() -> orchestrator.run(CTX, plan(false)))
                    .isInstanceOf(MetadataNotFoundException.class)
                    .hasMessageContaining(OLD);
        }

        @Test
        @DisplayName("should throw when the new field does not exist")
        void shouldThrowWhenNewFieldMissing() {
            InMemoryOrgConnector bare = new InMemoryOrgConnector(clock).withField(OLD);
            BatchOrchestrator orchestrator = BatchOrchestrator.builder()
                    .connector(bare).backups(backups).workspace(workspace)
                    .config(config().build()).clock(clock).sleeper(sleeps::add).build();

            assertThatThrownBy(() -> orchestrator.run(CTX, plan(false)))
                    .isInstanceOf(MetadataNotFoundException.class)
                    .hasMessageContaining(NEW);
            assertThat(bare.callCount("find")).isZero();
        }
    }

    @Nested
    @DisplayName("resume and cancellation")
    class ResumeAndCancel {

        @Test
        @DisplayName("should skip batches confirmed by the previous run")
        void shouldSkipConfirmedBatches() throws Exception {
            org.searchReturnsAll(true).rejectDeploy(2, "Sales_Reports/Report_3: locked");
            BatchOrchestrator orchestrator = orchestrator(config().build());
            RunSummary first = orchestrator.run(CTX, plan(false));
            long retrievesBefore = org.callCount("retrieve");

            RunSummary second = orchestrator.run(CTX, plan(false), first, new RunCancellation());

            assertThat(second.runId()).isNotEqualTo(first.runId());
            assertThat(statuses(second)).containsExactly(BatchStatus.SKIPPED, BatchStatus.CONFIRMED, BatchStatus.CONFIRMED);
            assertThat(org.callCount("retrieve") - retrievesBefore).isEqualTo(2);
            assertThat(outcomes(second)).containsEntry("00O1", ChangeOutcome.SKIPPED);
            assertThat(org.definition("00O3")).contains(NEW);
        }

        @Test
        @DisplayName("should not resume from a run of a different replacement")
        void shouldIgnoreUnrelatedPreviousRun() throws Exception {
            org.searchReturnsAll(true);
            RunSummary unrelated = new RunSummary("old", "Account.A__c", "Account.B__c", false, 2, null, null,
                    List.of(new BatchSummary(1, BatchStatus.CONFIRMED, List.of("00O1", "00O2"), null, "0Af")),
                    List.of(), null, null, false);

            RunSummary summary = orchestrator(config().build()).run(CTX, plan(false), unrelated, new RunCancellation());

            assertThat(statuses(summary)).containsOnly(BatchStatus.CONFIRMED);
        }

        @Test
        @DisplayName("should stop between batches when cancelled")
        void shouldStopBetweenBatches() throws Exception {
            RunCancellation cancellation = new RunCancellation();
            Sleeper cancelOnFirstPoll = d -> cancellation.request();
            org.pollsUntilDone(2);
            BatchOrchestrator orchestrator = BatchOrchestrator.builder()
                    .connector(org).backups(backups).workspace(workspace)
                    .config(config().build()).clock(clock).sleeper(cancelOnFirstPoll).build();

            RunSummary summary = orchestrator.run(CTX, plan(false), null, cancellation);

            assertThat(statuses(summary)).containsExactly(BatchStatus.CONFIRMED, BatchStatus.PENDING, BatchStatus.PENDING);
            assertThat(summary.cancelled()).isTrue();
            assertThat(summary.succeeded()).isFalse();
            assertThat(cancellation.isFinished()).isTrue();
        }
    }
}
