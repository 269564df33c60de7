package wingman.cli;

import replacer.backup.FileBackupManager;
import replacer.config.ReplacerConfig;
import replacer.model.BackupRecord;
import replacer.workspace.RunWorkspace;
import wingman.restore.BackupRestorer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "restore-backup", description = "Deploy the original definitions saved by a run back to the org")
class RestoreBackupCommand implements Callable<Integer> {

    @ParentCommand
    WingmanCommand parent;

    @Spec
    CommandSpec spec;

    @Option(names = {"-o", "--org"}, description = "Org alias (overrides the global --org)")
    String org;

    @Option(names = "--run", required = true, description = "Id of the run whose backups are restored")
    String runId;

    @Option(names = "--dry-run", description = "List the backups without deploying them")
    boolean dryRun;

    @Option(names = "--workspace", description = "Workspace directory")
    Path workspaceDir;

    @Override
    public Integer call() throws Exception {
        String targetOrg = parent.resolveOrg(org, spec);
        ReplacerConfig config = parent.config(spec);
        RunWorkspace workspace = new RunWorkspace(workspaceDir != null ? workspaceDir : config.workspaceDir());

        BackupRestorer restorer = new BackupRestorer(parent.connector(workspace),
                new FileBackupManager(workspace.backupRoot(), parent.clock()), config, parent.sleeper());
        BackupRestorer.Outcome outcome = restorer.restore(config.orgContext(targetOrg), runId, dryRun);

        PrintWriter out = spec.commandLine().getOut();
        for (BackupRecord record : outcome.restored()) {
            out.printf("  %s  %s  (saved %s)%n", record.reportId(), record.fullName(), record.timestamp());
        }
        if (dryRun) {
            out.printf("Would restore %d report(s) from run %s%n", outcome.restored().size(), runId);
        } else {
            out.printf("Restored %d report(s) from run %s in deploy %s%n", outcome.restored().size(), runId,
                    outcome.deployId());
        }
        out.flush();
        return 0;
    }
}
