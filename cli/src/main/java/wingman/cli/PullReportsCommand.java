package wingman.cli;

import replacer.config.ReplacerConfig;
import replacer.workspace.RunWorkspace;
import wingman.pull.ReportPuller;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "pull-reports", description = "Retrieve report metadata without modifying anything")
class PullReportsCommand implements Callable<Integer> {

    private static final int LISTED_REPORTS = 50;

    @ParentCommand
    WingmanCommand parent;

    @Spec
    CommandSpec spec;

    @Option(names = {"-o", "--org"}, description = "Org alias (overrides the global --org)")
    String org;

    @Option(names = {"-n", "--name-contains"}, description = "Only reports whose name or developer name contains this text")
    String nameContains;

    @Option(names = {"-b", "--batch-size"}, description = "Reports per retrieve")
    Integer batchSize;

    @Option(names = "--output-dir", defaultValue = "force-app/main/default", description = "Where retrieved reports are written")
    Path outputDir;

    @Override
    public Integer call() throws Exception {
        String targetOrg = parent.resolveOrg(org, spec);
        ReplacerConfig config = parent.config(spec);
        int size = batchSize != null ? batchSize : config.batchSize();
        if (size <= 0) {
            throw new ParameterException(spec.commandLine(), "--batch-size must be positive");
        }

        ReportPuller puller = new ReportPuller(parent.sf(), new RunWorkspace(config.workspaceDir()));
        ReportPuller.PullResult result = puller.pull(config.orgContext(targetOrg), nameContains, size, outputDir);

        PrintWriter out = spec.commandLine().getOut();
        if (result.fullNames().isEmpty()) {
            out.println("No reports found" + (nameContains != null ? " matching '" + nameContains + "'" : ""));
            out.flush();
            return 0;
        }
        result.fullNames().stream().limit(LISTED_REPORTS).forEach(name -> out.println("  " + name));
        if (result.fullNames().size() > LISTED_REPORTS) {
            out.printf("  ... and %d more%n", result.fullNames().size() - LISTED_REPORTS);
        }
        out.printf("Pulled %d report(s) in %d batch(es) into %s%n", result.fullNames().size(), result.batches(), outputDir);
        if (!result.succeeded()) {
            out.println("Failed batches: " + result.failedBatches());
        }
        out.flush();
        return result.succeeded() ? 0 : 1;
    }
}
