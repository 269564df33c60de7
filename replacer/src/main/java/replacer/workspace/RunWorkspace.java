package replacer.workspace;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * The persisted directory layout of replacement runs.
 *
 * <pre>
 * &lt;root&gt;/retrieve/           retrieve manifests and retrieved definitions
 * &lt;root&gt;/deploy/             deploy manifests, staged sources, final package.xml
 * &lt;root&gt;/backup/&lt;runId&gt;/     pre-mutation snapshots
 * &lt;root&gt;/runs/&lt;runId&gt;-summary.json
 * </pre>
 */
public final class RunWorkspace {

    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

    private final Path root;

    public RunWorkspace(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path root() { return root; }

    public Path retrieveDir() { return root.resolve("retrieve"); }

    public Path deployDir() { return root.resolve("deploy"); }

    public Path backupRoot() { return root.resolve("backup"); }

    public Path runsDir() { return root.resolve("runs"); }

    public Path retrieveManifest(int batchId) {
        return retrieveDir().resolve("package_" + batchId + ".xml");
    }

    public Path deployManifest(int batchId) {
        return deployDir().resolve("package_" + batchId + ".xml");
    }

    /** Manifest listing every report replaced by the run. */
    public Path finalDeployManifest() {
        return deployDir().resolve("package.xml");
    }

    public Path summaryFile(String runId) {
        return runsDir().resolve(runId + "-summary.json");
    }

    /**
     * Creates the directory layout if missing.
     */
    public RunWorkspace create() throws IOException {
        Files.createDirectories(retrieveDir());
        Files.createDirectories(deployDir());
        Files.createDirectories(backupRoot());
        Files.createDirectories(runsDir());
        return this;
    }

    /**
     * Allocates a run id from the clock's UTC time. If a run with that id already left a
     * backup or summary behind, a numeric suffix is appended.
     */
    public String newRunId(Clock clock) {
        String base = RUN_ID_FORMAT.format(clock.instant());
        String candidate = base;
        for (int suffix = 2; isTaken(candidate); suffix++) {
            candidate = base + "-" + suffix;
        }
        return candidate;
    }

    private boolean isTaken(String runId) {
        return Files.exists(backupRoot().resolve(runId)) || Files.exists(summaryFile(runId));
    }
}
