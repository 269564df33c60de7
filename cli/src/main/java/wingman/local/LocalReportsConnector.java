package wingman.local;

import replacer.connector.OrgConnector;
import replacer.exceptions.ConnectorException;
import replacer.model.DeployResult;
import replacer.model.FieldReference;
import replacer.model.OrgContext;
import replacer.model.ReportDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * {@link OrgConnector} over report definitions already on disk, e.g. a
 * {@code force-app/main/default/reports} folder of a source-format project.
 *
 * <p>Nothing reaches an org. Retrieve reads the files, a "deploy" writes the new definitions
 * back in place and completes at once. A report is identified by its path below the reports
 * directory without the {@code .report-meta.xml} suffix, which is also its metadata full name
 * ({@code Folder/DeveloperName}). Field existence cannot be checked offline and is assumed.
 */
public class LocalReportsConnector implements OrgConnector {

    private static final Logger log = LoggerFactory.getLogger(LocalReportsConnector.class);

    public static final String REPORT_SUFFIX = ".report-meta.xml";

    private final Path reportsDir;
    private final Set<String> deployIds = new HashSet<>();
    private int deploys;

    public LocalReportsConnector(Path reportsDir) {
        this.reportsDir = reportsDir;
    }

    public Path reportsDir() {
        return reportsDir;
    }

    @Override
    public boolean fieldExists(OrgContext ctx, FieldReference field) {
        log.debug("Not checking {} against an org; reading local reports from {}", field, reportsDir);
        return true;
    }

    /**
     * Returns every report file whose text mentions the field. The rewriter decides which
     * mentions are real references.
     */
    @Override
    public List<ReportDescriptor> findReportsReferencing(OrgContext ctx, FieldReference field)
            throws ConnectorException {
        if (!Files.isDirectory(reportsDir)) {
            throw new ConnectorException("Reports path does not exist: " + reportsDir, "locate", null, null);
        }
        List<ReportDescriptor> found = new ArrayList<>();
        int scanned = 0;
        try (Stream<Path> files = Files.walk(reportsDir)) {
            for (Path file : (Iterable<Path>) files.filter(LocalReportsConnector::isReportFile).sorted()::iterator) {
                scanned++;
                if (Files.readString(file, StandardCharsets.UTF_8).contains(field.qualifiedName())) {
                    found.add(descriptor(file));
                }
            }
        } catch (IOException e) {
            throw new ConnectorException("Cannot scan " + reportsDir + ": " + e.getMessage(), "locate", null, e);
        }
        log.info("{} of {} report file(s) under {} mention {}", found.size(), scanned, reportsDir, field);
        return found;
    }

    @Override
    public List<ReportDescriptor> retrieve(OrgContext ctx, List<ReportDescriptor> reports) throws ConnectorException {
        List<ReportDescriptor> retrieved = new ArrayList<>(reports.size());
        for (ReportDescriptor report : reports) {
            Path file = reportsDir.resolve(report.storagePath());
            if (!Files.isRegularFile(file)) {
                log.warn("Report file {} has disappeared", file);
                continue;
            }
            try {
                retrieved.add(report.withDefinition(Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new ConnectorException("Cannot read " + file + ": " + e.getMessage(), "retrieve",
                        report.reportId(), e);
            }
        }
        return retrieved;
    }

    @Override
    public synchronized String startDeploy(OrgContext ctx, List<ReportDescriptor> reports) throws ConnectorException {
        for (ReportDescriptor report : reports) {
            if (!report.isRetrieved()) {
                throw new IllegalArgumentException("Report " + report.reportId() + " has no definition to write");
            }
            Path file = reportsDir.resolve(report.storagePath());
            try {
                Files.createDirectories(file.getParent());
                Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
                Files.writeString(tmp, report.rawDefinition(), StandardCharsets.UTF_8);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new ConnectorException("Cannot write " + file + ": " + e.getMessage(), "deploy",
                        report.reportId(), e);
            }
        }
        String deployId = "local-" + (++deploys);
        deployIds.add(deployId);
        log.info("Wrote {} report(s) under {} ({})", reports.size(), reportsDir, deployId);
        return deployId;
    }

    @Override
    public synchronized DeployResult checkDeploy(OrgContext ctx, String deployId) {
        if (deployIds.contains(deployId)) {
            return DeployResult.succeeded(deployId);
        }
        return DeployResult.failed(deployId, List.of("Unknown local deploy " + deployId));
    }

    private ReportDescriptor descriptor(Path file) {
        String relative = reportsDir.relativize(file).toString().replace('\\', '/');
        String fullName = relative.substring(0, relative.length() - REPORT_SUFFIX.length());
        return new ReportDescriptor(fullName, fullName, relative, null);
    }

    private static boolean isReportFile(Path path) {
        return Files.isRegularFile(path) && path.getFileName().toString().endsWith(REPORT_SUFFIX);
    }
}
