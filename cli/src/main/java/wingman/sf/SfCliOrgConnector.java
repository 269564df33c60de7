package wingman.sf;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import replacer.connector.OrgConnector;
import replacer.exceptions.ConnectorException;
import replacer.manifest.PackageManifestWriter;
import replacer.model.DeployResult;
import replacer.model.DeployStatus;
import replacer.model.FieldReference;
import replacer.model.OrgContext;
import replacer.model.ReportDescriptor;
import replacer.workspace.RunWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * {@link OrgConnector} that drives the {@code sf} command line.
 *
 * <p>Retrieves and deploys go through a small source-format project rooted at the workspace:
 * <pre>
 * &lt;workspace&gt;/sfdx-project.json
 * &lt;workspace&gt;/retrieve/sf-package.xml         manifest of the current retrieve
 * &lt;workspace&gt;/retrieve/source/reports/...     retrieved definitions
 * &lt;workspace&gt;/deploy/source/reports/...       definitions staged for the current deploy
 * </pre>
 *
 * <p>The {@code sf} tool cannot search report columns, so {@link #findReportsReferencing}
 * returns every report of the org and leaves matching to the rewriter.
 */
public class SfCliOrgConnector implements OrgConnector {

    private static final Logger log = LoggerFactory.getLogger(SfCliOrgConnector.class);

    static final String PROJECT_FILE = "sfdx-project.json";
    private static final String SOURCE_DIR = "source";

    private final SfCli sf;
    private final ReportCatalog catalog;
    private final RunWorkspace workspace;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public SfCliOrgConnector(SfCli sf, RunWorkspace workspace) {
        this.sf = sf;
        this.catalog = new ReportCatalog(sf);
        this.workspace = workspace;
    }

    @Override
    public boolean fieldExists(OrgContext ctx, FieldReference field) throws ConnectorException {
        String soql = "SELECT QualifiedApiName FROM FieldDefinition"
                + " WHERE EntityDefinition.QualifiedApiName = '" + field.objectName() + "'"
                + " AND QualifiedApiName = '" + field.fieldName() + "'";
        return !sf.query(ctx.targetOrg(), soql, true).isEmpty();
    }

    @Override
    public List<ReportDescriptor> findReportsReferencing(OrgContext ctx, FieldReference field)
            throws ConnectorException {
        List<ReportDescriptor> reports = new ArrayList<>();
        for (ReportCatalog.Entry entry : catalog.list(ctx.targetOrg())) {
            reports.add(ReportDescriptor.handle(entry.id(), entry.fullName()));
        }
        log.debug("Returning all {} report(s) of '{}' as candidates for {}", reports.size(), ctx.targetOrg(), field);
        return reports;
    }

    @Override
    public List<ReportDescriptor> retrieve(OrgContext ctx, List<ReportDescriptor> reports) throws ConnectorException {
        Path outputDir = workspace.retrieveDir().resolve(SOURCE_DIR);
        Path manifest = workspace.retrieveDir().resolve("sf-package.xml");
        try {
            ensureProject(ctx);
            for (ReportDescriptor report : reports) {
                Files.deleteIfExists(outputDir.resolve(report.storagePath()));
            }
            PackageManifestWriter.write(manifest, reports.stream().map(ReportDescriptor::fullName).toList(),
                    ctx.apiVersion());
        } catch (IOException e) {
            throw new ConnectorException("Cannot prepare retrieve: " + e.getMessage(), "retrieve", null, e);
        }

        sf.run(ctx.targetOrg(), workspace.root(), "project", "retrieve", "start",
                "--manifest", relative(manifest), "--output-dir", relative(outputDir));

        List<ReportDescriptor> retrieved = new ArrayList<>();
        for (ReportDescriptor report : reports) {
            Path file = outputDir.resolve(report.storagePath());
            if (!Files.isRegularFile(file)) {
                log.warn("Report {} ({}) was not retrieved", report.reportId(), report.fullName());
                continue;
            }
            try {
                retrieved.add(report.withDefinition(Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                throw new ConnectorException("Cannot read retrieved " + file + ": " + e.getMessage(),
                        "retrieve", report.reportId(), e);
            }
        }
        return retrieved;
    }

    @Override
    public String startDeploy(OrgContext ctx, List<ReportDescriptor> reports) throws ConnectorException {
        Path sourceDir = workspace.deployDir().resolve(SOURCE_DIR);
        try {
            ensureProject(ctx);
            deleteRecursively(sourceDir);
            Files.createDirectories(sourceDir);
            for (ReportDescriptor report : reports) {
                if (!report.isRetrieved()) {
                    throw new IllegalArgumentException("Report " + report.reportId() + " has no definition to deploy");
                }
                Path file = sourceDir.resolve(report.storagePath());
                Files.createDirectories(file.getParent());
                Files.writeString(file, report.rawDefinition(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new ConnectorException("Cannot stage deploy: " + e.getMessage(), "deploy", null, e);
        }

        JsonNode result = sf.run(ctx.targetOrg(), workspace.root(), "project", "deploy", "start",
                "--source-dir", relative(sourceDir), "--async");
        String deployId = result.path("id").asText("");
        if (deployId.isEmpty()) {
            throw new ConnectorException("sf project deploy start returned no job id", "deploy", null, null);
        }
        log.info("Started deploy {} of {} report(s)", deployId, reports.size());
        return deployId;
    }

    @Override
    public DeployResult checkDeploy(OrgContext ctx, String deployId) throws ConnectorException {
        String[] args = {"project", "deploy", "report", "--job-id", deployId};
        SfResponse response = sf.invoke(ctx.targetOrg(), workspace.root(), args);
        JsonNode status = response.result().path("status");
        if (!status.isTextual()) {
            throw sf.toException(args, response);
        }
        DeployStatus mapped = mapStatus(status.asText());
        List<String> failures = componentFailures(response.result());
        if (mapped == DeployStatus.SUCCEEDED && !failures.isEmpty()) {
            mapped = DeployStatus.FAILED;
        }
        return new DeployResult(deployId, mapped, failures);
    }

    static DeployStatus mapStatus(String status) {
        switch (status.toLowerCase(Locale.ROOT)) {
            case "succeeded":
                return DeployStatus.SUCCEEDED;
            case "failed":
            case "succeededpartial":
                return DeployStatus.FAILED;
            case "canceled":
                return DeployStatus.CANCELED;
            case "pending":
            case "queued":
                return DeployStatus.QUEUED;
            default:
                return DeployStatus.IN_PROGRESS;
        }
    }

    // details.componentFailures is an object for a single failure, an array otherwise
    static List<String> componentFailures(JsonNode result) {
        JsonNode node = result.path("details").path("componentFailures");
        List<String> failures = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(f -> failures.add(describeFailure(f)));
        } else if (node.isObject()) {
            failures.add(describeFailure(node));
        }
        return failures;
    }

    private static String describeFailure(JsonNode failure) {
        String fullName = failure.path("fullName").asText("?");
        String problem = failure.path("problem").asText("unknown problem");
        return fullName + ": " + problem;
    }

    // sf refuses to load a project whose package directory is missing
    private void ensureProject(OrgContext ctx) throws IOException {
        workspace.create();
        Files.createDirectories(workspace.deployDir().resolve(SOURCE_DIR));
        Path project = workspace.root().resolve(PROJECT_FILE);
        if (Files.exists(project)) return;

        ObjectNode root = mapper.createObjectNode();
        root.putArray("packageDirectories").addObject()
                .put("path", workspace.root().relativize(workspace.deployDir().resolve(SOURCE_DIR)).toString())
                .put("default", true);
        root.put("sourceApiVersion", ctx.apiVersion());
        mapper.writeValue(project.toFile(), root);
    }

    private String relative(Path path) {
        return workspace.root().toAbsolutePath().relativize(path.toAbsolutePath()).toString();
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path p : (Iterable<Path>) paths.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(p);
            }
        }
    }
}
