package wingman.pull;

import replacer.engine.BatchPartitioner;
import replacer.exceptions.ConnectorException;
import replacer.exceptions.OrgAuthException;
import replacer.manifest.PackageManifestWriter;
import replacer.model.BatchJob;
import replacer.model.OrgContext;
import replacer.model.ReportDescriptor;
import replacer.workspace.RunWorkspace;
import wingman.sf.ReportCatalog;
import wingman.sf.SfCli;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Retrieves report definitions in batches without modifying anything.
 *
 * <p>Batch manifests are written to the workspace retrieve directory as
 * {@code package_<n>.xml}. A failed batch is logged and the pull moves on to the next one;
 * only an authorization failure stops it.
 */
public class ReportPuller {

    private static final Logger log = LoggerFactory.getLogger(ReportPuller.class);

    /**
     * @param fullNames every report selected for the pull
     * @param batches number of batches attempted
     * @param failedBatches ids of batches whose retrieve failed
     */
    public record PullResult(List<String> fullNames, int batches, List<Integer> failedBatches) {

        public boolean succeeded() {
            return failedBatches.isEmpty();
        }
    }

    private final SfCli sf;
    private final ReportCatalog catalog;
    private final RunWorkspace workspace;

    public ReportPuller(SfCli sf, RunWorkspace workspace) {
        this.sf = sf;
        this.catalog = new ReportCatalog(sf);
        this.workspace = workspace;
    }

    /**
     * @param nameContains case-insensitive filter on name or developer name, or null for all reports
     * @param outputDir where {@code sf} writes the retrieved source
     */
    public PullResult pull(OrgContext ctx, String nameContains, int batchSize, Path outputDir)
            throws ConnectorException, IOException {
        workspace.create();
        List<ReportDescriptor> selected = new ArrayList<>();
        for (ReportCatalog.Entry entry : catalog.list(ctx.targetOrg())) {
            if (matches(entry, nameContains)) {
                selected.add(ReportDescriptor.handle(entry.id(), entry.fullName()));
            }
        }
        List<String> fullNames = selected.stream().map(ReportDescriptor::fullName).toList();
        if (selected.isEmpty()) {
            log.info("No reports found in '{}'{}", ctx.targetOrg(),
                    nameContains == null ? "" : " matching '" + nameContains + "'");
            return new PullResult(fullNames, 0, List.of());
        }

        List<BatchJob> batches = BatchPartitioner.partition(selected, batchSize);
        log.info("Retrieving {} report(s) in {} batch(es)", selected.size(), batches.size());
        List<Integer> failed = new ArrayList<>();
        for (BatchJob batch : batches) {
            Path manifest = PackageManifestWriter.write(workspace.retrieveManifest(batch.batchId()),
                    batch.reports().stream().map(ReportDescriptor::fullName).toList(), ctx.apiVersion());
            try {
                sf.run(ctx.targetOrg(), null, "project", "retrieve", "start",
                        "--manifest", manifest.toString(), "--output-dir", outputDir.toString());
                log.info("Batch {}/{} retrieved ({} report(s))", batch.batchId(), batches.size(), batch.size());
            } catch (OrgAuthException e) {
                throw e;
            } catch (ConnectorException e) {
                log.warn("Batch {}/{} retrieve failed: {}", batch.batchId(), batches.size(), e.getMessage());
                failed.add(batch.batchId());
            }
        }
        return new PullResult(fullNames, batches.size(), failed);
    }

    static boolean matches(ReportCatalog.Entry entry, String nameContains) {
        if (nameContains == null || nameContains.isBlank()) return true;
        String needle = nameContains.toLowerCase(Locale.ROOT);
        return entry.name().toLowerCase(Locale.ROOT).contains(needle)
                || entry.developerName().toLowerCase(Locale.ROOT).contains(needle);
    }
}
