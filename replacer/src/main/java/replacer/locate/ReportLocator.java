package replacer.locate;

import replacer.connector.OrgConnector;
import replacer.exceptions.ConnectorException;
import replacer.exceptions.MetadataNotFoundException;
import replacer.model.FieldReference;
import replacer.model.OrgContext;
import replacer.model.ReportDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the candidate set of reports for a replacement.
 *
 * <p>The field is checked eagerly, before any batching. Candidates are de-duplicated by
 * report id and sorted by report id, so the same org state always partitions the same way.
 */
public class ReportLocator {

    private static final Logger log = LoggerFactory.getLogger(ReportLocator.class);

    private final OrgConnector connector;

    public ReportLocator(OrgConnector connector) {
        this.connector = Objects.requireNonNull(connector, "connector");
    }

    /**
     * Fails unless the field exists in the org.
     *
     * @throws MetadataNotFoundException if the field does not exist
     */
    public void requireField(OrgContext ctx, FieldReference field) throws ConnectorException {
        if (!connector.fieldExists(ctx, field)) {
            throw new MetadataNotFoundException("Field " + field.qualifiedName()
                    + " does not exist in org '" + ctx.targetOrg() + "'");
        }
    }

    /**
     * Returns the candidate reports for the field, sorted by report id.
     *
     * @throws MetadataNotFoundException if the field does not exist
     */
    public List<ReportDescriptor> locate(OrgContext ctx, FieldReference field) throws ConnectorException {
        requireField(ctx, field);

        List<ReportDescriptor> found = connector.findReportsReferencing(ctx, field);
        Map<String, ReportDescriptor> unique = new LinkedHashMap<>();
        for (ReportDescriptor report : found) {
            unique.putIfAbsent(report.reportId(), report);
        }
        if (unique.size() < found.size()) {
            log.debug("Dropped {} duplicate candidate(s) for {}", found.size() - unique.size(), field);
        }

        List<ReportDescriptor> candidates = new ArrayList<>(unique.values());
        candidates.sort(Comparator.comparing(ReportDescriptor::reportId));
        log.info("Located {} candidate report(s) for {}", candidates.size(), field);
        return candidates;
    }
}
