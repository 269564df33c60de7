package wingman.sf;

import com.fasterxml.jackson.databind.JsonNode;
import replacer.exceptions.ConnectorException;
import replacer.exceptions.OrgAuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the reports of an org with their metadata full names.
 *
 * <p>A full name is {@code <folderDeveloperName>/<reportDeveloperName>}. Reports in
 * "Public Reports" or outside any folder belong to {@code unfiled$public}. When the folder
 * cannot be mapped to a developer name, its label is used with spaces replaced by underscores.
 */
public class ReportCatalog {

    private static final Logger log = LoggerFactory.getLogger(ReportCatalog.class);

    static final String REPORT_QUERY =
            "SELECT Id, Name, DeveloperName, FolderName FROM Report WHERE IsDeleted = false ORDER BY Name";
    static final String FOLDER_QUERY = "SELECT Id, Name, DeveloperName FROM Folder ORDER BY Name";
    static final String UNFILED_FOLDER = "unfiled$public";
    private static final String PUBLIC_REPORTS = "Public Reports";

    /**
     * A report row.
     *
     * @param id report id
     * @param name display name
     * @param developerName API name
     * @param folderName folder label, possibly empty
     * @param fullName metadata full name
     */
    public record Entry(String id, String name, String developerName, String folderName, String fullName) {
    }

    private final SfCli sf;

    public ReportCatalog(SfCli sf) {
        this.sf = sf;
    }

    public List<Entry> list(String targetOrg) throws ConnectorException {
        List<JsonNode> reports = sf.query(targetOrg, REPORT_QUERY, false);
        Map<String, String> folders = folderMapping(targetOrg);

        List<Entry> entries = new ArrayList<>();
        for (JsonNode report : reports) {
            String developerName = report.path("DeveloperName").asText("");
            if (developerName.isEmpty()) continue;
            String folderName = report.path("FolderName").asText("");
            entries.add(new Entry(report.path("Id").asText(), report.path("Name").asText(developerName),
                    developerName, folderName, fullName(developerName, folderName, folders)));
        }
        log.debug("Org '{}' has {} report(s) in {} mapped folder(s)", targetOrg, entries.size(), folders.size());
        return entries;
    }

    // Folder label -> developer name. An unreadable folder list is not fatal.
    private Map<String, String> folderMapping(String targetOrg) throws ConnectorException {
        Map<String, String> mapping = new HashMap<>();
        List<JsonNode> folders;
        try {
            folders = sf.query(targetOrg, FOLDER_QUERY, false);
        } catch (OrgAuthException e) {
            throw e;
        } catch (ConnectorException e) {
            log.warn("Could not list folders, using folder names as-is: {}", e.getMessage());
            return mapping;
        }
        for (JsonNode folder : folders) {
            String name = folder.path("Name").asText("");
            String developerName = folder.path("DeveloperName").asText("");
            if (!name.isEmpty() && !developerName.isEmpty()) {
                mapping.put(name, developerName);
            }
        }
        return mapping;
    }

    static String fullName(String developerName, String folderName, Map<String, String> folders) {
        if (folderName == null || folderName.isEmpty() || PUBLIC_REPORTS.equals(folderName)) {
            return UNFILED_FOLDER + "/" + developerName;
        }
        String folder = folders.get(folderName);
        if (folder == null) {
            folder = folderName.replace(' ', '_');
        }
        return folder + "/" + developerName;
    }
}
