package wingman.extract;

import com.fasterxml.jackson.databind.JsonNode;
import replacer.exceptions.ConnectorException;
import replacer.exceptions.OrgAuthException;
import wingman.sf.SfCli;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Exports field metadata of objects to CSV, one file per object named
 * {@code <Object>_field_metadata.csv}.
 *
 * <p>Fields come from {@code FieldDefinition} unless an explicit list is given. A field whose
 * metadata cannot be read is logged and left out of the file.
 */
public class FieldMetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(FieldMetadataExtractor.class);

    public static final List<String> HEADER = List.of(
            "Object", "Full Name", "Namespace", "DeveloperName", "Label", "Type", "Description", "Formula");

    private static final Pattern API_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    /**
     * Result for one object.
     *
     * @param objectName the object
     * @param file the CSV written
     * @param rows fields written
     * @param skipped fields whose metadata could not be read
     */
    public record ObjectExport(String objectName, Path file, int rows, int skipped) {
    }

    private final SfCli sf;

    public FieldMetadataExtractor(SfCli sf) {
        this.sf = sf;
    }

    /**
     * @param maxFields keep only the first N listed fields when &gt; 0; ignored for explicit fields
     * @param specificFields explicit field names, or empty to list every field
     * @throws IOException if a CSV cannot be written
     * @throws ConnectorException on org-level failures (auth, listing fields)
     */
    public ObjectExport export(String targetOrg, String objectName, int maxFields, List<String> specificFields,
                               Path outputDir) throws IOException, ConnectorException {
        requireApiName(objectName);
        List<String> fields;
        if (!specificFields.isEmpty()) {
            fields = specificFields;
        } else {
            fields = listFields(targetOrg, objectName);
            if (maxFields > 0 && maxFields < fields.size()) {
                log.info("Limiting {} to its first {} of {} field(s)", objectName, maxFields, fields.size());
                fields = fields.subList(0, maxFields);
            }
        }

        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(objectName + "_field_metadata.csv");
        int rows = 0;
        int skipped = 0;
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CsvWriter csv = new CsvWriter(writer)) {
            csv.writeRow(HEADER);
            for (String field : fields) {
                List<String> row = metadataRow(targetOrg, objectName, field);
                if (row == null) {
                    skipped++;
                    continue;
                }
                csv.writeRow(row);
                rows++;
            }
        }
        log.info("Wrote {} field(s) of {} to {}", rows, objectName, file);
        return new ObjectExport(objectName, file, rows, skipped);
    }

    List<String> listFields(String targetOrg, String objectName) throws ConnectorException {
        String soql = "SELECT DeveloperName FROM FieldDefinition"
                + " WHERE EntityDefinition.DeveloperName = '" + objectName + "'";
        List<String> fields = new ArrayList<>();
        for (JsonNode record : sf.query(targetOrg, soql, false)) {
            String name = record.path("DeveloperName").asText("");
            if (!name.isEmpty()) fields.add(name);
        }
        if (fields.isEmpty()) {
            log.warn("No fields found for object {}", objectName);
        }
        return fields;
    }

    // null when the field is unknown or its metadata cannot be read
    private List<String> metadataRow(String targetOrg, String objectName, String field) throws ConnectorException {
        if (!API_NAME.matcher(field).matches()) {
            log.warn("Skipping invalid field name '{}'", field);
            return null;
        }
        String soql = "SELECT EntityDefinition.DeveloperName, FullName, NamespacePrefix, DeveloperName,"
                + " MasterLabel, DataType, Description, Metadata FROM FieldDefinition"
                + " WHERE EntityDefinition.DeveloperName = '" + objectName + "'"
                + " AND DeveloperName = '" + field + "'";
        List<JsonNode> records;
        try {
            records = sf.query(targetOrg, soql, true);
        } catch (OrgAuthException e) {
            throw e;
        } catch (ConnectorException e) {
            log.warn("Failed to get metadata for {}.{}: {}", objectName, field, e.getMessage());
            return null;
        }
        if (records.isEmpty()) {
            log.warn("No metadata for {}.{}", objectName, field);
            return null;
        }
        JsonNode r = records.get(0);
        String object = r.path("EntityDefinition").path("DeveloperName").asText("");
        String fullName = text(r, "FullName");
        String developerName = text(r, "DeveloperName");
        if (object.isEmpty() && fullName.isEmpty() && developerName.isEmpty()) {
            return null;
        }
        return List.of(object, fullName, text(r, "NamespacePrefix"), developerName, text(r, "MasterLabel"),
                text(r, "DataType"), text(r, "Description"), text(r.path("Metadata"), "formula"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? "" : value.asText();
    }

    private static void requireApiName(String name) {
        if (!API_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid object name '" + name + "'");
        }
    }
}
