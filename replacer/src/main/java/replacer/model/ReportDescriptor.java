package replacer.model;

import java.util.Objects;

/**
 * One remote report.
 *
 * <p>{@code rawDefinition} is null until the report has been retrieved. Descriptors are
 * never mutated; each pipeline stage hands a new descriptor to the next one.
 *
 * @param reportId the platform id of the report
 * @param fullName the metadata full name ({@code Folder/DeveloperName})
 * @param storagePath the path of the definition relative to a source root
 * @param rawDefinition the report markup as retrieved, or null when not fetched yet
 */
public record ReportDescriptor(String reportId, String fullName, String storagePath, String rawDefinition) {

    public ReportDescriptor {
        Objects.requireNonNull(reportId, "reportId");
        Objects.requireNonNull(fullName, "fullName");
        if (storagePath == null) {
            storagePath = defaultStoragePath(fullName);
        }
    }

    /**
     * Creates an identifier-only descriptor (content not fetched yet).
     */
    public static ReportDescriptor handle(String reportId, String fullName) {
        return new ReportDescriptor(reportId, fullName, null, null);
    }

    /** Returns the conventional source path of a report full name. */
    public static String defaultStoragePath(String fullName) {
        return "reports/" + fullName + ".report-meta.xml";
    }

    /** Returns a copy carrying the given definition. */
    public ReportDescriptor withDefinition(String definition) {
        return new ReportDescriptor(reportId, fullName, storagePath, definition);
    }

    /** Returns true once the definition has been retrieved. */
    public boolean isRetrieved() {
        return rawDefinition != null;
    }

    @Override
    public String toString() {
        return "ReportDescriptor{" + reportId + ", " + fullName
                + (rawDefinition == null ? "" : ", " + rawDefinition.length() + " chars") + '}';
    }
}
