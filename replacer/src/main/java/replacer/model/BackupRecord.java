package replacer.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable, write-once snapshot of a report taken before it is mutated.
 *
 * @param runId the run that took the snapshot
 * @param reportId the report id
 * @param fullName the report full name
 * @param storagePath the report storage path
 * @param originalContent the definition as retrieved
 * @param timestamp when the snapshot became durable
 */
public record BackupRecord(
        String runId,
        String reportId,
        String fullName,
        String storagePath,
        String originalContent,
        Instant timestamp
) {
    public BackupRecord {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(reportId, "reportId");
        Objects.requireNonNull(originalContent, "originalContent");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
