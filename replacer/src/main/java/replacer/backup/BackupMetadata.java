package replacer.backup;

import replacer.model.BackupRecord;

import java.time.Instant;

/**
 * JSON shape of a backup's metadata file. The content itself lives next to it.
 */
record BackupMetadata(String runId, String reportId, String fullName, String storagePath, Instant timestamp) {

    static BackupMetadata of(BackupRecord record) {
        return new BackupMetadata(record.runId(), record.reportId(), record.fullName(),
                record.storagePath(), record.timestamp());
    }
}
