package replacer.backup;

import replacer.model.BackupRecord;
import replacer.model.ReportDescriptor;

import java.io.IOException;
import java.util.List;

/**
 * Durable, write-once snapshots of report definitions taken before they are modified.
 *
 * <p>{@link #snapshot} returns only after the snapshot is durable. Snapshots are never
 * deleted by the engine.
 */
public interface BackupManager {

    /**
     * Persists the report's current definition for the run.
     *
     * <p>A second snapshot of the same report in the same run returns the first record
     * unchanged.
     *
     * @throws IllegalArgumentException if the report has not been retrieved
     * @throws IOException if the snapshot could not be made durable
     */
    BackupRecord snapshot(String runId, ReportDescriptor report) throws IOException;

    /**
     * Re-reads the durable content and rebuilds the pre-run descriptor.
     */
    ReportDescriptor restore(BackupRecord record) throws IOException;

    boolean hasDurableBackup(String runId, String reportId);

    /**
     * Loads every snapshot of a run, ordered by report id.
     */
    List<BackupRecord> listRun(String runId) throws IOException;
}
