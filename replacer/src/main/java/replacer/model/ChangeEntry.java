package replacer.model;

import java.util.Objects;

/**
 * Per-report outcome accumulated into the run summary.
 *
 * @param reportId the report id
 * @param fullName the report full name
 * @param batchId the batch the report belongs to
 * @param referencesFound token-exact matches of the old field
 * @param referencesReplaced substitutions made, never more than {@code referencesFound}
 * @param outcome what happened to the report
 * @param detail failure or skip detail, may be null
 */
public record ChangeEntry(
        String reportId,
        String fullName,
        int batchId,
        int referencesFound,
        int referencesReplaced,
        ChangeOutcome outcome,
        String detail
) {
    public ChangeEntry {
        Objects.requireNonNull(reportId, "reportId");
        Objects.requireNonNull(outcome, "outcome");
        if (referencesFound < 0 || referencesReplaced < 0) {
            throw new IllegalArgumentException("reference counts must not be negative");
        }
        if (referencesReplaced > referencesFound) {
            throw new IllegalArgumentException("referencesReplaced (" + referencesReplaced
                    + ") exceeds referencesFound (" + referencesFound + ") for " + reportId);
        }
    }

    /** Returns true if the old field occurs in the report. */
    public boolean matched() {
        return referencesFound > 0;
    }
}
