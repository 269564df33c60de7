package replacer.model;

import java.util.Objects;

/**
 * Immutable configuration of one replacement run.
 *
 * @param oldField the field reference to replace
 * @param newField the replacement reference
 * @param dryRun preview only: no backups, no deploys
 * @param batchSize maximum number of reports per batch, strictly positive
 */
public record ReplacementPlan(FieldReference oldField, FieldReference newField, boolean dryRun, int batchSize) {

    public ReplacementPlan {
        Objects.requireNonNull(oldField, "oldField");
        Objects.requireNonNull(newField, "newField");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (oldField.equals(newField)) {
            throw new IllegalArgumentException("oldField and newField are identical: " + oldField);
        }
    }

    /**
     * Convenience factory parsing both references.
     */
    public static ReplacementPlan of(String oldField, String newField, boolean dryRun, int batchSize) {
        return new ReplacementPlan(FieldReference.parse(oldField), FieldReference.parse(newField), dryRun, batchSize);
    }
}
