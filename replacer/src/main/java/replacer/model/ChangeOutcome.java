package replacer.model;

/**
 * What happened to one report during a run.
 */
public enum ChangeOutcome {
    /** References replaced, deployed and confirmed. */
    REPLACED,
    /** Dry run: references would be replaced. */
    PREVIEWED,
    /** Scanned, no reference to the old field. */
    NO_MATCH,
    /** Definition is not well-formed; excluded from deploy. */
    MALFORMED,
    /** The report's batch failed. */
    FAILED,
    /** The report's batch was confirmed by a previous run. */
    SKIPPED
}
