package replacer.model;

/**
 * Lifecycle states of a {@link BatchJob}.
 *
 * <pre>
 * PENDING ─► RETRIEVED ─► REWRITTEN ─┬─► DRY_RUN_REPORTED
 *    │                               └─► BACKED_UP ─► DEPLOYED ─► CONFIRMED
 *    └─► SKIPPED                              └──────────────────► CONFIRMED (nothing to deploy)
 *
 * FAILED is reachable from every non-terminal state.
 * </pre>
 *
 * @see replacer.engine.BatchStateMachine
 */
public enum BatchStatus {
    PENDING,
    RETRIEVED,
    REWRITTEN,
    DRY_RUN_REPORTED,
    BACKED_UP,
    DEPLOYED,
    CONFIRMED,
    FAILED,
    /** Confirmed by a previous run; not reprocessed. */
    SKIPPED;

    /**
     * @return true if no further transition is allowed
     */
    public boolean isTerminal() {
        return this == DRY_RUN_REPORTED || this == CONFIRMED || this == FAILED || this == SKIPPED;
    }
}
