package replacer.engine;

import replacer.model.BatchStatus;

/**
 * Validates and applies {@link BatchStatus} transitions.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>PENDING → RETRIEVED | FAILED | SKIPPED</li>
 *   <li>RETRIEVED → REWRITTEN | FAILED</li>
 *   <li>REWRITTEN → DRY_RUN_REPORTED | BACKED_UP | FAILED</li>
 *   <li>BACKED_UP → DEPLOYED | CONFIRMED (nothing changed, no deploy) | FAILED</li>
 *   <li>DEPLOYED → CONFIRMED | FAILED</li>
 * </ul>
 *
 * <p>Terminal states accept no transition. Backward transitions are never allowed.
 */
public final class BatchStateMachine {

    private BatchStateMachine() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @throws IllegalArgumentException if either state is null
     * @throws IllegalStateException if the transition is not allowed
     */
    public static void validate(BatchStatus from, BatchStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                    String.format("Cannot transition from terminal state: %s -> %s", from, to));
        }

        boolean valid = switch (from) {
            case PENDING -> to == BatchStatus.RETRIEVED || to == BatchStatus.FAILED || to == BatchStatus.SKIPPED;
            case RETRIEVED -> to == BatchStatus.REWRITTEN || to == BatchStatus.FAILED;
            case REWRITTEN -> to == BatchStatus.DRY_RUN_REPORTED || to == BatchStatus.BACKED_UP
                    || to == BatchStatus.FAILED;
            case BACKED_UP -> to == BatchStatus.DEPLOYED || to == BatchStatus.CONFIRMED || to == BatchStatus.FAILED;
            case DEPLOYED -> to == BatchStatus.CONFIRMED || to == BatchStatus.FAILED;
            case DRY_RUN_REPORTED, CONFIRMED, FAILED, SKIPPED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(String.format("Invalid state transition: %s -> %s", from, to));
        }
    }

    /**
     * Validates and returns the next state.
     */
    public static BatchStatus transition(BatchStatus current, BatchStatus next) {
        validate(current, next);
        return next;
    }
}
