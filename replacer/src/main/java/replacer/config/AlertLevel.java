package replacer.config;

/**
 * Alert level for replacement event logging.
 *
 * <p>Controls the minimum severity of events emitted by
 * {@link replacer.alert.ReplacementAlertLogger}. Configured through the
 * {@code replacer.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - every event: run started, batch state changes, confirmations</li>
 *   <li>{@link #WARNING} - retries, cancellation and failures</li>
 *   <li>{@link #ERROR} - failures only</li>
 * </ul>
 *
 * @see ReplacerConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log all events. Useful when following a run batch by batch. */
    DEBUG,

    /** Log retries, cancellation and failures. The default. */
    WARNING,

    /** Log batch and run failures only. */
    ERROR
}
