package replacer.exceptions;

/**
 * Base exception for failures in a field replacement run.
 *
 * <p>Carries optional diagnostic context:
 * <ul>
 *   <li>the pipeline stage where the failure occurred (e.g. {@code retrieve}, {@code deploy})</li>
 *   <li>the id of the report being processed, when the failure concerns a single report</li>
 * </ul>
 *
 * <p>Both are appended to {@link #getMessage()} so log lines stay self-describing.
 *
 * @see replacer.engine.BatchOrchestrator
 */
public class ReplaceException extends Exception {

    private final String stage;
    private final String reportId;

    /**
     * Creates a new exception with a message.
     *
     * @param message the error message
     */
    public ReplaceException(String message) {
        this(message, null, null, null);
    }

    /**
     * Creates a new exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public ReplaceException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new exception with full diagnostic context.
     *
     * @param message the error message
     * @param stage the pipeline stage where the failure occurred (may be null)
     * @param reportId the report involved (may be null)
     * @param cause the underlying cause (may be null)
     */
    public ReplaceException(String message, String stage, String reportId, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.reportId = reportId;
    }

    /**
     * Returns the pipeline stage where the failure occurred.
     *
     * @return the stage name, or null if not set
     */
    public String getStage() {
        return stage;
    }

    /**
     * Returns the id of the report involved in the failure.
     *
     * @return the report id, or null if the failure is not report-specific
     */
    public String getReportId() {
        return reportId;
    }

    /**
     * Returns the message without the appended diagnostics.
     *
     * @return the raw message
     */
    public String getRawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        StringBuilder sb = new StringBuilder(base == null ? "" : base);

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (reportId != null) sb.append(" [report=").append(reportId).append("]");

        return sb.toString();
    }
}
