package replacer.exceptions;

/**
 * Thrown when a report definition is not well-formed markup.
 *
 * <p>Per-report: the report is excluded from its batch's deploy and recorded as
 * skipped, while the rest of the batch continues.
 */
public class MalformedReportException extends ReplaceException {

    private final int referencesFound;

    public MalformedReportException(String message, String reportId, int referencesFound, Throwable cause) {
        super(message, "rewrite", reportId, cause);
        this.referencesFound = referencesFound;
    }

    /**
     * Returns the number of raw token matches seen before the markup was rejected.
     *
     * @return the raw match count
     */
    public int getReferencesFound() {
        return referencesFound;
    }
}
