package replacer.exceptions;

/**
 * Failure reported by an {@link replacer.connector.OrgConnector} call.
 *
 * <p>Subclasses classify the failure so the orchestrator can apply its policy:
 * auth failures abort the run, transient failures are retried, everything else
 * fails the current batch.
 */
public class ConnectorException extends ReplaceException {

    public ConnectorException(String message) {
        super(message);
    }

    public ConnectorException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConnectorException(String message, String stage, String reportId, Throwable cause) {
        super(message, stage, reportId, cause);
    }
}
