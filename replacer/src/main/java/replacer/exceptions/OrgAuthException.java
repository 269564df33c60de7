package replacer.exceptions;

/**
 * Thrown when the target org rejects the session or cannot be resolved.
 *
 * <p>Fatal: the orchestrator aborts the whole run, regardless of the
 * continue-on-error setting.
 */
public class OrgAuthException extends ConnectorException {

    public OrgAuthException(String message) {
        super(message);
    }

    public OrgAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
