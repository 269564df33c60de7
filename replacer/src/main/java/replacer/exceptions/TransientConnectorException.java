package replacer.exceptions;

/**
 * A connector failure that may succeed if the call is repeated
 * (network hiccup, process I/O failure, remote overload).
 *
 * <p>The orchestrator retries these with exponential backoff before failing the batch.
 *
 * @see replacer.engine.RetryPolicy
 */
public class TransientConnectorException extends ConnectorException {

    public TransientConnectorException(String message) {
        super(message);
    }

    public TransientConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
