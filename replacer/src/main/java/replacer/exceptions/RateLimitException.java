package replacer.exceptions;

/**
 * Thrown when the remote platform refuses a call because an API limit was hit.
 */
public class RateLimitException extends TransientConnectorException {

    public RateLimitException(String message) {
        super(message);
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
