package replacer.exceptions;

import java.time.Duration;

/**
 * Exception thrown when an org connector call exceeds its configured timeout.
 *
 * <p>Treated as a transient failure: the orchestrator retries the call with backoff
 * before failing the batch. Starting a deploy is the exception: a timed-out start fails the
 * batch at once, since the org may already have accepted the deploy.
 *
 * <p>This is an unchecked exception so timeout protection can wrap connector calls
 * without changing their signatures.
 *
 * @see replacer.engine.TimeoutExecutor
 */
public class ConnectorTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    /**
     * Creates a new timeout exception.
     *
     * @param operation the name of the operation that timed out
     * @param timeout the configured timeout that was exceeded
     */
    public ConnectorTimeoutException(String operation, Duration timeout) {
        super(formatMessage(operation, timeout));
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Creates a new timeout exception with a cause.
     *
     * @param operation the name of the operation that timed out
     * @param timeout the configured timeout that was exceeded
     * @param cause the underlying cause (typically TimeoutException or InterruptedException)
     */
    public ConnectorTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(formatMessage(operation, timeout), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    /**
     * Returns the name of the operation that timed out.
     *
     * @return the operation name (e.g., "retrieve[batch 2]", "checkDeploy")
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Returns the configured timeout that was exceeded.
     *
     * @return the timeout duration
     */
    public Duration getTimeout() {
        return timeout;
    }

    private static String formatMessage(String operation, Duration timeout) {
        return String.format("Operation '%s' timed out after %d ms", operation, timeout.toMillis());
    }
}
