package replacer.engine;

import replacer.exceptions.ConnectorException;
import replacer.exceptions.ConnectorTimeoutException;
import replacer.exceptions.TransientConnectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Retries transient connector failures with exponential backoff.
 *
 * <p>Retried: {@link TransientConnectorException} (including rate limiting) and
 * {@link ConnectorTimeoutException}. Everything else propagates on the first attempt.
 * Each attempt runs under the connector timeout through {@link TimeoutExecutor}.
 *
 * <p>Calls that are not safe to repeat once the remote side may have acted on them, such as
 * starting a deploy, use {@link #executeOnceAfterTimeout} so a timeout is not retried.
 */
public final class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /**
     * A connector call.
     */
    @FunctionalInterface
    public interface ConnectorCall<T> {
        T call() throws ConnectorException;
    }

    /**
     * Notified before each retry.
     */
    @FunctionalInterface
    public interface RetryListener {
        void onRetry(String operation, int failedAttempt, long delayMs, Exception error);
    }

    private final int maxAttempts;
    private final Duration timeout;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration timeout, BackoffCalculator backoff, Sleeper sleeper) {
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be positive");
        this.maxAttempts = maxAttempts;
        this.timeout = timeout;
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs the call, retrying transient failures.
     *
     * @param operation operation name for logs and timeout messages
     * @param call the connector call
     * @param listener notified before each retry
     * @return the call's result
     * @throws ConnectorException the last failure once attempts are exhausted, or the first non-transient one
     * @throws ConnectorTimeoutException if the last attempt timed out
     */
    public <T> T execute(String operation, ConnectorCall<T> call, RetryListener listener)
            throws ConnectorException {
        return execute(operation, call, listener, true);
    }

    /**
     * Like {@link #execute}, but a timeout propagates on the first occurrence. Transient
     * failures reported by the remote side are still retried.
     */
    public <T> T executeOnceAfterTimeout(String operation, ConnectorCall<T> call, RetryListener listener)
            throws ConnectorException {
        return execute(operation, call, listener, false);
    }

    private <T> T execute(String operation, ConnectorCall<T> call, RetryListener listener, boolean retryTimeouts)
            throws ConnectorException {
        int attempt = 1;
        while (true) {
            try {
                return invoke(operation, call);
            } catch (TransientConnectorException | ConnectorTimeoutException e) {
                if (!retryTimeouts && e instanceof ConnectorTimeoutException) {
                    log.warn("'{}' timed out and may have reached the org; not retrying", operation);
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("'{}' failed after {} attempt(s): {}", operation, attempt, e.getMessage());
                    throw e;
                }
                long delayMs = backoff.calculate(attempt);
                listener.onRetry(operation, attempt, delayMs, e);
                backOff(operation, delayMs, e);
                attempt++;
            }
        }
    }

    private void backOff(String operation, long delayMs, Exception cause) throws ConnectorException {
        try {
            sleeper.sleep(Duration.ofMillis(delayMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConnectorException interrupted = new ConnectorException(
                    "Interrupted while waiting to retry '" + operation + "'", e);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }

    private <T> T invoke(String operation, ConnectorCall<T> call) throws ConnectorException {
        try {
            return TimeoutExecutor.execute(operation, timeout, call::call);
        } catch (ConnectorException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ConnectorException("Operation '" + operation + "' failed: " + e.getMessage(), e);
        }
    }
}
