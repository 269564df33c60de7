package replacer.engine;

import replacer.exceptions.ConnectorTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs connector calls under a timeout.
 *
 * <p>Operations that exceed their timeout are cancelled with interruption and surface as
 * {@link ConnectorTimeoutException}. The executor then waits up to {@link #CANCEL_GRACE} for the
 * interrupted call to return, so a retry does not overlap the call it replaces. A call that
 * ignores interruption for longer keeps running on its daemon thread and its result is discarded.
 */
public final class TimeoutExecutor {

    private static final Logger log = LoggerFactory.getLogger(TimeoutExecutor.class);

    // Daemon threads so a stuck connector call never blocks JVM shutdown
    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "replacer-connector-call");
        t.setDaemon(true);
        return t;
    });

    /** How long a timed-out call may take to react to its interrupt. */
    public static final Duration CANCEL_GRACE = Duration.ofSeconds(30);

    private TimeoutExecutor() {
    }

    /**
     * Returns true if the timeout is set and positive.
     */
    public static boolean isEnabled(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }

    /**
     * Executes a callable with a timeout.
     *
     * <p>If the timeout is disabled (null or zero) the callable runs on the calling thread.
     *
     * @param operation the name of the operation (for error messages)
     * @param timeout the timeout duration, or null/zero to disable
     * @param callable the operation to execute
     * @return the result of the callable
     * @throws ConnectorTimeoutException if the operation times out
     * @throws Exception whatever the callable throws
     */
    public static <T> T execute(String operation, Duration timeout, Callable<T> callable) throws Exception {
        if (!isEnabled(timeout)) {
            return callable.call();
        }

        log.debug("Executing '{}' with timeout of {} ms", operation, timeout.toMillis());

        AtomicBoolean started = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);
        Future<T> future = EXECUTOR.submit(() -> {
            started.set(true);
            try {
                return callable.call();
            } finally {
                finished.countDown();
            }
        });

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Operation '{}' timed out after {} ms", operation, timeout.toMillis());
            cancelAndAwait(operation, future, started, finished);
            throw new ConnectorTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConnectorTimeoutException(operation, timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            } else {
                throw new RuntimeException("Operation '" + operation + "' failed", cause);
            }
        }
    }

    private static void cancelAndAwait(String operation, Future<?> future, AtomicBoolean started,
                                       CountDownLatch finished) {
        future.cancel(true);
        if (!started.get()) {
            return;
        }
        try {
            if (!finished.await(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Operation '{}' ignored its interrupt for {} s and is still running",
                        operation, CANCEL_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
