package replacer.engine;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation of a run.
 *
 * <p>The orchestrator checks {@link #isRequested()} between batches only: a batch that has
 * started always reaches a terminal state. {@link #awaitCompletion(long, TimeUnit)} lets a
 * shutdown hook wait until the run has stopped.
 */
public final class RunCancellation {

    private final AtomicBoolean requested = new AtomicBoolean();
    private final CountDownLatch finished = new CountDownLatch(1);

    public void request() {
        requested.set(true);
    }

    public boolean isRequested() {
        return requested.get();
    }

    /** Called by the orchestrator when the run has stopped, whatever the outcome. */
    void markFinished() {
        finished.countDown();
    }

    public boolean isFinished() {
        return finished.getCount() == 0;
    }

    /**
     * @return true if the run finished within the timeout
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }
}
