package wingman.cli;

import replacer.engine.RunCancellation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shutdown hook body for a replacement run. On user interrupt it asks the run to stop after the
 * current batch, then holds the JVM open until the command has printed the run summary.
 */
class InterruptGuard implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(InterruptGuard.class);

    private final RunCancellation cancellation;
    private final Duration grace;
    private final CountDownLatch reported = new CountDownLatch(1);

    InterruptGuard(RunCancellation cancellation, Duration grace) {
        this.cancellation = cancellation;
        this.grace = grace;
    }

    @Override
    public void run() {
        cancellation.request();
        log.warn("Interrupted; finishing the current batch before exiting");
        try {
            if (!reported.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run did not report within {} s; exiting anyway", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Called once the summary has been printed, or the command has given up. */
    void reported() {
        reported.countDown();
    }
}
