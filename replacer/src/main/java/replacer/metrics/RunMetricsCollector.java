package replacer.metrics;

import replacer.metrics.RunMetrics.Phase;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects phase timings and batch counters while a run executes.
 *
 * <h2>Usage:</h2>
 * <pre>
 * RunMetricsCollector metrics = new RunMetricsCollector(clock);
 * metrics.start(runId);
 *
 * List&lt;ReportDescriptor&gt; retrieved = metrics.timed(Phase.RETRIEVE, () -&gt; connector.retrieve(ctx, batch));
 * metrics.batchConfirmed();
 *
 * RunMetrics result = metrics.finish();
 * </pre>
 *
 * <p>Only the orchestrator thread records into a collector.
 */
public final class RunMetricsCollector {

    private final Clock clock;
    private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);
    private final AtomicInteger retries = new AtomicInteger();

    private String runId;
    private Instant startTime;
    private int batchesTotal;
    private int batchesConfirmed;
    private int batchesFailed;
    private int reportsScanned;

    public RunMetricsCollector() {
        this(Clock.systemUTC());
    }

    public RunMetricsCollector(Clock clock) {
        this.clock = clock;
    }

    /**
     * Starts collection for a new run, discarding anything recorded before.
     *
     * @return this collector for method chaining
     */
    public RunMetricsCollector start(String runId) {
        this.runId = runId;
        this.startTime = clock.instant();
        this.phaseDurations.clear();
        this.retries.set(0);
        this.batchesTotal = 0;
        this.batchesConfirmed = 0;
        this.batchesFailed = 0;
        this.reportsScanned = 0;
        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a phase and run the action (can throw checked exceptions).
     */
    public <E extends Exception> void timed(Phase phase, ThrowingRunnable<E> action) throws E {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            record(phase, System.nanoTime() - start);
        }
    }

    /**
     * Time a phase and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(Phase phase, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(phase, System.nanoTime() - start);
        }
    }

    private void record(Phase phase, long nanos) {
        phaseDurations.merge(phase, Duration.ofNanos(nanos).toMillis(), Long::sum);
    }

    public RunMetricsCollector batchesTotal(int count) {
        this.batchesTotal = count;
        return this;
    }

    public RunMetricsCollector reportsScanned(int count) {
        this.reportsScanned = count;
        return this;
    }

    public void batchConfirmed() {
        batchesConfirmed++;
    }

    public void batchFailed() {
        batchesFailed++;
    }

    public void retried() {
        retries.incrementAndGet();
    }

    /**
     * Finishes collection and returns the metrics.
     */
    public RunMetrics finish() {
        Instant endTime = clock.instant();
        return new RunMetrics(
                runId,
                startTime,
                endTime,
                RunMetrics.copyOf(phaseDurations),
                Duration.between(startTime, endTime).toMillis(),
                batchesTotal,
                batchesConfirmed,
                batchesFailed,
                retries.get(),
                reportsScanned);
    }
}
