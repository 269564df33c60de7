package replacer.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable timing and volume metrics of one replacement run.
 *
 * <p>Phase durations accumulate across batches: {@code phaseDuration(DEPLOY)} is the total
 * time spent deploying and polling for every batch of the run.
 *
 * <p>Use {@link #summary()} for a one-line log summary, or {@link #toMap()} for JSON.
 *
 * @see RunMetricsCollector
 */
public record RunMetrics(
        String runId,
        Instant startTime,
        Instant endTime,
        Map<Phase, Long> phaseDurations,
        long totalDurationMs,
        int batchesTotal,
        int batchesConfirmed,
        int batchesFailed,
        int retries,
        int reportsScanned
) {
    /**
     * Run phases for timing breakdown.
     */
    public enum Phase {
        /** Field checks and candidate search */
        LOCATE,
        /** Batched retrieve of report definitions */
        RETRIEVE,
        /** Parallel reference rewriting */
        REWRITE,
        /** Durable snapshots of originals */
        BACKUP,
        /** Batched deploy, including status polling */
        DEPLOY
    }

    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * @return accumulated duration of the phase in milliseconds, or 0 if it never ran
     */
    public long phaseDuration(Phase phase) {
        return phaseDurations.getOrDefault(phase, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Run %s in %dms | Batches: %d total, %d confirmed, %d failed | Retries: %d | Reports scanned: %d",
                runId, totalDurationMs, batchesTotal, batchesConfirmed, batchesFailed, retries, reportsScanned);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("batchesTotal", batchesTotal);
        map.put("batchesConfirmed", batchesConfirmed);
        map.put("batchesFailed", batchesFailed);
        map.put("retries", retries);
        map.put("reportsScanned", reportsScanned);
        phaseDurations.forEach((phase, duration) ->
                map.put(phase.name().toLowerCase(Locale.ROOT) + "DurationMs", duration));
        return map;
    }

    static Map<Phase, Long> copyOf(Map<Phase, Long> durations) {
        Map<Phase, Long> copy = new EnumMap<>(Phase.class);
        copy.putAll(durations);
        return copy;
    }
}
