package replacer.report;

import replacer.model.ChangeEntry;
import replacer.model.ChangeOutcome;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Accumulates per-report outcomes of a run.
 *
 * <p>Rewrite workers call {@link #scanned} concurrently; the orchestrator records the final
 * {@link ChangeEntry} of each report once its batch is terminal. All updates go through one
 * lock.
 */
public class ChangeReport {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ChangeEntry> entries = new ArrayList<>();
    private final Set<String> scannedReports = new HashSet<>();

    /**
     * Notes that a report definition has been examined.
     */
    public void scanned(String reportId) {
        lock.lock();
        try {
            scannedReports.add(reportId);
        } finally {
            lock.unlock();
        }
    }

    public void record(ChangeEntry entry) {
        lock.lock();
        try {
            entries.add(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the entries, ordered by batch and report id.
     */
    public List<ChangeEntry> entries() {
        lock.lock();
        try {
            List<ChangeEntry> copy = new ArrayList<>(entries);
            copy.sort(Comparator.comparingInt(ChangeEntry::batchId).thenComparing(ChangeEntry::reportId));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    public RunSummary.Counters counters() {
        lock.lock();
        try {
            int matched = 0;
            int replaced = 0;
            int skipped = 0;
            int failed = 0;
            for (ChangeEntry e : entries) {
                if (e.matched()) matched++;
                switch (e.outcome()) {
                    case REPLACED -> replaced++;
                    case MALFORMED -> skipped++;
                    case FAILED -> failed++;
                    default -> { }
                }
            }
            return new RunSummary.Counters(scannedReports.size(), matched, replaced, skipped, failed);
        } finally {
            lock.unlock();
        }
    }

    public int count(ChangeOutcome outcome) {
        lock.lock();
        try {
            return (int) entries.stream().filter(e -> e.outcome() == outcome).count();
        } finally {
            lock.unlock();
        }
    }
}
