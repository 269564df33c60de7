package replacer.report;

import replacer.model.BatchStatus;
import replacer.model.ChangeEntry;
import replacer.model.ChangeOutcome;

import java.io.PrintWriter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link RunSummary} for the operator.
 *
 * <p>The only place in the engine that writes to the terminal.
 */
public class ChangeReportPrinter {

    private final PrintWriter out;

    public ChangeReportPrinter(PrintWriter out) {
        this.out = out;
    }

    public void print(RunSummary summary) {
        out.printf("Run %s: %s -> %s%s%n", summary.runId(), summary.oldField(), summary.newField(),
                summary.dryRun() ? " (dry run)" : "");

        if (summary.dryRun()) {
            printPreview(summary);
        } else {
            printReplaced(summary);
        }

        List<ChangeEntry> malformed = summary.entries().stream()
                .filter(e -> e.outcome() == ChangeOutcome.MALFORMED).toList();
        if (!malformed.isEmpty()) {
            out.println();
            out.println("Skipped (malformed definition):");
            malformed.forEach(e -> out.printf("  %s  %s%s%n", e.reportId(), nameOf(e), detailOf(e)));
        }

        if (!summary.succeeded()) {
            printBatchStates(summary);
        }

        RunSummary.Counters c = summary.counters();
        out.println();
        out.printf("Scanned: %d  Matched: %d  Replaced: %d  Skipped: %d  Failed: %d%n",
                c.scanned(), c.matched(), c.replaced(), c.skipped(), c.failed());
        if (summary.runError() != null) {
            out.println("Run failed: " + summary.runError());
        }
        if (summary.cancelled()) {
            out.println("Run cancelled; rerun with --resume to continue.");
        }
        out.flush();
    }

    private void printPreview(RunSummary summary) {
        List<ChangeEntry> previewed = summary.entries().stream()
                .filter(e -> e.outcome() == ChangeOutcome.PREVIEWED).toList();
        out.println();
        if (previewed.isEmpty()) {
            out.println("No report references " + summary.oldField() + ".");
            return;
        }
        out.printf("Would update %d report(s):%n", previewed.size());
        for (ChangeEntry e : previewed) {
            out.printf("  [batch %d] %s  %s  (%d reference%s)%n", e.batchId(), e.reportId(), nameOf(e),
                    e.referencesFound(), e.referencesFound() == 1 ? "" : "s");
        }
    }

    private void printReplaced(RunSummary summary) {
        List<ChangeEntry> replaced = summary.entries().stream()
                .filter(e -> e.outcome() == ChangeOutcome.REPLACED).toList();
        out.println();
        out.printf("Updated %d report(s)%n", replaced.size());
        for (ChangeEntry e : replaced) {
            out.printf("  [batch %d] %s  %s  (%d replaced)%n", e.batchId(), e.reportId(), nameOf(e),
                    e.referencesReplaced());
        }
    }

    private void printBatchStates(RunSummary summary) {
        out.println();
        out.println("Confirmed batches:     " + ids(summary.batchesIn(BatchStatus.CONFIRMED)));
        out.println("Skipped batches:       " + ids(summary.batchesIn(BatchStatus.SKIPPED)));
        List<BatchSummary> failed = summary.batchesIn(BatchStatus.FAILED);
        out.println("Failed batches:        " + ids(failed));
        for (BatchSummary b : failed) {
            out.printf("  batch %d: %s%n", b.batchId(), b.failureMessage());
        }
        out.println("Not attempted batches: " + ids(summary.batchesIn(BatchStatus.PENDING)));
    }

    private static String ids(List<BatchSummary> batches) {
        if (batches.isEmpty()) return "none";
        return batches.stream().map(b -> String.valueOf(b.batchId())).collect(Collectors.joining(", "));
    }

    private static String nameOf(ChangeEntry e) {
        return e.fullName() != null ? e.fullName() : "";
    }

    private static String detailOf(ChangeEntry e) {
        return e.detail() != null ? "  " + e.detail() : "";
    }
}
