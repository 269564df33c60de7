package replacer.engine;

import replacer.model.BatchJob;
import replacer.model.ReportDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the candidate list into contiguous batches, keeping locator order.
 */
public final class BatchPartitioner {

    private BatchPartitioner() {
    }

    /**
     * @return {@code ceil(n / batchSize)} batches numbered from 1; empty for no candidates
     */
    public static List<BatchJob> partition(List<ReportDescriptor> candidates, int batchSize) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive");
        List<BatchJob> batches = new ArrayList<>();
        for (int from = 0, id = 1; from < candidates.size(); from += batchSize, id++) {
            int to = Math.min(from + batchSize, candidates.size());
            batches.add(new BatchJob(id, candidates.subList(from, to)));
        }
        return batches;
    }
}
