package org.scout.core.exec;

import java.util.ArrayList;
import java.util.List;

final class BatchPlanner {

    private BatchPlanner() {
    }

    /**
     * Splits {@code items} into consecutive chunks of at most {@code size}, keeping order.
     */
    static <T> List<List<T>> partition(List<T> items, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Batch size must be positive: " + size);
        }
        List<List<T>> batches = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            batches.add(List.copyOf(items.subList(start, Math.min(items.size(), start + size))));
        }
        return batches;
    }
}
