package com.pgstress.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a table's target row count into insert batches.
 *
 * <p>Every batch holds {@code batchSize} rows except the last, which holds the
 * remainder; the sizes always add up to the target.
 */
public final class BatchPlan {

    private final int totalRows;
    private final int batchSize;

    public BatchPlan(int totalRows, int batchSize) {
        if (totalRows < 0) {
            throw new IllegalArgumentException("totalRows must not be negative: " + totalRows);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.totalRows = totalRows;
        this.batchSize = batchSize;
    }

    public int batchCount() {
        return (int) (((long) totalRows + batchSize - 1) / batchSize);
    }

    /**
     * Gets the size of one batch.
     *
     * @param batchNumber 1-based batch number
     * @return rows in that batch
     */
    public int sizeOf(int batchNumber) {
        if (batchNumber < 1 || batchNumber > batchCount()) {
            throw new IndexOutOfBoundsException("Batch " + batchNumber + " of " + batchCount());
        }
        return Math.min(batchSize, totalRows - (batchNumber - 1) * batchSize);
    }

    public List<Integer> sizes() {
        int count = batchCount();
        List<Integer> sizes = new ArrayList<>(count);
        for (int batch = 1; batch <= count; batch++) {
            sizes.add(sizeOf(batch));
        }
        return Collections.unmodifiableList(sizes);
    }

    public int totalRows() {
        return totalRows;
    }
}
