package com.pgstress.service;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAccumulator;

/**
 * Running totals of the insert phase, shared by all insert workers.
 *
 * <p>Each update is a single atomic read-modify-write, so the final value is
 * the sum of every batch result whatever the interleaving.
 */
public class InsertProgress {

    private final long targetRows;
    private final AtomicLong insertedRows = new AtomicLong();
    private final AtomicLong completedBatches = new AtomicLong();
    private final AtomicLong failedBatches = new AtomicLong();
    private final DoubleAccumulator peakPoolPressure = new DoubleAccumulator(Math::max, 0.0);

    public InsertProgress(long targetRows) {
        this.targetRows = targetRows;
    }

    /**
     * Records one finished batch.
     *
     * @param rows rows the batch inserted, 0 if it failed
     * @param succeeded whether the batch committed
     * @return inserted rows across all workers, including this batch
     */
    public long record(int rows, boolean succeeded) {
        completedBatches.incrementAndGet();
        if (!succeeded) {
            failedBatches.incrementAndGet();
        }
        return insertedRows.addAndGet(rows);
    }

    public long insertedRows() {
        return insertedRows.get();
    }

    public long targetRows() {
        return targetRows;
    }

    public long completedBatches() {
        return completedBatches.get();
    }

    public long failedBatches() {
        return failedBatches.get();
    }

    /**
     * Keeps the highest connection pool pressure seen during the phase.
     *
     * @param pressure a pressure sample, 0.0 to 1.0
     */
    public void observePoolPressure(double pressure) {
        peakPoolPressure.accumulate(pressure);
    }

    public double peakPoolPressure() {
        return peakPoolPressure.get();
    }

    public String render() {
        return ProgressBar.render(insertedRows.get(), targetRows);
    }
}
