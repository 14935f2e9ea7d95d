package com.pgstress.service;

import com.pgstress.backend.BatchInserter;
import com.pgstress.backend.BatchPlan;
import com.pgstress.config.WorkloadConfiguration;
import com.pgstress.model.TableDescriptor;
import com.pgstress.pool.ConnectionPoolMonitor;
import com.pgstress.task.TableInsertTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans the insert phase out over a fixed pool of worker threads.
 *
 * <p>One {@link TableInsertTask} is scheduled per table, never per batch.
 * Tasks run concurrently; batches of one table run in order inside its task.
 * The coordinator blocks until every task has finished.
 */
@Service
public class ParallelInsertCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ParallelInsertCoordinator.class);

    private final BatchInserter batchInserter;
    private final JdbcTemplate jdbcTemplate;
    private final ConnectionPoolMonitor poolMonitor;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Constructor for ParallelInsertCoordinator.
     *
     * @param batchInserter inserter for single batches
     * @param jdbcTemplate template over the shared connection pool
     * @param poolMonitor monitor of the shared connection pool
     */
    public ParallelInsertCoordinator(
            BatchInserter batchInserter,
            JdbcTemplate jdbcTemplate,
            ConnectionPoolMonitor poolMonitor) {
        this.batchInserter = batchInserter;
        this.jdbcTemplate = jdbcTemplate;
        this.poolMonitor = poolMonitor;
    }

    /**
     * Inserts {@code rowsPerTable} rows into every table.
     *
     * @param tables the tables created by provisioning
     * @param configuration the run configuration
     * @return shared progress; its inserted count is the sum of all table results
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public InsertProgress insertAll(List<TableDescriptor> tables, WorkloadConfiguration configuration)
            throws InterruptedException {
        long targetRows = (long) tables.size() * configuration.rowsPerTable();
        InsertProgress progress = new InsertProgress(targetRows);
        if (tables.isEmpty()) {
            log.warn("No tables to insert into");
            return progress;
        }

        List<TableInsertTask> tasks = new ArrayList<>(tables.size());
        for (TableDescriptor table : tables) {
            tasks.add(new TableInsertTask(
                table,
                new BatchPlan(configuration.rowsPerTable(), configuration.batchSize()),
                batchInserter,
                jdbcTemplate,
                progress,
                poolMonitor,
                cancelled::get));
        }

        int workers = Math.min(configuration.threads(), tables.size());
        log.info("Inserting {} rows into each of {} tables with {} workers (batch size {})",
            configuration.rowsPerTable(), tables.size(), workers, configuration.batchSize());

        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        long totalInserted = 0;
        try {
            List<Future<Long>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                try {
                    totalInserted += futures.get(i).get();
                } catch (ExecutionException e) {
                    log.error("Insert task for {} failed", tables.get(i).name(), e.getCause());
                }
            }
        } finally {
            executor.shutdownNow();
        }

        if (totalInserted != progress.insertedRows()) {
            log.warn("Task totals ({}) and progress counter ({}) disagree", totalInserted, progress.insertedRows());
        }
        log.info("Inserted {} of {} rows ({} failed batches, peak pool pressure {})",
            totalInserted, targetRows, progress.failedBatches(),
            String.format("%.2f", progress.peakPoolPressure()));
        return progress;
    }

    /**
     * Asks running insert tasks to stop before their next batch.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.warn("Insert workload cancellation requested");
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "insert-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
