package com.pgstress.task;

import com.pgstress.backend.BatchInserter;
import com.pgstress.backend.BatchPlan;
import com.pgstress.model.TableDescriptor;
import com.pgstress.pool.ConnectionPoolMonitor;
import com.pgstress.service.InsertProgress;
import com.pgstress.service.ProgressBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;

/**
 * Inserts every planned row of one table.
 *
 * <p>The task borrows a single pooled connection through
 * {@link JdbcTemplate#execute(ConnectionCallback)} and holds it until its last
 * batch is done; the template returns it to the pool on every exit path.
 * Batches run sequentially and each one is its own transaction. The
 * cancellation signal is checked before every batch. Pool pressure is sampled
 * with each progress line, while this task still holds its connection.
 */
public class TableInsertTask implements Callable<Long> {

    private static final Logger log = LoggerFactory.getLogger(TableInsertTask.class);

    /** Progress is logged every this many batches, and after a table's last batch. */
    static final int PROGRESS_EVERY_BATCHES = 5;

    private final TableDescriptor table;
    private final BatchPlan plan;
    private final BatchInserter batchInserter;
    private final JdbcTemplate jdbcTemplate;
    private final InsertProgress progress;
    private final ConnectionPoolMonitor poolMonitor;
    private final BooleanSupplier cancelled;

    /**
     * Constructor for TableInsertTask.
     *
     * @param table the table to fill
     * @param plan batch split of the table's target rows
     * @param batchInserter inserter for single batches
     * @param jdbcTemplate template over the shared connection pool
     * @param progress shared progress counters
     * @param poolMonitor monitor of the shared connection pool
     * @param cancelled returns true once the workload should stop
     */
    public TableInsertTask(
            TableDescriptor table,
            BatchPlan plan,
            BatchInserter batchInserter,
            JdbcTemplate jdbcTemplate,
            InsertProgress progress,
            ConnectionPoolMonitor poolMonitor,
            BooleanSupplier cancelled) {
        this.table = table;
        this.plan = plan;
        this.batchInserter = batchInserter;
        this.jdbcTemplate = jdbcTemplate;
        this.progress = progress;
        this.poolMonitor = poolMonitor;
        this.cancelled = cancelled;
    }

    /**
     * Runs all batches of the table.
     *
     * @return rows inserted into the table, 0 if no connection could be borrowed
     */
    @Override
    public Long call() {
        try {
            Long inserted = jdbcTemplate.execute((ConnectionCallback<Long>) this::insertAll);
            return inserted != null ? inserted : 0L;
        } catch (DataAccessException e) {
            log.error("Insert task for {} aborted: {}", table.name(), e.getMessage());
            return 0L;
        }
    }

    private long insertAll(Connection connection) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        long inserted = 0;
        int totalBatches = plan.batchCount();
        try {
            for (int batch = 1; batch <= totalBatches; batch++) {
                if (cancelled.getAsBoolean()) {
                    log.warn("Insert into {} cancelled after {}/{} batches", table.name(), batch - 1, totalBatches);
                    break;
                }
                int size = plan.sizeOf(batch);
                int rows = batchInserter.insertBatch(connection, table, size, batch, totalBatches);
                inserted += rows;
                long overall = progress.record(rows, rows == size);
                if (batch % PROGRESS_EVERY_BATCHES == 0 || batch == totalBatches) {
                    log.info("Inserting {}", ProgressBar.render(overall, progress.targetRows()));
                    progress.observePoolPressure(poolMonitor.logSnapshot("insert").pressure());
                }
            }
        } finally {
            restoreAutoCommit(connection, autoCommit);
        }
        log.debug("Table {} done: {}/{} rows", table.name(), inserted, plan.totalRows());
        return inserted;
    }

    /**
     * Puts auto-commit back before the connection returns to the pool. A
     * connection that died mid-table cannot take it; the rows committed before
     * that still count.
     */
    private void restoreAutoCommit(Connection connection, boolean autoCommit) {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.warn("Could not restore auto-commit on the connection used for {}: {}", table.name(), e.getMessage());
        }
    }
}
