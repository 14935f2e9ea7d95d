package com.pgstress.service;

import com.pgstress.model.TableDescriptor;
import com.pgstress.repository.StressTableRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Bulk-updates random rows of the provisioned tables.
 *
 * <p>Each table is one transaction: {@code updated_at} moves to the current
 * time and the table's first INTEGER or BIGINT column, if it has one, is
 * incremented. A failed table is rolled back and the phase continues.
 */
@Service
public class RowUpdater {

    private static final Logger log = LoggerFactory.getLogger(RowUpdater.class);

    private final StressTableRepository repository;
    private final TransactionTemplate transactionTemplate;

    private final Counter tablesUpdatedCounter;
    private final Counter tablesFailedCounter;
    private final Counter rowsUpdatedCounter;

    public RowUpdater(
            StressTableRepository repository,
            TransactionTemplate transactionTemplate,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.tablesUpdatedCounter = Counter.builder("stress.updates.tables.success")
            .description("Tables whose bulk update committed")
            .register(meterRegistry);
        this.tablesFailedCounter = Counter.builder("stress.updates.tables.failure")
            .description("Tables whose bulk update was rolled back")
            .register(meterRegistry);
        this.rowsUpdatedCounter = Counter.builder("stress.updates.rows")
            .description("Rows touched by bulk updates")
            .register(meterRegistry);
    }

    /**
     * Updates {@code rowsPerTable} random rows of every table.
     *
     * @param tables the provisioned tables
     * @param rowsPerTable rows to pick per table
     * @return number of tables whose update committed
     */
    public int updateAll(List<TableDescriptor> tables, int rowsPerTable) {
        if (tables.isEmpty()) {
            log.warn("No tables to update, skipping updates");
            return 0;
        }
        log.info("Updating {} random rows in each of {} tables...", rowsPerTable, tables.size());
        int updated = 0;
        for (int i = 0; i < tables.size(); i++) {
            if (update(tables.get(i), rowsPerTable)) {
                updated++;
            }
            log.debug("Updating {}", ProgressBar.render(i + 1, tables.size()));
        }
        if (updated == tables.size()) {
            log.info("✓ Updates completed");
        } else {
            log.warn("⚠ Updated {} out of {} tables", updated, tables.size());
        }
        return updated;
    }

    /**
     * Updates {@code count} random rows of one table in a single transaction.
     *
     * @param table the table
     * @param count rows to pick
     * @return true if the update committed
     */
    public boolean update(TableDescriptor table, int count) {
        try {
            Integer rows = transactionTemplate.execute(status -> repository.updateRandomRows(table, count));
            int touched = rows != null ? rows : 0;
            rowsUpdatedCounter.increment(touched);
            tablesUpdatedCounter.increment();
            log.debug("Updated {} rows of {}{}", touched, table.name(),
                table.firstUpdatableColumn().map(column -> ", incremented " + column.name()).orElse(""));
            return true;
        } catch (DataAccessException e) {
            tablesFailedCounter.increment();
            log.error("Failed to update table {}: {}", table.name(), e.getMessage());
            return false;
        }
    }
}
