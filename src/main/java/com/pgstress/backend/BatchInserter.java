package com.pgstress.backend;

import com.pgstress.config.WorkloadConfiguration;
import com.pgstress.generator.RowGenerator;
import com.pgstress.model.Row;
import com.pgstress.model.TableDescriptor;
import com.pgstress.repository.StressTableRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Generates and inserts one batch of rows as a single transaction.
 *
 * <p>The batch goes out as one multi-row INSERT on the worker's connection and
 * is committed on success. A failing batch is rolled back and reported as zero
 * rows; the caller moves on to its next batch.
 */
@Component
public class BatchInserter {

    private static final Logger log = LoggerFactory.getLogger(BatchInserter.class);

    private final StressTableRepository repository;
    private final RowGenerator rowGenerator;
    private final int queryTimeoutSeconds;

    private final Counter batchCounter;
    private final Counter batchSuccessCounter;
    private final Counter batchFailureCounter;
    private final Counter rowSuccessCounter;
    private final Counter rowFailureCounter;
    private final Timer batchTimer;

    /**
     * Constructor for BatchInserter.
     *
     * @param repository the stress table repository
     * @param rowGenerator generator for the batch rows
     * @param configuration the run configuration, for the statement timeout
     * @param meterRegistry the Micrometer meter registry
     */
    public BatchInserter(
            StressTableRepository repository,
            RowGenerator rowGenerator,
            WorkloadConfiguration configuration,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.rowGenerator = rowGenerator;
        this.queryTimeoutSeconds = configuration.queryTimeoutSeconds();

        this.batchCounter = Counter.builder("stress.batches.total")
            .description("Total number of insert batches attempted")
            .register(meterRegistry);
        this.batchSuccessCounter = Counter.builder("stress.batches.success")
            .description("Insert batches committed")
            .register(meterRegistry);
        this.batchFailureCounter = Counter.builder("stress.batches.failure")
            .description("Insert batches rolled back")
            .register(meterRegistry);
        this.rowSuccessCounter = Counter.builder("stress.rows.inserted")
            .description("Rows committed by insert batches")
            .register(meterRegistry);
        this.rowFailureCounter = Counter.builder("stress.rows.failed")
            .description("Rows lost with rolled back batches")
            .register(meterRegistry);
        this.batchTimer = Timer.builder("stress.batch.duration")
            .description("Generate, insert and commit time of one batch")
            .register(meterRegistry);
    }

    /**
     * Inserts one batch into {@code table}.
     *
     * <p>The connection must have auto-commit disabled; this method commits or
     * rolls back the batch itself.
     *
     * @param connection the connection owned by the calling worker
     * @param table the target table
     * @param rowCount rows in this batch
     * @param batchNumber 1-based batch number, for logging
     * @param totalBatches batches planned for the table, for logging
     * @return rows inserted, 0 when the batch failed
     */
    public int insertBatch(Connection connection, TableDescriptor table, int rowCount,
            int batchNumber, int totalBatches) {
        batchCounter.increment();
        Timer.Sample sample = Timer.start();
        try {
            List<Row> rows = rowGenerator.nextRows(table.columns(), rowCount);
            int inserted = repository.insertRows(connection, table, rows, queryTimeoutSeconds);
            connection.commit();
            batchSuccessCounter.increment();
            rowSuccessCounter.increment(inserted);
            log.debug("Batch {}/{} committed {} rows into {}", batchNumber, totalBatches, inserted, table.name());
            return inserted;
        } catch (SQLException | RuntimeException e) {
            rollback(connection, table);
            batchFailureCounter.increment();
            rowFailureCounter.increment(rowCount);
            log.error("Failed to insert batch {}/{} into {}: {}",
                batchNumber, totalBatches, table.name(), e.getMessage());
            return 0;
        } finally {
            sample.stop(batchTimer);
        }
    }

    private void rollback(Connection connection, TableDescriptor table) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed on {}: {}", table.name(), e.getMessage());
        }
    }
}
