package com.pgstress.service;

import com.pgstress.TestDatabases;
import com.pgstress.backend.BatchInserter;
import com.pgstress.config.WorkloadConfiguration;
import com.pgstress.generator.RowGenerator;
import com.pgstress.generator.SchemaGenerator;
import com.pgstress.model.TableDescriptor;
import com.pgstress.pool.ConnectionPoolMonitor;
import com.pgstress.repository.StressTableRepository;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ParallelInsertCoordinatorTest {

    private HikariDataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private StressTableRepository repository;
    private SimpleMeterRegistry meterRegistry;
    private String url;

    @BeforeEach
    void setUp() {
        url = TestDatabases.h2Url("coordinator");
        dataSource = TestDatabases.pool(url, 6);
        jdbcTemplate = TestDatabases.jdbcTemplate(dataSource);
        repository = new StressTableRepository(jdbcTemplate);
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    /**
     * Records batch sizes per table and which threads ran them.
     */
    private static class RecordingBatchInserter extends BatchInserter {
        final Map<String, List<Integer>> sizes = new ConcurrentHashMap<>();
        final List<String> threads = new CopyOnWriteArrayList<>();

        RecordingBatchInserter(StressTableRepository repository, WorkloadConfiguration configuration,
                MeterRegistry meterRegistry) {
            super(repository, new RowGenerator(), configuration, meterRegistry);
        }

        @Override
        public int insertBatch(Connection connection, TableDescriptor table, int rowCount,
                int batchNumber, int totalBatches) {
            sizes.computeIfAbsent(table.name(), name -> new CopyOnWriteArrayList<>()).add(rowCount);
            threads.add(Thread.currentThread().getName());
            return super.insertBatch(connection, table, rowCount, batchNumber, totalBatches);
        }
    }

    private List<TableDescriptor> createTables(int count, int cols) {
        SchemaGenerator generator = new SchemaGenerator();
        List<TableDescriptor> tables = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            TableDescriptor table = new TableDescriptor(generator.nextTableName(), generator.nextColumns(cols));
            repository.createTable(table);
            tables.add(table);
        }
        return tables;
    }

    private ParallelInsertCoordinator coordinator(BatchInserter inserter) {
        return new ParallelInsertCoordinator(inserter, jdbcTemplate, new ConnectionPoolMonitor(dataSource, meterRegistry));
    }

    @Test
    @DisplayName("More tables than workers: every table gets all rows in planned batches")
    void fillsEveryTable() throws Exception {
        WorkloadConfiguration configuration = TestDatabases.configuration(url, 3, 100, 5, 40, 2);
        List<TableDescriptor> tables = createTables(3, 5);
        RecordingBatchInserter inserter = new RecordingBatchInserter(repository, configuration, meterRegistry);

        InsertProgress progress = coordinator(inserter).insertAll(tables, configuration);

        assertThat(progress.insertedRows()).isEqualTo(300);
        assertThat(progress.targetRows()).isEqualTo(300);
        assertThat(progress.completedBatches()).isEqualTo(9);
        assertThat(progress.failedBatches()).isZero();
        for (TableDescriptor table : tables) {
            assertThat(repository.countRows(table.name())).isEqualTo(100);
            assertThat(inserter.sizes.get(table.name())).containsExactly(40, 40, 20);
        }
        assertThat(inserter.threads).allMatch(name -> name.startsWith("insert-worker-"));
        assertThat(inserter.threads.stream().distinct().count()).isLessThanOrEqualTo(2);
        assertThat(meterRegistry.get("stress.rows.inserted").counter().count()).isEqualTo(300.0);
        assertThat(progress.peakPoolPressure()).isGreaterThan(0.0);
    }

    @Test
    @DisplayName("A table whose batches fail does not stop the other tables")
    void failingTableIsIsolated() throws Exception {
        WorkloadConfiguration configuration = TestDatabases.configuration(url, 2, 50, 3, 20, 2);
        List<TableDescriptor> tables = createTables(2, 3);
        repository.dropTable(tables.get(0).name());
        BatchInserter inserter = new BatchInserter(repository, new RowGenerator(), configuration, meterRegistry);

        InsertProgress progress = coordinator(inserter).insertAll(tables, configuration);

        assertThat(progress.insertedRows()).isEqualTo(50);
        assertThat(progress.failedBatches()).isEqualTo(3);
        assertThat(repository.countRows(tables.get(1).name())).isEqualTo(50);
        assertThat(meterRegistry.get("stress.batches.failure").counter().count()).isEqualTo(3.0);
        assertThat(meterRegistry.get("stress.rows.failed").counter().count()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Cancellation before the run stops every table before its first batch")
    void cancelledBeforeStart() throws Exception {
        WorkloadConfiguration configuration = TestDatabases.configuration(url, 2, 50, 3, 10, 2);
        List<TableDescriptor> tables = createTables(2, 3);
        ParallelInsertCoordinator coordinator =
            coordinator(new BatchInserter(repository, new RowGenerator(), configuration, meterRegistry));

        coordinator.cancel();
        InsertProgress progress = coordinator.insertAll(tables, configuration);

        assertThat(coordinator.isCancelled()).isTrue();
        assertThat(progress.insertedRows()).isZero();
        assertThat(progress.completedBatches()).isZero();
        assertThat(repository.countRows(tables.get(0).name())).isZero();
    }

    @Test
    @DisplayName("No tables means no work")
    void noTables() throws Exception {
        WorkloadConfiguration configuration = TestDatabases.configuration(url, 1, 10, 1, 10, 1);

        InsertProgress progress = coordinator(
            new BatchInserter(repository, new RowGenerator(), configuration, meterRegistry)).insertAll(List.of(), configuration);

        assertThat(progress.insertedRows()).isZero();
        assertThat(progress.targetRows()).isZero();
    }
}
