package com.pgstress.service;

import com.pgstress.TestDatabases;
import com.pgstress.backend.BatchInserter;
import com.pgstress.config.WorkloadConfiguration;
import com.pgstress.generator.RowGenerator;
import com.pgstress.generator.SchemaGenerator;
import com.pgstress.model.StressTestReport;
import com.pgstress.pool.ConnectionPoolMonitor;
import com.pgstress.repository.StressTableRepository;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import static com.pgstress.TestDatabases.SCHEMA;
import static org.assertj.core.api.Assertions.assertThat;

class StressWorkloadTest {

    private HikariDataSource dataSource;
    private StressTableRepository repository;
    private SimpleMeterRegistry meterRegistry;
    private String url;

    @BeforeEach
    void setUp() {
        url = TestDatabases.h2Url("workload");
        dataSource = TestDatabases.pool(url, 4);
        repository = new StressTableRepository(TestDatabases.jdbcTemplate(dataSource));
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    private StressWorkload workload(WorkloadConfiguration configuration) {
        JdbcTemplate jdbcTemplate = TestDatabases.jdbcTemplate(dataSource);
        TransactionTemplate transactionTemplate = TestDatabases.transactionTemplate(dataSource);
        BatchInserter inserter = new BatchInserter(repository, new RowGenerator(), configuration, meterRegistry);
        return new StressWorkload(
            new TableProvisioner(repository, new SchemaGenerator(), transactionTemplate, meterRegistry),
            new ParallelInsertCoordinator(inserter, jdbcTemplate, new ConnectionPoolMonitor(dataSource, meterRegistry)),
            new RowUpdater(repository, transactionTemplate, meterRegistry),
            new QueryRunner(repository),
            new DatabaseStatistics(repository));
    }

    @Test
    @DisplayName("A full run provisions, fills, updates and samples every table")
    void fullRun() throws Exception {
        WorkloadConfiguration configuration = TestDatabases.configuration(url, 3, 100, 6, 40, 2);

        StressTestReport report = workload(configuration).run(configuration);

        assertThat(report.tablesRequested()).isEqualTo(3);
        assertThat(report.tablesCreated()).isEqualTo(3);
        assertThat(report.rowsTargeted()).isEqualTo(300);
        assertThat(report.rowsInserted()).isEqualTo(300);
        assertThat(report.batchesFailed()).isZero();
        assertThat(report.peakPoolPressure()).isBetween(0.0, 1.0).isGreaterThan(0.0);
        assertThat(report.tablesUpdated()).isEqualTo(3);
        assertThat(report.queriesSucceeded()).isEqualTo(QueryRunner.SAMPLE_QUERIES);
        assertThat(report.stressTablesInCatalog()).contains(3L);
        assertThat(report.elapsed()).isPositive();

        for (String table : repository.findTablesWithPrefix(SCHEMA, SchemaGenerator.TABLE_PREFIX)) {
            assertThat(repository.countRows(table)).isEqualTo(100);
        }
        assertThat(meterRegistry.get("stress.updates.rows").counter().count()).isEqualTo(30.0);
    }

    @Test
    @DisplayName("Size probes that the server does not support leave the figure unknown")
    void sizeUnknownWithoutPostgresFunctions() throws Exception {
        WorkloadConfiguration configuration = TestDatabases.configuration(url, 1, 10, 2, 10, 1);

        StressTestReport report = workload(configuration).run(configuration);

        assertThat(report.databaseSize()).isEmpty();
        assertThat(report.rowsInserted()).isEqualTo(10);
    }

    @Test
    @DisplayName("A cancelled run skips updates and queries")
    void cancelledRun() throws Exception {
        WorkloadConfiguration configuration = TestDatabases.configuration(url, 2, 20, 2, 10, 2);
        StressWorkload workload = workload(configuration);

        workload.cancel();
        StressTestReport report = workload.run(configuration);

        assertThat(report.tablesCreated()).isEqualTo(2);
        assertThat(report.rowsInserted()).isZero();
        assertThat(report.tablesUpdated()).isZero();
        assertThat(report.queriesSucceeded()).isZero();
    }
}
