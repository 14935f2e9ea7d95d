package com.pgstress.service;

import com.pgstress.TestDatabases;
import com.pgstress.generator.SchemaGenerator;
import com.pgstress.model.ColumnDefinition;
import com.pgstress.model.ColumnType;
import com.pgstress.model.TableDescriptor;
import com.pgstress.repository.StressTableRepository;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static com.pgstress.TestDatabases.SCHEMA;
import static org.assertj.core.api.Assertions.assertThat;

class StressTableCleanerTest {

    private HikariDataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private StressTableRepository repository;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabases.pool(TestDatabases.h2Url("cleaner"), 2);
        jdbcTemplate = TestDatabases.jdbcTemplate(dataSource);
        repository = new StressTableRepository(jdbcTemplate);
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    @Test
    void dropsOnlyStressTables() {
        SchemaGenerator generator = new SchemaGenerator();
        for (int i = 0; i < 3; i++) {
            repository.createTable(new TableDescriptor(generator.nextTableName(), generator.nextColumns(2)));
        }
        jdbcTemplate.execute("CREATE TABLE customers (id INT PRIMARY KEY)");

        int remaining = new StressTableCleaner(repository).dropAll(SCHEMA);

        assertThat(remaining).isZero();
        assertThat(repository.findTablesWithPrefix(SCHEMA, SchemaGenerator.TABLE_PREFIX)).isEmpty();
        assertThat(repository.tableExists(SCHEMA, "customers")).isTrue();
    }

    @Test
    void nothingToDrop() {
        assertThat(new StressTableCleaner(repository).dropAll(SCHEMA)).isZero();
    }

    @Test
    void statisticsCountLeftoverTables() {
        repository.createTable(new TableDescriptor("stress_table_leftover",
            List.of(new ColumnDefinition("col_1_int", ColumnType.INTEGER))));

        DatabaseStatistics statistics = new DatabaseStatistics(repository);

        assertThat(statistics.stressTableCount(SCHEMA)).contains(1L);
        assertThat(statistics.databaseSize()).isEmpty();
    }
}
