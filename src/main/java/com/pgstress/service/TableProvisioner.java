package com.pgstress.service;

import com.pgstress.config.WorkloadConfiguration;
import com.pgstress.generator.SchemaGenerator;
import com.pgstress.model.ColumnDefinition;
import com.pgstress.model.ProvisioningResult;
import com.pgstress.model.TableDescriptor;
import com.pgstress.repository.StressTableRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates the randomly named, randomly shaped stress tables.
 *
 * <p>Each attempt draws a name, checks it against the catalog and, if it is
 * free, creates the table and its index in one transaction. Collisions and
 * failures consume attempts from a budget of {@value #ATTEMPTS_PER_TABLE} per
 * requested table shared by the whole phase; when it runs out the phase ends
 * with fewer tables than requested.
 */
@Service
public class TableProvisioner {

    private static final Logger log = LoggerFactory.getLogger(TableProvisioner.class);

    static final int ATTEMPTS_PER_TABLE = 3;

    private final StressTableRepository repository;
    private final SchemaGenerator schemaGenerator;
    private final TransactionTemplate transactionTemplate;

    private final Counter createdCounter;
    private final Counter failedCounter;
    private final Counter collisionCounter;

    /**
     * Constructor for TableProvisioner.
     *
     * @param repository the stress table repository
     * @param schemaGenerator source of table names and column layouts
     * @param transactionTemplate template wrapping each table creation
     * @param meterRegistry the Micrometer meter registry
     */
    public TableProvisioner(
            StressTableRepository repository,
            SchemaGenerator schemaGenerator,
            TransactionTemplate transactionTemplate,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.schemaGenerator = schemaGenerator;
        this.transactionTemplate = transactionTemplate;
        this.createdCounter = Counter.builder("stress.tables.created")
            .description("Stress tables created")
            .register(meterRegistry);
        this.failedCounter = Counter.builder("stress.tables.failed")
            .description("Table creations or name checks that failed")
            .register(meterRegistry);
        this.collisionCounter = Counter.builder("stress.tables.collisions")
            .description("Generated table names that already existed")
            .register(meterRegistry);
    }

    /**
     * Provisions up to {@code configuration.tables()} tables.
     *
     * @param configuration the run configuration
     * @return the created tables with their columns, and attempt statistics
     */
    public ProvisioningResult provision(WorkloadConfiguration configuration) {
        int requested = configuration.tables();
        int maxAttempts = requested * ATTEMPTS_PER_TABLE;
        List<TableDescriptor> created = new ArrayList<>(requested);
        int attempts = 0;
        int failed = 0;
        int collisions = 0;

        log.info("Creating {} tables with random names...", requested);
        while (created.size() < requested && attempts < maxAttempts) {
            String name = schemaGenerator.nextTableName();
            attempts++;

            Attempt attempt = attempt(name, configuration);
            switch (attempt.outcome()) {
                case COLLISION -> collisions++;
                case FAILED -> failed++;
                case CREATED -> {
                    created.add(attempt.table());
                    log.info("Creating tables {}", ProgressBar.render(created.size(), requested));
                }
            }
        }

        boolean exhausted = created.size() < requested && attempts >= maxAttempts;
        ProvisioningResult result = new ProvisioningResult(requested, attempts, created, failed, collisions, exhausted);
        if (result.isComplete()) {
            log.info("✓ All {} new tables created", requested);
        } else {
            log.warn("⚠ Created {} out of {} tables", result.created(), requested);
            if (exhausted) {
                log.warn("  (Reached max attempts {}: {} name collisions, {} failures)", maxAttempts, collisions, failed);
            }
        }
        return result;
    }

    private Attempt attempt(String name, WorkloadConfiguration configuration) {
        try {
            if (repository.tableExists(configuration.schema(), name)) {
                collisionCounter.increment();
                log.debug("Table name {} already taken, drawing another", name);
                return Attempt.of(Outcome.COLLISION);
            }
        } catch (DataAccessException e) {
            failedCounter.increment();
            log.warn("Could not check whether {} exists, skipping it: {}", name, e.getMessage());
            return Attempt.of(Outcome.FAILED);
        }

        List<ColumnDefinition> columns = schemaGenerator.nextColumns(configuration.columnsPerTable());
        TableDescriptor table = new TableDescriptor(name, columns);
        try {
            transactionTemplate.executeWithoutResult(status -> repository.createTable(table));
        } catch (DataAccessException e) {
            failedCounter.increment();
            log.error("Failed to create table {}: {}", name, e.getMessage());
            return Attempt.of(Outcome.FAILED);
        }
        createdCounter.increment();
        return new Attempt(Outcome.CREATED, table);
    }

    private enum Outcome {
        CREATED, COLLISION, FAILED
    }

    private record Attempt(Outcome outcome, TableDescriptor table) {
        static Attempt of(Outcome outcome) {
            return new Attempt(outcome, null);
        }
    }
}
