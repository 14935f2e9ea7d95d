package com.pgstress.service;

import com.pgstress.model.TableDescriptor;
import com.pgstress.repository.StressTableRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Random;

/**
 * Samples the provisioned tables with read-only {@code COUNT(*)} queries.
 */
@Service
public class QueryRunner {

    private static final Logger log = LoggerFactory.getLogger(QueryRunner.class);

    public static final int SAMPLE_QUERIES = 5;

    private final StressTableRepository repository;
    private final Random random;

    @Autowired
    public QueryRunner(StressTableRepository repository) {
        this(repository, new Random());
    }

    QueryRunner(StressTableRepository repository, Random random) {
        this.repository = repository;
        this.random = random;
    }

    /**
     * Counts rows of {@value #SAMPLE_QUERIES} randomly chosen tables.
     *
     * @param tables the provisioned tables
     * @return number of queries that completed
     */
    public int runSampleQueries(List<TableDescriptor> tables) {
        if (tables.isEmpty()) {
            log.warn("No tables to query, skipping test queries");
            return 0;
        }
        log.info("Running test queries...");
        int succeeded = 0;
        for (int i = 1; i <= SAMPLE_QUERIES; i++) {
            TableDescriptor table = tables.get(random.nextInt(tables.size()));
            try {
                long count = repository.countRows(table.name());
                log.info("  Query {}/{}: SELECT COUNT(*) FROM {} -> ✓ {} rows", i, SAMPLE_QUERIES, table.name(), count);
                succeeded++;
            } catch (DataAccessException e) {
                log.error("  Query {}/{}: SELECT COUNT(*) FROM {} -> ✗ {}", i, SAMPLE_QUERIES, table.name(), e.getMessage());
            }
        }
        return succeeded;
    }
}
