package com.pgstress.service;

import com.pgstress.generator.SchemaGenerator;
import com.pgstress.repository.StressTableRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Best-effort figures for the final summary.
 *
 * <p>Every probe may fail, for instance against a server without the
 * PostgreSQL size functions; a failed probe yields an empty value.
 */
@Service
public class DatabaseStatistics {

    private static final Logger log = LoggerFactory.getLogger(DatabaseStatistics.class);

    private final StressTableRepository repository;

    public DatabaseStatistics(StressTableRepository repository) {
        this.repository = repository;
    }

    /**
     * Counts stress tables in the catalog, including those left by earlier runs.
     *
     * @param schema the catalog schema
     * @return the count, empty if the catalog could not be read
     */
    public Optional<Long> stressTableCount(String schema) {
        try {
            return Optional.of((long) repository.findTablesWithPrefix(schema, SchemaGenerator.TABLE_PREFIX).size());
        } catch (DataAccessException e) {
            log.warn("Could not count stress tables: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> databaseSize() {
        try {
            return repository.databaseSize();
        } catch (DataAccessException e) {
            log.warn("Could not determine database size: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
