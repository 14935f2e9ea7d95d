package com.pgstress.service;

import com.pgstress.generator.SchemaGenerator;
import com.pgstress.repository.StressTableRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Drops the tables stress runs have left behind.
 */
@Service
public class StressTableCleaner {

    private static final Logger log = LoggerFactory.getLogger(StressTableCleaner.class);

    private final StressTableRepository repository;

    public StressTableCleaner(StressTableRepository repository) {
        this.repository = repository;
    }

    /**
     * Drops every table of {@code schema} named with the stress prefix.
     *
     * @param schema the catalog schema
     * @return number of stress tables still present afterwards
     */
    public int dropAll(String schema) {
        log.info("Finding stress test tables...");
        List<String> tables = repository.findTablesWithPrefix(schema, SchemaGenerator.TABLE_PREFIX);
        if (tables.isEmpty()) {
            log.info("No stress test tables found.");
            return 0;
        }
        log.info("Found {} stress test tables, dropping them...", tables.size());

        int dropped = 0;
        for (String table : tables) {
            try {
                repository.dropTable(table);
                dropped++;
            } catch (DataAccessException e) {
                log.error("Failed to drop {}: {}", table, e.getMessage());
            }
        }

        int remaining = repository.findTablesWithPrefix(schema, SchemaGenerator.TABLE_PREFIX).size();
        if (remaining == 0) {
            log.info("✓ All {} stress test tables dropped", dropped);
        } else {
            log.warn("Warning: {} tables still remain.", remaining);
        }
        return remaining;
    }
}
