package com.pgstress.service;

import com.pgstress.config.WorkloadConfiguration;
import com.pgstress.repository.StressTableRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Verifies the write endpoint before any work is done.
 *
 * <p>A connection that cannot be established, or a server that turns out to
 * be a standby, is fatal. Servers without {@code pg_is_in_recovery()} are
 * accepted as writable.
 */
@Service
public class ConnectivityCheck {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityCheck.class);

    private final StressTableRepository repository;

    public ConnectivityCheck(StressTableRepository repository) {
        this.repository = repository;
    }

    /**
     * Runs the check.
     *
     * @param configuration the run configuration, for messages
     * @throws DatabaseUnavailableException if the database cannot be used
     */
    public void verify(WorkloadConfiguration configuration) {
        log.info("Checking database connectivity ({}:{}/{})...",
            configuration.host(), configuration.port(), configuration.database());
        try {
            repository.ping();
        } catch (DataAccessException e) {
            log.error("ERROR: Could not connect to database: {}", e.getMessage());
            throw new DatabaseUnavailableException("Could not connect to " + configuration.jdbcUrl(), e);
        }

        boolean standby;
        try {
            standby = repository.isInRecovery();
        } catch (DataAccessException e) {
            log.debug("Recovery state unavailable, assuming a writable server: {}", e.getMessage());
            standby = false;
        }
        if (standby) {
            log.error("ERROR: Connected to a replica, not the leader; the write port should route to the leader");
            throw new DatabaseUnavailableException("Server behind " + configuration.jdbcUrl() + " is in recovery");
        }
        log.info("✓ Database connection successful");
    }
}
