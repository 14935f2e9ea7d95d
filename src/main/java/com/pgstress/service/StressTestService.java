package com.pgstress.service;

import com.pgstress.config.WorkloadConfiguration;
import com.pgstress.model.StressTestReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Service;

/**
 * Entry point of a stress run once the application context is up.
 *
 * <p>Checks connectivity (fatal on failure), then either drops leftover stress
 * tables ({@code --cleanup}) or runs the workload and prints the summary.
 * Partial failures inside the workload never fail the run.
 */
@Service
public class StressTestService implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(StressTestService.class);

    private static final String BASE_PACKAGE = "com.pgstress";

    private final WorkloadConfiguration configuration;
    private final ConnectivityCheck connectivityCheck;
    private final StressWorkload workload;
    private final StressTableCleaner cleaner;
    private final LoggingSystem loggingSystem;

    private volatile StressTestReport lastReport;
    private volatile boolean running;

    /**
     * Constructor for StressTestService.
     *
     * @param configuration the run configuration
     * @param connectivityCheck the pre-flight check
     * @param workload the workload phases
     * @param cleaner the leftover table cleaner
     * @param loggingSystem used to raise the log level for {@code --debug}
     */
    public StressTestService(
            WorkloadConfiguration configuration,
            ConnectivityCheck connectivityCheck,
            StressWorkload workload,
            StressTableCleaner cleaner,
            LoggingSystem loggingSystem) {
        this.configuration = configuration;
        this.connectivityCheck = connectivityCheck;
        this.workload = workload;
        this.cleaner = cleaner;
        this.loggingSystem = loggingSystem;
        registerShutdownHook();
    }

    /**
     * Cancels a running workload when the JVM is asked to stop.
     */
    private void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (running) {
                log.warn("=== Shutdown detected - cancelling remaining insert batches ===");
                workload.cancel();
            }
        }, "stress-test-shutdown-hook"));
    }

    @Override
    public void run(String... args) throws Exception {
        if (configuration.debug()) {
            loggingSystem.setLogLevel(BASE_PACKAGE, LogLevel.DEBUG);
        }
        logConfiguration();
        connectivityCheck.verify(configuration);

        if (configuration.cleanup()) {
            cleaner.dropAll(configuration.schema());
            return;
        }

        running = true;
        try {
            lastReport = workload.run(configuration);
        } finally {
            running = false;
        }
        printSummary(lastReport);
    }

    /**
     * Gets the report of the last completed run.
     *
     * @return the report, null before a workload has completed
     */
    public StressTestReport getLastReport() {
        return lastReport;
    }

    private void logConfiguration() {
        log.info("========================================");
        log.info("  PostgreSQL Stress Test");
        log.info("========================================");
        log.info("Configuration:");
        log.info("  Database: {}", configuration.database());
        log.info("  Host:Port: {}:{}", configuration.host(), configuration.port());
        log.info("  Tables: {}", configuration.tables());
        log.info("  Rows per table: {}", configuration.rowsPerTable());
        log.info("  Columns per table: {}", configuration.columnsPerTable());
        log.info("  Batch size: {}", configuration.batchSize());
        log.info("  Threads: {}", configuration.threads());
        if (configuration.cleanup()) {
            log.info("  Mode: cleanup");
        }
    }

    private void printSummary(StressTestReport report) {
        log.info("========================================");
        log.info("=== Database Statistics ===");
        log.info("  Tables created: {} out of {}", report.tablesCreated(), report.tablesRequested());
        log.info("  Stress tables in schema: {}", report.stressTablesInCatalog().map(String::valueOf).orElse("unknown"));
        log.info("  Rows inserted: {} of {} ({} failed batches)",
            report.rowsInserted(), report.rowsTargeted(), report.batchesFailed());
        log.info("  Peak connection pool pressure: {}", String.format("%.2f", report.peakPoolPressure()));
        log.info("  Tables updated: {}", report.tablesUpdated());
        log.info("  Test queries succeeded: {}/{}", report.queriesSucceeded(), QueryRunner.SAMPLE_QUERIES);
        log.info("  Database size: {}", report.databaseSize().orElse("unknown"));
        log.info("  Duration: {} seconds", report.elapsed().toSeconds());
        log.info("========================================");
        log.info("Stress test completed. To clean up the test data, run again with --cleanup");
    }
}
