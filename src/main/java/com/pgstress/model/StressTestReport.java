package com.pgstress.model;

import java.time.Duration;
import java.util.Optional;

/**
 * Final figures of one stress run.
 */
public record StressTestReport(
    int tablesRequested,
    int tablesCreated,
    long rowsTargeted,
    long rowsInserted,
    long batchesFailed,
    double peakPoolPressure,
    int tablesUpdated,
    int queriesSucceeded,
    Optional<Long> stressTablesInCatalog,
    Optional<String> databaseSize,
    Duration elapsed
) {
}
