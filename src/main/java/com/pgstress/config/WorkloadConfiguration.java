package com.pgstress.config;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.convert.DurationStyle;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Immutable configuration of one stress run.
 *
 * <p>Built once at startup; precedence is command-line flag, then environment
 * variable or {@code .env} entry, then built-in default. Core components
 * receive this object and never read the environment themselves.
 */
public record WorkloadConfiguration(
    int tables,
    int rowsPerTable,
    int columnsPerTable,
    int batchSize,
    int threads,
    String host,
    int port,
    String database,
    String user,
    String password,
    String schema,
    Duration statementTimeout,
    Duration connectionTimeout,
    String jdbcUrlOverride,
    boolean debug,
    boolean cleanup
) {

    /** PostgreSQL rejects statements with more bind parameters than this. */
    public static final int MAX_BIND_PARAMETERS = 65_535;

    /** Connections kept beyond the worker count for the sequential phases. */
    public static final int EXTRA_CONNECTIONS = 2;

    public WorkloadConfiguration {
        requirePositive("tables", tables);
        requirePositive("rows", rowsPerTable);
        requirePositive("cols", columnsPerTable);
        requirePositive("batch-size", batchSize);
        requirePositive("threads", threads);
        requirePositive("port", port);
        if ((long) Math.min(batchSize, rowsPerTable) * columnsPerTable > MAX_BIND_PARAMETERS) {
            throw new IllegalArgumentException(String.format(
                "batch-size %d x cols %d exceeds the %d bind parameters one INSERT may carry",
                batchSize, columnsPerTable, MAX_BIND_PARAMETERS));
        }
        if (schema == null || schema.isBlank()) {
            throw new IllegalArgumentException("schema must not be blank");
        }
    }

    /**
     * Merges command-line flags over the bound properties.
     *
     * @param properties environment, {@code .env} and default values
     * @param arguments the application's command-line arguments
     * @return the run configuration
     */
    public static WorkloadConfiguration from(StressProperties properties, ApplicationArguments arguments) {
        return new WorkloadConfiguration(
            option(arguments, "tables", Integer::parseInt, properties.tables()),
            option(arguments, "rows", Integer::parseInt, properties.rows()),
            option(arguments, "cols", Integer::parseInt, properties.cols()),
            option(arguments, "batch-size", Integer::parseInt, properties.batchSize()),
            option(arguments, "threads", Integer::parseInt, properties.threads()),
            option(arguments, "host", Function.identity(), properties.host()),
            option(arguments, "port", Integer::parseInt, properties.port()),
            option(arguments, "database", Function.identity(), properties.database()),
            option(arguments, "user", Function.identity(), properties.user()),
            option(arguments, "password", Function.identity(), properties.password()),
            option(arguments, "schema", Function.identity(), properties.schema()),
            option(arguments, "statement-timeout", DurationStyle::detectAndParse, properties.statementTimeout()),
            properties.connectionTimeout(),
            option(arguments, "jdbc-url", Function.identity(), properties.jdbcUrl()),
            arguments.containsOption("debug"),
            arguments.containsOption("cleanup"));
    }

    private static <T> T option(ApplicationArguments arguments, String name, Function<String, T> parser, T fallback) {
        List<String> values = arguments.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        String raw = values.get(values.size() - 1);
        try {
            return parser.apply(raw);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid value for --" + name + ": " + raw, e);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    /**
     * Returns the JDBC URL, the explicit override if one was given.
     *
     * @return the URL the connection pool connects to
     */
    public String jdbcUrl() {
        if (jdbcUrlOverride != null && !jdbcUrlOverride.isBlank()) {
            return jdbcUrlOverride;
        }
        return String.format("jdbc:postgresql://%s:%d/%s", host, port, database);
    }

    public int poolSize() {
        return threads + EXTRA_CONNECTIONS;
    }

    /**
     * Rows each table has touched by the update phase: a tenth of its rows, at least one.
     *
     * @return the per-table update count
     */
    public int updateCount() {
        return Math.max(1, rowsPerTable / 10);
    }

    /**
     * Statement timeout in whole seconds as JDBC expects it, never below one.
     *
     * @return the per-statement deadline in seconds
     */
    public int queryTimeoutSeconds() {
        return (int) Math.max(1, statementTimeout.toSeconds());
    }

    @Override
    public String toString() {
        return "WorkloadConfiguration[tables=" + tables + ", rowsPerTable=" + rowsPerTable
            + ", columnsPerTable=" + columnsPerTable + ", batchSize=" + batchSize
            + ", threads=" + threads + ", url=" + jdbcUrl() + ", user=" + user
            + ", schema=" + schema + ", debug=" + debug + ", cleanup=" + cleanup + "]";
    }
}
