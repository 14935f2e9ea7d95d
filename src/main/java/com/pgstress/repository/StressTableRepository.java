package com.pgstress.repository;

import com.pgstress.model.ColumnDefinition;
import com.pgstress.model.Row;
import com.pgstress.model.TableDescriptor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * SQL issued against stress tables and the schema catalog.
 *
 * <p>Table and column names are generated identifiers and are written into the
 * statements unquoted, so the server folds them to lower case. Catalog lookups
 * compare against the folded name for the same reason.
 */
@Repository
public class StressTableRepository {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String TABLE_EXISTS_SQL = """
        SELECT COUNT(*) FROM information_schema.tables
        WHERE table_schema = ? AND table_name = ?
        """;

    private static final String TABLES_WITH_PREFIX_SQL = """
        SELECT table_name FROM information_schema.tables
        WHERE table_schema = ? AND table_name LIKE ?
        ORDER BY table_name
        """;

    private final JdbcTemplate jdbcTemplate;

    /**
     * Constructor for StressTableRepository.
     *
     * @param jdbcTemplate the JdbcTemplate instance
     */
    public StressTableRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Runs a trivial round trip to prove a connection can be borrowed and used.
     *
     * @return the value the server echoed, 1
     */
    public int ping() {
        Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        return one != null ? one : 0;
    }

    /**
     * Asks a PostgreSQL server whether it is a standby.
     *
     * @return true when the server is in recovery and cannot take writes
     */
    public boolean isInRecovery() {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject("SELECT pg_is_in_recovery()", Boolean.class));
    }

    /**
     * Checks the catalog for a table with the given name.
     *
     * @param schema the catalog schema
     * @param tableName the unquoted table name
     * @return true if the table already exists
     */
    public boolean tableExists(String schema, String tableName) {
        Long count = jdbcTemplate.queryForObject(TABLE_EXISTS_SQL, Long.class, schema, fold(tableName));
        return count != null && count > 0;
    }

    /**
     * Lists the tables of a schema whose name starts with {@code prefix}.
     *
     * @param schema the catalog schema
     * @param prefix the name prefix
     * @return matching table names, sorted
     */
    public List<String> findTablesWithPrefix(String schema, String prefix) {
        String folded = fold(prefix);
        return jdbcTemplate.queryForList(TABLES_WITH_PREFIX_SQL, String.class, schema, folded + "%")
            .stream()
            .filter(name -> name.startsWith(folded))
            .collect(Collectors.toList());
    }

    /**
     * Creates the table and its {@code created_at} index.
     *
     * <p>Callers wrap this in a transaction so both statements succeed or neither does.
     *
     * @param table the table to create
     */
    public void createTable(TableDescriptor table) {
        String name = identifier(table.name());
        String columns = table.columns().stream()
            .map(ColumnDefinition::ddl)
            .collect(Collectors.joining(",\n    "));
        jdbcTemplate.execute("CREATE TABLE " + name + " (\n"
            + "    id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n"
            + "    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,\n"
            + "    updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,\n"
            + "    " + columns + "\n"
            + ")");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS " + indexName(table.name())
            + " ON " + name + " (created_at)");
    }

    /**
     * Inserts all rows with one multi-row INSERT on the caller's connection.
     *
     * <p>The statement is executed in a single round trip; committing or rolling
     * back is left to the caller.
     *
     * @param connection the connection owned by the calling worker
     * @param table the target table
     * @param rows the rows, each matching the table's columns
     * @param queryTimeoutSeconds statement deadline, 0 for none
     * @return the number of rows the server reported inserted
     * @throws SQLException if the statement fails
     */
    public int insertRows(Connection connection, TableDescriptor table, List<Row> rows, int queryTimeoutSeconds)
            throws SQLException {
        if (rows.isEmpty()) {
            return 0;
        }
        int columnCount = table.columnCount();
        try (PreparedStatement ps = connection.prepareStatement(multiRowInsertSql(table, rows.size()))) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            int parameter = 1;
            for (Row row : rows) {
                if (row.arity() != columnCount) {
                    throw new IllegalArgumentException(String.format(
                        "Row arity %d does not match %d columns of %s", row.arity(), columnCount, table.name()));
                }
                for (Object value : row.values()) {
                    ps.setObject(parameter++, value);
                }
            }
            return ps.executeUpdate();
        }
    }

    /**
     * Touches {@code count} randomly chosen rows.
     *
     * <p>{@code updated_at} is set to the current time and, when the table has
     * one, the first INTEGER or BIGINT column is incremented.
     *
     * @param table the table to update
     * @param count how many rows to pick
     * @return the number of rows updated
     */
    public int updateRandomRows(TableDescriptor table, int count) {
        String name = identifier(table.name());
        String increment = table.firstUpdatableColumn()
            .map(column -> ",\n    " + column.name() + " = " + column.name() + " + 1")
            .orElse("");
        String sql = "UPDATE " + name + "\n"
            + "SET updated_at = CURRENT_TIMESTAMP" + increment + "\n"
            + "WHERE id IN (SELECT id FROM " + name + " ORDER BY RANDOM() LIMIT ?)";
        return jdbcTemplate.update(sql, count);
    }

    /**
     * Gets the row count of a table.
     *
     * @param tableName the table
     * @return the number of rows
     */
    public long countRows(String tableName) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + identifier(tableName), Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Drops a table and everything depending on it.
     *
     * @param tableName the table
     */
    public void dropTable(String tableName) {
        jdbcTemplate.execute("DROP TABLE IF EXISTS " + identifier(tableName) + " CASCADE");
    }

    /**
     * Gets the human readable size of the connected database.
     *
     * @return e.g. {@code 42 MB}
     */
    public Optional<String> databaseSize() {
        return Optional.ofNullable(jdbcTemplate.queryForObject(
            "SELECT pg_size_pretty(pg_database_size(current_database()))", String.class));
    }

    static String multiRowInsertSql(TableDescriptor table, int rowCount) {
        String columns = table.columns().stream()
            .map(ColumnDefinition::name)
            .collect(Collectors.joining(", "));
        String tuple = table.columns().stream()
            .map(column -> "?")
            .collect(Collectors.joining(", ", "(", ")"));
        StringBuilder sql = new StringBuilder(64 + rowCount * (tuple.length() + 2))
            .append("INSERT INTO ").append(identifier(table.name()))
            .append(" (").append(columns).append(") VALUES ");
        for (int i = 0; i < rowCount; i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(tuple);
        }
        return sql.toString();
    }

    static String indexName(String tableName) {
        return "idx_" + identifier(tableName) + "_created";
    }

    static String fold(String identifier) {
        return identifier.toLowerCase(Locale.ROOT);
    }

    private static String identifier(String name) {
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a plain SQL identifier: " + name);
        }
        return name;
    }
}
