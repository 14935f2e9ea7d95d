package com.pgstress.generator;

import com.pgstress.model.ColumnDefinition;
import com.pgstress.model.Row;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates random rows matching a table's column types.
 *
 * <p>Shared by all insert workers; {@link Random} is thread-safe.
 */
@Component
public class RowGenerator {

    public static final int INTEGER_MAX = 1_000_000;
    public static final long BIGINT_FACTOR_MAX = 1L << 31;
    public static final int VARCHAR_LENGTH = 100;
    public static final int TEXT_LENGTH = 50;
    public static final double NUMERIC_MAX = 10_000.0;

    private final Random random;

    public RowGenerator() {
        this(new Random());
    }

    public RowGenerator(Random random) {
        this.random = random;
    }

    /**
     * Generates one row with a value per column.
     *
     * @param columns the table's generated columns
     * @return a row whose arity equals {@code columns.size()}
     */
    public Row nextRow(List<ColumnDefinition> columns) {
        List<Object> values = new ArrayList<>(columns.size());
        for (ColumnDefinition column : columns) {
            values.add(nextValue(column));
        }
        return new Row(values);
    }

    /**
     * Generates {@code count} rows for one batch.
     *
     * @param columns the table's generated columns
     * @param count number of rows
     * @return the rows
     */
    public List<Row> nextRows(List<ColumnDefinition> columns, int count) {
        List<Row> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            rows.add(nextRow(columns));
        }
        return rows;
    }

    private Object nextValue(ColumnDefinition column) {
        return switch (column.type()) {
            case INTEGER -> random.nextInt(INTEGER_MAX + 1);
            // product of two factors in [0, 2^31], beyond 32-bit range
            case BIGINT -> nextBigintFactor() * nextBigintFactor();
            case VARCHAR -> RandomStrings.alphanumeric(random, VARCHAR_LENGTH);
            case NUMERIC -> BigDecimal.valueOf(random.nextDouble() * NUMERIC_MAX)
                .setScale(2, RoundingMode.HALF_UP);
            case TEXT -> RandomStrings.alphanumeric(random, TEXT_LENGTH);
        };
    }

    private long nextBigintFactor() {
        return (long) (random.nextDouble() * (BIGINT_FACTOR_MAX + 1));
    }
}
