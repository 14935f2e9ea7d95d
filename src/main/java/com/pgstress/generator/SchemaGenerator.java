package com.pgstress.generator;

import com.pgstress.model.ColumnDefinition;
import com.pgstress.model.ColumnType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates random stress table names and column layouts.
 *
 * <p>Names are not guaranteed unique; the provisioner checks them against the
 * live catalog before creating anything.
 */
@Component
public class SchemaGenerator {

    public static final String TABLE_PREFIX = "stress_table_";
    public static final int TABLE_SUFFIX_LENGTH = 12;

    private static final ColumnType[] TYPES = ColumnType.values();

    private final Random random;

    public SchemaGenerator() {
        this(new Random());
    }

    public SchemaGenerator(Random random) {
        this.random = random;
    }

    /**
     * Generates a table name: {@value #TABLE_PREFIX} followed by a random suffix.
     *
     * @return a new candidate table name
     */
    public String nextTableName() {
        return TABLE_PREFIX + RandomStrings.alphanumeric(random, TABLE_SUFFIX_LENGTH);
    }

    /**
     * Generates {@code count} columns, each with an independently chosen type.
     *
     * <p>Column names encode the 1-based position and the type suffix, for
     * example {@code col_3_numeric}.
     *
     * @param count number of columns
     * @return the column definitions in position order
     */
    public List<ColumnDefinition> nextColumns(int count) {
        List<ColumnDefinition> columns = new ArrayList<>(count);
        for (int position = 1; position <= count; position++) {
            ColumnType type = TYPES[random.nextInt(TYPES.length)];
            columns.add(new ColumnDefinition("col_" + position + "_" + type.suffix(), type));
        }
        return columns;
    }
}
