package com.pgstress.generator;

import com.pgstress.model.ColumnDefinition;
import com.pgstress.model.ColumnType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaGeneratorTest {

    private final SchemaGenerator generator = new SchemaGenerator(new Random(42));

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 5, 10, 64})
    @DisplayName("nextColumns returns exactly n named columns with known types")
    void columnCountMatches(int count) {
        List<ColumnDefinition> columns = generator.nextColumns(count);

        assertThat(columns).hasSize(count);
        assertThat(columns).allSatisfy(column -> {
            assertThat(column.name()).isNotBlank();
            assertThat(column.type()).isIn((Object[]) ColumnType.values());
        });
    }

    @Test
    @DisplayName("Column names encode 1-based position and type suffix")
    void columnNamesEncodePositionAndType() {
        List<ColumnDefinition> columns = generator.nextColumns(20);

        for (int i = 0; i < columns.size(); i++) {
            ColumnDefinition column = columns.get(i);
            assertThat(column.name()).isEqualTo("col_" + (i + 1) + "_" + column.type().suffix());
        }
    }

    @Test
    @DisplayName("Every column type is eventually drawn")
    void allTypesAreDrawn() {
        Set<ColumnType> seen = EnumSet.noneOf(ColumnType.class);
        generator.nextColumns(500).forEach(column -> seen.add(column.type()));

        assertThat(seen).containsExactlyInAnyOrder(ColumnType.values());
    }

    @Test
    @DisplayName("Table names are the prefix plus 12 alphanumeric characters")
    void tableNameShape() {
        String name = generator.nextTableName();

        assertThat(name).startsWith(SchemaGenerator.TABLE_PREFIX);
        assertThat(name.substring(SchemaGenerator.TABLE_PREFIX.length()))
            .hasSize(SchemaGenerator.TABLE_SUFFIX_LENGTH)
            .matches("[A-Za-z0-9]+");
    }

    @Test
    @DisplayName("10,000 generated table names do not collide")
    void tableNamesAreDistinct() {
        SchemaGenerator unseeded = new SchemaGenerator();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            names.add(unseeded.nextTableName());
        }

        assertThat(names).hasSize(10_000);
    }
}
