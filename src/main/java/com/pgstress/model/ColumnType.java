package com.pgstress.model;

/**
 * SQL column types a generated stress table can carry.
 *
 * <p>Each type knows its DDL spelling, the suffix used in generated column
 * names and whether the row updater may increment it.
 */
public enum ColumnType {
    TEXT("TEXT", "text", false),
    INTEGER("INTEGER", "int", true),
    BIGINT("BIGINT", "bigint", true),
    VARCHAR("VARCHAR(255)", "varchar", false),
    NUMERIC("NUMERIC(10,2)", "numeric", false);

    private final String sqlType;
    private final String suffix;
    private final boolean updatable;

    ColumnType(String sqlType, String suffix, boolean updatable) {
        this.sqlType = sqlType;
        this.suffix = suffix;
        this.updatable = updatable;
    }

    public String sqlType() {
        return sqlType;
    }

    public String suffix() {
        return suffix;
    }

    /**
     * Whether columns of this type are targets of the {@code col = col + 1} update.
     *
     * @return true for INTEGER and BIGINT
     */
    public boolean isUpdatable() {
        return updatable;
    }
}
