package io.calcport.engine.plan;

import java.util.Objects;

/**
 * Represents a reference to a column of the source rows.
 *
 * @param tableAlias The alias of the relation holding the column, empty for unqualified
 * @param columnName The column name (a mapped identifier)
 * @param sqlType    The column type
 */
public record ColumnReference(
        String tableAlias,
        String columnName,
        SqlType sqlType) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(tableAlias, "Table alias cannot be null");
        Objects.requireNonNull(columnName, "Column name cannot be null");
        Objects.requireNonNull(sqlType, "SQL type cannot be null");
    }

    public static ColumnReference of(String tableAlias, String columnName, SqlType type) {
        return new ColumnReference(tableAlias, columnName, type);
    }

    /**
     * Creates a column reference without a table alias.
     */
    public static ColumnReference of(String columnName, SqlType type) {
        return new ColumnReference("", columnName, type);
    }

    public boolean isQualified() {
        return !tableAlias.isEmpty();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public SqlType type() {
        return sqlType;
    }

    @Override
    public String toString() {
        return tableAlias.isEmpty() ? columnName : tableAlias + "." + columnName;
    }
}
