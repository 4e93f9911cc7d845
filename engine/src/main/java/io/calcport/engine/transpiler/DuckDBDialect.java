package io.calcport.engine.transpiler;

import io.calcport.engine.plan.SqlType;

import java.util.Set;

/**
 * SQL dialect implementation for DuckDB.
 * DuckDB uses double quotes for identifiers and single quotes for strings.
 */
public final class DuckDBDialect implements SQLDialect {

    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    // Reserved and type/function-name keywords from duckdb_keywords()
    private static final Set<String> RESERVED = Set.of(
            "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric", "both",
            "case", "cast", "check", "collate", "column", "constraint", "create", "default",
            "deferrable", "desc", "describe", "distinct", "do", "else", "end", "except", "false",
            "fetch", "for", "foreign", "from", "grant", "group", "having", "in", "initially",
            "intersect", "into", "lateral", "leading", "limit", "not", "null", "offset", "on",
            "only", "or", "order", "pivot", "pivot_longer", "pivot_wider", "placing", "primary",
            "qualify", "references", "returning", "select", "show", "some", "summarize",
            "symmetric", "table", "then", "to", "trailing", "true", "union", "unique", "unpivot",
            "using", "variadic", "when", "where", "window", "with",
            "anti", "asof", "authorization", "binary", "collation", "concurrently", "cross",
            "freeze", "full", "generated", "glob", "ilike", "inner", "is", "isnull", "join",
            "left", "like", "map", "natural", "notnull", "outer", "overlaps", "positional",
            "right", "semi", "similar", "struct", "tablesample", "try_cast", "verbose");

    private DuckDBDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "DuckDB";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        // Escape any existing double quotes by doubling them
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String quoteStringLiteral(String value) {
        // Escape any existing single quotes by doubling them
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    @Override
    public Set<String> reservedWords() {
        return RESERVED;
    }

    @Override
    public String typeName(SqlType type) {
        return switch (type) {
            case VARCHAR -> "VARCHAR";
            case BIGINT -> "BIGINT";
            case DOUBLE -> "DOUBLE";
            case BOOLEAN -> "BOOLEAN";
            case DATE -> "DATE";
            case TIMESTAMP -> "TIMESTAMP";
            case UNKNOWN -> "VARCHAR";
        };
    }
}
