package io.calcport.engine.transpiler;

import io.calcport.engine.plan.SqlType;

import java.util.Locale;
import java.util.Set;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations handle differences between database engines.
 */
public interface SQLDialect {

    /**
     * @return The dialect name (e.g., "DuckDB")
     */
    String name();

    /**
     * Quote an identifier (table name, column name, alias).
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Quote a string literal value.
     *
     * @param value The string value to quote
     * @return The quoted string literal
     */
    String quoteStringLiteral(String value);

    /**
     * Format a boolean literal.
     *
     * @param value The boolean value
     * @return The SQL boolean representation
     */
    String formatBoolean(boolean value);

    /**
     * Keywords that may not be used as bare column names, lower case.
     */
    Set<String> reservedWords();

    /**
     * Name of a column type in this dialect.
     */
    String typeName(SqlType type);

    default boolean isReservedWord(String word) {
        return reservedWords().contains(word.toLowerCase(Locale.ROOT));
    }

    /**
     * Format a NULL literal.
     *
     * @return The SQL NULL representation
     */
    default String formatNull() {
        return "NULL";
    }

    /**
     * Format a DATE literal from an ISO yyyy-MM-dd string.
     */
    default String formatDate(String isoDate) {
        return "DATE '" + isoDate + "'";
    }

    /**
     * Format a TIMESTAMP literal from a yyyy-MM-dd HH:mm:ss string.
     */
    default String formatTimestamp(String dateTime) {
        return "TIMESTAMP '" + dateTime.replace('T', ' ') + "'";
    }
}
