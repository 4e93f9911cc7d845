package io.calcport.engine.plan;

import java.util.Objects;

/**
 * Represents a literal value in the plan.
 *
 * @param value       The literal value (can be null)
 * @param literalType The type of the literal
 */
public record Literal(
        Object value,
        LiteralType literalType) implements Expression {

    public enum LiteralType {
        STRING,
        INTEGER,
        DOUBLE,
        BOOLEAN,
        NULL,
        DATE,
        TIMESTAMP
    }

    public Literal {
        Objects.requireNonNull(literalType, "Literal type cannot be null");

        if (value == null && literalType != LiteralType.NULL) {
            throw new IllegalArgumentException(literalType + " literal must have a value");
        }
        if (value != null) {
            switch (literalType) {
                case STRING, DATE, TIMESTAMP -> {
                    if (!(value instanceof String)) {
                        throw new IllegalArgumentException(literalType + " literal must have String value");
                    }
                }
                case INTEGER, DOUBLE -> {
                    if (!(value instanceof Number)) {
                        throw new IllegalArgumentException(literalType + " literal must have Number value");
                    }
                }
                case BOOLEAN -> {
                    if (!(value instanceof Boolean)) {
                        throw new IllegalArgumentException("BOOLEAN literal must have Boolean value");
                    }
                }
                case NULL -> throw new IllegalArgumentException("NULL literal cannot have a value");
            }
        }
    }

    public static Literal string(String value) {
        return new Literal(value, LiteralType.STRING);
    }

    public static Literal integer(long value) {
        return new Literal(value, LiteralType.INTEGER);
    }

    public static Literal decimal(double value) {
        return new Literal(value, LiteralType.DOUBLE);
    }

    public static Literal bool(boolean value) {
        return new Literal(value, LiteralType.BOOLEAN);
    }

    public static Literal nullValue() {
        return new Literal(null, LiteralType.NULL);
    }

    /**
     * Factory for DATE literals. Value should be in 'YYYY-MM-DD' format.
     */
    public static Literal date(String value) {
        return new Literal(value, LiteralType.DATE);
    }

    /**
     * Factory for TIMESTAMP literals. Value should be in 'YYYY-MM-DD HH:MM:SS' format.
     */
    public static Literal timestamp(String value) {
        return new Literal(value, LiteralType.TIMESTAMP);
    }

    public boolean isNull() {
        return literalType == LiteralType.NULL;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public SqlType type() {
        return switch (literalType) {
            case STRING -> SqlType.VARCHAR;
            case INTEGER -> SqlType.BIGINT;
            case DOUBLE -> SqlType.DOUBLE;
            case BOOLEAN -> SqlType.BOOLEAN;
            case NULL -> SqlType.UNKNOWN;
            case DATE -> SqlType.DATE;
            case TIMESTAMP -> SqlType.TIMESTAMP;
        };
    }

    @Override
    public String toString() {
        return switch (literalType) {
            case NULL -> "NULL";
            case STRING -> "'" + value + "'";
            case DATE -> "DATE '" + value + "'";
            case TIMESTAMP -> "TIMESTAMP '" + value + "'";
            default -> String.valueOf(value);
        };
    }
}
