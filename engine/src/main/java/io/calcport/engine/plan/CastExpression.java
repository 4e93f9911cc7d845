package io.calcport.engine.plan;

import java.util.Objects;

/**
 * Represents a SQL CAST expression: CAST(source AS targetType).
 *
 * @param source     The expression to cast
 * @param targetType The type to cast to
 */
public record CastExpression(Expression source, SqlType targetType) implements Expression {

    public CastExpression {
        Objects.requireNonNull(source, "Source expression cannot be null");
        Objects.requireNonNull(targetType, "Target type cannot be null");
    }

    /**
     * A NULL of the given type, {@code CAST(NULL AS type)}.
     */
    public static CastExpression typedNull(SqlType type) {
        return new CastExpression(Literal.nullValue(), type);
    }

    @Override
    public SqlType type() {
        return targetType;
    }

    @Override
    public boolean isAggregate() {
        return source.isAggregate();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitCast(this);
    }
}
