package io.calcport.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * String concatenation, rendered with {@code ||}.
 *
 * @param parts The expressions to concatenate, in order
 */
public record ConcatExpression(List<Expression> parts) implements Expression {

    public ConcatExpression {
        Objects.requireNonNull(parts, "Parts cannot be null");
        parts = List.copyOf(parts);
        if (parts.size() < 2) {
            throw new IllegalArgumentException("Concatenation requires at least two parts");
        }
    }

    public static ConcatExpression of(Expression... parts) {
        return new ConcatExpression(List.of(parts));
    }

    @Override
    public SqlType type() {
        return SqlType.VARCHAR;
    }

    @Override
    public boolean isAggregate() {
        return parts.stream().anyMatch(Expression::isAggregate);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitConcat(this);
    }
}
