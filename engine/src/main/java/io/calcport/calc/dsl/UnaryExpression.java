package io.calcport.calc.dsl;

import io.calcport.engine.diagnostic.SourcePosition;

import java.util.Objects;

/**
 * Unary expression: -[Discount], NOT [Shipped].
 */
public record UnaryExpression(Operator operator, CalcExpression operand, SourcePosition position)
        implements CalcExpression {

    public enum Operator {
        NEGATE,
        NOT
    }

    public UnaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
        Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public <T> T accept(CalcExpressionVisitor<T> visitor) {
        return visitor.visitUnary(this);
    }
}
