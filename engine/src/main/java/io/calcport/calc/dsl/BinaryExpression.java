package io.calcport.calc.dsl;

import io.calcport.engine.diagnostic.SourcePosition;

import java.util.Objects;

/**
 * Binary expression: left op right (e.g., [Profit] / [Sales], [Region] = "East", a AND b)
 */
public record BinaryExpression(
        BinaryOperator operator,
        CalcExpression left,
        CalcExpression right,
        SourcePosition position) implements CalcExpression {

    public BinaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
        Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public <T> T accept(CalcExpressionVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }
}
