package io.calcport.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Boolean connective over one (NOT) or more (AND, OR) operands.
 *
 * @param operator The logical operator
 * @param operands The operands, exactly one for NOT
 */
public record LogicalExpression(
        LogicalOperator operator,
        List<Expression> operands) implements Expression {

    public enum LogicalOperator {
        AND,
        OR,
        NOT
    }

    public LogicalExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operands, "Operands cannot be null");
        operands = List.copyOf(operands);
        if (operator == LogicalOperator.NOT && operands.size() != 1) {
            throw new IllegalArgumentException("NOT requires exactly one operand");
        }
        if (operator != LogicalOperator.NOT && operands.size() < 2) {
            throw new IllegalArgumentException(operator + " requires at least two operands");
        }
    }

    public static LogicalExpression and(Expression left, Expression right) {
        return new LogicalExpression(LogicalOperator.AND, List.of(left, right));
    }

    public static LogicalExpression or(Expression left, Expression right) {
        return new LogicalExpression(LogicalOperator.OR, List.of(left, right));
    }

    public static LogicalExpression not(Expression operand) {
        return new LogicalExpression(LogicalOperator.NOT, List.of(operand));
    }

    @Override
    public SqlType type() {
        return SqlType.BOOLEAN;
    }

    @Override
    public boolean isAggregate() {
        return operands.stream().anyMatch(Expression::isAggregate);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitLogical(this);
    }
}
