package io.calcport.engine.plan;

import java.util.Objects;

/**
 * Represents a comparison expression (e.g., column = 'value').
 *
 * @param left     The left operand
 * @param operator The comparison operator
 * @param right    The right operand, null for IS NULL / IS NOT NULL
 */
public record ComparisonExpression(
        Expression left,
        ComparisonOperator operator,
        Expression right
) implements Expression {

    public enum ComparisonOperator {
        EQUALS("="),
        NOT_EQUALS("<>"),
        LESS_THAN("<"),
        LESS_THAN_OR_EQUALS("<="),
        GREATER_THAN(">"),
        GREATER_THAN_OR_EQUALS(">="),
        IS_NOT_DISTINCT_FROM("IS NOT DISTINCT FROM"),
        IS_NULL("IS NULL"),
        IS_NOT_NULL("IS NOT NULL");

        private final String sql;

        ComparisonOperator(String sql) {
            this.sql = sql;
        }

        public String toSql() {
            return sql;
        }

        public boolean isUnary() {
            return this == IS_NULL || this == IS_NOT_NULL;
        }
    }

    public ComparisonExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        if (!operator.isUnary()) {
            Objects.requireNonNull(right, "Right operand cannot be null");
        }
    }

    public static ComparisonExpression of(Expression left, ComparisonOperator operator, Expression right) {
        return new ComparisonExpression(left, operator, right);
    }

    public static ComparisonExpression equals(Expression left, Expression right) {
        return new ComparisonExpression(left, ComparisonOperator.EQUALS, right);
    }

    public static ComparisonExpression isNull(Expression operand) {
        return new ComparisonExpression(operand, ComparisonOperator.IS_NULL, null);
    }

    public static ComparisonExpression notDistinct(Expression left, Expression right) {
        return new ComparisonExpression(left, ComparisonOperator.IS_NOT_DISTINCT_FROM, right);
    }

    @Override
    public SqlType type() {
        return SqlType.BOOLEAN;
    }

    @Override
    public boolean isAggregate() {
        return left.isAggregate() || (right != null && right.isAggregate());
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        if (operator.isUnary()) {
            return left + " " + operator.toSql();
        }
        return left + " " + operator.toSql() + " " + right;
    }
}
