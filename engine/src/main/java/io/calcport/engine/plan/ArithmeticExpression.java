package io.calcport.engine.plan;

import java.util.Objects;

/**
 * Represents an arithmetic expression in SQL.
 *
 * Supports: +, -, *, /, %
 *
 * @param left     The left operand
 * @param operator The arithmetic operator
 * @param right    The right operand
 */
public record ArithmeticExpression(
        Expression left,
        Operator operator,
        Expression right) implements Expression {

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public ArithmeticExpression {
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static ArithmeticExpression divide(Expression left, Expression right) {
        return new ArithmeticExpression(left, Operator.DIVIDE, right);
    }

    public static ArithmeticExpression multiply(Expression left, Expression right) {
        return new ArithmeticExpression(left, Operator.MULTIPLY, right);
    }

    public static ArithmeticExpression subtract(Expression left, Expression right) {
        return new ArithmeticExpression(left, Operator.SUBTRACT, right);
    }

    /**
     * @return The SQL operator symbol
     */
    public String sqlOperator() {
        return operator.symbol();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitArithmetic(this);
    }

    @Override
    public SqlType type() {
        // each operand's type is computed once; chains of + are left-deep
        SqlType leftType = left.type();
        if (leftType.isTemporal() && operator != Operator.DIVIDE) {
            return leftType;
        }
        // Integer arithmetic stays integer, DuckDB's / always yields a double
        if (leftType == SqlType.BIGINT && operator != Operator.DIVIDE && right.type() == SqlType.BIGINT) {
            return SqlType.BIGINT;
        }
        return SqlType.DOUBLE;
    }

    @Override
    public boolean isAggregate() {
        return left.isAggregate() || right.isAggregate();
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
