package io.calcport.engine.plan;

import java.util.Objects;

/**
 * Represents an aggregate function call over the rows of the current group.
 *
 * @param function The aggregate function
 * @param argument The expression being aggregated
 */
public record AggregateExpression(
        AggregateFunction function,
        Expression argument) implements Expression {

    public enum AggregateFunction {
        SUM("SUM"),
        AVG("AVG"),
        COUNT("COUNT"),
        COUNT_DISTINCT("COUNT(DISTINCT"),
        MIN("MIN"),
        MAX("MAX"),
        MEDIAN("MEDIAN"),
        STDDEV_SAMP("STDDEV_SAMP"),
        STDDEV_POP("STDDEV_POP"),
        VAR_SAMP("VAR_SAMP"),
        VAR_POP("VAR_POP");

        private final String sql;

        AggregateFunction(String sql) {
            this.sql = sql;
        }

        public String sql() {
            return sql;
        }
    }

    public AggregateExpression {
        Objects.requireNonNull(function, "Function cannot be null");
        Objects.requireNonNull(argument, "Argument cannot be null");
    }

    public static AggregateExpression of(AggregateFunction function, Expression argument) {
        return new AggregateExpression(function, argument);
    }

    @Override
    public SqlType type() {
        return switch (function) {
            case COUNT, COUNT_DISTINCT -> SqlType.BIGINT;
            case MIN, MAX -> argument.type();
            case SUM -> argument.type() == SqlType.BIGINT ? SqlType.BIGINT : SqlType.DOUBLE;
            default -> SqlType.DOUBLE;
        };
    }

    @Override
    public boolean isAggregate() {
        return true;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAggregate(this);
    }

    @Override
    public String toString() {
        return function.name() + "(" + argument + ")";
    }
}
