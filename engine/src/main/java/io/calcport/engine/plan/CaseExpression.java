package io.calcport.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents a searched CASE expression in SQL.
 *
 * <pre>
 * CASE
 *     WHEN cond1 THEN val1
 *     WHEN cond2 THEN val2
 *     ELSE val3
 * END
 * </pre>
 *
 * Branches are evaluated in list order; the first true condition wins.
 *
 * @param whens     The WHEN/THEN pairs, in evaluation order
 * @param elseValue The value when no condition holds
 */
public record CaseExpression(
        List<When> whens,
        Expression elseValue
) implements Expression {

    public record When(Expression condition, Expression result) {
        public When {
            Objects.requireNonNull(condition, "Condition cannot be null");
            Objects.requireNonNull(result, "Result cannot be null");
        }
    }

    public CaseExpression {
        Objects.requireNonNull(whens, "Branches cannot be null");
        Objects.requireNonNull(elseValue, "Else value cannot be null");
        whens = List.copyOf(whens);
        if (whens.isEmpty()) {
            throw new IllegalArgumentException("CASE requires at least one WHEN branch");
        }
    }

    public static CaseExpression of(Expression condition, Expression thenValue, Expression elseValue) {
        return new CaseExpression(List.of(new When(condition, thenValue)), elseValue);
    }

    @Override
    public SqlType type() {
        for (When when : whens) {
            SqlType resultType = when.result().type();
            if (resultType != SqlType.UNKNOWN) {
                return resultType;
            }
        }
        return elseValue.type();
    }

    @Override
    public boolean isAggregate() {
        return elseValue.isAggregate()
                || whens.stream().anyMatch(w -> w.condition().isAggregate() || w.result().isAggregate());
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitCase(this);
    }
}
