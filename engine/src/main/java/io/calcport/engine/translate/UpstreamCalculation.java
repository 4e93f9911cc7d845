package io.calcport.engine.translate;

import io.calcport.calc.dsl.CalcExpression;
import io.calcport.engine.plan.Expression;

import java.util.Objects;
import java.util.Set;

/**
 * A calculation translated earlier in the same request, available to the
 * calculations that reference it.
 *
 * @param sourceKey           The calculation's raw name
 * @param identifier          Its mapped identifier
 * @param plan                The lowered expression, over unqualified source columns
 * @param ast                 The parsed formula, re-lowered when referenced inside a level-of-detail scope
 * @param consumedIdentifiers Source columns the plan reads
 */
public record UpstreamCalculation(
        String sourceKey,
        String identifier,
        Expression plan,
        CalcExpression ast,
        Set<String> consumedIdentifiers) {

    public UpstreamCalculation {
        Objects.requireNonNull(sourceKey, "Source key cannot be null");
        Objects.requireNonNull(identifier, "Identifier cannot be null");
        Objects.requireNonNull(plan, "Plan cannot be null");
        Objects.requireNonNull(ast, "AST cannot be null");
        consumedIdentifiers = consumedIdentifiers == null ? Set.of() : Set.copyOf(consumedIdentifiers);
    }

    public boolean isAggregate() {
        return plan.isAggregate();
    }
}
