package io.calcport.calc.dsl;

import io.calcport.engine.diagnostic.SourcePosition;

import java.util.List;
import java.util.Objects;

/**
 * Ordered multi-branch conditional.
 *
 * <p>Produced by {@code IF c1 THEN r1 ELSEIF c2 THEN r2 ... ELSE e END} and by
 * {@code CASE x WHEN v1 THEN r1 ... END}, which becomes branches testing
 * {@code x = v1}, {@code x = v2}, ... Branches keep their written order and the
 * first branch whose condition holds wins, even when later conditions also hold.
 *
 * @param branches   condition/result pairs in written order, never empty
 * @param elseResult fallback result, or null when no ELSE was written
 */
public record ConditionalExpression(List<Branch> branches, CalcExpression elseResult, SourcePosition position)
        implements CalcExpression {

    public record Branch(CalcExpression condition, CalcExpression result) {
        public Branch {
            Objects.requireNonNull(condition, "Branch condition cannot be null");
            Objects.requireNonNull(result, "Branch result cannot be null");
        }
    }

    public ConditionalExpression {
        Objects.requireNonNull(position, "Position cannot be null");
        branches = List.copyOf(branches);
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("Conditional requires at least one branch");
        }
    }

    public boolean hasElse() {
        return elseResult != null;
    }

    @Override
    public <T> T accept(CalcExpressionVisitor<T> visitor) {
        return visitor.visitConditional(this);
    }
}
