package io.calcport.calc.dsl;

import io.calcport.engine.diagnostic.SourcePosition;

import java.util.List;
import java.util.Objects;

/**
 * Level of Detail expression: {FIXED [Region] : SUM([Sales])}.
 *
 * <p>An empty dimension list with FIXED means one group for the whole table.
 * {@code {SUM([Sales])}} without a scope keyword is parsed as FIXED with no
 * dimensions.
 *
 * @param scope      FIXED, INCLUDE or EXCLUDE
 * @param dimensions grouping fields in written order
 * @param aggregate  expression evaluated once per group
 */
public record LevelOfDetailExpression(
        Scope scope,
        List<FieldReference> dimensions,
        CalcExpression aggregate,
        SourcePosition position) implements CalcExpression {

    public enum Scope {
        FIXED,
        INCLUDE,
        EXCLUDE
    }

    public LevelOfDetailExpression {
        Objects.requireNonNull(scope, "Scope cannot be null");
        Objects.requireNonNull(aggregate, "Aggregate expression cannot be null");
        Objects.requireNonNull(position, "Position cannot be null");
        dimensions = List.copyOf(dimensions);
    }

    @Override
    public <T> T accept(CalcExpressionVisitor<T> visitor) {
        return visitor.visitLevelOfDetail(this);
    }
}
