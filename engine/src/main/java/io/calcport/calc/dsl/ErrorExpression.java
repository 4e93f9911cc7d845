package io.calcport.calc.dsl;

import io.calcport.engine.diagnostic.SourcePosition;

import java.util.Objects;

/**
 * Sentinel for a sub-expression that could not be parsed. Lets the parent node
 * still be built so the rest of the formula is checked in the same pass.
 */
public record ErrorExpression(String message, SourcePosition position) implements CalcExpression {

    public ErrorExpression {
        Objects.requireNonNull(message, "Message cannot be null");
        Objects.requireNonNull(position, "Position cannot be null");
    }

    @Override
    public <T> T accept(CalcExpressionVisitor<T> visitor) {
        return visitor.visitError(this);
    }
}
