package io.calcport.calc.dsl;

import io.calcport.engine.diagnostic.SourcePosition;

import java.util.Objects;

/**
 * Reference to a field or calculation: [Sales], [Orders].[Sales].
 *
 * @param name      the name as written, brackets removed
 * @param sourceKey raw name of the resolved field, or null when the name is unknown
 * @param position  where the reference starts
 */
public record FieldReference(String name, String sourceKey, SourcePosition position) implements CalcExpression {

    public FieldReference {
        Objects.requireNonNull(name, "Field name cannot be null");
        Objects.requireNonNull(position, "Position cannot be null");
    }

    public static FieldReference resolved(String name, String sourceKey, SourcePosition position) {
        return new FieldReference(name, Objects.requireNonNull(sourceKey), position);
    }

    public static FieldReference unresolved(String name, SourcePosition position) {
        return new FieldReference(name, null, position);
    }

    public boolean isResolved() {
        return sourceKey != null;
    }

    @Override
    public <T> T accept(CalcExpressionVisitor<T> visitor) {
        return visitor.visitFieldReference(this);
    }
}
