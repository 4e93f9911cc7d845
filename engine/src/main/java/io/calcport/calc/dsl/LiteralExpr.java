package io.calcport.calc.dsl;

import io.calcport.engine.diagnostic.SourcePosition;
import io.calcport.engine.model.DataType;

import java.util.Objects;

/**
 * Literal value: "East", 42, 3.5, TRUE, #2024-01-15#, NULL.
 *
 * <p>Value representation per type: STRING → String, INTEGER → Long,
 * REAL → Double, BOOLEAN → Boolean, DATE/DATETIME → ISO String.
 * A null value with a null dataType is the NULL literal.
 */
public record LiteralExpr(Object value, DataType dataType, SourcePosition position) implements CalcExpression {

    public LiteralExpr {
        Objects.requireNonNull(position, "Position cannot be null");
        if (value != null && dataType == null) {
            throw new IllegalArgumentException("Non-null literal requires a data type");
        }
    }

    public static LiteralExpr string(String value, SourcePosition position) {
        return new LiteralExpr(value, DataType.STRING, position);
    }

    public static LiteralExpr integer(long value, SourcePosition position) {
        return new LiteralExpr(value, DataType.INTEGER, position);
    }

    public static LiteralExpr real(double value, SourcePosition position) {
        return new LiteralExpr(value, DataType.REAL, position);
    }

    public static LiteralExpr bool(boolean value, SourcePosition position) {
        return new LiteralExpr(value, DataType.BOOLEAN, position);
    }

    public static LiteralExpr nullValue(SourcePosition position) {
        return new LiteralExpr(null, null, position);
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public <T> T accept(CalcExpressionVisitor<T> visitor) {
        return visitor.visitLiteral(this);
    }
}
