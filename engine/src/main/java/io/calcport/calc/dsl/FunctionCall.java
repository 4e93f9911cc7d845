package io.calcport.calc.dsl;

import io.calcport.engine.diagnostic.SourcePosition;

import java.util.List;
import java.util.Objects;

/**
 * Function call: SUM([Sales]), DATEADD('month', 1, [Order Date]).
 *
 * @param name      function name, upper-cased
 * @param arguments arguments in written order
 */
public record FunctionCall(String name, List<CalcExpression> arguments, SourcePosition position)
        implements CalcExpression {

    public FunctionCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(position, "Position cannot be null");
        arguments = List.copyOf(arguments);
    }

    public int arity() {
        return arguments.size();
    }

    public CalcExpression argument(int index) {
        return arguments.get(index);
    }

    @Override
    public <T> T accept(CalcExpressionVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
