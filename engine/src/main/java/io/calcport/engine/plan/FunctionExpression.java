package io.calcport.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * A scalar SQL function call, {@code name(arg1, arg2, ...)}.
 *
 * @param functionName The SQL function name
 * @param arguments    The arguments
 * @param returnType   The type of the result
 */
public record FunctionExpression(
        String functionName,
        List<Expression> arguments,
        SqlType returnType) implements Expression {

    public FunctionExpression {
        Objects.requireNonNull(functionName, "Function name cannot be null");
        Objects.requireNonNull(returnType, "Return type cannot be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public static FunctionExpression of(String functionName, SqlType returnType, Expression... arguments) {
        return new FunctionExpression(functionName, List.of(arguments), returnType);
    }

    @Override
    public SqlType type() {
        return returnType;
    }

    @Override
    public boolean isAggregate() {
        return arguments.stream().anyMatch(Expression::isAggregate);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
