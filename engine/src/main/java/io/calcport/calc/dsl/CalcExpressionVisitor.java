package io.calcport.calc.dsl;

/**
 * Visitor over the closed {@link CalcExpression} union.
 *
 * @param <T> The return type of the visitor methods
 */
public interface CalcExpressionVisitor<T> {

    T visitLiteral(LiteralExpr literal);

    T visitFieldReference(FieldReference reference);

    T visitBinary(BinaryExpression binary);

    T visitUnary(UnaryExpression unary);

    T visitFunctionCall(FunctionCall call);

    T visitConditional(ConditionalExpression conditional);

    T visitLevelOfDetail(LevelOfDetailExpression lod);

    T visitError(ErrorExpression error);
}
