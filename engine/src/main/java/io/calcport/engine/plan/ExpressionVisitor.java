package io.calcport.engine.plan;

/**
 * Visitor interface for traversing Expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    T visitColumnReference(ColumnReference columnRef);

    T visitLiteral(Literal literal);

    T visitArithmetic(ArithmeticExpression arithmetic);

    T visitComparison(ComparisonExpression comparison);

    T visitLogical(LogicalExpression logical);

    T visitConcat(ConcatExpression concat);

    T visitFunctionCall(FunctionExpression functionCall);

    T visitAggregate(AggregateExpression aggregate);

    T visitCast(CastExpression cast);

    /**
     * Visit a CASE/conditional expression.
     */
    T visitCase(CaseExpression caseExpr);

    /**
     * Visit a level-of-detail subquery.
     */
    T visitFixedScope(FixedScopeExpression fixedScope);
}
