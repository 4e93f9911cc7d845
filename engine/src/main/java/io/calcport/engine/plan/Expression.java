package io.calcport.engine.plan;

/**
 * Sealed interface representing SQL scalar expressions emitted for a calculation.
 *
 * Includes:
 * - ColumnReference: reference to a source column
 * - Literal: constant value
 * - ArithmeticExpression, ComparisonExpression, LogicalExpression, ConcatExpression
 * - FunctionExpression, AggregateExpression, CastExpression, CaseExpression
 * - FixedScopeExpression: a level-of-detail aggregate broadcast back to rows
 */
public sealed interface Expression
        permits ColumnReference, Literal, ArithmeticExpression, ComparisonExpression, LogicalExpression,
        ConcatExpression, FunctionExpression, AggregateExpression, CastExpression, CaseExpression,
        FixedScopeExpression {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * @return The SQL type this expression produces, UNKNOWN when it can not be told
     */
    SqlType type();

    /**
     * @return True if evaluating this expression aggregates rows of the current query
     */
    default boolean isAggregate() {
        return false;
    }
}
