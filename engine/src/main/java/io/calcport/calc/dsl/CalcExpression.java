package io.calcport.calc.dsl;

import io.calcport.engine.diagnostic.SourcePosition;

/**
 * Root of the calculation-language AST.
 *
 * Type hierarchy:
 * CalcExpression
 * ├── LiteralExpr (string, number, boolean, date, null)
 * ├── FieldReference ([Sales], possibly unresolved)
 * ├── BinaryExpression (arithmetic, comparison, logical)
 * ├── UnaryExpression (negation, NOT)
 * ├── FunctionCall (SUM(...), LEFT(...), ...)
 * ├── ConditionalExpression (IF/ELSEIF/ELSE and desugared CASE)
 * ├── LevelOfDetailExpression ({FIXED [Region] : SUM([Sales])})
 * └── ErrorExpression (sub-expression that failed to parse)
 *
 * The union is closed; every consumer handles all arms through
 * {@link CalcExpressionVisitor}.
 */
public sealed interface CalcExpression
        permits LiteralExpr, FieldReference, BinaryExpression, UnaryExpression, FunctionCall,
        ConditionalExpression, LevelOfDetailExpression, ErrorExpression {

    <T> T accept(CalcExpressionVisitor<T> visitor);

    /**
     * @return where the expression starts in the calculation source
     */
    SourcePosition position();
}
