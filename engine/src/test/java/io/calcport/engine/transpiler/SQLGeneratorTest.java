package io.calcport.engine.transpiler;

import io.calcport.engine.plan.AggregateExpression;
import io.calcport.engine.plan.ArithmeticExpression;
import io.calcport.engine.plan.CastExpression;
import io.calcport.engine.plan.ColumnReference;
import io.calcport.engine.plan.ComparisonExpression;
import io.calcport.engine.plan.FixedScopeExpression;
import io.calcport.engine.plan.Literal;
import io.calcport.engine.plan.SqlType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rendering plan expressions as DuckDB SQL.
 */
@DisplayName("SQL generator")
class SQLGeneratorTest {

    private final SQLGenerator generator = new SQLGenerator(DuckDBDialect.INSTANCE);

    @Test
    @DisplayName("Identifiers are quoted, embedded quotes doubled")
    void testIdentifierQuoting() {
        assertEquals("\"order\"", generator.generate(ColumnReference.of("order", SqlType.VARCHAR)));
        assertEquals("\"a\"\"b\"", generator.generate(ColumnReference.of("a\"b", SqlType.VARCHAR)));
        assertEquals("t.\"x\"", generator.generate(ColumnReference.of("t", "x", SqlType.BIGINT)));
    }

    @Test
    @DisplayName("Doubles always carry a fractional part")
    void testDoubles() {
        assertEquals("3.0", generator.generate(Literal.decimal(3)));
        assertEquals("-0.25", generator.generate(Literal.decimal(-0.25)));
        assertEquals("42", generator.generate(Literal.integer(42)));
    }

    @Test
    @DisplayName("Casts use DuckDB type names")
    void testCast() {
        assertEquals("CAST(NULL AS DOUBLE)", generator.generate(CastExpression.typedNull(SqlType.DOUBLE)));
        assertEquals("CAST(\"d\" AS TIMESTAMP)",
                generator.generate(new CastExpression(ColumnReference.of("d", SqlType.DATE), SqlType.TIMESTAMP)));
    }

    @Test
    @DisplayName("Unary comparisons have no right operand")
    void testIsNull() {
        assertEquals("(\"x\" IS NULL)", generator.generate(ComparisonExpression.isNull(
                ColumnReference.of("x", SqlType.BIGINT))));
    }

    @Test
    @DisplayName("Fixed scopes render as correlated scalar subqueries")
    void testFixedScope() {
        FixedScopeExpression scope = new FixedScopeExpression(1, "facts",
                List.of(new FixedScopeExpression.Key(
                        ColumnReference.of("lod1_rows", "k", SqlType.VARCHAR),
                        ColumnReference.of("src", "k", SqlType.VARCHAR))),
                AggregateExpression.of(AggregateExpression.AggregateFunction.COUNT,
                        ColumnReference.of("lod1_rows", "v", SqlType.BIGINT)));

        assertEquals("(SELECT lod1.\"__lod_value\" FROM (SELECT lod1_rows.\"k\" AS \"__lod_key_0\","
                + " COUNT(lod1_rows.\"v\") AS \"__lod_value\" FROM facts AS lod1_rows GROUP BY lod1_rows.\"k\")"
                + " AS lod1 WHERE lod1.\"__lod_key_0\" IS NOT DISTINCT FROM src.\"k\")", generator.generate(scope));
        assertEquals(SqlType.BIGINT, scope.type());
    }

    @Test
    @DisplayName("Modulo and nested arithmetic stay parenthesized")
    void testArithmetic() {
        assertEquals("((\"a\" % 2) - 1)", generator.generate(ArithmeticExpression.subtract(
                new ArithmeticExpression(ColumnReference.of("a", SqlType.BIGINT),
                        ArithmeticExpression.Operator.MODULO, Literal.integer(2)),
                Literal.integer(1))));
    }
}
