package io.calcport.engine.translate;

import io.calcport.calc.dsl.CalcParser;
import io.calcport.calc.dsl.ParseResult;
import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.diagnostic.DiagnosticKind;
import io.calcport.engine.mapping.IdentifierMapper;
import io.calcport.engine.mapping.IdentifierTable;
import io.calcport.engine.model.DataType;
import io.calcport.engine.model.Field;
import io.calcport.engine.model.FieldCatalog;
import io.calcport.engine.transpiler.DuckDBDialect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for lowering calculation ASTs to DuckDB SQL text.
 */
@DisplayName("Calculation translator")
class CalcTranslatorTest {

    private static final FieldCatalog FIELDS = FieldCatalog.of(
            Field.dimension("Region", DataType.STRING),
            Field.dimension("Customer Name", DataType.STRING),
            Field.dimension("Order Date", DataType.DATE),
            Field.measure("Sales", DataType.REAL),
            Field.measure("Profit", DataType.REAL),
            Field.calculation("Profit Ratio", DataType.REAL, "[Profit] / [Sales]"));

    private static final IdentifierTable TABLE = new IdentifierMapper()
            .assignAll(IdentifierTable.empty(), FIELDS.fields());

    private static TranslationResult translate(String formula) {
        return translate(formula, TranslatorOptions.defaults(), Map.of());
    }

    private static TranslationResult translate(String formula, TranslatorOptions options,
                                               Map<String, UpstreamCalculation> upstream) {
        ParseResult parsed = CalcParser.parse(formula, FIELDS);
        return new CalcTranslator(DuckDBDialect.INSTANCE, options).translate(parsed.ast(), TABLE, upstream);
    }

    private static List<DiagnosticKind> kinds(TranslationResult result) {
        return result.diagnostics().stream().map(Diagnostic::kind).toList();
    }

    private static UpstreamCalculation profitRatio() {
        ParseResult parsed = CalcParser.parse("[Profit] / [Sales]", FIELDS);
        TranslationResult result = new CalcTranslator(DuckDBDialect.INSTANCE, TranslatorOptions.defaults())
                .translate(parsed.ast(), TABLE, Map.of());
        return new UpstreamCalculation("Profit Ratio", "profit_ratio", result.plan(), parsed.ast(),
                result.consumedIdentifiers());
    }

    @Nested
    @DisplayName("Scalar expressions")
    class Scalars {

        @Test
        @DisplayName("Arithmetic keeps precedence through parentheses")
        void testArithmetic() {
            TranslationResult result = translate("[Sales] + [Profit] * 2");

            assertEquals("(\"sales\" + (\"profit\" * 2))", result.expression());
            assertTrue(result.diagnostics().isEmpty());
            assertFalse(result.isAggregate());
            assertEquals(List.of("sales", "profit"), List.copyOf(result.consumedIdentifiers()));
        }

        @Test
        @DisplayName("Literals render in DuckDB syntax")
        void testLiterals() {
            assertEquals("(\"sales\" * 1.5)", translate("[Sales] * 1.5").expression());
            assertEquals("'it''s'", translate("'it''s'").expression());
            assertEquals("TRUE", translate("true").expression());
            assertEquals("NULL", translate("NULL").expression());
            assertEquals("DATE '2024-01-15'", translate("#2024-01-15#").expression());
            assertEquals("TIMESTAMP '2024-01-15 10:30:00'", translate("#2024-01-15 10:30:00#").expression());
        }

        @Test
        @DisplayName("Negation subtracts from zero")
        void testNegation() {
            assertEquals("(0 - \"sales\")", translate("-[Sales]").expression());
        }

        @Test
        @DisplayName("String addition becomes one flattened concatenation")
        void testConcat() {
            TranslationResult result = translate("[Region] + ' - ' + [Customer Name]");

            assertEquals("(\"region\" || ' - ' || \"customer_name\")", result.expression());
        }

        @Test
        @DisplayName("Chained AND/OR flatten, NOT wraps its operand")
        void testLogical() {
            assertEquals("((\"sales\" > 1) OR (\"sales\" < 0) OR (\"profit\" = 0))",
                    translate("[Sales] > 1 OR [Sales] < 0 OR [Profit] = 0").expression());
            assertEquals("((NOT (\"sales\" > 0)) AND (\"profit\" < 0))",
                    translate("NOT [Sales] > 0 AND [Profit] < 0").expression());
            assertEquals("(\"region\" <> 'East')", translate("[Region] != 'East'").expression());
        }

        @Test
        @DisplayName("IF keeps branch order, missing ELSE becomes a typed NULL")
        void testConditional() {
            assertEquals("CASE WHEN (\"sales\" > 100) THEN 'High' WHEN (\"sales\" > 10) THEN 'Mid' ELSE 'Low' END",
                    translate("IF [Sales] > 100 THEN 'High' ELSEIF [Sales] > 10 THEN 'Mid' ELSE 'Low' END")
                            .expression());
            assertEquals("CASE WHEN (\"sales\" > 0) THEN 1 ELSE CAST(NULL AS BIGINT) END",
                    translate("IF [Sales] > 0 THEN 1 END").expression());
        }

        @Test
        @DisplayName("A long chain of additions translates in linear time")
        void testLongSum() {
            // GIVEN: a 200-term left-deep sum
            String formula = String.join(" + ", Collections.nCopies(200, "[Sales]"));

            // WHEN
            TranslationResult result = assertTimeoutPreemptively(Duration.ofSeconds(1), () -> translate(formula));

            // THEN
            assertTrue(result.diagnostics().isEmpty());
            assertTrue(result.expression().startsWith("(".repeat(199) + "\"sales\" + \"sales\")"));
            assertEquals(List.of("sales"), List.copyOf(result.consumedIdentifiers()));
        }

        @Test
        @DisplayName("Deeply nested IF results translate in linear time")
        void testNestedConditionals() {
            // GIVEN: IF nested 60 deep in the THEN branch
            int depth = 60;
            String formula = "IF [Sales] > 0 THEN ".repeat(depth) + "[Profit]" + " ELSE 0 END".repeat(depth);

            TranslationResult result = assertTimeoutPreemptively(Duration.ofSeconds(1), () -> translate(formula));

            assertTrue(result.diagnostics().isEmpty());
            assertEquals(depth, result.expression().split("CASE WHEN", -1).length - 1);
        }
    }

    @Nested
    @DisplayName("Division")
    class Division {

        @Test
        @DisplayName("Unguarded division is reported as informational")
        void testUnchecked() {
            TranslationResult result = translate("SUM([Profit]) / SUM([Sales])");

            assertEquals("(SUM(\"profit\") / SUM(\"sales\"))", result.expression());
            assertEquals(List.of(DiagnosticKind.DIVIDE_BY_ZERO_UNCHECKED), kinds(result));
            assertFalse(result.hasErrors());
            assertTrue(result.isAggregate());
        }

        @Test
        @DisplayName("Guarded division wraps the divisor in nullif")
        void testGuarded() {
            TranslationResult result = translate("SUM([Profit]) / SUM([Sales])",
                    TranslatorOptions.defaults().withGuardDivision(true), Map.of());

            assertEquals("(SUM(\"profit\") / nullif(SUM(\"sales\"), 0))", result.expression());
            assertTrue(result.diagnostics().isEmpty());
        }

        @Test
        @DisplayName("Functions that divide follow the same rule")
        void testFunctionDivision() {
            TranslationResult result = translate("LOG([Sales], 2)");

            assertEquals("(ln(\"sales\") / ln(2))", result.expression());
            assertEquals(List.of(DiagnosticKind.DIVIDE_BY_ZERO_UNCHECKED), kinds(result));
        }
    }

    @Nested
    @DisplayName("Functions")
    class Functions {

        @Test
        @DisplayName("Registered functions map to DuckDB names")
        void testMappedFunctions() {
            assertEquals("COUNT(DISTINCT \"customer_name\")", translate("COUNTD([Customer Name])").expression());
            assertEquals("coalesce(\"sales\", 0)", translate("ZN([Sales])").expression());
            assertEquals("length(\"region\")", translate("len([Region])").expression());
            assertEquals("greatest(\"sales\", \"profit\")", translate("MAX([Sales], [Profit])").expression());
            assertEquals("CAST(trunc(\"sales\") AS BIGINT)", translate("INT([Sales])").expression());
            assertEquals("CAST(\"region\" AS BIGINT)", translate("INT([Region])").expression());
            assertEquals("(\"region\" IS NULL)", translate("ISNULL([Region])").expression());
        }

        @Test
        @DisplayName("IIF routes a NULL test to the unknown branch")
        void testIif() {
            assertEquals("CASE WHEN (\"sales\" > 0) THEN 'pos' WHEN (NOT (\"sales\" > 0)) THEN 'neg'"
                            + " ELSE CAST(NULL AS VARCHAR) END",
                    translate("IIF([Sales] > 0, 'pos', 'neg')").expression());
            assertTrue(translate("IIF([Sales] > 0, 'pos', 'neg', 'n/a')").expression().endsWith("ELSE 'n/a' END"));
        }

        @Test
        @DisplayName("ATTR is the group's single value or NULL")
        void testAttr() {
            assertEquals("CASE WHEN (MIN(\"region\") IS NOT DISTINCT FROM MAX(\"region\")) THEN MIN(\"region\")"
                    + " ELSE CAST(NULL AS VARCHAR) END", translate("ATTR([Region])").expression());
        }

        @Test
        @DisplayName("Date functions take a literal date part")
        void testDateFunctions() {
            assertEquals("date_diff('day', \"order_date\", DATE '2024-01-31')",
                    translate("DATEDIFF('day', [Order Date], #2024-01-31#)").expression());
            assertEquals("date_add(\"order_date\", to_months((1 * 3)))",
                    translate("DATEADD('quarter', 1, [Order Date])").expression());
            assertEquals("date_trunc('month', \"order_date\")",
                    translate("DATETRUNC('MONTH', [Order Date])").expression());
            assertEquals("year(\"order_date\")", translate("YEAR([Order Date])").expression());
        }

        @Test
        @DisplayName("An unknown date part is an argument error")
        void testBadDatePart() {
            TranslationResult result = translate("DATEPART('fortnight', [Order Date])");

            assertEquals(List.of(DiagnosticKind.ARGUMENT_ERROR), kinds(result));
            assertTrue(result.diagnostics().get(0).message().contains("fortnight"));
        }

        @Test
        @DisplayName("Wrong arity names the expected count")
        void testArity() {
            TranslationResult result = translate("LEFT([Region])");

            assertEquals(List.of(DiagnosticKind.ARGUMENT_ERROR), kinds(result));
            assertEquals("LEFT expects 2 arguments, got 1", result.diagnostics().get(0).message());
            assertEquals("NULL", result.expression());
        }

        @Test
        @DisplayName("Unknown functions and table calculations are unsupported")
        void testUnsupported() {
            TranslationResult unknown = translate("FOO([Sales])");
            TranslationResult running = translate("RUNNING_SUM(SUM([Sales]))");

            assertEquals(List.of(DiagnosticKind.UNSUPPORTED_FUNCTION), kinds(unknown));
            assertEquals(List.of("FOO"), unknown.diagnostics().get(0).subjects());
            assertEquals(List.of(DiagnosticKind.UNSUPPORTED_FUNCTION), kinds(running));
            assertTrue(running.diagnostics().get(0).message().contains("Table calculation"));
        }

        @Test
        @DisplayName("Aggregating an aggregate is rejected")
        void testNestedAggregate() {
            TranslationResult result = translate("SUM(AVG([Sales]))");

            assertTrue(result.hasErrors());
            assertEquals(List.of(DiagnosticKind.ARGUMENT_ERROR), kinds(result));
        }

        @Test
        @DisplayName("Lowering continues past the first problem")
        void testSeveralProblems() {
            TranslationResult result = translate("FOO([Sales]) + LEFT([Region]) + [Discount]");

            assertEquals(List.of(DiagnosticKind.UNSUPPORTED_FUNCTION, DiagnosticKind.ARGUMENT_ERROR,
                    DiagnosticKind.UNRESOLVED_FIELD), kinds(result));
        }
    }

    @Nested
    @DisplayName("Level of detail")
    class LevelOfDetail {

        @Test
        @DisplayName("FIXED correlates the scope with the current row")
        void testFixed() {
            TranslationResult result = translate("{FIXED [Region] : SUM([Sales])}");

            assertEquals("(SELECT lod1.\"__lod_value\" FROM (SELECT lod1_rows.\"region\" AS \"__lod_key_0\","
                    + " SUM(lod1_rows.\"sales\") AS \"__lod_value\" FROM source_rows AS lod1_rows"
                    + " GROUP BY lod1_rows.\"region\") AS lod1"
                    + " WHERE lod1.\"__lod_key_0\" IS NOT DISTINCT FROM src.\"region\")", result.expression());
            assertTrue(result.diagnostics().isEmpty());
            assertFalse(result.isAggregate());
        }

        @Test
        @DisplayName("FIXED without dimensions aggregates the whole table")
        void testWholeTable() {
            assertEquals("(SELECT lod1.\"__lod_value\" FROM (SELECT SUM(lod1_rows.\"sales\") AS \"__lod_value\""
                            + " FROM source_rows AS lod1_rows) AS lod1)",
                    translate("{FIXED : SUM([Sales])}").expression());
        }

        @Test
        @DisplayName("Relation and row alias come from the options")
        void testCustomRelation() {
            TranslatorOptions options = TranslatorOptions.defaults()
                    .withSourceRelation("orders")
                    .withRowAlias("o");

            String sql = translate("{FIXED [Region] : SUM([Sales])}", options, Map.of()).expression();

            assertTrue(sql.contains("FROM orders AS lod1_rows"));
            assertTrue(sql.endsWith("IS NOT DISTINCT FROM o.\"region\")"));
        }

        @Test
        @DisplayName("Nested scopes correlate with the enclosing scope's rows")
        void testNested() {
            String sql = translate("{FIXED [Region] : AVG({FIXED [Region], [Customer Name] : SUM([Sales])})}")
                    .expression();

            assertTrue(sql.contains("FROM source_rows AS lod2_rows"));
            assertTrue(sql.contains("lod2.\"__lod_key_0\" IS NOT DISTINCT FROM lod1_rows.\"region\""));
            assertTrue(sql.contains("lod2.\"__lod_key_1\" IS NOT DISTINCT FROM lod1_rows.\"customer_name\""));
            assertTrue(sql.contains("lod1.\"__lod_key_0\" IS NOT DISTINCT FROM src.\"region\""));
        }

        @Test
        @DisplayName("INCLUDE keeps its dimensions and is flagged as context dependent")
        void testInclude() {
            TranslationResult result = translate("{INCLUDE [Customer Name] : SUM([Sales])}");

            assertEquals(List.of(DiagnosticKind.CONTEXT_DEPENDENT_SCOPE), kinds(result));
            assertFalse(result.hasErrors());
            assertTrue(result.expression().contains("GROUP BY lod1_rows.\"customer_name\""));
        }

        @Test
        @DisplayName("EXCLUDE drops its dimensions and is flagged as context dependent")
        void testExclude() {
            TranslationResult result = translate("{EXCLUDE [Region] : SUM([Sales])}");

            assertEquals(List.of(DiagnosticKind.CONTEXT_DEPENDENT_SCOPE), kinds(result));
            assertFalse(result.expression().contains("GROUP BY"));
            assertFalse(result.expression().contains("WHERE"));
        }

        @Test
        @DisplayName("A scope body that does not aggregate is an argument error")
        void testNonAggregateBody() {
            TranslationResult result = translate("{FIXED [Region] : [Sales]}");

            assertEquals(List.of(DiagnosticKind.ARGUMENT_ERROR), kinds(result));
            assertEquals("NULL", result.expression());
        }
    }

    @Nested
    @DisplayName("References")
    class References {

        @Test
        @DisplayName("Unknown fields become NULL placeholders with one diagnostic per occurrence")
        void testUnresolved() {
            TranslationResult result = translate("[Discount] * 2 + [Discount]");

            assertTrue(result.hasErrors());
            assertEquals(List.of(DiagnosticKind.UNRESOLVED_FIELD, DiagnosticKind.UNRESOLVED_FIELD), kinds(result));
            assertEquals("((NULL * 2) + NULL)", result.expression());
        }

        @Test
        @DisplayName("Upstream calculations are inlined with their source columns")
        void testInlineUpstream() {
            TranslationResult result = translate("[Profit Ratio] * 100", TranslatorOptions.defaults()
                    .withGuardDivision(true), Map.of("Profit Ratio", profitRatio()));

            assertEquals("((\"profit\" / \"sales\") * 100)", result.expression());
            assertEquals(Set.of("profit", "sales"), result.consumedIdentifiers());
            assertTrue(result.diagnostics().isEmpty());
        }

        @Test
        @DisplayName("Upstream calculations can be referenced by identifier instead")
        void testByIdentifier() {
            TranslationResult result = translate("[Profit Ratio] * 100", TranslatorOptions.defaults()
                    .withReferenceCalculationsByIdentifier(true), Map.of("Profit Ratio", profitRatio()));

            assertEquals("(\"profit_ratio\" * 100)", result.expression());
            assertEquals(Set.of("profit_ratio"), result.consumedIdentifiers());
        }

        @Test
        @DisplayName("Upstream calculations inside a scope read the scope's rows")
        void testUpstreamInScope() {
            String sql = translate("{FIXED [Region] : SUM([Profit Ratio])}", TranslatorOptions.defaults(),
                    Map.of("Profit Ratio", profitRatio())).expression();

            assertTrue(sql.contains("SUM((lod1_rows.\"profit\" / lod1_rows.\"sales\"))"));
        }

        @Test
        @DisplayName("A calculation that was not translated fails its dependents")
        void testUpstreamMissing() {
            TranslationResult result = translate("[Profit Ratio] * 100");

            assertEquals(List.of(DiagnosticKind.UPSTREAM_FAILED), kinds(result));
            assertEquals(List.of("Profit Ratio"), result.diagnostics().get(0).subjects());
        }
    }
}
