package io.calcport.engine.execution;

import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.diagnostic.DiagnosticKind;
import io.calcport.engine.mapping.IdentifierMapper;
import io.calcport.engine.mapping.IdentifierTable;
import io.calcport.engine.model.CalculationState;
import io.calcport.engine.model.DataType;
import io.calcport.engine.model.Field;
import io.calcport.engine.translate.TranslatorOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for translating a whole workbook in one request.
 */
@DisplayName("Workbook translator")
class WorkbookTranslatorTest {

    private static final List<Field> SOURCE = List.of(
            Field.dimension("Region", DataType.STRING),
            Field.measure("Sales", DataType.REAL),
            Field.measure("Profit", DataType.REAL));

    private final WorkbookTranslator translator = new WorkbookTranslator();

    private TranslationResponse translate(Field... calculations) {
        return translate(TranslatorOptions.defaults(), calculations);
    }

    private TranslationResponse translate(TranslatorOptions options, Field... calculations) {
        List<Field> fields = new ArrayList<>(SOURCE);
        fields.addAll(List.of(calculations));
        return translator.translate(TranslationRequest.of(fields).withOptions(options));
    }

    private static CalculationResult result(TranslationResponse response, String key) {
        return response.result(key).orElseThrow();
    }

    private static List<DiagnosticKind> kinds(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::kind).toList();
    }

    @Nested
    @DisplayName("States")
    class States {

        @Test
        @DisplayName("A clean calculation is translated with its expression")
        void testTranslated() {
            TranslationResponse response = translate(
                    Field.calculation("Double Sales", DataType.REAL, "[Sales] * 2"));

            CalculationResult r = result(response, "Double Sales");
            assertEquals(CalculationState.TRANSLATED, r.state());
            assertEquals("double_sales", r.identifier());
            assertEquals("(\"sales\" * 2)", r.expression());
            assertEquals(List.of("sales"), List.copyOf(r.consumedIdentifiers()));
            assertFalse(r.aggregate());
        }

        @Test
        @DisplayName("A syntax error leaves the calculation PARSE_FAILED without an expression")
        void testParseFailed() {
            TranslationResponse response = translate(Field.calculation("Broken", DataType.REAL, "SUM([Sales]"));

            CalculationResult r = result(response, "Broken");
            assertEquals(CalculationState.PARSE_FAILED, r.state());
            assertTrue(r.expressionText().isEmpty());
            assertTrue(kinds(r.diagnostics()).contains(DiagnosticKind.SYNTAX_ERROR));
        }

        @Test
        @DisplayName("An unknown field fails translation with a single diagnostic")
        void testTranslateFailed() {
            TranslationResponse response = translate(
                    Field.calculation("Net", DataType.REAL, "[Sales] - [Discount]"));

            CalculationResult r = result(response, "Net");
            assertEquals(CalculationState.TRANSLATE_FAILED, r.state());
            assertNull(r.expression());
            assertEquals(List.of(DiagnosticKind.UNRESOLVED_FIELD), kinds(r.diagnostics()));
        }

        @Test
        @DisplayName("Informational diagnostics do not fail a calculation")
        void testInfoOnly() {
            TranslationResponse response = translate(
                    Field.calculation("Ratio", DataType.REAL, "SUM([Profit]) / SUM([Sales])"));

            CalculationResult r = result(response, "Ratio");
            assertEquals(CalculationState.TRANSLATED, r.state());
            assertTrue(r.aggregate());
            assertEquals(List.of(DiagnosticKind.DIVIDE_BY_ZERO_UNCHECKED), kinds(r.diagnostics()));
        }

        @Test
        @DisplayName("A calculation nested too deeply fails alone")
        void testNestingTooDeep() {
            // GIVEN: one formula far past the nesting limit among ordinary ones
            String deep = "(".repeat(1000) + "[Sales]" + ")".repeat(1000);
            TranslationResponse response = translate(
                    Field.calculation("Deep", DataType.REAL, deep),
                    Field.calculation("Uses Deep", DataType.REAL, "[Deep] + 1"),
                    Field.calculation("Double Sales", DataType.REAL, "[Sales] * 2"));

            // THEN: the deep one is PARSE_FAILED, its dependent fails, the rest translates
            CalculationResult r = result(response, "Deep");
            assertEquals(CalculationState.PARSE_FAILED, r.state());
            assertEquals(List.of(DiagnosticKind.EXPRESSION_TOO_DEEP), kinds(r.diagnostics()));
            assertEquals(List.of(DiagnosticKind.UPSTREAM_FAILED), kinds(result(response, "Uses Deep").diagnostics()));
            assertEquals("(\"sales\" * 2)", result(response, "Double Sales").expression());
        }

        @Test
        @DisplayName("A long sum and its dependent translate promptly")
        void testLongSum() {
            String sum = String.join(" + ", Collections.nCopies(200, "[Sales]"));

            TranslationResponse response = assertTimeoutPreemptively(Duration.ofSeconds(2), () -> translate(
                    Field.calculation("Big Sum", DataType.REAL, sum),
                    Field.calculation("Uses Big Sum", DataType.REAL, "[Big Sum] / 2")));

            assertEquals(2, response.stateCounts().get(CalculationState.TRANSLATED));
        }

        @Test
        @DisplayName("State counts cover every calculation")
        void testStateCounts() {
            TranslationResponse response = translate(
                    Field.calculation("A", DataType.REAL, "[Sales]"),
                    Field.calculation("B", DataType.REAL, "[Nope]"),
                    Field.calculation("C", DataType.REAL, "(("));

            Map<CalculationState, Integer> counts = response.stateCounts();
            assertEquals(1, counts.get(CalculationState.TRANSLATED));
            assertEquals(1, counts.get(CalculationState.TRANSLATE_FAILED));
            assertEquals(1, counts.get(CalculationState.PARSE_FAILED));
        }
    }

    @Nested
    @DisplayName("Dependencies")
    class Dependencies {

        @Test
        @DisplayName("Calculations are emitted after the ones they reference")
        void testEmissionOrder() {
            TranslationResponse response = translate(
                    Field.calculation("Pct", DataType.REAL, "[Ratio] * 100"),
                    Field.calculation("Ratio", DataType.REAL, "[Profit] / [Sales]"));

            assertEquals(List.of("Ratio", "Pct"), response.emissionOrder());
            // results stay in input order
            assertEquals("Pct", response.results().get(0).sourceKey());
            assertEquals("((\"profit\" / \"sales\") * 100)", result(response, "Pct").expression());
            assertEquals(List.of("Ratio", "Pct"), response.translatedInEmissionOrder().stream()
                    .map(CalculationResult::sourceKey).toList());
        }

        @Test
        @DisplayName("A failure upstream fails its dependents")
        void testUpstreamFailed() {
            TranslationResponse response = translate(
                    Field.calculation("Bad", DataType.REAL, "[Sales] +"),
                    Field.calculation("Uses Bad", DataType.REAL, "[Bad] * 2"),
                    Field.calculation("Independent", DataType.REAL, "[Sales] * 3"));

            assertEquals(CalculationState.PARSE_FAILED, result(response, "Bad").state());
            CalculationResult dependent = result(response, "Uses Bad");
            assertEquals(CalculationState.TRANSLATE_FAILED, dependent.state());
            assertEquals(List.of(DiagnosticKind.UPSTREAM_FAILED), kinds(dependent.diagnostics()));
            assertEquals(CalculationState.TRANSLATED, result(response, "Independent").state());
        }

        @Test
        @DisplayName("A cycle is isolated; everything else still translates")
        void testCycleIsolation() {
            // GIVEN: A -> B -> C -> A, plus D depending on A and an unrelated E
            TranslationResponse response = translate(
                    Field.calculation("A", DataType.REAL, "[B] + 1"),
                    Field.calculation("B", DataType.REAL, "[C] + 1"),
                    Field.calculation("C", DataType.REAL, "[A] + 1"),
                    Field.calculation("D", DataType.REAL, "[A] * 2"),
                    Field.calculation("E", DataType.REAL, "[Sales] * 2"));

            // THEN: one batch diagnostic naming the three members
            List<Diagnostic> cycles = response.diagnostics().stream()
                    .filter(d -> d.kind() == DiagnosticKind.CIRCULAR_DEPENDENCY)
                    .toList();
            assertEquals(1, cycles.size());
            assertEquals(List.of("A", "B", "C"), cycles.get(0).subjects());

            for (String member : List.of("A", "B", "C")) {
                CalculationResult r = result(response, member);
                assertEquals(CalculationState.EXCLUDED_BY_CYCLE, r.state());
                assertEquals(List.of(DiagnosticKind.CIRCULAR_DEPENDENCY), kinds(r.diagnostics()));
            }
            assertEquals(CalculationState.TRANSLATE_FAILED, result(response, "D").state());
            assertEquals(CalculationState.TRANSLATED, result(response, "E").state());
            assertEquals(List.of("D", "E"), response.emissionOrder());
        }
    }

    @Nested
    @DisplayName("Identifiers")
    class Identifiers {

        @Test
        @DisplayName("Fields missing from the table are assigned, existing identifiers kept")
        void testAutoAssign() {
            IdentifierMapper mapper = new IdentifierMapper();
            IdentifierTable table = mapper.assignAll(IdentifierTable.empty(), List.of(SOURCE.get(1)));
            table = mapper.rename(table, "Sales", "revenue").table();
            List<Field> fields = new ArrayList<>(SOURCE);
            fields.add(Field.calculation("Twice", DataType.REAL, "[Sales] * 2"));

            TranslationResponse response = translator.translate(TranslationRequest.of(fields).withTable(table));

            assertEquals(4, response.table().size());
            assertEquals("revenue", response.table().identifierOf("Sales").orElseThrow());
            assertEquals("region", response.table().identifierOf("Region").orElseThrow());
            assertEquals("(\"revenue\" * 2)", result(response, "Twice").expression());
        }

        @Test
        @DisplayName("Identifiers that clash with the configured relation are reported")
        void testRelationConflict() {
            IdentifierMapper mapper = new IdentifierMapper();
            IdentifierTable table = mapper.assignAll(IdentifierTable.empty(),
                    List.of(Field.dimension("Orders", DataType.STRING)));
            List<Field> fields = List.of(Field.dimension("Orders", DataType.STRING));

            TranslationResponse response = translator.translate(TranslationRequest.of(fields)
                    .withTable(table)
                    .withOptions(TranslatorOptions.defaults().withSourceRelation("orders")));

            assertEquals(List.of(DiagnosticKind.NAMING_CONFLICT), kinds(response.diagnostics()));
            assertEquals(List.of("Orders"), response.diagnostics().get(0).subjects());
        }

        @Test
        @DisplayName("Newly assigned identifiers avoid the configured row alias")
        void testRowAliasAvoided() {
            TranslationResponse response = translator.translate(TranslationRequest.of(
                            List.of(Field.dimension("Facts", DataType.STRING)))
                    .withOptions(TranslatorOptions.defaults().withRowAlias("facts")));

            assertEquals("facts_field", response.table().identifierOf("Facts").orElseThrow());
            assertTrue(response.diagnostics().isEmpty());
        }
    }

    @Test
    @DisplayName("Parallel parsing gives the same response")
    void testParallelParse() {
        List<Field> calculations = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            calculations.add(Field.calculation("Calc " + i, DataType.REAL,
                    i == 0 ? "[Sales] * 2" : "[Calc " + (i - 1) + "] + " + i));
        }
        Field[] array = calculations.toArray(new Field[0]);

        TranslationResponse sequential = translate(array);
        TranslationResponse parallel = translate(TranslatorOptions.defaults().withParallelParse(true), array);

        assertEquals(sequential.results(), parallel.results());
        assertEquals(sequential.emissionOrder(), parallel.emissionOrder());
        assertEquals(50, sequential.translatedInEmissionOrder().size());
    }

    @Test
    @DisplayName("Duplicate raw names are rejected")
    void testDuplicateFields() {
        List<Field> fields = List.of(Field.measure("Sales", DataType.REAL), Field.measure("Sales", DataType.REAL));

        assertThrows(IllegalArgumentException.class, () -> translator.translate(TranslationRequest.of(fields)));
    }
}
