package io.calcport.engine.execution;

import io.calcport.calc.dsl.CalcParser;
import io.calcport.calc.dsl.ParseResult;
import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.diagnostic.DiagnosticKind;
import io.calcport.engine.diagnostic.SourcePosition;
import io.calcport.engine.mapping.IdentifierMapper;
import io.calcport.engine.mapping.IdentifierMapping;
import io.calcport.engine.mapping.IdentifierTable;
import io.calcport.engine.mapping.IdentifierValidator;
import io.calcport.engine.mapping.ReservedWords;
import io.calcport.engine.model.CalculationState;
import io.calcport.engine.model.Field;
import io.calcport.engine.model.FieldCatalog;
import io.calcport.engine.resolve.CalculationDependencies;
import io.calcport.engine.resolve.DependencyOrder;
import io.calcport.engine.resolve.DependencyResolver;
import io.calcport.engine.transpiler.DuckDBDialect;
import io.calcport.engine.transpiler.SQLDialect;
import io.calcport.engine.translate.CalcTranslator;
import io.calcport.engine.translate.TranslationResult;
import io.calcport.engine.translate.TranslatorOptions;
import io.calcport.engine.translate.UpstreamCalculation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Translates every calculation of a workbook in one pass.
 *
 * <pre>
 * assign identifiers -> parse (optionally in parallel) -> order -> translate in order
 * </pre>
 *
 * A failure is confined to its calculation: a syntax error leaves it
 * PARSE_FAILED, an error during lowering TRANSLATE_FAILED, a cycle
 * EXCLUDED_BY_CYCLE, and calculations depending on any of those report
 * upstream-failed. Nothing here throws on malformed formulas.
 */
public final class WorkbookTranslator {

    private static final Logger log = LoggerFactory.getLogger(WorkbookTranslator.class);

    private final SQLDialect dialect;
    private final IdentifierMapper mapper = new IdentifierMapper();
    private final DependencyResolver resolver = new DependencyResolver();

    public WorkbookTranslator() {
        this(DuckDBDialect.INSTANCE);
    }

    public WorkbookTranslator(SQLDialect dialect) {
        this.dialect = dialect;
    }

    /**
     * @throws IllegalArgumentException if two fields share a raw name
     */
    public TranslationResponse translate(TranslationRequest request) {
        TranslatorOptions options = request.options();
        FieldCatalog catalog = FieldCatalog.of(request.fields());

        ReservedWords reservedWords = ReservedWords.forDialect(dialect, options.sourceRelation(), options.rowAlias());
        IdentifierTable table = mapper.assignAll(request.table().withReservedWords(reservedWords), request.fields());
        List<Diagnostic> batchDiagnostics = new ArrayList<>(invalidMappings(table));

        List<Field> calculations = catalog.calculations();
        Map<String, ParseResult> parsed = parseAll(calculations, catalog, options.parallelParse());

        DependencyOrder order = resolver.order(calculations.stream()
                .map(c -> new CalculationDependencies(c.rawName(), parsed.get(c.rawName()).references()))
                .toList());
        batchDiagnostics.addAll(order.diagnostics());

        CalcTranslator translator = new CalcTranslator(dialect, options);
        Map<String, UpstreamCalculation> translated = new HashMap<>();
        Map<String, CalculationResult> results = new HashMap<>();
        for (String key : order.order()) {
            results.put(key, translateOne(key, parsed.get(key), table, translator, translated));
        }
        for (String key : order.excluded()) {
            List<Diagnostic> diagnostics = new ArrayList<>();
            order.diagnostics().stream()
                    .filter(d -> d.subjects().contains(key))
                    .forEach(diagnostics::add);
            diagnostics.addAll(parsed.get(key).diagnostics());
            results.put(key, CalculationResult.failed(key, identifier(table, key),
                    CalculationState.EXCLUDED_BY_CYCLE, diagnostics));
        }

        List<CalculationResult> inInputOrder = calculations.stream()
                .map(c -> results.get(c.rawName()))
                .toList();
        TranslationResponse response = new TranslationResponse(inInputOrder, order.order(), table, batchDiagnostics);
        log.info("Translated workbook: {} field(s), {} calculation(s), states {}",
                request.fields().size(), calculations.size(), response.stateCounts());
        return response;
    }

    private CalculationResult translateOne(String key, ParseResult parse, IdentifierTable table,
                                           CalcTranslator translator, Map<String, UpstreamCalculation> translated) {
        String identifier = identifier(table, key);
        if (parse.hasSyntaxErrors()) {
            log.debug("{} failed to parse: {}", key, parse.diagnostics());
            return CalculationResult.failed(key, identifier, CalculationState.PARSE_FAILED, parse.diagnostics());
        }

        TranslationResult result = translator.translate(parse.ast(), table, translated);
        // The parser and the translator both report unresolved fields
        List<Diagnostic> diagnostics = new ArrayList<>(Stream.concat(
                        parse.diagnostics().stream(), result.diagnostics().stream())
                .collect(Collectors.toCollection(LinkedHashSet::new)));

        if (diagnostics.stream().anyMatch(Diagnostic::isError)) {
            log.debug("{} failed to translate: {}", key, diagnostics);
            return CalculationResult.failed(key, identifier, CalculationState.TRANSLATE_FAILED, diagnostics);
        }
        translated.put(key, new UpstreamCalculation(
                key, identifier, result.plan(), parse.ast(), result.consumedIdentifiers()));
        return new CalculationResult(key, identifier, CalculationState.TRANSLATED, result.expression(),
                result.consumedIdentifiers(), result.isAggregate(), diagnostics);
    }

    private static Map<String, ParseResult> parseAll(List<Field> calculations, FieldCatalog catalog,
                                                     boolean parallel) {
        Stream<Field> stream = parallel ? calculations.parallelStream() : calculations.stream();
        return stream.collect(Collectors.toMap(
                Field::rawName,
                c -> CalcParser.parse(c.sourceText(), catalog),
                (a, b) -> a,
                HashMap::new));
    }

    /**
     * One naming-conflict diagnostic per mapping the request could not make valid,
     * e.g. a user identifier that collides with a configured row alias.
     */
    private static List<Diagnostic> invalidMappings(IdentifierTable table) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (IdentifierMapping mapping : table.mappings()) {
            List<String> problems = IdentifierValidator.problems(table, mapping);
            if (!problems.isEmpty()) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.NAMING_CONFLICT,
                        "Identifier for field '" + mapping.sourceKey() + "' is invalid: "
                                + String.join("; ", problems),
                        SourcePosition.UNKNOWN, mapping.sourceKey()));
            }
        }
        return diagnostics;
    }

    private static String identifier(IdentifierTable table, String key) {
        return table.identifierOf(key).orElse("");
    }
}
