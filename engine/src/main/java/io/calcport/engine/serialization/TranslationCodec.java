package io.calcport.engine.serialization;

import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.execution.CalculationResult;
import io.calcport.engine.execution.TranslationRequest;
import io.calcport.engine.execution.TranslationResponse;
import io.calcport.engine.mapping.IdentifierMapper;
import io.calcport.engine.mapping.IdentifierTable;
import io.calcport.engine.mapping.MappingSummary;
import io.calcport.engine.mapping.ReservedWords;
import io.calcport.engine.model.DataType;
import io.calcport.engine.model.Field;
import io.calcport.engine.model.FieldKind;
import io.calcport.engine.translate.TranslatorOptions;
import io.calcport.engine.transpiler.DuckDBDialect;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts translation requests and responses to and from JSON trees.
 *
 * <p>Request:
 * <pre>
 * {"fields": [{"raw_name", "display_name"?, "kind", "data_type", "source_text"?}],
 *  "mappings": [mapping records]?,
 *  "options": {"guard_division", "reference_calculations_by_identifier",
 *              "parallel_parse", "source_relation", "row_alias"}?}
 * </pre>
 */
public final class TranslationCodec {

    private final MappingSerializer mappings;

    public TranslationCodec(IdentifierMapper mapper) {
        this.mappings = new MappingSerializer(mapper);
    }

    /**
     * @throws IllegalArgumentException if a field is malformed
     * @throws io.calcport.engine.mapping.MappingImportException if the mappings are rejected
     */
    public TranslationRequest readRequest(Map<String, Object> body, TranslatorOptions defaults) {
        Object fieldList = body.get("fields");
        if (!(fieldList instanceof List<?> rawFields)) {
            throw new IllegalArgumentException("Request needs a 'fields' array");
        }
        List<Field> fields = new ArrayList<>();
        for (Object raw : rawFields) {
            if (!(raw instanceof Map<?, ?> f)) {
                throw new IllegalArgumentException("Every field must be an object");
            }
            fields.add(new Field(
                    required(f, "raw_name"),
                    optional(f, "display_name"),
                    FieldKind.valueOf(required(f, "kind").toUpperCase(Locale.ROOT)),
                    DataType.fromWireName(required(f, "data_type")),
                    optional(f, "source_text")));
        }

        TranslatorOptions options = readOptions(body.get("options"), defaults);
        IdentifierTable table = null;
        if (body.get("mappings") instanceof List<?> records) {
            table = mappings.importRecords(records, ReservedWords.forDialect(
                    DuckDBDialect.INSTANCE, options.sourceRelation(), options.rowAlias()));
        }
        return new TranslationRequest(fields, table, options);
    }

    public Map<String, Object> writeResponse(TranslationResponse response) {
        Map<String, Object> tree = new LinkedHashMap<>();
        List<Object> calculations = new ArrayList<>();
        for (CalculationResult result : response.results()) {
            Map<String, Object> calc = new LinkedHashMap<>();
            calc.put("source_key", result.sourceKey());
            calc.put("identifier", result.identifier());
            calc.put("state", result.state().wireName());
            if (result.isTranslated()) {
                calc.put("expression", result.expression());
                calc.put("consumed_identifiers", new ArrayList<>(result.consumedIdentifiers()));
                calc.put("aggregate", result.aggregate());
            }
            calc.put("diagnostics", diagnostics(result.diagnostics()));
            calculations.add(calc);
        }
        tree.put("calculations", calculations);
        tree.put("emission_order", response.emissionOrder());
        tree.put("mappings", mappings.export(response.table()));
        tree.put("summary", summary(response.table().summary()));
        tree.put("diagnostics", diagnostics(response.diagnostics()));
        return tree;
    }

    public Map<String, Object> summary(MappingSummary summary) {
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("total", summary.total());
        tree.put("valid", summary.valid());
        tree.put("invalid", summary.invalid());
        Map<String, Object> byKind = new LinkedHashMap<>();
        for (FieldKind kind : FieldKind.values()) {
            byKind.put(kind.name().toLowerCase(Locale.ROOT), summary.byKind().getOrDefault(kind, 0));
        }
        tree.put("by_kind", byKind);
        return tree;
    }

    public List<Object> diagnostics(List<Diagnostic> diagnostics) {
        List<Object> list = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            Map<String, Object> tree = new LinkedHashMap<>();
            tree.put("kind", d.kind().wireName());
            tree.put("severity", d.kind().severity().name().toLowerCase(Locale.ROOT));
            tree.put("message", d.message());
            if (d.position().isKnown()) {
                tree.put("line", d.position().line());
                tree.put("column", d.position().column());
            }
            tree.put("subjects", d.subjects());
            list.add(tree);
        }
        return list;
    }

    public MappingSerializer mappings() {
        return mappings;
    }

    public static TranslatorOptions readOptions(Object raw, TranslatorOptions defaults) {
        if (!(raw instanceof Map<?, ?> o)) {
            return defaults;
        }
        return new TranslatorOptions(
                flag(o, "guard_division", defaults.guardDivision()),
                flag(o, "reference_calculations_by_identifier", defaults.referenceCalculationsByIdentifier()),
                flag(o, "parallel_parse", defaults.parallelParse()),
                o.get("source_relation") instanceof String relation ? relation : defaults.sourceRelation(),
                o.get("row_alias") instanceof String alias ? alias : defaults.rowAlias());
    }

    private static boolean flag(Map<?, ?> map, String key, boolean fallback) {
        return map.get(key) instanceof Boolean b ? b : fallback;
    }

    private static String required(Map<?, ?> map, String key) {
        if (!(map.get(key) instanceof String s) || s.isEmpty()) {
            throw new IllegalArgumentException("Field member '" + key + "' is required");
        }
        return s;
    }

    private static String optional(Map<?, ?> map, String key) {
        return map.get(key) instanceof String s ? s : null;
    }
}
