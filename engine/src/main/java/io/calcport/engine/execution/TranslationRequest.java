package io.calcport.engine.execution;

import io.calcport.engine.mapping.IdentifierTable;
import io.calcport.engine.model.Field;
import io.calcport.engine.translate.TranslatorOptions;

import java.util.List;
import java.util.Objects;

/**
 * One workbook's fields, the identifier table as the caller last saw it, and
 * the options to translate with.
 *
 * @param fields  Every field in workbook order, calculations carrying their formulas
 * @param table   Current identifiers; fields without one are assigned during the request
 * @param options Translation switches
 */
public record TranslationRequest(List<Field> fields, IdentifierTable table, TranslatorOptions options) {

    public TranslationRequest {
        Objects.requireNonNull(fields, "Fields cannot be null");
        fields = List.copyOf(fields);
        table = table == null ? IdentifierTable.empty() : table;
        options = options == null ? TranslatorOptions.defaults() : options;
    }

    public static TranslationRequest of(List<Field> fields) {
        return new TranslationRequest(fields, null, null);
    }

    public TranslationRequest withTable(IdentifierTable newTable) {
        return new TranslationRequest(fields, newTable, options);
    }

    public TranslationRequest withOptions(TranslatorOptions newOptions) {
        return new TranslationRequest(fields, table, newOptions);
    }
}
