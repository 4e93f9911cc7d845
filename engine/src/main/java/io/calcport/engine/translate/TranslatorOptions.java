package io.calcport.engine.translate;

import java.util.Objects;
import java.util.Properties;

/**
 * Switches that change the emitted SQL.
 *
 * @param guardDivision                    Emit {@code a / NULLIF(b, 0)} instead of reporting unchecked divisions
 * @param referenceCalculationsByIdentifier Reference upstream calculations by column instead of inlining them
 * @param parallelParse                    Parse a request's calculations concurrently
 * @param sourceRelation                   SQL relation holding every source row, read by level-of-detail scopes
 * @param rowAlias                         Alias the consumer gives the current row's relation
 */
public record TranslatorOptions(
        boolean guardDivision,
        boolean referenceCalculationsByIdentifier,
        boolean parallelParse,
        String sourceRelation,
        String rowAlias) {

    public static final String PREFIX = "calcport.";
    public static final String DEFAULT_SOURCE_RELATION = "source_rows";
    public static final String DEFAULT_ROW_ALIAS = "src";

    public TranslatorOptions {
        Objects.requireNonNull(sourceRelation, "Source relation cannot be null");
        Objects.requireNonNull(rowAlias, "Row alias cannot be null");
        if (sourceRelation.isBlank() || rowAlias.isBlank()) {
            throw new IllegalArgumentException("Source relation and row alias must not be blank");
        }
    }

    public static TranslatorOptions defaults() {
        return new TranslatorOptions(false, false, false, DEFAULT_SOURCE_RELATION, DEFAULT_ROW_ALIAS);
    }

    /**
     * Reads {@code calcport.guardDivision}, {@code calcport.referenceCalculationsByIdentifier},
     * {@code calcport.parallelParse}, {@code calcport.sourceRelation} and {@code calcport.rowAlias}.
     */
    public static TranslatorOptions fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    public static TranslatorOptions fromProperties(Properties properties) {
        TranslatorOptions d = defaults();
        return new TranslatorOptions(
                flag(properties, "guardDivision", d.guardDivision()),
                flag(properties, "referenceCalculationsByIdentifier", d.referenceCalculationsByIdentifier()),
                flag(properties, "parallelParse", d.parallelParse()),
                properties.getProperty(PREFIX + "sourceRelation", d.sourceRelation()),
                properties.getProperty(PREFIX + "rowAlias", d.rowAlias()));
    }

    public TranslatorOptions withGuardDivision(boolean guard) {
        return new TranslatorOptions(guard, referenceCalculationsByIdentifier, parallelParse, sourceRelation, rowAlias);
    }

    public TranslatorOptions withReferenceCalculationsByIdentifier(boolean byIdentifier) {
        return new TranslatorOptions(guardDivision, byIdentifier, parallelParse, sourceRelation, rowAlias);
    }

    public TranslatorOptions withParallelParse(boolean parallel) {
        return new TranslatorOptions(guardDivision, referenceCalculationsByIdentifier, parallel, sourceRelation, rowAlias);
    }

    public TranslatorOptions withSourceRelation(String relation) {
        return new TranslatorOptions(guardDivision, referenceCalculationsByIdentifier, parallelParse, relation, rowAlias);
    }

    public TranslatorOptions withRowAlias(String alias) {
        return new TranslatorOptions(guardDivision, referenceCalculationsByIdentifier, parallelParse, sourceRelation, alias);
    }

    private static boolean flag(Properties properties, String key, boolean fallback) {
        String value = properties.getProperty(PREFIX + key);
        return value == null ? fallback : Boolean.parseBoolean(value.trim());
    }
}
