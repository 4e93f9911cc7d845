package io.calcport.engine.model;

import java.util.Objects;

/**
 * A named, typed unit of data in the source workbook.
 *
 * <p>Calculations carry their formula in {@code sourceText}; for every other
 * kind it is null.
 *
 * @param rawName     opaque source identifier, also the mapping key
 * @param displayName human-readable label, may be null
 * @param kind        role of the field
 * @param dataType    declared value type
 * @param sourceText  calculation formula, only for {@link FieldKind#CALCULATION}
 */
public record Field(
        String rawName,
        String displayName,
        FieldKind kind,
        DataType dataType,
        String sourceText) {

    public Field {
        Objects.requireNonNull(rawName, "Raw name cannot be null");
        Objects.requireNonNull(kind, "Field kind cannot be null");
        Objects.requireNonNull(dataType, "Data type cannot be null");
        if (kind == FieldKind.CALCULATION && sourceText == null) {
            throw new IllegalArgumentException("Calculation '" + rawName + "' has no source text");
        }
    }

    public static Field dimension(String rawName, DataType dataType) {
        return new Field(rawName, null, FieldKind.DIMENSION, dataType, null);
    }

    public static Field measure(String rawName, DataType dataType) {
        return new Field(rawName, null, FieldKind.MEASURE, dataType, null);
    }

    public static Field parameter(String rawName, DataType dataType) {
        return new Field(rawName, null, FieldKind.PARAMETER, dataType, null);
    }

    public static Field calculation(String rawName, DataType dataType, String sourceText) {
        return new Field(rawName, null, FieldKind.CALCULATION, dataType, sourceText);
    }

    public boolean isCalculation() {
        return kind == FieldKind.CALCULATION;
    }

    /**
     * The name as written inside a formula reference, without delimiting brackets.
     */
    public String referenceName() {
        return stripDelimiters(rawName);
    }

    /**
     * Removes enclosing brackets or quotes, e.g. {@code [Order Date]} becomes {@code Order Date}.
     */
    public static String stripDelimiters(String name) {
        String s = name.strip();
        while (s.length() >= 2 && isDelimiterPair(s.charAt(0), s.charAt(s.length() - 1))) {
            s = s.substring(1, s.length() - 1).strip();
        }
        return s;
    }

    private static boolean isDelimiterPair(char open, char close) {
        return (open == '[' && close == ']')
                || (open == '"' && close == '"')
                || (open == '\'' && close == '\'');
    }
}
