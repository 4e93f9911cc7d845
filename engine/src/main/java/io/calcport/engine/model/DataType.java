package io.calcport.engine.model;

import java.util.Arrays;

/**
 * Value type of a field or calculation, as declared by the workbook.
 */
public enum DataType {
    STRING("string"),
    INTEGER("integer"),
    REAL("real"),
    BOOLEAN("boolean"),
    DATE("date"),
    DATETIME("datetime");

    private final String wireName;

    DataType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isNumeric() {
        return this == INTEGER || this == REAL;
    }

    public boolean isTemporal() {
        return this == DATE || this == DATETIME;
    }

    public static DataType fromWireName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown data type: " + name));
    }
}
