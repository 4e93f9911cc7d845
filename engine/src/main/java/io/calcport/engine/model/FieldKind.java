package io.calcport.engine.model;

import java.util.Arrays;

/**
 * Role of a field in the workbook.
 */
public enum FieldKind {
    DIMENSION("dimension"),
    MEASURE("measure"),
    PARAMETER("parameter"),
    CALCULATION("calculation");

    private final String wireName;

    FieldKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static FieldKind fromWireName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equalsIgnoreCase(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown field kind: " + name));
    }
}
