package io.calcport.engine.mapping;

import java.util.Locale;

/**
 * Derived validity of a mapping. Never stored; always recomputed from the table.
 */
public enum MappingStatus {
    VALID,
    INVALID;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
