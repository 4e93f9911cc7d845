package io.calcport.engine.mapping;

import io.calcport.engine.model.FieldKind;

import java.util.Map;

/**
 * Counts over an identifier table.
 */
public record MappingSummary(int total, int valid, int invalid, Map<FieldKind, Integer> byKind) {

    public MappingSummary {
        byKind = Map.copyOf(byKind);
    }
}
