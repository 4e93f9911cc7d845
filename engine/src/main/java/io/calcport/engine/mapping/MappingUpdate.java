package io.calcport.engine.mapping;

/**
 * Outcome of a single-mapping edit: the new table, the touched mapping and its status.
 */
public record MappingUpdate(IdentifierTable table, IdentifierMapping mapping, MappingStatus status) {
}
