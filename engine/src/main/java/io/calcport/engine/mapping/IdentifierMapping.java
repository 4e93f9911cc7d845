package io.calcport.engine.mapping;

import io.calcport.engine.model.DataType;
import io.calcport.engine.model.FieldKind;

import java.util.Objects;

/**
 * One row of the identifier table: a source field and the target-language
 * identifier it is emitted as.
 *
 * @param sourceKey        The raw field name, primary key of the table
 * @param targetIdentifier The emitted identifier, or "" while unresolved
 * @param label            Human-facing display name
 * @param dataType         The field's data type
 * @param kind             Dimension, measure, parameter or calculation
 * @param origin           Generated or user-edited
 */
public record IdentifierMapping(
        String sourceKey,
        String targetIdentifier,
        String label,
        DataType dataType,
        FieldKind kind,
        MappingOrigin origin) {

    public IdentifierMapping {
        Objects.requireNonNull(sourceKey, "Source key cannot be null");
        targetIdentifier = targetIdentifier == null ? "" : targetIdentifier;
        label = label == null ? "" : label;
        Objects.requireNonNull(dataType, "Data type cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(origin, "Origin cannot be null");
    }

    public boolean isUnresolved() {
        return targetIdentifier.isEmpty();
    }

    public IdentifierMapping withIdentifier(String identifier, MappingOrigin newOrigin) {
        return new IdentifierMapping(sourceKey, identifier, label, dataType, kind, newOrigin);
    }

    public IdentifierMapping withLabel(String newLabel) {
        return new IdentifierMapping(sourceKey, targetIdentifier, newLabel, dataType, kind, origin);
    }
}
