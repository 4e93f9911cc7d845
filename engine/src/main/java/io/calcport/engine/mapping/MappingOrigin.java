package io.calcport.engine.mapping;

/**
 * Where a mapping's identifier came from.
 */
public enum MappingOrigin {
    GENERATED,
    USER_EDITED
}
