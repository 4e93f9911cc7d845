package io.calcport.engine.plan;

import io.calcport.engine.model.DataType;

/**
 * Represents SQL types for expressions in the IR.
 * Used for typed NULL fallbacks and CAST insertion.
 */
public enum SqlType {
    VARCHAR,
    BIGINT,
    DOUBLE,
    BOOLEAN,
    DATE,
    TIMESTAMP,
    UNKNOWN;

    public static SqlType fromDataType(DataType dataType) {
        return switch (dataType) {
            case STRING -> VARCHAR;
            case INTEGER -> BIGINT;
            case REAL -> DOUBLE;
            case BOOLEAN -> BOOLEAN;
            case DATE -> DATE;
            case DATETIME -> TIMESTAMP;
        };
    }

    public boolean isNumeric() {
        return this == BIGINT || this == DOUBLE;
    }

    public boolean isTemporal() {
        return this == DATE || this == TIMESTAMP;
    }
}
