package io.calcport.engine.diagnostic;

/**
 * How a diagnostic affects the calculation it is attached to.
 */
public enum Severity {
    /** The calculation cannot be emitted. */
    ERROR,
    /** Informational; the expression is still emitted. */
    INFO
}
