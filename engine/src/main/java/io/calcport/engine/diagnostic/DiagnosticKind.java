package io.calcport.engine.diagnostic;

import java.util.Arrays;

/**
 * Closed set of issues the engine reports. The wire name is the form used in
 * JSON payloads.
 */
public enum DiagnosticKind {
    SYNTAX_ERROR("syntax-error", Severity.ERROR),
    UNRESOLVED_FIELD("unresolved-field", Severity.ERROR),
    UNSUPPORTED_FUNCTION("unsupported-function", Severity.ERROR),
    ARGUMENT_ERROR("argument-error", Severity.ERROR),
    CIRCULAR_DEPENDENCY("circular-dependency", Severity.ERROR),
    UPSTREAM_FAILED("upstream-failed", Severity.ERROR),
    NAMING_CONFLICT("naming-conflict", Severity.ERROR),
    EXPRESSION_TOO_DEEP("expression-too-deep", Severity.ERROR),
    CONTEXT_DEPENDENT_SCOPE("context-dependent-scope", Severity.INFO),
    DIVIDE_BY_ZERO_UNCHECKED("divide-by-zero-unchecked", Severity.INFO);

    private final String wireName;
    private final Severity severity;

    DiagnosticKind(String wireName, Severity severity) {
        this.wireName = wireName;
        this.severity = severity;
    }

    public String wireName() {
        return wireName;
    }

    public Severity severity() {
        return severity;
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public static DiagnosticKind fromWireName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown diagnostic kind: " + name));
    }
}
