package io.calcport.engine.diagnostic;

import java.util.List;
import java.util.Objects;

/**
 * A structured report of a parse, ordering, naming or translation issue.
 *
 * @param kind     what went wrong
 * @param message  human-readable description
 * @param position where in the calculation source, or {@link SourcePosition#UNKNOWN}
 * @param subjects names the diagnostic is about (field names, calculation keys)
 */
public record Diagnostic(
        DiagnosticKind kind,
        String message,
        SourcePosition position,
        List<String> subjects) {

    public Diagnostic {
        Objects.requireNonNull(kind, "Diagnostic kind cannot be null");
        Objects.requireNonNull(message, "Diagnostic message cannot be null");
        position = position == null ? SourcePosition.UNKNOWN : position;
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
    }

    public static Diagnostic of(DiagnosticKind kind, String message, SourcePosition position, String... subjects) {
        return new Diagnostic(kind, message, position, List.of(subjects));
    }

    public static Diagnostic syntaxError(String message, SourcePosition position) {
        return new Diagnostic(DiagnosticKind.SYNTAX_ERROR, message, position, List.of());
    }

    public static Diagnostic unresolvedField(String name, SourcePosition position) {
        return of(DiagnosticKind.UNRESOLVED_FIELD, "Unknown field [" + name + "]", position, name);
    }

    public static Diagnostic unsupportedFunction(String name, SourcePosition position) {
        return of(DiagnosticKind.UNSUPPORTED_FUNCTION,
                "Function " + name + " has no SQL translation", position, name);
    }

    public static Diagnostic argumentError(String message, SourcePosition position, String subject) {
        return of(DiagnosticKind.ARGUMENT_ERROR, message, position, subject);
    }

    public static Diagnostic circularDependency(List<String> members) {
        return new Diagnostic(DiagnosticKind.CIRCULAR_DEPENDENCY,
                "Circular dependency between calculations: " + String.join(" -> ", members),
                SourcePosition.UNKNOWN, members);
    }

    public static Diagnostic expressionTooDeep(String message, SourcePosition position) {
        return new Diagnostic(DiagnosticKind.EXPRESSION_TOO_DEEP, message, position, List.of());
    }

    public static Diagnostic upstreamFailed(String calculation, SourcePosition position) {
        return of(DiagnosticKind.UPSTREAM_FAILED,
                "Referenced calculation [" + calculation + "] was not translated", position, calculation);
    }

    public static Diagnostic namingConflict(String identifier, String owner, String requester) {
        return of(DiagnosticKind.NAMING_CONFLICT,
                "Identifier '" + identifier + "' is already used by field '" + owner + "'",
                SourcePosition.UNKNOWN, requester, owner);
    }

    public static Diagnostic contextDependentScope(String scope, SourcePosition position) {
        return of(DiagnosticKind.CONTEXT_DEPENDENT_SCOPE,
                scope + " level of detail assumes whole-table granularity", position, scope);
    }

    public static Diagnostic divideByZeroUnchecked(SourcePosition position) {
        return of(DiagnosticKind.DIVIDE_BY_ZERO_UNCHECKED,
                "Division is not guarded against a zero divisor", position);
    }

    public boolean isError() {
        return kind.isError();
    }

    @Override
    public String toString() {
        String where = position.isKnown() ? " at " + position : "";
        return kind.wireName() + where + ": " + message;
    }
}
