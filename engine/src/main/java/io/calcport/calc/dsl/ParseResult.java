package io.calcport.calc.dsl;

import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.diagnostic.DiagnosticKind;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of parsing one calculation.
 *
 * <p>The AST is always present: parts that failed to parse are
 * {@link ErrorExpression} nodes and the matching syntax errors are listed in
 * {@code diagnostics}.
 *
 * @param ast         best-effort tree
 * @param references  raw names of every resolved field the formula mentions, in first-use order
 * @param diagnostics syntax errors and unresolved references, in source order
 */
public record ParseResult(CalcExpression ast, Set<String> references, List<Diagnostic> diagnostics) {

    public ParseResult {
        Objects.requireNonNull(ast, "AST cannot be null");
        references = Collections.unmodifiableSet(new LinkedHashSet<>(references));
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return true when the tree contains parts that could not be parsed
     */
    public boolean hasSyntaxErrors() {
        return diagnostics.stream().anyMatch(d -> d.kind() == DiagnosticKind.SYNTAX_ERROR
                || d.kind() == DiagnosticKind.EXPRESSION_TOO_DEEP);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }
}
