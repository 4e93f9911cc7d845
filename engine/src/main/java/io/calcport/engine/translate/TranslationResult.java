package io.calcport.engine.translate;

import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.plan.Expression;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of one translation: the SQL text, the plan it was rendered from,
 * the source columns it reads and what went wrong along the way.
 *
 * <p>The expression is best effort; with any error diagnostic present it
 * contains placeholders and must not be used.
 *
 * @param expression          SQL text of the expression
 * @param plan                The plan the text was rendered from
 * @param consumedIdentifiers Identifiers of the source columns read, in first-use order
 * @param diagnostics         Errors and informational notes
 */
public record TranslationResult(
        String expression,
        Expression plan,
        Set<String> consumedIdentifiers,
        List<Diagnostic> diagnostics) {

    public TranslationResult {
        consumedIdentifiers = Collections.unmodifiableSet(new LinkedHashSet<>(consumedIdentifiers));
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * @return True if the expression aggregates the rows of the consuming query
     */
    public boolean isAggregate() {
        return plan.isAggregate();
    }
}
