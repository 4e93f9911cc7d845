package io.calcport.engine.execution;

import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.model.CalculationState;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome for one calculation. Only a TRANSLATED result carries an expression.
 *
 * @param sourceKey           The calculation's raw name
 * @param identifier          Its mapped identifier
 * @param state               Terminal state
 * @param expression          SQL expression, null unless translated
 * @param consumedIdentifiers Source columns the expression reads
 * @param aggregate           Whether the expression needs a GROUP BY context
 * @param diagnostics         Everything reported for this calculation, in order
 */
public record CalculationResult(
        String sourceKey,
        String identifier,
        CalculationState state,
        String expression,
        Set<String> consumedIdentifiers,
        boolean aggregate,
        List<Diagnostic> diagnostics) {

    public CalculationResult {
        Objects.requireNonNull(sourceKey, "Source key cannot be null");
        Objects.requireNonNull(state, "State cannot be null");
        if (state == CalculationState.TRANSLATED) {
            Objects.requireNonNull(expression, "A translated calculation needs an expression");
        } else if (expression != null) {
            throw new IllegalArgumentException("Only translated calculations carry an expression");
        }
        consumedIdentifiers = consumedIdentifiers == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(consumedIdentifiers));
        diagnostics = List.copyOf(diagnostics);
    }

    static CalculationResult failed(String sourceKey, String identifier, CalculationState state,
                                    List<Diagnostic> diagnostics) {
        return new CalculationResult(sourceKey, identifier, state, null, Set.of(), false, diagnostics);
    }

    public boolean isTranslated() {
        return state == CalculationState.TRANSLATED;
    }

    public Optional<String> expressionText() {
        return Optional.ofNullable(expression);
    }
}
