package io.calcport.engine.execution;

import io.calcport.engine.diagnostic.Diagnostic;
import io.calcport.engine.mapping.IdentifierTable;
import io.calcport.engine.model.CalculationState;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a translation request produced.
 *
 * @param results       One result per calculation, in input order
 * @param emissionOrder Source keys in dependency order, cycle members left out
 * @param table         The identifier table after auto-assignment
 * @param diagnostics   Batch-level diagnostics: cycles and invalid mappings
 */
public record TranslationResponse(
        List<CalculationResult> results,
        List<String> emissionOrder,
        IdentifierTable table,
        List<Diagnostic> diagnostics) {

    public TranslationResponse {
        results = List.copyOf(results);
        emissionOrder = List.copyOf(emissionOrder);
        diagnostics = List.copyOf(diagnostics);
    }

    public Optional<CalculationResult> result(String sourceKey) {
        return results.stream().filter(r -> r.sourceKey().equals(sourceKey)).findFirst();
    }

    /**
     * Translated results in emission order.
     */
    public List<CalculationResult> translatedInEmissionOrder() {
        return emissionOrder.stream()
                .map(this::result)
                .flatMap(Optional::stream)
                .filter(CalculationResult::isTranslated)
                .toList();
    }

    public Map<CalculationState, Integer> stateCounts() {
        Map<CalculationState, Integer> counts = new EnumMap<>(CalculationState.class);
        results.forEach(r -> counts.merge(r.state(), 1, Integer::sum));
        return counts;
    }
}
