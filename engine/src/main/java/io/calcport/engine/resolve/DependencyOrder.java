package io.calcport.engine.resolve;

import io.calcport.engine.diagnostic.Diagnostic;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Emission order of calculations. Cycle members appear only in {@code excluded},
 * each cycle reported by one circular-dependency diagnostic.
 */
public record DependencyOrder(List<String> order, Set<String> excluded, List<Diagnostic> diagnostics) {

    public DependencyOrder {
        order = List.copyOf(order);
        excluded = Collections.unmodifiableSet(new LinkedHashSet<>(excluded));
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isExcluded(String sourceKey) {
        return excluded.contains(sourceKey);
    }
}
