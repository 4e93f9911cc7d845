package io.calcport.engine.resolve;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A calculation and the source keys its formula mentions.
 */
public record CalculationDependencies(String sourceKey, Set<String> references) {

    public CalculationDependencies {
        Objects.requireNonNull(sourceKey, "Source key cannot be null");
        references = references == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(references));
    }
}
