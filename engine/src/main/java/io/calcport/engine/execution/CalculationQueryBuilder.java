package io.calcport.engine.execution;

import io.calcport.engine.transpiler.SQLDialect;
import io.calcport.engine.translate.TranslatorOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles runnable queries from a translation response.
 *
 * <p>Row-level calculations become extra columns of a SELECT over the source
 * relation, aliased with the configured row alias so level-of-detail lookups
 * correlate. Aggregate calculations go into a separate grouped SELECT.
 */
public final class CalculationQueryBuilder {

    private final SQLDialect dialect;
    private final TranslatorOptions options;

    public CalculationQueryBuilder(SQLDialect dialect, TranslatorOptions options) {
        this.dialect = dialect;
        this.options = options;
    }

    /**
     * Every source column plus one column per translated row-level calculation.
     * With calculations referenced by identifier, each calculation is added in
     * its own nested SELECT so later ones can read earlier ones.
     */
    public String rowLevelQuery(TranslationResponse response) {
        List<CalculationResult> rowLevel = response.translatedInEmissionOrder().stream()
                .filter(r -> !r.aggregate())
                .toList();
        String from = options.sourceRelation() + " AS " + options.rowAlias();
        if (!options.referenceCalculationsByIdentifier()) {
            List<String> columns = new ArrayList<>();
            columns.add(options.rowAlias() + ".*");
            rowLevel.forEach(r -> columns.add(column(r)));
            return "SELECT " + String.join(", ", columns) + " FROM " + from;
        }

        String query = "SELECT " + options.rowAlias() + ".* FROM " + from;
        for (CalculationResult result : rowLevel) {
            query = "SELECT " + options.rowAlias() + ".*, " + column(result)
                    + " FROM (" + query + ") AS " + options.rowAlias();
        }
        return query;
    }

    /**
     * The aggregate calculations grouped by the given dimension identifiers.
     *
     * @throws IllegalArgumentException if the response has no translated aggregate calculation
     */
    public String aggregateQuery(TranslationResponse response, List<String> dimensionIdentifiers) {
        List<CalculationResult> aggregates = response.translatedInEmissionOrder().stream()
                .filter(CalculationResult::aggregate)
                .toList();
        if (aggregates.isEmpty()) {
            throw new IllegalArgumentException("No translated aggregate calculation to select");
        }
        List<String> dimensions = dimensionIdentifiers.stream()
                .map(dialect::quoteIdentifier)
                .toList();
        List<String> columns = new ArrayList<>(dimensions);
        aggregates.forEach(r -> columns.add(column(r)));

        var sb = new StringBuilder("SELECT ").append(String.join(", ", columns));
        sb.append(" FROM ").append(options.sourceRelation()).append(" AS ").append(options.rowAlias());
        if (!dimensions.isEmpty()) {
            sb.append(" GROUP BY ").append(String.join(", ", dimensions));
            sb.append(" ORDER BY ").append(String.join(", ", dimensions));
        }
        return sb.toString();
    }

    private String column(CalculationResult result) {
        return result.expression() + " AS " + dialect.quoteIdentifier(result.identifier());
    }
}
