package io.calcport.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * A level-of-detail aggregate: the full source relation grouped by the keys,
 * the aggregate computed per group, and the current row's group value picked
 * by a correlated lookup.
 *
 * <pre>
 * (SELECT lod1."__lod_value"
 *    FROM (SELECT k AS "__lod_key_0", agg AS "__lod_value"
 *            FROM source AS lod1_rows GROUP BY k) AS lod1
 *   WHERE lod1."__lod_key_0" IS NOT DISTINCT FROM outer.k)
 * </pre>
 *
 * @param depth          Nesting level, 1 for the outermost scope
 * @param sourceRelation SQL text of the full row relation
 * @param keys           Grouping keys, each evaluated inside and outside the scope
 * @param aggregate      The per-group aggregate, evaluated over {@link #rowsAlias()}
 */
public record FixedScopeExpression(
        int depth,
        String sourceRelation,
        List<Key> keys,
        Expression aggregate) implements Expression {

    public static final String VALUE_COLUMN = "__lod_value";
    public static final String KEY_COLUMN_PREFIX = "__lod_key_";

    /**
     * @param inner The key evaluated over the scope's own rows
     * @param outer The same key evaluated over the enclosing rows
     */
    public record Key(Expression inner, Expression outer) {
        public Key {
            Objects.requireNonNull(inner, "Inner key cannot be null");
            Objects.requireNonNull(outer, "Outer key cannot be null");
        }
    }

    public FixedScopeExpression {
        if (depth < 1) {
            throw new IllegalArgumentException("Depth must be positive: " + depth);
        }
        Objects.requireNonNull(sourceRelation, "Source relation cannot be null");
        Objects.requireNonNull(aggregate, "Aggregate cannot be null");
        keys = keys == null ? List.of() : List.copyOf(keys);
    }

    public static String rowsAlias(int depth) {
        return "lod" + depth + "_rows";
    }

    public static String groupsAlias(int depth) {
        return "lod" + depth;
    }

    public String rowsAlias() {
        return rowsAlias(depth);
    }

    public String groupsAlias() {
        return groupsAlias(depth);
    }

    public boolean isWholeTable() {
        return keys.isEmpty();
    }

    @Override
    public SqlType type() {
        return aggregate.type();
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitFixedScope(this);
    }
}
