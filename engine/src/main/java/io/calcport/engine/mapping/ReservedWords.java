package io.calcport.engine.mapping;

import io.calcport.engine.transpiler.DuckDBDialect;
import io.calcport.engine.transpiler.SQLDialect;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Names a generated or user-chosen identifier may never take: the target
 * dialect's keywords, plus a small conflict set of names the runtime uses for
 * its own containers (the source relation, the row alias, generic variable names).
 */
public final class ReservedWords {

    /**
     * Generic container names reserved regardless of dialect.
     */
    public static final Set<String> RUNTIME_NAMES = Set.of(
            "data", "df", "result", "value", "index", "src", "source_rows");

    public static final ReservedWords DUCKDB = forDialect(DuckDBDialect.INSTANCE);

    private final SQLDialect dialect;
    private final Set<String> conflicts;

    private ReservedWords(SQLDialect dialect, Set<String> conflicts) {
        this.dialect = dialect;
        this.conflicts = Set.copyOf(conflicts);
    }

    public static ReservedWords forDialect(SQLDialect dialect, String... extraConflicts) {
        Set<String> conflicts = new LinkedHashSet<>(RUNTIME_NAMES);
        for (String name : extraConflicts) {
            conflicts.add(name.toLowerCase(Locale.ROOT));
        }
        return new ReservedWords(dialect, conflicts);
    }

    public boolean isKeyword(String name) {
        return dialect.isReservedWord(name);
    }

    public boolean isRuntimeName(String name) {
        return conflicts.contains(name.toLowerCase(Locale.ROOT));
    }

    public boolean isReserved(String name) {
        return isKeyword(name) || isRuntimeName(name);
    }

    public SQLDialect dialect() {
        return dialect;
    }

    public Set<String> conflicts() {
        return conflicts;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ReservedWords other
                && dialect.name().equals(other.dialect.name())
                && conflicts.equals(other.conflicts);
    }

    @Override
    public int hashCode() {
        return dialect.name().hashCode() * 31 + conflicts.hashCode();
    }
}
