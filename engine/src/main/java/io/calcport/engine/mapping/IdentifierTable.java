package io.calcport.engine.mapping;

import io.calcport.engine.model.FieldKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, insertion-ordered set of identifier mappings for one workbook.
 *
 * <p>Edits go through {@link IdentifierMapper}, which returns a new table.
 * Status is never stored; {@link #status(String)} recomputes it.
 * Identifiers are compared case-insensitively, as DuckDB resolves quoted
 * column names.
 */
public final class IdentifierTable {

    private final Map<String, IdentifierMapping> bySourceKey;
    private final Map<String, List<String>> ownersByIdentifier;
    private final ReservedWords reservedWords;

    private IdentifierTable(Map<String, IdentifierMapping> bySourceKey, ReservedWords reservedWords) {
        this.bySourceKey = bySourceKey;
        this.reservedWords = Objects.requireNonNull(reservedWords, "Reserved words cannot be null");
        this.ownersByIdentifier = new LinkedHashMap<>();
        for (IdentifierMapping m : bySourceKey.values()) {
            if (!m.isUnresolved()) {
                ownersByIdentifier.computeIfAbsent(foldCase(m.targetIdentifier()), k -> new ArrayList<>())
                        .add(m.sourceKey());
            }
        }
    }

    public static IdentifierTable empty() {
        return empty(ReservedWords.DUCKDB);
    }

    public static IdentifierTable empty(ReservedWords reservedWords) {
        return new IdentifierTable(new LinkedHashMap<>(), reservedWords);
    }

    static IdentifierTable of(Collection<IdentifierMapping> mappings, ReservedWords reservedWords) {
        Map<String, IdentifierMapping> map = new LinkedHashMap<>();
        for (IdentifierMapping m : mappings) {
            map.put(m.sourceKey(), m);
        }
        return new IdentifierTable(map, reservedWords);
    }

    IdentifierTable with(IdentifierMapping mapping) {
        Map<String, IdentifierMapping> map = new LinkedHashMap<>(bySourceKey);
        map.put(mapping.sourceKey(), mapping);
        return new IdentifierTable(map, reservedWords);
    }

    /**
     * Same mappings checked against a different reserved-word set.
     */
    public IdentifierTable withReservedWords(ReservedWords words) {
        if (words.equals(reservedWords)) {
            return this;
        }
        return new IdentifierTable(bySourceKey, words);
    }

    public Optional<IdentifierMapping> get(String sourceKey) {
        return Optional.ofNullable(bySourceKey.get(sourceKey));
    }

    public boolean contains(String sourceKey) {
        return bySourceKey.containsKey(sourceKey);
    }

    /**
     * The target identifier for a source key, empty while unresolved or unknown.
     */
    public Optional<String> identifierOf(String sourceKey) {
        IdentifierMapping m = bySourceKey.get(sourceKey);
        return m == null || m.isUnresolved() ? Optional.empty() : Optional.of(m.targetIdentifier());
    }

    public boolean isTaken(String identifier) {
        return ownersByIdentifier.containsKey(foldCase(identifier));
    }

    /**
     * Source keys currently holding {@code identifier}; more than one means the table is inconsistent.
     */
    public List<String> owners(String identifier) {
        return List.copyOf(ownersByIdentifier.getOrDefault(foldCase(identifier), List.of()));
    }

    /**
     * The key two identifiers share when DuckDB would treat them as the same column.
     */
    public static String foldCase(String identifier) {
        return identifier.toLowerCase(Locale.ROOT);
    }

    public MappingStatus status(String sourceKey) {
        IdentifierMapping m = bySourceKey.get(sourceKey);
        if (m == null) {
            throw new MappingException("Unknown field '" + sourceKey + "'");
        }
        return IdentifierValidator.problems(this, m).isEmpty() ? MappingStatus.VALID : MappingStatus.INVALID;
    }

    public List<IdentifierMapping> mappings() {
        return List.copyOf(bySourceKey.values());
    }

    public ReservedWords reservedWords() {
        return reservedWords;
    }

    public int size() {
        return bySourceKey.size();
    }

    public MappingSummary summary() {
        int valid = 0;
        Map<FieldKind, Integer> byKind = new EnumMap<>(FieldKind.class);
        for (IdentifierMapping m : bySourceKey.values()) {
            if (status(m.sourceKey()) == MappingStatus.VALID) {
                valid++;
            }
            byKind.merge(m.kind(), 1, Integer::sum);
        }
        return new MappingSummary(bySourceKey.size(), valid, bySourceKey.size() - valid, byKind);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IdentifierTable other
                && List.copyOf(bySourceKey.values()).equals(List.copyOf(other.bySourceKey.values()))
                && reservedWords.equals(other.reservedWords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(List.copyOf(bySourceKey.values()), reservedWords);
    }

    @Override
    public String toString() {
        return "IdentifierTable" + bySourceKey.values();
    }
}
