package io.calcport.engine.mapping;

import io.calcport.engine.model.DataType;
import io.calcport.engine.model.Field;
import io.calcport.engine.model.FieldKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns every edit to an {@link IdentifierTable}.
 *
 * <p>Each operation takes a table and returns a new one, so a rejected edit
 * leaves the caller's table untouched. Generated names are always unique and
 * valid; user-supplied names are never silently disambiguated.
 */
public final class IdentifierMapper {

    private static final Logger log = LoggerFactory.getLogger(IdentifierMapper.class);

    public IdentifierMapper() {
    }

    /**
     * Binds a field to an identifier. Assigning a key that already has an
     * identifier returns the existing mapping unchanged.
     */
    public MappingUpdate assign(IdentifierTable table, String rawName, String displayName,
                                DataType dataType, FieldKind kind) {
        Optional<IdentifierMapping> existing = table.get(rawName);
        if (existing.isPresent() && !existing.get().isUnresolved()) {
            return new MappingUpdate(table, existing.get(), table.status(rawName));
        }

        NameGenerator generator = new NameGenerator(table.reservedWords());
        String identifier = generator.generate(rawName, dataType, table::isTaken);
        String label = existing.map(IdentifierMapping::label)
                .filter(l -> !l.isEmpty())
                .orElse(displayName == null || displayName.isBlank()
                        ? NameGenerator.displayName(rawName)
                        : displayName);
        IdentifierMapping mapping = new IdentifierMapping(
                rawName, identifier, label, dataType, kind, MappingOrigin.GENERATED);
        IdentifierTable updated = table.with(mapping);
        log.debug("Assigned {} -> {}", rawName, identifier);
        return new MappingUpdate(updated, mapping, updated.status(rawName));
    }

    /**
     * Assigns every field in order; already-mapped fields keep their identifiers.
     */
    public IdentifierTable assignAll(IdentifierTable table, List<Field> fields) {
        IdentifierTable current = table;
        for (Field field : fields) {
            current = assign(current, field.rawName(), field.displayName(), field.dataType(), field.kind()).table();
        }
        return current;
    }

    public MappingStatus validate(IdentifierTable table, IdentifierMapping mapping) {
        return IdentifierValidator.problems(table, mapping).isEmpty() ? MappingStatus.VALID : MappingStatus.INVALID;
    }

    /**
     * Gives a field a user-chosen identifier.
     *
     * @throws NamingConflictException    if another field already holds the identifier
     * @throws InvalidIdentifierException if the identifier is malformed or reserved
     * @throws MappingException           if the source key is unknown
     */
    public MappingUpdate rename(IdentifierTable table, String sourceKey, String newIdentifier) {
        IdentifierMapping current = table.get(sourceKey)
                .orElseThrow(() -> new MappingException("Unknown field '" + sourceKey + "'"));
        Optional<String> problem = IdentifierValidator.syntaxProblem(newIdentifier, table.reservedWords());
        if (problem.isPresent()) {
            throw new InvalidIdentifierException(newIdentifier, problem.get());
        }
        Optional<String> owner = table.owners(newIdentifier).stream()
                .filter(o -> !o.equals(sourceKey))
                .findFirst();
        if (owner.isPresent()) {
            log.debug("Rename of {} to {} rejected, held by {}", sourceKey, newIdentifier, owner.get());
            throw new NamingConflictException(newIdentifier, owner.get(), sourceKey);
        }

        IdentifierMapping renamed = current.withIdentifier(newIdentifier, MappingOrigin.USER_EDITED);
        IdentifierTable updated = table.with(renamed);
        return new MappingUpdate(updated, renamed, updated.status(sourceKey));
    }

    /**
     * Changes only the label. Labels need not be unique.
     */
    public MappingUpdate relabel(IdentifierTable table, String sourceKey, String label) {
        IdentifierMapping current = table.get(sourceKey)
                .orElseThrow(() -> new MappingException("Unknown field '" + sourceKey + "'"));
        IdentifierMapping relabelled = current.withLabel(label);
        IdentifierTable updated = table.with(relabelled);
        return new MappingUpdate(updated, relabelled, updated.status(sourceKey));
    }

    public List<IdentifierMapping> exportMappings(IdentifierTable table) {
        return table.mappings();
    }

    /**
     * Replaces the whole table. The import is rejected in full if any record has
     * a missing or duplicate source key, or a non-empty identifier that is
     * malformed, reserved or shared with another record. Empty identifiers are
     * accepted and stay invalid until assigned.
     *
     * @throws MappingImportException listing every offending record
     */
    public IdentifierTable importMappings(List<IdentifierMapping> records, ReservedWords reservedWords) {
        List<MappingImportException.Problem> problems = new ArrayList<>();
        Map<String, Integer> keys = new HashMap<>();
        Map<String, Integer> identifiers = new HashMap<>();

        for (int i = 0; i < records.size(); i++) {
            IdentifierMapping m = records.get(i);
            String key = m.sourceKey();
            if (key.isBlank()) {
                problems.add(new MappingImportException.Problem(i, key, "source key is empty"));
            } else if (keys.putIfAbsent(key, i) != null) {
                problems.add(new MappingImportException.Problem(i, key,
                        "duplicate source key, first seen at #" + keys.get(key)));
            }

            String identifier = m.targetIdentifier();
            if (identifier.isEmpty()) {
                continue;
            }
            Optional<String> problem = IdentifierValidator.syntaxProblem(identifier, reservedWords);
            if (problem.isPresent()) {
                problems.add(new MappingImportException.Problem(i, key, problem.get()));
            } else if (identifiers.putIfAbsent(IdentifierTable.foldCase(identifier), i) != null) {
                problems.add(new MappingImportException.Problem(i, key, "identifier '" + identifier
                        + "' already used by record #" + identifiers.get(IdentifierTable.foldCase(identifier))));
            }
        }

        if (!problems.isEmpty()) {
            log.warn("Rejected import of {} mappings: {} problem(s)", records.size(), problems.size());
            throw new MappingImportException(problems);
        }

        NameGenerator generator = new NameGenerator(reservedWords);
        List<IdentifierMapping> imported = new ArrayList<>(records.size());
        for (IdentifierMapping m : records) {
            boolean generated = !m.isUnresolved()
                    && m.targetIdentifier().equals(generator.baseName(m.sourceKey(), m.dataType()));
            imported.add(m.withIdentifier(m.targetIdentifier(),
                    generated ? MappingOrigin.GENERATED : MappingOrigin.USER_EDITED));
        }
        log.info("Imported {} mappings", imported.size());
        return IdentifierTable.of(imported, reservedWords);
    }
}
