package io.calcport.engine.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only index of a workbook's fields, looked up by the name a formula uses.
 *
 * <p>A formula reference {@code [Order Date]} matches a field whose raw name is
 * either {@code Order Date} or {@code [Order Date]}. Exact raw-name matches win.
 * Safe to share between threads once built.
 */
public final class FieldCatalog {

    private final Map<String, Field> byRawName = new LinkedHashMap<>();
    private final Map<String, Field> byReferenceName = new LinkedHashMap<>();

    private FieldCatalog(Collection<Field> fields) {
        for (Field field : fields) {
            if (byRawName.putIfAbsent(field.rawName(), field) != null) {
                throw new IllegalArgumentException("Duplicate field: " + field.rawName());
            }
            byReferenceName.putIfAbsent(field.referenceName(), field);
        }
    }

    public static FieldCatalog of(Collection<Field> fields) {
        return new FieldCatalog(fields);
    }

    public static FieldCatalog of(Field... fields) {
        return new FieldCatalog(List.of(fields));
    }

    public Optional<Field> resolve(String name) {
        Field exact = byRawName.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        return Optional.ofNullable(byReferenceName.get(Field.stripDelimiters(name)));
    }

    public Optional<Field> get(String rawName) {
        return Optional.ofNullable(byRawName.get(rawName));
    }

    public boolean isCalculation(String rawName) {
        Field field = byRawName.get(rawName);
        return field != null && field.isCalculation();
    }

    public List<Field> fields() {
        return List.copyOf(byRawName.values());
    }

    public List<Field> calculations() {
        return byRawName.values().stream().filter(Field::isCalculation).toList();
    }

    public int size() {
        return byRawName.size();
    }
}
