package io.calcport.engine.serialization;

import io.calcport.engine.mapping.IdentifierMapper;
import io.calcport.engine.mapping.IdentifierMapping;
import io.calcport.engine.mapping.IdentifierTable;
import io.calcport.engine.mapping.MappingImportException;
import io.calcport.engine.mapping.MappingOrigin;
import io.calcport.engine.mapping.ReservedWords;
import io.calcport.engine.model.DataType;
import io.calcport.engine.model.FieldKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The persisted mapping format, one record per field:
 *
 * <pre>
 * {"source_key": ..., "display_name": ..., "target_identifier": ...,
 *  "data_type": "string|integer|real|boolean|date|datetime",
 *  "kind": "dimension|measure|parameter|calculation", "status": "valid|invalid"}
 * </pre>
 *
 * Records are plain maps and lists, ready for {@code CalcHttpJson}. The
 * {@code status} member is written for readers but ignored on import, where it
 * is recomputed.
 */
public final class MappingSerializer {

    private final IdentifierMapper mapper;

    public MappingSerializer(IdentifierMapper mapper) {
        this.mapper = mapper;
    }

    public List<Map<String, Object>> export(IdentifierTable table) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (IdentifierMapping m : mapper.exportMappings(table)) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("source_key", m.sourceKey());
            record.put("display_name", m.label());
            record.put("target_identifier", m.targetIdentifier());
            record.put("data_type", m.dataType().wireName());
            record.put("kind", m.kind().name().toLowerCase(Locale.ROOT));
            record.put("status", table.status(m.sourceKey()).wireName());
            records.add(record);
        }
        return records;
    }

    /**
     * Replaces the table with the given records, all or nothing.
     *
     * @throws MappingImportException listing every record that is not an object,
     *                                has an unknown data type or kind, or fails validation
     */
    public IdentifierTable importRecords(List<?> records, ReservedWords reservedWords) {
        List<MappingImportException.Problem> problems = new ArrayList<>();
        List<IdentifierMapping> mappings = new ArrayList<>();
        List<Integer> positions = new ArrayList<>();

        for (int i = 0; i < records.size(); i++) {
            if (!(records.get(i) instanceof Map<?, ?> record)) {
                problems.add(new MappingImportException.Problem(i, null, "record is not an object"));
                continue;
            }
            String key = text(record, "source_key");
            try {
                DataType dataType = DataType.fromWireName(text(record, "data_type"));
                FieldKind kind = FieldKind.valueOf(text(record, "kind").toUpperCase(Locale.ROOT));
                mappings.add(new IdentifierMapping(key, text(record, "target_identifier"),
                        text(record, "display_name"), dataType, kind, MappingOrigin.USER_EDITED));
                positions.add(i);
            } catch (IllegalArgumentException e) {
                problems.add(new MappingImportException.Problem(i, key,
                        "bad data_type or kind: " + e.getMessage()));
            }
        }

        try {
            IdentifierTable table = mapper.importMappings(mappings, reservedWords);
            if (problems.isEmpty()) {
                return table;
            }
        } catch (MappingImportException e) {
            for (MappingImportException.Problem p : e.problems()) {
                problems.add(new MappingImportException.Problem(positions.get(p.index()), p.sourceKey(), p.reason()));
            }
        }
        problems.sort((a, b) -> Integer.compare(a.index(), b.index()));
        throw new MappingImportException(problems);
    }

    private static String text(Map<?, ?> record, String member) {
        Object value = record.get(member);
        return value == null ? "" : value.toString();
    }
}
