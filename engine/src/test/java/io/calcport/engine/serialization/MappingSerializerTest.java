package io.calcport.engine.serialization;

import io.calcport.engine.mapping.IdentifierMapper;
import io.calcport.engine.mapping.IdentifierTable;
import io.calcport.engine.mapping.MappingImportException;
import io.calcport.engine.mapping.MappingOrigin;
import io.calcport.engine.mapping.ReservedWords;
import io.calcport.engine.model.DataType;
import io.calcport.engine.model.Field;
import io.calcport.engine.server.CalcHttpJson;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the persisted mapping record format.
 */
@DisplayName("Mapping serializer")
class MappingSerializerTest {

    private final IdentifierMapper mapper = new IdentifierMapper();
    private final MappingSerializer serializer = new MappingSerializer(mapper);

    private static Map<String, Object> record(String key, String identifier, String type, String kind) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("source_key", key);
        record.put("display_name", key);
        record.put("target_identifier", identifier);
        record.put("data_type", type);
        record.put("kind", kind);
        return record;
    }

    @Test
    @DisplayName("Export writes one record per field with status")
    void testExport() {
        IdentifierTable table = mapper.assignAll(IdentifierTable.empty(), List.of(
                Field.dimension("[Order Date]", DataType.DATE),
                Field.measure("Sales", DataType.REAL)));

        List<Map<String, Object>> records = serializer.export(table);

        assertEquals(2, records.size());
        Map<String, Object> first = records.get(0);
        assertEquals("[Order Date]", first.get("source_key"));
        assertEquals("Order Date", first.get("display_name"));
        assertEquals("order_date", first.get("target_identifier"));
        assertEquals("date", first.get("data_type"));
        assertEquals("dimension", first.get("kind"));
        assertEquals("valid", first.get("status"));
    }

    @Test
    @DisplayName("Records survive a JSON round trip")
    void testJsonRoundTrip() {
        IdentifierTable table = mapper.assignAll(IdentifierTable.empty(), List.of(
                Field.dimension("Région", DataType.STRING),
                Field.calculation("Profit \"Ratio\"", DataType.REAL, "1")));
        table = mapper.rename(table, "Région", "area").table();

        String json = CalcHttpJson.toJson(serializer.export(table));
        IdentifierTable restored = serializer.importRecords((List<?>) CalcHttpJson.parse(json), ReservedWords.DUCKDB);

        assertEquals(table, restored);
        assertEquals(MappingOrigin.USER_EDITED, restored.get("Région").orElseThrow().origin());
    }

    @Test
    @DisplayName("Structural and validation problems are reported together with record positions")
    void testImportProblems() {
        List<Object> records = List.of(
                record("Region", "region", "string", "dimension"),
                "not an object",
                record("Sales", "sales", "money", "measure"),
                record("Profit", "select", "real", "measure"),
                record("Discount", "region", "real", "measure"));

        MappingImportException e = assertThrows(MappingImportException.class,
                () -> serializer.importRecords(records, ReservedWords.DUCKDB));

        assertEquals(List.of(1, 2, 3, 4),
                e.problems().stream().map(MappingImportException.Problem::index).toList());
        assertEquals("Profit", e.problems().get(2).sourceKey());
        assertEquals("Discount", e.problems().get(3).sourceKey());
    }

    @Test
    @DisplayName("Records without an identifier import as invalid mappings")
    void testUnresolvedRecord() {
        IdentifierTable table = serializer.importRecords(
                List.of(record("Region", "", "string", "dimension")), ReservedWords.DUCKDB);

        assertEquals("invalid", serializer.export(table).get(0).get("status"));
    }
}
