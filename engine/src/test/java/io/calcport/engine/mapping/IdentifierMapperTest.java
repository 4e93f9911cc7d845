package io.calcport.engine.mapping;

import io.calcport.engine.model.DataType;
import io.calcport.engine.model.Field;
import io.calcport.engine.model.FieldKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for identifier table edits: assignment, rename, relabel and import.
 */
@DisplayName("Identifier mapper")
class IdentifierMapperTest {

    private IdentifierMapper mapper;
    private IdentifierTable table;

    @BeforeEach
    void setUp() {
        mapper = new IdentifierMapper();
        table = mapper.assignAll(IdentifierTable.empty(), List.of(
                Field.dimension("Region", DataType.STRING),
                Field.measure("Sales", DataType.REAL),
                Field.measure("Profit", DataType.REAL),
                Field.calculation("Profit Ratio", DataType.REAL, "[Profit] / [Sales]")));
    }

    @Nested
    @DisplayName("Assignment")
    class Assignment {

        @Test
        @DisplayName("Every field gets a valid generated identifier")
        void testAssignAll() {
            assertEquals(4, table.size());
            assertEquals("profit_ratio", table.identifierOf("Profit Ratio").orElseThrow());
            for (IdentifierMapping m : table.mappings()) {
                assertEquals(MappingOrigin.GENERATED, m.origin());
                assertEquals(MappingStatus.VALID, table.status(m.sourceKey()));
            }
        }

        @Test
        @DisplayName("Assigning an already-mapped key is a no-op")
        void testIdempotent() {
            IdentifierTable renamed = mapper.rename(table, "Sales", "revenue").table();

            MappingUpdate again = mapper.assign(renamed, "Sales", null, DataType.REAL, FieldKind.MEASURE);

            assertSame(renamed, again.table());
            assertEquals("revenue", again.mapping().targetIdentifier());
        }

        @Test
        @DisplayName("Names that normalize alike stay unique")
        void testUniqueness() {
            IdentifierTable t = mapper.assignAll(IdentifierTable.empty(), List.of(
                    Field.measure("Sales", DataType.REAL),
                    Field.measure("[sales]", DataType.REAL),
                    Field.measure("SALES!", DataType.REAL)));

            Set<String> identifiers = new HashSet<>();
            t.mappings().forEach(m -> identifiers.add(m.targetIdentifier()));
            assertEquals(Set.of("sales", "sales_2", "sales_3"), identifiers);
        }

        @Test
        @DisplayName("Generated names avoid user identifiers that differ only in case")
        void testGeneratedAvoidsCaseVariant() {
            // GIVEN: a user-edited 'Order_Date' on another field
            MappingUpdate first = mapper.assign(IdentifierTable.empty(), "ship", null,
                    DataType.DATE, FieldKind.DIMENSION);
            IdentifierTable edited = mapper.rename(first.table(), "ship", "Order_Date").table();

            // WHEN: 'Order Date' is generated
            MappingUpdate second = mapper.assign(edited, "Order Date", null, DataType.DATE, FieldKind.DIMENSION);

            // THEN: it is disambiguated and both stay valid
            assertEquals("order_date_2", second.mapping().targetIdentifier());
            assertEquals(MappingStatus.VALID, second.status());
            assertEquals(MappingStatus.VALID, second.table().status("ship"));
        }

        @Test
        @DisplayName("Labels fall back from display name to a derived label")
        void testLabels() {
            MappingUpdate withDisplay = mapper.assign(IdentifierTable.empty(), "cust_nm", "Customer Name",
                    DataType.STRING, FieldKind.DIMENSION);
            MappingUpdate derived = mapper.assign(IdentifierTable.empty(), "[Ship_Mode]", null,
                    DataType.STRING, FieldKind.DIMENSION);

            assertEquals("Customer Name", withDisplay.mapping().label());
            assertEquals("Ship Mode", derived.mapping().label());
        }

        @Test
        @DisplayName("An unresolved imported mapping is filled in on assignment, keeping its label")
        void testFillUnresolved() {
            IdentifierTable imported = mapper.importMappings(List.of(
                    new IdentifierMapping("Region", "", "Sales Region", DataType.STRING,
                            FieldKind.DIMENSION, MappingOrigin.USER_EDITED)), ReservedWords.DUCKDB);
            assertEquals(MappingStatus.INVALID, imported.status("Region"));

            MappingUpdate update = mapper.assign(imported, "Region", null, DataType.STRING, FieldKind.DIMENSION);

            assertEquals("region", update.mapping().targetIdentifier());
            assertEquals("Sales Region", update.mapping().label());
            assertEquals(MappingStatus.VALID, update.status());
        }
    }

    @Nested
    @DisplayName("Rename")
    class Rename {

        @Test
        @DisplayName("A free, well-formed identifier is accepted as a user edit")
        void testRename() {
            MappingUpdate update = mapper.rename(table, "Sales", "revenue");

            assertEquals("revenue", update.mapping().targetIdentifier());
            assertEquals(MappingOrigin.USER_EDITED, update.mapping().origin());
            assertEquals(MappingStatus.VALID, update.status());
            // original table unchanged
            assertEquals("sales", table.identifierOf("Sales").orElseThrow());
        }

        @Test
        @DisplayName("Renaming to another field's identifier is a naming conflict")
        void testConflict() {
            NamingConflictException e = assertThrows(NamingConflictException.class,
                    () -> mapper.rename(table, "Sales", "profit"));

            assertEquals("profit", e.identifier());
            assertEquals("Profit", e.owner());
            assertEquals("Sales", e.requester());
            assertEquals("naming-conflict", e.toDiagnostic().kind().wireName());
        }

        @Test
        @DisplayName("Identifiers differing only in case conflict")
        void testCaseInsensitiveConflict() {
            // GIVEN: Sales holds the generated identifier 'sales'
            NamingConflictException e = assertThrows(NamingConflictException.class,
                    () -> mapper.rename(table, "Profit", "Sales"));

            assertEquals("Sales", e.owner());
            assertEquals("profit", table.identifierOf("Profit").orElseThrow());
        }

        @Test
        @DisplayName("Changing the case of a field's own identifier is allowed")
        void testRecaseOwnIdentifier() {
            MappingUpdate update = mapper.rename(table, "Sales", "SALES");

            assertEquals("SALES", update.mapping().targetIdentifier());
            assertEquals(MappingStatus.VALID, update.status());
            assertTrue(update.table().isTaken("sales"));
        }

        @Test
        @DisplayName("Renaming to the current identifier is allowed")
        void testRenameToSelf() {
            MappingUpdate update = mapper.rename(table, "Sales", "sales");

            assertEquals(MappingStatus.VALID, update.status());
        }

        @Test
        @DisplayName("Malformed, reserved and runtime names are rejected")
        void testInvalid() {
            assertThrows(InvalidIdentifierException.class, () -> mapper.rename(table, "Sales", "select"));
            assertThrows(InvalidIdentifierException.class, () -> mapper.rename(table, "Sales", "SELECT"));
            assertThrows(InvalidIdentifierException.class, () -> mapper.rename(table, "Sales", "2x"));
            assertThrows(InvalidIdentifierException.class, () -> mapper.rename(table, "Sales", "net sales"));
            assertThrows(InvalidIdentifierException.class, () -> mapper.rename(table, "Sales", ""));
            assertThrows(InvalidIdentifierException.class, () -> mapper.rename(table, "Sales", "src"));
        }

        @Test
        @DisplayName("Unknown source keys are rejected")
        void testUnknown() {
            MappingException e = assertThrows(MappingException.class,
                    () -> mapper.rename(table, "Discount", "discount"));

            assertFalse(e instanceof InvalidIdentifierException);
        }

        @Test
        @DisplayName("Relabel changes only the label")
        void testRelabel() {
            MappingUpdate update = mapper.relabel(table, "Region", "Sales Region");

            assertEquals("Sales Region", update.mapping().label());
            assertEquals("region", update.mapping().targetIdentifier());
            assertEquals(MappingOrigin.GENERATED, update.mapping().origin());
        }
    }

    @Nested
    @DisplayName("Summary")
    class Summary {

        @Test
        @DisplayName("Counts valid, invalid and per-kind mappings")
        void testSummary() {
            IdentifierTable imported = mapper.importMappings(List.of(
                    new IdentifierMapping("Region", "region", "Region", DataType.STRING,
                            FieldKind.DIMENSION, MappingOrigin.GENERATED),
                    new IdentifierMapping("Sales", "", "Sales", DataType.REAL,
                            FieldKind.MEASURE, MappingOrigin.GENERATED),
                    new IdentifierMapping("Profit", "profit", "Profit", DataType.REAL,
                            FieldKind.MEASURE, MappingOrigin.GENERATED)), ReservedWords.DUCKDB);

            MappingSummary summary = imported.summary();

            assertEquals(3, summary.total());
            assertEquals(2, summary.valid());
            assertEquals(1, summary.invalid());
            assertEquals(2, summary.byKind().get(FieldKind.MEASURE));
            assertEquals(1, summary.byKind().get(FieldKind.DIMENSION));
        }
    }

    @Nested
    @DisplayName("Import and export")
    class ImportExport {

        @Test
        @DisplayName("Export then import reproduces the table")
        void testRoundTrip() {
            IdentifierTable edited = mapper.rename(table, "Profit Ratio", "margin").table();

            IdentifierTable imported = mapper.importMappings(mapper.exportMappings(edited), ReservedWords.DUCKDB);

            assertEquals(edited, imported);
            assertEquals(MappingOrigin.USER_EDITED, imported.get("Profit Ratio").orElseThrow().origin());
            assertEquals(MappingOrigin.GENERATED, imported.get("Sales").orElseThrow().origin());
        }

        @Test
        @DisplayName("A bad import is rejected whole, listing every problem")
        void testRejectAll() {
            // GIVEN: a duplicate key, a reserved identifier and a shared identifier
            List<IdentifierMapping> records = List.of(
                    new IdentifierMapping("Region", "region", "", DataType.STRING,
                            FieldKind.DIMENSION, MappingOrigin.GENERATED),
                    new IdentifierMapping("Region", "region_2", "", DataType.STRING,
                            FieldKind.DIMENSION, MappingOrigin.GENERATED),
                    new IdentifierMapping("Sales", "select", "", DataType.REAL,
                            FieldKind.MEASURE, MappingOrigin.GENERATED),
                    new IdentifierMapping("Profit", "region", "", DataType.REAL,
                            FieldKind.MEASURE, MappingOrigin.GENERATED),
                    new IdentifierMapping("Discount", "discount", "", DataType.REAL,
                            FieldKind.MEASURE, MappingOrigin.GENERATED));

            // WHEN / THEN
            MappingImportException e = assertThrows(MappingImportException.class,
                    () -> mapper.importMappings(records, ReservedWords.DUCKDB));

            assertEquals(List.of(1, 2, 3), e.problems().stream().map(MappingImportException.Problem::index).toList());
            assertTrue(e.problems().get(1).reason().contains("reserved"));
        }

        @Test
        @DisplayName("An import holding identifiers that differ only in case is rejected")
        void testImportCaseInsensitiveDuplicate() {
            List<IdentifierMapping> records = List.of(
                    new IdentifierMapping("Sales", "Sales", "", DataType.REAL,
                            FieldKind.MEASURE, MappingOrigin.USER_EDITED),
                    new IdentifierMapping("sales amount", "sales", "", DataType.REAL,
                            FieldKind.MEASURE, MappingOrigin.GENERATED));

            MappingImportException e = assertThrows(MappingImportException.class,
                    () -> mapper.importMappings(records, ReservedWords.DUCKDB));

            assertEquals(1, e.problems().size());
            assertEquals(1, e.problems().get(0).index());
            assertTrue(e.problems().get(0).reason().contains("record #0"));
        }

        @Test
        @DisplayName("Import checks against the given reserved-word set")
        void testImportReservedWords() {
            ReservedWords words = ReservedWords.forDialect(ReservedWords.DUCKDB.dialect(), "orders");
            List<IdentifierMapping> records = List.of(
                    new IdentifierMapping("Orders", "orders", "", DataType.STRING,
                            FieldKind.DIMENSION, MappingOrigin.GENERATED));

            assertDoesNotThrow(() -> mapper.importMappings(records, ReservedWords.DUCKDB));
            assertThrows(MappingImportException.class, () -> mapper.importMappings(records, words));
        }
    }
}
