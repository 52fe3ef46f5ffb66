package org.boring.semantic.model;

import org.boring.semantic.store.Column;
import org.boring.semantic.store.SqlDataType;
import org.boring.semantic.store.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SemanticTableTest {

    private static final Table FLIGHTS = new Table("flights", List.of(
            Column.required("flight_id", SqlDataType.INTEGER),
            Column.required("origin", SqlDataType.VARCHAR),
            Column.nullable("distance", SqlDataType.INTEGER),
            Column.required("departed_at", SqlDataType.TIMESTAMP)));

    private static SemanticTable flights() {
        return SemanticTable.from(FLIGHTS)
                .withDimensions(
                        Dimension.column("origin"),
                        Dimension.time("departed_at", row -> row.column("departed_at"), TimeGrain.HOUR))
                .withMeasures(
                        Measure.count("flight_count"),
                        Measure.sum("total_distance", "distance"));
    }

    @Nested
    @DisplayName("Building")
    class Building {

        @Test
        @DisplayName("Fields keep declaration order")
        void testDeclarationOrder() {
            SemanticTable table = flights();

            assertEquals("flights", table.name());
            assertEquals(List.of("origin", "departed_at"), table.availableDimensions());
            assertEquals(List.of("flight_count", "total_distance"), table.availableMeasures());
        }

        @Test
        @DisplayName("Builders return new tables")
        void testImmutability() {
            SemanticTable base = flights();
            SemanticTable extended = base.withMeasures(Measure.max("longest", "distance"));

            assertFalse(base.measure("longest").isPresent());
            assertTrue(extended.measure("longest").isPresent());
        }

        @Test
        @DisplayName("A field name is defined once across dimensions and measures")
        void testDuplicates() {
            SemanticTable table = flights();

            var duplicateDimension = assertThrows(DuplicateFieldException.class,
                    () -> table.withDimensions(Dimension.column("origin")));
            assertEquals("origin", duplicateDimension.fieldName());
            assertEquals("flights", duplicateDimension.tableName());

            assertThrows(DuplicateFieldException.class,
                    () -> table.withMeasures(Measure.count("origin")));
            assertThrows(DuplicateFieldException.class,
                    () -> table.withDimensions(Dimension.column("flight_count", "origin")));
            assertThrows(DuplicateFieldException.class,
                    () -> table.withMeasures(Measure.count("n"), Measure.count("n")));
        }

        @Test
        @DisplayName("Overrides replace a field of the same kind")
        void testOverride() {
            SemanticTable table = flights().withMeasures(
                    List.of(Measure.countDistinct("flight_count", "flight_id")), true);

            assertEquals(Measure.Kind.BASE, table.measure("flight_count").orElseThrow().kind());
            assertEquals(List.of("flight_count", "total_distance"), table.availableMeasures());
        }

        @Test
        @DisplayName("Names and primary keys are validated")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> SemanticTable.of("a.b", FLIGHTS));
            assertThrows(IllegalArgumentException.class, () -> SemanticTable.of(" ", FLIGHTS));
            assertThrows(IllegalArgumentException.class, () -> flights().withPrimaryKey("missing"));
        }

        @Test
        @DisplayName("Renaming keeps every field")
        void testNamed() {
            SemanticTable renamed = flights().named("return_flights");

            assertEquals("return_flights", renamed.name());
            assertEquals(flights().availableMeasures(), renamed.availableMeasures());
            assertEquals("flights", renamed.source().name());
        }
    }

    @Test
    @DisplayName("Describe lists fields with their metadata")
    @SuppressWarnings("unchecked")
    void testDescribe() {
        // GIVEN
        SemanticTable table = flights()
                .withPrimaryKey("flight_id")
                .withDescription("Scheduled flights");

        // WHEN
        Map<String, Object> description = table.describe();

        // THEN
        assertEquals("flights", description.get("name"));
        assertEquals("Scheduled flights", description.get("description"));
        assertEquals("flight_id", description.get("primary_key"));

        var dimensions = (List<Map<String, Object>>) description.get("dimensions");
        assertEquals(2, dimensions.size());
        assertEquals(false, dimensions.get(0).get("is_time_dimension"));
        assertEquals(true, dimensions.get(1).get("is_time_dimension"));
        assertEquals("HOUR", dimensions.get(1).get("smallest_time_grain"));

        var measures = (List<Map<String, Object>>) description.get("measures");
        assertEquals("flight_count", measures.get(0).get("name"));
        assertEquals("BASE", measures.get(0).get("kind"));
    }
}
