package org.boring.semantic.resolve;

import org.boring.semantic.api.SemanticRelation;
import org.boring.semantic.model.Dimension;
import org.boring.semantic.model.Measure;
import org.boring.semantic.model.SemanticTable;
import org.boring.semantic.store.Column;
import org.boring.semantic.store.SqlDataType;
import org.boring.semantic.store.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for bare, qualified and nested field names across joins.
 */
class FieldResolutionTest {

    private static final SemanticTable FLIGHTS = SemanticTable.from(new Table("flights", List.of(
                    Column.required("flight_id", SqlDataType.INTEGER),
                    Column.required("carrier", SqlDataType.VARCHAR),
                    Column.required("origin", SqlDataType.VARCHAR))))
            .withDimensions(Dimension.column("carrier"), Dimension.column("origin"))
            .withMeasures(Measure.count("flight_count"));

    private static final SemanticTable CARRIERS = SemanticTable.from(new Table("carriers", List.of(
                    Column.required("code", SqlDataType.VARCHAR),
                    Column.required("name", SqlDataType.VARCHAR))))
            .withDimensions(Dimension.column("code"), Dimension.column("name"), Dimension.column("origin", "code"))
            .withMeasures(Measure.count("carrier_count"));

    private static FieldResolution joined(SemanticTable left, SemanticTable right) {
        return FieldResolution.of(SemanticRelation.of(left)
                .joinMany(SemanticRelation.of(right), "carrier", "code")
                .node());
    }

    @Test
    @DisplayName("Bare names belong to the leftmost declaring table")
    void testBareNamePrecedence() {
        assertEquals("flights.origin", joined(FLIGHTS, CARRIERS).dimension("origin").qualifiedName());
        assertEquals("carriers.origin", FieldResolution.of(SemanticRelation.of(CARRIERS)
                .joinOne(SemanticRelation.of(FLIGHTS), "code", "carrier").node())
                .dimension("origin").qualifiedName());
    }

    @Test
    @DisplayName("Qualified names and unique bare names")
    void testQualifiedAndUnique() {
        FieldResolution resolution = joined(FLIGHTS, CARRIERS);

        assertEquals("carriers.origin", resolution.dimension("carriers.origin").qualifiedName());
        assertEquals("carriers.name", resolution.dimension("name").qualifiedName());
        assertEquals("carriers.carrier_count", resolution.measure("carrier_count").qualifiedName());
        assertSame(CARRIERS, resolution.measure("carrier_count").table());
    }

    @Test
    @DisplayName("Nested qualifiers fall back to the innermost table")
    void testNestedQualifier() {
        FieldResolution resolution = joined(FLIGHTS, CARRIERS);

        assertEquals("carriers.name", resolution.dimension("flights.carriers.name").qualifiedName());
    }

    @Test
    @DisplayName("Calculated measures see their own table first")
    void testOwnerPrecedence() {
        SemanticTable carriers = CARRIERS.withMeasures(Measure.count("flight_count"));
        FieldResolution resolution = joined(FLIGHTS, carriers);

        assertEquals("flights.flight_count", resolution.measure("flight_count").qualifiedName());
        assertEquals("carriers.flight_count", resolution.measure("flight_count", "carriers").qualifiedName());
        assertEquals("flights.flight_count",
                resolution.measure("flights.flight_count", "carriers").qualifiedName());
    }

    @Test
    @DisplayName("Unknown names list the known ones")
    void testUnresolved() {
        FieldResolution resolution = joined(FLIGHTS, CARRIERS);

        var error = assertThrows(UnresolvedFieldException.class, () -> resolution.dimension("destination"));
        assertEquals("destination", error.field());
        assertTrue(error.available().contains("carriers.name"), error.getMessage());
        assertFalse(resolution.findMeasure("origin").isPresent());
    }

    @Test
    @DisplayName("A table cannot be joined to itself without renaming")
    void testSelfJoin() {
        assertThrows(IllegalArgumentException.class, () -> FieldResolution.of(SemanticRelation.of(FLIGHTS)
                .joinOne(SemanticRelation.of(FLIGHTS), "origin", "origin").node()));

        FieldResolution renamed = FieldResolution.of(SemanticRelation.of(FLIGHTS)
                .joinOne(SemanticRelation.of(FLIGHTS.named("connections")), "origin", "origin").node());
        assertEquals("connections.carrier", renamed.dimension("connections.carrier").qualifiedName());
        assertEquals(2, renamed.tables().size());
    }
}
