package org.boring.semantic.test;

import org.boring.semantic.api.SemanticRelation;
import org.boring.semantic.execution.BufferedResult;
import org.boring.semantic.ir.SortKey;
import org.boring.semantic.transpiler.LoweringOptions;
import org.boring.semantic.transpiler.SemanticLowerer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests that restricting table scans to referenced columns never changes a result.
 */
@DisplayName("Projection pushdown")
class ProjectionPushdownIntegrationTest extends AbstractDatabaseTest {

    private static final LoweringOptions UNPRUNED = LoweringOptions.defaults().withProjectionPushdown(false);

    private void assertSameResult(SemanticRelation query) {
        String pruned = query.sql();
        String unpruned = query.sql(UNPRUNED);
        System.out.println("Pruned:   " + pruned);
        System.out.println("Unpruned: " + unpruned);

        BufferedResult expected = query.execute(backend, UNPRUNED);
        BufferedResult actual = query.execute(backend);
        assertEquals(expected.columnNames(), actual.columnNames(), "Columns should match");
        assertEquals(expected.toMaps(), actual.toMaps(), "Rows should match");
    }

    @Test
    @DisplayName("Scans keep only the columns a single-table aggregate reads")
    void testSingleTablePruning() {
        // GIVEN
        var query = orders().filter("status = 'paid'").groupBy("customer_id").aggregate("revenue")
                .orderBy("customer_id");

        // WHEN
        String sql = query.sql();

        // THEN
        assertTrue(sql.contains("(SELECT \"customer_id\", \"amount\", \"status\" FROM"), sql);
        assertFalse(sql.contains("order_date"), sql);
        assertSameResult(query);
    }

    @Test
    @DisplayName("Columns reached through calculated measures are kept")
    void testCalculatedMeasureColumns() {
        // GIVEN
        var query = orders().groupBy("status").aggregate("revenue_per_order").orderBy("status");

        // WHEN
        String sql = query.sql();

        // THEN
        assertTrue(sql.contains("\"amount\""), sql);
        assertSameResult(query);
    }

    @Test
    @DisplayName("Row counts alone still scan one column")
    void testCountOnly() {
        var query = orders().aggregate("order_count");

        assertTrue(query.sql().contains("(SELECT \"order_id\" FROM"), query.sql());
        assertSameResult(query);
    }

    @Test
    @DisplayName("Join keys of every table are kept")
    void testJoinPruning() {
        // GIVEN
        var query = customersWithOrdersAndTickets()
                .groupBy("customers.country")
                .aggregate("orders.revenue", "tickets.ticket_count")
                .orderBy("customers.country");

        // WHEN / THEN
        assertFalse(query.sql().contains("lifetime_value"), query.sql());
        assertSameResult(query);
    }

    @Test
    @DisplayName("Raw row queries are not pruned")
    void testRawRows() {
        // GIVEN
        var query = orders().orderBy(SortKey.desc("amount")).limit(2);

        // WHEN
        BufferedResult result = query.execute(backend);

        // THEN
        assertEquals(query.sql(), query.sql(UNPRUNED));
        assertEquals(5, result.columnCount());
    }

    @Test
    @DisplayName("Planning is idempotent")
    void testIdempotent() {
        // GIVEN
        var node = customersWithOrders().groupBy("customers.segment").aggregate("orders.revenue").node();
        SemanticLowerer lowerer = new SemanticLowerer();

        // WHEN / THEN
        assertEquals(lowerer.plan(node), lowerer.plan(node));
        assertEquals(lowerer.toSql(node), lowerer.toSql(node));
        assertEquals(List.of("customers.segment", "orders.revenue"),
                customersWithOrders().groupBy("customers.segment").aggregate("orders.revenue")
                        .execute(backend).columnNames());
    }
}
