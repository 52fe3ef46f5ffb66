package org.boring.semantic.test;

import org.boring.semantic.api.SemanticQuery;
import org.boring.semantic.api.SemanticRelation;
import org.boring.semantic.execution.BufferedResult;
import org.boring.semantic.filter.Filter;
import org.boring.semantic.model.Dimension;
import org.boring.semantic.model.GrainTooFineException;
import org.boring.semantic.model.SemanticTable;
import org.boring.semantic.model.TimeGrain;
import org.boring.semantic.plan.DateTruncExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for time grains on time dimensions and time range filters.
 */
@DisplayName("Time dimensions")
class TimeDimensionIntegrationTest extends AbstractDatabaseTest {

    /** Orders with a time dimension that is only meaningful per month. */
    private static final SemanticTable MONTHLY_ORDERS = ORDERS.withDimensions(List.of(
            Dimension.time("order_month",
                    row -> new DateTruncExpression(DateTruncExpression.TruncPart.MONTH, row.column("order_date")),
                    TimeGrain.MONTH)), false);

    @Nested
    @DisplayName("Grouping at a grain")
    class Grains {

        @Test
        @DisplayName("Revenue by month")
        void testRevenueByMonth() {
            // GIVEN
            var query = orders()
                    .groupBy("order_date")
                    .timeGrain("order_date", TimeGrain.MONTH)
                    .aggregate("revenue")
                    .orderBy("order_date");

            // WHEN
            String sql = query.sql();
            System.out.println("Monthly SQL: " + sql);
            BufferedResult result = query.execute(backend);

            // THEN
            assertTrue(sql.contains("date_trunc('month'"), "Key should be truncated: " + sql);
            assertEquals(3, result.rowCount());
            assertTrue(String.valueOf(result.getValue(0, "order_date")).startsWith("2024-01"));
            assertEquals(380, longValue(result, 0, "revenue"));
            assertEquals(350, longValue(result, 1, "revenue"));
            assertEquals(270, longValue(result, 2, "revenue"));
        }

        @Test
        @DisplayName("A coarser grain collapses groups")
        void testQuarter() {
            // WHEN
            BufferedResult result = orders()
                    .groupBy("order_date")
                    .timeGrain("order_date", TimeGrain.QUARTER)
                    .aggregate("order_count")
                    .execute(backend);

            // THEN
            assertEquals(1, result.rowCount());
            assertEquals(8, longValue(result, 0, "order_count"));
        }

        @Test
        @DisplayName("Grains at or above the smallest grain are accepted")
        void testGrainAtSmallest() {
            // WHEN
            BufferedResult result = SemanticRelation.of(MONTHLY_ORDERS)
                    .groupBy("order_month")
                    .timeGrain("order_month", TimeGrain.MONTH)
                    .aggregate("revenue")
                    .execute(backend);

            // THEN
            assertEquals(3, result.rowCount());
        }

        @Test
        @DisplayName("Grains finer than the smallest grain are rejected")
        void testGrainTooFine() {
            // GIVEN
            var grouped = SemanticRelation.of(MONTHLY_ORDERS).groupBy("order_month");

            // WHEN
            var error = assertThrows(GrainTooFineException.class,
                    () -> grouped.timeGrain("order_month", TimeGrain.DAY));

            // THEN
            assertEquals("order_month", error.dimension());
            assertEquals(TimeGrain.DAY, error.requested());
            assertEquals(TimeGrain.MONTH, error.smallest());
        }

        @Test
        @DisplayName("Every grain at or above the smallest is accepted, every finer one rejected")
        void testGrainMonotonicity() {
            var grouped = SemanticRelation.of(MONTHLY_ORDERS).groupBy("order_month");
            for (TimeGrain grain : TimeGrain.values()) {
                if (grain.isFinerThan(TimeGrain.MONTH)) {
                    assertThrows(GrainTooFineException.class, () -> grouped.timeGrain("order_month", grain),
                            "Grain " + grain + " should be rejected");
                } else {
                    assertDoesNotThrow(() -> grouped.timeGrain("order_month", grain),
                            "Grain " + grain + " should be accepted");
                }
            }
        }

        @Test
        @DisplayName("Grains apply only to time dimensions among the keys")
        void testGrainOnWrongField() {
            var grouped = orders().groupBy("status");

            assertThrows(IllegalArgumentException.class, () -> grouped.timeGrain("status", TimeGrain.MONTH));
            assertThrows(IllegalArgumentException.class, () -> grouped.timeGrain("order_date", TimeGrain.MONTH));
        }
    }

    @Nested
    @DisplayName("Time ranges")
    class Ranges {

        @Test
        @DisplayName("Open-ended range filter on a relation")
        void testOpenRange() {
            // WHEN
            BufferedResult result = orders()
                    .filter(Filter.timeRange("order_date", "2024-03-01", null))
                    .aggregate("order_count")
                    .execute(backend);

            // THEN: 105, 107, 108
            assertEquals(3, longValue(result, 0, "order_count"));
        }

        @Test
        @DisplayName("Inclusive range with a grain in a query")
        void testQueryRange() {
            // GIVEN
            SemanticQuery query = SemanticQuery.on(orders())
                    .dimensions("order_date")
                    .measures("revenue")
                    .timeGrain("month")
                    .timeRange("2024-02-01", "2024-02-14")
                    .build();

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN: both February orders, the second on the upper bound
            assertEquals(1, result.rowCount());
            assertTrue(String.valueOf(result.getValue(0, "order_date")).startsWith("2024-02"));
            assertEquals(350, longValue(result, 0, "revenue"));
        }

        @Test
        @DisplayName("A range needs a time dimension among the query dimensions")
        void testRangeWithoutTimeDimension() {
            // GIVEN
            SemanticQuery query = SemanticQuery.on(orders())
                    .dimensions("status")
                    .measures("revenue")
                    .timeRange("2024-02-01", "2024-02-29")
                    .build();

            // WHEN / THEN
            assertThrows(IllegalArgumentException.class, query::sql);
        }

        @Test
        @DisplayName("A range needs at least one bound")
        void testEmptyRange() {
            assertThrows(IllegalArgumentException.class, () -> Filter.timeRange("order_date", null, null));
        }
    }
}
