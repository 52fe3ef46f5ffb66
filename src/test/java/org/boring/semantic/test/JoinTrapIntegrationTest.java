package org.boring.semantic.test;

import org.boring.semantic.execution.BufferedResult;
import org.boring.semantic.ir.AggregateSpec;
import org.boring.semantic.ir.SortKey;
import org.boring.semantic.planner.AmbiguousJoinCardinalityException;
import org.boring.semantic.transpiler.LoweringOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Aggregation across joins must give the values a per-table query would give.
 */
@DisplayName("Fan trap and chasm trap prevention")
class JoinTrapIntegrationTest extends AbstractDatabaseTest {

    @Nested
    @DisplayName("Fan trap: customers -< orders")
    class FanTrap {

        @Test
        @DisplayName("One-side sum is not inflated by the many side")
        void testOneSideSumAcrossJoinMany() {
            // GIVEN: 3 customers with lifetime values summing to 4500, and 8 orders
            var query = customersWithOrders().aggregate("customers.total_ltv");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN: the sum is the customers-only sum
            System.out.println("Fan trap SQL: " + query.sql());
            assertEquals(1, result.rowCount());
            assertEquals(4500, longValue(result, 0, "customers.total_ltv"));
        }

        @Test
        @DisplayName("Both sides aggregate correctly in one query")
        void testBothSidesInOneQuery() {
            // GIVEN
            var query = customersWithOrders()
                    .aggregate("customers.total_ltv", "orders.revenue", "orders.order_count", "customers.customer_count");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN
            assertEquals(4500, longValue(result, 0, "customers.total_ltv"));
            assertEquals(1000, longValue(result, 0, "orders.revenue"));
            assertEquals(8, longValue(result, 0, "orders.order_count"));
            assertEquals(3, longValue(result, 0, "customers.customer_count"));
        }

        @Test
        @DisplayName("Group keys of the one side split both sides' values")
        void testGroupedByOneSideKey() {
            // GIVEN
            var query = customersWithOrders()
                    .groupBy("customers.country")
                    .aggregate("customers.total_ltv", "orders.revenue")
                    .orderBy("customers.country");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN: DE first, then US
            assertEquals(2, result.rowCount());
            assertEquals("DE", result.getValue(0, "customers.country"));
            assertEquals(1500, longValue(result, 0, "customers.total_ltv"));
            assertEquals(230, longValue(result, 0, "orders.revenue"));
            assertEquals("US", result.getValue(1, "customers.country"));
            assertEquals(3000, longValue(result, 1, "customers.total_ltv"));
            assertEquals(770, longValue(result, 1, "orders.revenue"));
        }

        @Test
        @DisplayName("Group keys of the many side keep one-side values per group")
        void testGroupedByManySideKey() {
            // GIVEN: lifetime value per order status counts each customer once per status
            var query = customersWithOrders()
                    .groupBy("orders.status")
                    .aggregate("customers.total_ltv", "orders.order_count");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN: paid orders come from all three customers, refunded from Alice, pending from Carol
            int paid = rowWhere(result, "orders.status", "paid");
            assertEquals(4500, longValue(result, paid, "customers.total_ltv"));
            assertEquals(6, longValue(result, paid, "orders.order_count"));
            int refunded = rowWhere(result, "orders.status", "refunded");
            assertEquals(1000, longValue(result, refunded, "customers.total_ltv"));
            int pending = rowWhere(result, "orders.status", "pending");
            assertEquals(1500, longValue(result, pending, "customers.total_ltv"));
        }

        @Test
        @DisplayName("Averages are recombined from sums and counts")
        void testAverageAcrossJoin() {
            // GIVEN
            var query = customersWithOrders()
                    .groupBy("customers.country")
                    .aggregate("orders.avg_amount");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN: US orders 100, 200, 50, 300, 120
            int us = rowWhere(result, "customers.country", "US");
            assertEquals(154.0, doubleValue(result, us, "orders.avg_amount"), 1e-9);
            int de = rowWhere(result, "customers.country", "DE");
            assertEquals(230.0 / 3, doubleValue(result, de, "orders.avg_amount"), 1e-9);
        }

        @Test
        @DisplayName("Row filters on either side apply before the arms are aggregated")
        void testFilteredJoin() {
            // GIVEN: only paid orders
            var query = customersWithOrders()
                    .filter("orders.status = 'paid'")
                    .aggregate("customers.total_ltv", "orders.revenue");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN
            assertEquals(4500, longValue(result, 0, "customers.total_ltv"));
            assertEquals(890, longValue(result, 0, "orders.revenue"));
        }

        @Test
        @DisplayName("Counting distinct values of the many side")
        void testCountDistinctAcrossJoin() {
            // GIVEN
            Map<String, AggregateSpec> aggregates = new LinkedHashMap<>();
            aggregates.put("statuses", AggregateSpec.countDistinct("orders.status"));
            aggregates.put("customers", AggregateSpec.countDistinct("customers.name"));
            var query = customersWithOrders().aggregate(aggregates);

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN
            assertEquals(3, longValue(result, 0, "statuses"));
            assertEquals(3, longValue(result, 0, "customers"));
        }
    }

    @Nested
    @DisplayName("Chasm trap: orders >- customers -< tickets")
    class ChasmTrap {

        @Test
        @DisplayName("Each child's count equals its own row count")
        void testIndependentChildCounts() {
            // GIVEN: the raw join has 17 rows (3*2 + 2*1 + 3*3)
            var query = customersWithOrdersAndTickets()
                    .aggregate("orders.order_count", "tickets.ticket_count");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN
            System.out.println("Chasm trap SQL: " + query.sql());
            assertEquals(8, longValue(result, 0, "orders.order_count"));
            assertEquals(6, longValue(result, 0, "tickets.ticket_count"));
        }

        @Test
        @DisplayName("Per-group counts of both children")
        void testChildCountsPerGroup() {
            // GIVEN
            var query = customersWithOrdersAndTickets()
                    .groupBy("customers.country")
                    .aggregate("orders.revenue", "tickets.ticket_count", "customers.total_ltv")
                    .orderBy(SortKey.desc("customers.country"));

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN: US first
            assertEquals(2, result.rowCount());
            assertEquals("US", result.getValue(0, "customers.country"));
            assertEquals(770, longValue(result, 0, "orders.revenue"));
            assertEquals(3, longValue(result, 0, "tickets.ticket_count"));
            assertEquals(3000, longValue(result, 0, "customers.total_ltv"));
            assertEquals("DE", result.getValue(1, "customers.country"));
            assertEquals(230, longValue(result, 1, "orders.revenue"));
            assertEquals(3, longValue(result, 1, "tickets.ticket_count"));
            assertEquals(1500, longValue(result, 1, "customers.total_ltv"));
        }

        @Test
        @DisplayName("Result columns follow the requested order, not the arm order")
        void testColumnOrderAcrossArms() {
            // GIVEN: measures of three arms requested interleaved
            var query = customersWithOrdersAndTickets()
                    .groupBy("customers.country")
                    .aggregate("orders.order_count", "tickets.ticket_count", "customers.total_ltv",
                            "orders.avg_amount");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN
            assertEquals(List.of("customers.country", "orders.order_count", "tickets.ticket_count",
                    "customers.total_ltv", "orders.avg_amount"), result.columnNames());
            int us = rowWhere(result, "customers.country", "US");
            assertEquals(5, longValue(result, us, "orders.order_count"));
            assertEquals(3, longValue(result, us, "tickets.ticket_count"));
            assertEquals(3000, longValue(result, us, "customers.total_ltv"));
            assertEquals(154.0, doubleValue(result, us, "orders.avg_amount"), 1e-9);
        }

        @Test
        @DisplayName("Grouping by one child's key leaves the other child's values per group")
        void testGroupedByChildKey() {
            // GIVEN
            var query = customersWithOrdersAndTickets()
                    .groupBy("tickets.priority")
                    .aggregate("orders.order_count", "tickets.ticket_count");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN: high tickets belong to Alice and Carol (6 orders), low to everyone (8 orders)
            int high = rowWhere(result, "tickets.priority", "high");
            assertEquals(2, longValue(result, high, "tickets.ticket_count"));
            assertEquals(6, longValue(result, high, "orders.order_count"));
            int low = rowWhere(result, "tickets.priority", "low");
            assertEquals(4, longValue(result, low, "tickets.ticket_count"));
            assertEquals(8, longValue(result, low, "orders.order_count"));
        }
    }

    @Nested
    @DisplayName("Parents without children: Dan has no orders and no tickets")
    class ChildlessParent {

        @BeforeEach
        void addChildlessCustomer() throws SQLException {
            try (Statement stmt = connection.createStatement()) {
                stmt.execute("INSERT INTO customers VALUES (4, 'Dan', 'FR', 'smb', 700)");
            }
        }

        @Test
        @DisplayName("One-side sum across joinMany equals the sum on the one side alone")
        void testOneSideSumKeepsChildlessParent() {
            // GIVEN
            var alone = customers().aggregate("customers.total_ltv");
            var joined = customersWithOrders().aggregate("customers.total_ltv");

            // WHEN
            BufferedResult aloneResult = alone.execute(backend);
            BufferedResult joinedResult = joined.execute(backend);

            // THEN
            assertEquals(5200, longValue(aloneResult, 0, "customers.total_ltv"));
            assertEquals(longValue(aloneResult, 0, "customers.total_ltv"),
                    longValue(joinedResult, 0, "customers.total_ltv"));
        }

        @Test
        @DisplayName("Per-group one-side values across joinMany equal the one side alone")
        void testGroupedOneSideValuesKeepChildlessParent() {
            // GIVEN
            var alone = customers()
                    .groupBy("customers.country")
                    .aggregate("customers.total_ltv", "customers.customer_count")
                    .orderBy("customers.country");
            var joined = customersWithOrdersAndTickets()
                    .groupBy("customers.country")
                    .aggregate("customers.total_ltv", "customers.customer_count")
                    .orderBy("customers.country");

            // WHEN
            BufferedResult aloneResult = alone.execute(backend);
            BufferedResult joinedResult = joined.execute(backend);

            // THEN: DE, FR, US on both
            assertEquals(3, joinedResult.rowCount());
            for (int i = 0; i < aloneResult.rowCount(); i++) {
                assertEquals(aloneResult.getValue(i, "customers.country"), joinedResult.getValue(i, "customers.country"));
                assertEquals(longValue(aloneResult, i, "customers.total_ltv"),
                        longValue(joinedResult, i, "customers.total_ltv"));
                assertEquals(longValue(aloneResult, i, "customers.customer_count"),
                        longValue(joinedResult, i, "customers.customer_count"));
            }
        }

        @Test
        @DisplayName("Pre-aggregated arms over a left join give zero counts and null sums")
        void testLeftJoinThroughArms() {
            // GIVEN
            var query = customersWithOrders()
                    .groupBy("customers.country")
                    .aggregate("customers.total_ltv", "orders.order_count", "orders.revenue");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN: the FR group holds only Dan
            assertTrue(query.sql().contains("LEFT OUTER JOIN"), query.sql());
            int fr = rowWhere(result, "customers.country", "FR");
            assertEquals(700, longValue(result, fr, "customers.total_ltv"));
            assertEquals(0, longValue(result, fr, "orders.order_count"));
            assertNull(result.getValue(fr, "orders.revenue"));
            int us = rowWhere(result, "customers.country", "US");
            assertEquals(5, longValue(result, us, "orders.order_count"));
            assertEquals(770, longValue(result, us, "orders.revenue"));
        }

        @Test
        @DisplayName("Both children count their own rows when one parent has neither")
        void testChasmWithChildlessParent() {
            // GIVEN
            var query = customersWithOrdersAndTickets()
                    .aggregate("customers.customer_count", "orders.order_count", "tickets.ticket_count");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN
            assertEquals(4, longValue(result, 0, "customers.customer_count"));
            assertEquals(8, longValue(result, 0, "orders.order_count"));
            assertEquals(6, longValue(result, 0, "tickets.ticket_count"));
        }
    }

    @Nested
    @DisplayName("Joins that need no pre-aggregation")
    class PassThrough {

        @Test
        @DisplayName("Measures of the left side across a ONE join keep the plain join")
        void testJoinOnePassThrough() {
            // GIVEN: each order has exactly one customer
            var query = orders()
                    .joinOne(customers(), "orders.customer_id", "customers.customer_id")
                    .groupBy("customers.segment")
                    .aggregate("orders.revenue");

            // WHEN
            String sql = query.sql();
            BufferedResult result = query.execute(backend);

            // THEN: no pre-aggregated arm in the SQL
            assertFalse(sql.contains("__arm"), "SQL should not pre-aggregate: " + sql);
            assertEquals(650, longValue(result, rowWhere(result, "customers.segment", "smb"), "orders.revenue"));
            assertEquals(350, longValue(result, rowWhere(result, "customers.segment", "enterprise"), "orders.revenue"));
        }

        @Test
        @DisplayName("Measures of the right side of a ONE join are pre-aggregated")
        void testJoinOneRightSideMeasure() {
            // GIVEN: three orders point at Carol, whose lifetime value must count once
            var query = orders()
                    .joinOne(customers(), "orders.customer_id", "customers.customer_id")
                    .aggregate("customers.total_ltv");

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN
            assertEquals(4500, longValue(result, 0, "customers.total_ltv"));
        }
    }

    @Nested
    @DisplayName("Undeclared cardinality")
    class UndeclaredCardinality {

        @Test
        @DisplayName("Aggregating across an undeclared join fails by default")
        void testUndeclaredJoinFails() {
            // GIVEN
            var query = customers()
                    .join(orders(), "customers.customer_id", "orders.customer_id")
                    .aggregate("customers.total_ltv");

            // WHEN / THEN
            var error = assertThrows(AmbiguousJoinCardinalityException.class, () -> query.execute(backend));
            assertTrue(error.getMessage().contains("customers.total_ltv"), error.getMessage());
        }

        @Test
        @DisplayName("The permissive option keeps the raw, inflated join")
        void testUndeclaredJoinPermissive() {
            // GIVEN
            var query = customers()
                    .join(orders(), "customers.customer_id", "orders.customer_id")
                    .aggregate("customers.total_ltv");
            LoweringOptions permissive = LoweringOptions.defaults().withAllowUndeclaredJoinCardinality(true);

            // WHEN
            BufferedResult result = query.execute(backend, permissive);

            // THEN: each lifetime value is repeated once per order
            assertEquals(11500, longValue(result, 0, "customers.total_ltv"));
        }

        @Test
        @DisplayName("Undeclared joins without aggregation are allowed")
        void testUndeclaredJoinWithoutMeasures() {
            // GIVEN
            var query = customers()
                    .join(orders(), "customers.customer_id", "orders.customer_id")
                    .groupBy("customers.name")
                    .distinct();

            // WHEN
            BufferedResult result = query.execute(backend);

            // THEN
            assertEquals(3, result.rowCount());
        }
    }
}
