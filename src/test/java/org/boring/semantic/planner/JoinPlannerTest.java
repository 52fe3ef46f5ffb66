package org.boring.semantic.planner;

import org.boring.semantic.api.SemanticRelation;
import org.boring.semantic.ir.SemanticAggregate;
import org.boring.semantic.ir.SemanticFilter;
import org.boring.semantic.ir.SemanticGroupBy;
import org.boring.semantic.ir.SemanticJoin;
import org.boring.semantic.ir.SemanticNode;
import org.boring.semantic.ir.SemanticPreAggregate;
import org.boring.semantic.model.Dimension;
import org.boring.semantic.model.Measure;
import org.boring.semantic.model.SemanticTable;
import org.boring.semantic.store.Column;
import org.boring.semantic.store.SqlDataType;
import org.boring.semantic.store.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the arms the join planner builds around aggregates over joins.
 */
class JoinPlannerTest {

    private static final SemanticTable CUSTOMERS = SemanticTable.from(new Table("customers", List.of(
                    Column.required("customer_id", SqlDataType.INTEGER),
                    Column.required("country", SqlDataType.VARCHAR),
                    Column.required("lifetime_value", SqlDataType.INTEGER))))
            .withDimensions(Dimension.column("customer_id"), Dimension.column("country"))
            .withMeasures(Measure.sum("total_ltv", "lifetime_value"));

    private static final SemanticTable ORDERS = SemanticTable.from(new Table("orders", List.of(
                    Column.required("order_id", SqlDataType.INTEGER),
                    Column.required("customer_id", SqlDataType.INTEGER),
                    Column.required("status", SqlDataType.VARCHAR),
                    Column.required("amount", SqlDataType.INTEGER))))
            .withDimensions(Dimension.column("customer_id"), Dimension.column("status"))
            .withMeasures(
                    Measure.sum("revenue", "amount"),
                    Measure.avg("avg_amount", "amount"),
                    Measure.countDistinct("buyers", "customer_id"));

    private static SemanticRelation customersWithOrders() {
        return SemanticRelation.of(CUSTOMERS)
                .joinMany(SemanticRelation.of(ORDERS), "customers.customer_id", "orders.customer_id");
    }

    private static SemanticNode plan(SemanticRelation relation) {
        return new JoinPlanner(false).apply(relation.node());
    }

    private static Map<String, SemanticPreAggregate> arms(SemanticNode node) {
        Map<String, SemanticPreAggregate> arms = new LinkedHashMap<>();
        collectArms(node, arms);
        return arms;
    }

    private static void collectArms(SemanticNode node, Map<String, SemanticPreAggregate> arms) {
        if (node instanceof SemanticPreAggregate arm) {
            arms.put(arm.tableName(), arm);
        } else if (node instanceof SemanticAggregate aggregate) {
            collectArms(aggregate.source(), arms);
        } else if (node instanceof SemanticGroupBy groupBy) {
            collectArms(groupBy.source(), arms);
        } else if (node instanceof SemanticFilter filter) {
            collectArms(filter.source(), arms);
        } else if (node instanceof SemanticJoin join) {
            collectArms(join.left(), arms);
            collectArms(join.right(), arms);
        }
    }

    @Nested
    @DisplayName("Arms")
    class Arms {

        @Test
        @DisplayName("Only tables owning measures get an arm")
        void testOwnersOnly() {
            // WHEN
            SemanticNode planned = plan(customersWithOrders().groupBy("customers.country").aggregate("orders.revenue"));

            // THEN
            var aggregate = assertInstanceOf(SemanticAggregate.class, planned);
            assertTrue(aggregate.preAggregated(), "Aggregate should be marked pre-aggregated");
            Map<String, SemanticPreAggregate> arms = arms(planned);
            assertEquals(List.of("orders"), List.copyOf(arms.keySet()));
            assertEquals(List.of("customer_id"), arms.get("orders").grain());
            assertEquals(1, arms.get("orders").partials().size());
        }

        @Test
        @DisplayName("Grain includes join keys, group keys and filtered columns")
        void testGrain() {
            // GIVEN
            var relation = customersWithOrders()
                    .filter("orders.status = 'paid'")
                    .groupBy("customers.country")
                    .aggregate("customers.total_ltv", "orders.avg_amount");

            // WHEN
            Map<String, SemanticPreAggregate> arms = arms(plan(relation));

            // THEN
            assertEquals(List.of("customer_id", "country"), arms.get("customers").grain());
            assertEquals(List.of("customer_id", "status"), arms.get("orders").grain());
            assertEquals(2, arms.get("orders").partials().size(), "AVG should use a sum and a count partial");
        }

        @Test
        @DisplayName("Distinct-count arguments are part of the grain")
        void testCountDistinctGrain() {
            Map<String, SemanticPreAggregate> arms = arms(plan(customersWithOrders().aggregate("orders.buyers")));

            assertEquals(List.of("customer_id"), arms.get("orders").grain());
            assertTrue(arms.get("orders").partials().isEmpty());
        }
    }

    @Nested
    @DisplayName("No rewrite")
    class NoRewrite {

        @Test
        @DisplayName("Single tables are left alone")
        void testSingleTable() {
            SemanticNode node = SemanticRelation.of(ORDERS).groupBy("status").aggregate("revenue").node();

            assertEquals(node, new JoinPlanner(false).apply(node));
        }

        @Test
        @DisplayName("ONE joins with leftmost measures are left alone")
        void testPassThrough() {
            // GIVEN
            SemanticNode node = SemanticRelation.of(ORDERS)
                    .joinOne(SemanticRelation.of(CUSTOMERS), "orders.customer_id", "customers.customer_id")
                    .groupBy("customers.country")
                    .aggregate("orders.revenue")
                    .node();

            // WHEN
            SemanticNode planned = new JoinPlanner(false).apply(node);

            // THEN
            assertEquals(node, planned);
            assertTrue(arms(planned).isEmpty());
        }
    }

    @Nested
    @DisplayName("Undeclared cardinality")
    class Undeclared {

        private final SemanticNode node = SemanticRelation.of(CUSTOMERS)
                .join(SemanticRelation.of(ORDERS), "customers.customer_id", "orders.customer_id")
                .aggregate("customers.total_ltv")
                .node();

        @Test
        @DisplayName("Fails by default, naming the aggregates")
        void testStrict() {
            var error = assertThrows(AmbiguousJoinCardinalityException.class,
                    () -> new JoinPlanner(false).apply(node));
            assertEquals(List.of("customers.total_ltv"), error.aggregates());
        }

        @Test
        @DisplayName("Keeps the raw join when allowed")
        void testPermissive() {
            SemanticNode planned = new JoinPlanner(true).apply(node);

            assertTrue(arms(planned).isEmpty());
            assertFalse(((SemanticAggregate) planned).preAggregated());
        }
    }
}
