package org.boring.semantic.transpiler;

import org.boring.semantic.plan.AggregateExpression;
import org.boring.semantic.plan.ColumnReference;
import org.boring.semantic.plan.ComparisonExpression;
import org.boring.semantic.plan.DateTruncExpression;
import org.boring.semantic.plan.FilterNode;
import org.boring.semantic.plan.GroupByNode;
import org.boring.semantic.plan.JoinNode;
import org.boring.semantic.plan.LimitNode;
import org.boring.semantic.plan.Literal;
import org.boring.semantic.plan.ProjectNode;
import org.boring.semantic.plan.Projection;
import org.boring.semantic.plan.SortNode;
import org.boring.semantic.plan.SubqueryNode;
import org.boring.semantic.plan.TableNode;
import org.boring.semantic.store.Column;
import org.boring.semantic.store.SqlDataType;
import org.boring.semantic.store.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rendering relational plans as DuckDB SQL.
 */
class SQLGeneratorTest {

    private static final Table ORDERS = new Table("orders", List.of(
            Column.required("order_id", SqlDataType.INTEGER),
            Column.required("customer_id", SqlDataType.INTEGER),
            Column.required("amount", SqlDataType.INTEGER),
            Column.required("order_date", SqlDataType.DATE)));

    private static final Table CUSTOMERS = new Table("customers", List.of(
            Column.required("customer_id", SqlDataType.INTEGER),
            Column.required("country", SqlDataType.VARCHAR)));

    private final SQLGenerator generator = new SQLGenerator(DuckDBDialect.INSTANCE);

    private static ColumnReference col(String table, String column, SqlDataType type) {
        return ColumnReference.of(table, column, type);
    }

    @Nested
    @DisplayName("Query blocks")
    class QueryBlocks {

        @Test
        @DisplayName("Stacked filters fuse into one WHERE clause")
        void testFilterFusion() {
            // GIVEN
            var orders = new TableNode(ORDERS, "orders");
            var filtered = new FilterNode(
                    new FilterNode(orders, ComparisonExpression.greaterThan(
                            col("orders", "amount", SqlDataType.INTEGER), Literal.integer(100))),
                    ComparisonExpression.lessThan(
                            col("orders", "order_date", SqlDataType.DATE), Literal.date("2024-03-01")));
            var project = ProjectNode.of(filtered, Projection.of(col("orders", "order_id", SqlDataType.INTEGER), "id"));

            // WHEN
            String sql = generator.generate(project);
            System.out.println("SQL: " + sql);

            // THEN
            assertEquals("SELECT \"orders\".\"order_id\" AS \"id\" FROM \"orders\" AS \"orders\""
                    + " WHERE \"orders\".\"amount\" > 100 AND \"orders\".\"order_date\" < DATE '2024-03-01'", sql);
        }

        @Test
        @DisplayName("Group by with a truncated key")
        void testGroupBy() {
            // GIVEN
            var month = new DateTruncExpression(DateTruncExpression.TruncPart.MONTH,
                    col("orders", "order_date", SqlDataType.DATE));
            var groupBy = new GroupByNode(new TableNode(ORDERS, "orders"),
                    List.of(Projection.of(month, "order_date")),
                    List.of(Projection.of(AggregateExpression.sum(col("orders", "amount", SqlDataType.INTEGER)),
                            "revenue")));

            // WHEN
            String sql = generator.generate(groupBy);

            // THEN
            assertEquals("SELECT date_trunc('month', \"orders\".\"order_date\") AS \"order_date\","
                    + " SUM(\"orders\".\"amount\") AS \"revenue\" FROM \"orders\" AS \"orders\""
                    + " GROUP BY date_trunc('month', \"orders\".\"order_date\")", sql);
        }

        @Test
        @DisplayName("Grand totals have no GROUP BY")
        void testGrandTotal() {
            var groupBy = new GroupByNode(new TableNode(ORDERS, "orders"), List.of(),
                    List.of(Projection.of(AggregateExpression.countAll(), "order_count")));

            assertEquals("SELECT COUNT(*) AS \"order_count\" FROM \"orders\" AS \"orders\"",
                    generator.generate(groupBy));
        }

        @Test
        @DisplayName("Pruned scans select only their columns")
        void testPrunedTable() {
            var table = new TableNode(ORDERS, "orders", List.of("order_id", "amount"));

            assertEquals("SELECT * FROM (SELECT \"order_id\", \"amount\" FROM \"orders\") AS \"orders\"",
                    generator.generate(table));
        }
    }

    @Nested
    @DisplayName("Joins and nesting")
    class JoinsAndNesting {

        @Test
        @DisplayName("Join conditions go to ON")
        void testJoin() {
            // GIVEN
            var join = JoinNode.leftOuter(new TableNode(CUSTOMERS, "customers"), new TableNode(ORDERS, "orders"),
                    ComparisonExpression.equals(col("customers", "customer_id", SqlDataType.INTEGER),
                            col("orders", "customer_id", SqlDataType.INTEGER)));

            // WHEN
            String sql = generator.generate(join);

            // THEN
            assertEquals("SELECT * FROM \"customers\" AS \"customers\" LEFT OUTER JOIN \"orders\" AS \"orders\""
                    + " ON \"customers\".\"customer_id\" = \"orders\".\"customer_id\"", sql);
        }

        @Test
        @DisplayName("Non-table sources are nested as subq")
        void testNestedSource() {
            // GIVEN
            var grouped = new SubqueryNode(new GroupByNode(new TableNode(ORDERS, "orders"),
                    List.of(Projection.of(col("orders", "customer_id", SqlDataType.INTEGER), "customer_id")),
                    List.of(Projection.of(AggregateExpression.sum(col("orders", "amount", SqlDataType.INTEGER)),
                            "revenue"))), "per_customer");
            var filtered = new FilterNode(new ProjectNode(grouped, List.of(
                    Projection.of(col("per_customer", "revenue", SqlDataType.BIGINT), "revenue"))),
                    ComparisonExpression.greaterThan(ColumnReference.of("revenue", SqlDataType.BIGINT),
                            Literal.integer(300)));

            // WHEN
            String sql = generator.generate(filtered);

            // THEN
            assertTrue(sql.startsWith("SELECT * FROM (SELECT \"per_customer\".\"revenue\" AS \"revenue\" FROM (SELECT"),
                    sql);
            assertTrue(sql.endsWith(") AS \"subq\" WHERE \"revenue\" > 300"), sql);
        }

        @Test
        @DisplayName("Order and limit append to their source")
        void testSortAndLimit() {
            // GIVEN
            var sorted = new SortNode(new TableNode(ORDERS, "orders"),
                    List.of(SortNode.SortColumn.desc(col("orders", "amount", SqlDataType.INTEGER))));
            var limited = new LimitNode(sorted, 3, 1);

            // WHEN / THEN
            assertEquals("SELECT * FROM \"orders\" AS \"orders\" ORDER BY \"orders\".\"amount\" DESC LIMIT 3 OFFSET 1",
                    generator.generate(limited));
        }
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("Literals are quoted and escaped")
        void testLiterals() {
            assertEquals("'O''Brien'", generator.generateExpression(Literal.string("O'Brien")));
            assertEquals("DATE '2024-01-01'", generator.generateExpression(Literal.date("2024-01-01")));
            assertEquals("TRUE", generator.generateExpression(Literal.bool(true)));
            assertEquals("NULL", generator.generateExpression(Literal.nullValue()));
        }

        @Test
        @DisplayName("Unqualified references render bare")
        void testUnqualifiedColumn() {
            assertEquals("\"orders.revenue\"",
                    generator.generateExpression(ColumnReference.of("orders.revenue", SqlDataType.BIGINT)));
        }

        @Test
        @DisplayName("Null-safe equality for join keys")
        void testNotDistinctFrom() {
            assertEquals("\"__arm0\".\"__key_0\" IS NOT DISTINCT FROM \"__arm1\".\"__key_0\"",
                    generator.generateExpression(ComparisonExpression.notDistinctFrom(
                            col("__arm0", "__key_0", SqlDataType.VARCHAR),
                            col("__arm1", "__key_0", SqlDataType.VARCHAR))));
        }
    }
}
