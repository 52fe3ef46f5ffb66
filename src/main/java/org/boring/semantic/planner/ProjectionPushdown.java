package org.boring.semantic.planner;

import org.boring.semantic.ir.SemanticFilter;
import org.boring.semantic.ir.SemanticJoin;
import org.boring.semantic.ir.SemanticLimit;
import org.boring.semantic.ir.SemanticNode;
import org.boring.semantic.ir.SemanticOrderBy;
import org.boring.semantic.ir.SemanticPreAggregate;
import org.boring.semantic.ir.SemanticSource;
import org.boring.semantic.plan.ColumnCollector;
import org.boring.semantic.plan.RelationNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Restricts every table scan to the columns the query actually reads.
 *
 * The plan is lowered once without pruning; every column reference qualified with a
 * table's alias in that relational plan (group keys, filters, order keys, join keys,
 * projected dimensions, base measures, including those reached through calculated
 * measures) is a column the scan must keep. Pruning never changes which rows survive.
 */
public final class ProjectionPushdown {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectionPushdown.class);

    private ProjectionPushdown() {
    }

    /**
     * @param node     The rewritten plan
     * @param lowering Lowers a plan to its relational form, without pruning
     * @return The plan with pruned sources
     */
    public static SemanticNode apply(SemanticNode node, Function<SemanticNode, RelationNode> lowering) {
        if (selectsAllColumns(node)) {
            LOGGER.debug("Plan returns raw rows: no projection pushdown");
            return node;
        }
        Map<String, Set<String>> referenced = ColumnCollector.collect(lowering.apply(node));
        return new Pruner(referenced).rewrite(node);
    }

    /**
     * A plan without grouping or projection returns every column of its tables.
     */
    private static boolean selectsAllColumns(SemanticNode node) {
        if (node instanceof SemanticSource || node instanceof SemanticPreAggregate) {
            return true;
        }
        if (node instanceof SemanticFilter filter) {
            return selectsAllColumns(filter.source());
        }
        if (node instanceof SemanticOrderBy orderBy) {
            return selectsAllColumns(orderBy.source());
        }
        if (node instanceof SemanticLimit limit) {
            return selectsAllColumns(limit.source());
        }
        return node instanceof SemanticJoin;
    }

    private static final class Pruner extends SemanticRewriter {
        private final Map<String, Set<String>> referenced;

        Pruner(Map<String, Set<String>> referenced) {
            this.referenced = referenced;
        }

        @Override
        public SemanticNode visit(SemanticSource source) {
            String table = source.table().name();
            Set<String> used = referenced.getOrDefault(table, Set.of());
            List<String> columns = new ArrayList<>();
            for (String column : source.table().source().columnNames()) {
                if (used.contains(column)) {
                    columns.add(column);
                }
            }
            if (columns.isEmpty()) {
                // COUNT(*) alone still needs one column to scan
                columns.add(source.table().source().columnNames().get(0));
            }
            LOGGER.debug("Pushing down columns {} for '{}'", columns, table);
            return source.withColumns(columns);
        }

        @Override
        public SemanticNode visit(SemanticPreAggregate preAggregate) {
            return preAggregate.withSource((SemanticSource) visit(preAggregate.source()));
        }
    }
}
