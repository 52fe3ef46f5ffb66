package org.boring.semantic.planner;

import org.boring.semantic.ir.SemanticAggregate;
import org.boring.semantic.ir.SemanticFilter;
import org.boring.semantic.ir.SemanticGroupBy;
import org.boring.semantic.ir.SemanticJoin;
import org.boring.semantic.ir.SemanticLimit;
import org.boring.semantic.ir.SemanticMutate;
import org.boring.semantic.ir.SemanticNode;
import org.boring.semantic.ir.SemanticNodeVisitor;
import org.boring.semantic.ir.SemanticOrderBy;
import org.boring.semantic.ir.SemanticPreAggregate;
import org.boring.semantic.ir.SemanticProject;
import org.boring.semantic.ir.SemanticSource;

/**
 * Base class for plan rewrite passes: rebuilds every node over its rewritten inputs.
 * Passes override the cases they change.
 */
public abstract class SemanticRewriter implements SemanticNodeVisitor<SemanticNode> {

    public SemanticNode rewrite(SemanticNode node) {
        return node.accept(this);
    }

    @Override
    public SemanticNode visit(SemanticSource source) {
        return source;
    }

    @Override
    public SemanticNode visit(SemanticFilter filter) {
        return new SemanticFilter(rewrite(filter.source()), filter.filter());
    }

    @Override
    public SemanticNode visit(SemanticJoin join) {
        return new SemanticJoin(rewrite(join.left()), rewrite(join.right()), join.on(), join.cardinality(),
                join.how());
    }

    @Override
    public SemanticNode visit(SemanticGroupBy groupBy) {
        return new SemanticGroupBy(rewrite(groupBy.source()), groupBy.keys(), groupBy.timeGrains());
    }

    @Override
    public SemanticNode visit(SemanticAggregate aggregate) {
        return aggregate.withSource(rewrite(aggregate.source()), aggregate.preAggregated());
    }

    @Override
    public SemanticNode visit(SemanticMutate mutate) {
        return new SemanticMutate(rewrite(mutate.source()), mutate.computed());
    }

    @Override
    public SemanticNode visit(SemanticOrderBy orderBy) {
        return new SemanticOrderBy(rewrite(orderBy.source()), orderBy.keys());
    }

    @Override
    public SemanticNode visit(SemanticLimit limit) {
        return new SemanticLimit(rewrite(limit.source()), limit.n(), limit.offset());
    }

    @Override
    public SemanticNode visit(SemanticProject project) {
        return new SemanticProject(rewrite(project.source()), project.fields());
    }

    @Override
    public SemanticNode visit(SemanticPreAggregate preAggregate) {
        return preAggregate;
    }
}
