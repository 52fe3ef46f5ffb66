package org.boring.semantic.ir;

/**
 * Visitor interface for traversing SemanticNode trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface SemanticNodeVisitor<T> {

    T visit(SemanticSource source);

    T visit(SemanticFilter filter);

    T visit(SemanticJoin join);

    T visit(SemanticGroupBy groupBy);

    T visit(SemanticAggregate aggregate);

    T visit(SemanticMutate mutate);

    T visit(SemanticOrderBy orderBy);

    T visit(SemanticLimit limit);

    T visit(SemanticProject project);

    T visit(SemanticPreAggregate preAggregate);
}
