package org.boring.semantic.planner;

import org.boring.semantic.plan.AggregateExpression;
import org.boring.semantic.plan.ArithmeticExpression;
import org.boring.semantic.plan.ColumnReference;
import org.boring.semantic.plan.ComparisonExpression;
import org.boring.semantic.plan.DateTruncExpression;
import org.boring.semantic.plan.Expression;
import org.boring.semantic.plan.InExpression;
import org.boring.semantic.plan.Literal;
import org.boring.semantic.plan.LogicalExpression;
import org.boring.semantic.plan.SqlFunctionCall;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits an aggregate expression into re-aggregable partials computed inside a join arm
 * and a final expression over those partials.
 *
 * <pre>
 * SUM(x)            partial SUM(x)              final SUM(p)
 * COUNT(x)          partial COUNT(x)            final COALESCE(SUM(p), 0)
 * MIN(x) / MAX(x)   partial MIN(x) / MAX(x)     final MIN(p) / MAX(p)
 * AVG(x)            partials SUM(x), COUNT(x)   final SUM(s) / NULLIF(SUM(c), 0)
 * COUNT(DISTINCT x) no partial (x is part of the grain)
 * </pre>
 *
 * Partials are named {@code <column>__p<i>}, numbered in expression order, so the same
 * input always decomposes the same way.
 */
public final class AggregateDecomposition {

    /**
     * @param partials        Partial aggregates by column name
     * @param finalExpression The aggregate over the partials, qualified with the arm alias
     */
    public record Decomposed(Map<String, AggregateExpression> partials, Expression finalExpression) {

        public Decomposed {
            partials = Collections.unmodifiableMap(new LinkedHashMap<>(partials));
        }
    }

    private final String column;
    private final String armAlias;
    private final Map<String, AggregateExpression> partials = new LinkedHashMap<>();

    private AggregateDecomposition(String column, String armAlias) {
        this.column = column;
        this.armAlias = armAlias;
    }

    public static Decomposed decompose(String column, Expression aggregate, String armAlias) {
        AggregateDecomposition decomposition = new AggregateDecomposition(column, armAlias);
        Expression finalExpression = decomposition.transform(aggregate);
        return new Decomposed(decomposition.partials, finalExpression);
    }

    private Expression transform(Expression expression) {
        if (expression instanceof AggregateExpression aggregate) {
            return decomposeCall(aggregate);
        }
        if (expression instanceof ArithmeticExpression arithmetic) {
            return new ArithmeticExpression(transform(arithmetic.left()), arithmetic.operator(),
                    transform(arithmetic.right()));
        }
        if (expression instanceof SqlFunctionCall call) {
            return new SqlFunctionCall(call.functionName(), transformAll(call.arguments()), call.returnType());
        }
        if (expression instanceof ComparisonExpression comparison) {
            return new ComparisonExpression(transform(comparison.left()), comparison.operator(),
                    comparison.right() == null ? null : transform(comparison.right()));
        }
        if (expression instanceof LogicalExpression logical) {
            return new LogicalExpression(logical.operator(), transformAll(logical.operands()));
        }
        if (expression instanceof InExpression in) {
            return new InExpression(transform(in.operand()), transformAll(in.values()), in.negated());
        }
        if (expression instanceof DateTruncExpression dateTrunc) {
            return new DateTruncExpression(dateTrunc.part(), transform(dateTrunc.argument()));
        }
        return expression;
    }

    private List<Expression> transformAll(List<Expression> expressions) {
        List<Expression> result = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            result.add(transform(expression));
        }
        return result;
    }

    private Expression decomposeCall(AggregateExpression aggregate) {
        return switch (aggregate.function()) {
            case SUM -> AggregateExpression.sum(partial(aggregate));
            case MIN -> AggregateExpression.min(partial(aggregate));
            case MAX -> AggregateExpression.max(partial(aggregate));
            case COUNT -> SqlFunctionCall.coalesce(AggregateExpression.sum(partial(aggregate)), Literal.integer(0));
            case AVG -> {
                ColumnReference sum = partial(AggregateExpression.sum(aggregate.argument()));
                ColumnReference count = partial(AggregateExpression.count(aggregate.argument()));
                yield ArithmeticExpression.divide(
                        AggregateExpression.sum(sum),
                        SqlFunctionCall.nullIf(AggregateExpression.sum(count), Literal.integer(0)));
            }
            case COUNT_DISTINCT -> aggregate;
        };
    }

    private ColumnReference partial(AggregateExpression aggregate) {
        String name = column + "__p" + partials.size();
        partials.put(name, aggregate);
        return ColumnReference.of(armAlias, name, aggregate.type());
    }
}
