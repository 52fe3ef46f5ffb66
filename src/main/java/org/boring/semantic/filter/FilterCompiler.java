package org.boring.semantic.filter;

import org.boring.semantic.model.FieldScope;
import org.boring.semantic.plan.ComparisonExpression;
import org.boring.semantic.plan.ComparisonExpression.ComparisonOperator;
import org.boring.semantic.plan.Expression;
import org.boring.semantic.plan.InExpression;
import org.boring.semantic.plan.LogicalExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles structured filter conditions into predicate builders.
 *
 * Field names are resolved through the {@link FieldScope} the compiled filter is
 * applied to, and each value is converted against the resolved field's type.
 */
public final class FilterCompiler {

    private FilterCompiler() {
    }

    public static CompiledFilter compile(FilterCondition condition) {
        return fields -> build(condition, fields);
    }

    public static CompiledFilter compileRange(String dimension, Object start, Object end) {
        return fields -> {
            Expression target = fields.field(dimension);
            List<Expression> bounds = new ArrayList<>();
            if (start != null) {
                bounds.add(new ComparisonExpression(target, ComparisonOperator.GREATER_THAN_OR_EQUALS,
                        LiteralConverter.convert(start, target)));
            }
            if (end != null) {
                bounds.add(new ComparisonExpression(target, ComparisonOperator.LESS_THAN_OR_EQUALS,
                        LiteralConverter.convert(end, target)));
            }
            return LogicalExpression.and(bounds);
        };
    }

    private static Expression build(FilterCondition condition, FieldScope fields) {
        if (condition instanceof FilterCondition.Comparison comparison) {
            return buildComparison(comparison, fields);
        }
        if (condition instanceof FilterCondition.Compound compound) {
            List<Expression> operands = compound.conditions().stream()
                    .map(c -> build(c, fields))
                    .toList();
            return compound.logic() == FilterCondition.Logic.AND
                    ? LogicalExpression.and(operands)
                    : LogicalExpression.or(operands);
        }
        FilterCondition.Not not = (FilterCondition.Not) condition;
        return LogicalExpression.not(build(not.condition(), fields));
    }

    private static Expression buildComparison(FilterCondition.Comparison comparison, FieldScope fields) {
        Expression target = fields.field(comparison.field());
        return switch (comparison.operator()) {
            case EQUALS -> compare(target, ComparisonOperator.EQUALS, comparison.value());
            case NOT_EQUALS -> compare(target, ComparisonOperator.NOT_EQUALS, comparison.value());
            case GREATER_THAN -> compare(target, ComparisonOperator.GREATER_THAN, comparison.value());
            case GREATER_THAN_OR_EQUALS -> compare(target, ComparisonOperator.GREATER_THAN_OR_EQUALS, comparison.value());
            case LESS_THAN -> compare(target, ComparisonOperator.LESS_THAN, comparison.value());
            case LESS_THAN_OR_EQUALS -> compare(target, ComparisonOperator.LESS_THAN_OR_EQUALS, comparison.value());
            case LIKE -> compare(target, ComparisonOperator.LIKE, comparison.value());
            case NOT_LIKE -> LogicalExpression.not(compare(target, ComparisonOperator.LIKE, comparison.value()));
            case ILIKE -> compare(target, ComparisonOperator.ILIKE, comparison.value());
            case NOT_ILIKE -> LogicalExpression.not(compare(target, ComparisonOperator.ILIKE, comparison.value()));
            case IN -> new InExpression(target, convertAll(comparison.values(), target), false);
            case NOT_IN -> new InExpression(target, convertAll(comparison.values(), target), true);
            case IS_NULL -> ComparisonExpression.isNull(target);
            case IS_NOT_NULL -> ComparisonExpression.isNotNull(target);
        };
    }

    private static Expression compare(Expression target, ComparisonOperator operator, Object value) {
        return new ComparisonExpression(target, operator, LiteralConverter.convert(value, target));
    }

    private static List<Expression> convertAll(List<Object> values, Expression target) {
        List<Expression> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(LiteralConverter.convert(value, target));
        }
        return converted;
    }
}
