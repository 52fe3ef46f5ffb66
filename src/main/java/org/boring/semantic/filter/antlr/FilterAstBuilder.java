package org.boring.semantic.filter.antlr;

import org.boring.semantic.filter.FilterCondition;
import org.boring.semantic.filter.FilterOperator;
import org.boring.semantic.filter.FilterParseException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link FilterCondition}s from the filter expression parse tree.
 */
class FilterAstBuilder extends FilterExpressionBaseVisitor<FilterCondition> {

    @Override
    public FilterCondition visitFilter(FilterExpressionParser.FilterContext ctx) {
        return visit(ctx.orExpression());
    }

    @Override
    public FilterCondition visitOrExpression(FilterExpressionParser.OrExpressionContext ctx) {
        if (ctx.andExpression().size() == 1) {
            return visit(ctx.andExpression(0));
        }
        List<FilterCondition> operands = new ArrayList<>();
        for (FilterExpressionParser.AndExpressionContext operand : ctx.andExpression()) {
            operands.add(visit(operand));
        }
        return new FilterCondition.Compound(FilterCondition.Logic.OR, operands);
    }

    @Override
    public FilterCondition visitAndExpression(FilterExpressionParser.AndExpressionContext ctx) {
        if (ctx.notExpression().size() == 1) {
            return visit(ctx.notExpression(0));
        }
        List<FilterCondition> operands = new ArrayList<>();
        for (FilterExpressionParser.NotExpressionContext operand : ctx.notExpression()) {
            operands.add(visit(operand));
        }
        return new FilterCondition.Compound(FilterCondition.Logic.AND, operands);
    }

    @Override
    public FilterCondition visitNotExpression(FilterExpressionParser.NotExpressionContext ctx) {
        if (ctx.NOT() != null) {
            return new FilterCondition.Not(visit(ctx.notExpression()));
        }
        return visit(ctx.primary());
    }

    @Override
    public FilterCondition visitPrimary(FilterExpressionParser.PrimaryContext ctx) {
        if (ctx.orExpression() != null) {
            return visit(ctx.orExpression());
        }
        return visit(ctx.predicate());
    }

    @Override
    public FilterCondition visitNullPredicate(FilterExpressionParser.NullPredicateContext ctx) {
        FilterOperator operator = ctx.NOT() != null ? FilterOperator.IS_NOT_NULL : FilterOperator.IS_NULL;
        return new FilterCondition.Comparison(ctx.field().getText(), operator, null, null);
    }

    @Override
    public FilterCondition visitInPredicate(FilterExpressionParser.InPredicateContext ctx) {
        List<Object> values = new ArrayList<>();
        for (FilterExpressionParser.LiteralContext literal : ctx.literal()) {
            values.add(literalValue(literal));
        }
        FilterOperator operator = ctx.NOT() != null ? FilterOperator.NOT_IN : FilterOperator.IN;
        return new FilterCondition.Comparison(ctx.field().getText(), operator, null, values);
    }

    @Override
    public FilterCondition visitComparisonPredicate(FilterExpressionParser.ComparisonPredicateContext ctx) {
        FilterExpressionParser.ComparisonOperatorContext op = ctx.comparisonOperator();
        String symbol = op.SYMBOL_OP() != null
                ? op.SYMBOL_OP().getText()
                : (op.NOT() != null ? "not " : "") + op.IDENTIFIER().getText();
        FilterOperator operator = FilterOperator.fromSymbol(symbol);
        if (operator.isMembership() || operator.isNullCheck()) {
            throw new FilterParseException(
                    "Operator '" + symbol + "' cannot take a single value in '" + ctx.getText() + "'");
        }
        return new FilterCondition.Comparison(ctx.field().getText(), operator, literalValue(ctx.literal()), null);
    }

    private static Object literalValue(FilterExpressionParser.LiteralContext ctx) {
        if (ctx.STRING() != null) {
            String raw = ctx.STRING().getText();
            char quote = raw.charAt(0);
            String body = raw.substring(1, raw.length() - 1);
            return body.replace(String.valueOf(quote) + quote, String.valueOf(quote));
        }
        if (ctx.NUMBER() != null) {
            String number = ctx.NUMBER().getText();
            if (number.contains(".")) {
                return new BigDecimal(number);
            }
            return Long.parseLong(number);
        }
        return ctx.TRUE() != null;
    }
}
