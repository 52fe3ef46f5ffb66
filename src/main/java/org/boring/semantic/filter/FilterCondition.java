package org.boring.semantic.filter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * The structured form of a filter: a comparison on one field, or a boolean combination.
 *
 * Wire format (JSON):
 * <pre>
 * { "field": "status", "operator": "in", "values": ["paid", "shipped"] }
 * { "operator": "AND", "conditions": [ ... ] }
 * </pre>
 */
public sealed interface FilterCondition
        permits FilterCondition.Comparison, FilterCondition.Compound, FilterCondition.Not {

    /**
     * {@code field operator value} or {@code field operator (values...)}.
     *
     * @param field    The field name, bare or qualified
     * @param operator The canonical operator
     * @param value    The compared value (scalar operators)
     * @param values   The candidate values (membership operators)
     */
    record Comparison(String field, FilterOperator operator, Object value, List<Object> values)
            implements FilterCondition {

        public Comparison {
            Objects.requireNonNull(field, "Filter field cannot be null");
            Objects.requireNonNull(operator, "Filter operator cannot be null");
            if (operator.isMembership()) {
                if (values == null) {
                    throw new IllegalArgumentException("Operator '" + operator.symbol()
                            + "' on field '" + field + "' requires 'values'");
                }
                values = Collections.unmodifiableList(new ArrayList<>(values));
            } else if (operator.isNullCheck()) {
                if (value != null || values != null) {
                    throw new IllegalArgumentException("Operator '" + operator.symbol()
                            + "' on field '" + field + "' takes no value");
                }
            } else if (value == null) {
                throw new IllegalArgumentException("Operator '" + operator.symbol()
                        + "' on field '" + field + "' requires 'value'");
            }
        }
    }

    /**
     * AND / OR over nested conditions.
     */
    record Compound(Logic logic, List<FilterCondition> conditions) implements FilterCondition {

        public Compound {
            Objects.requireNonNull(logic, "Compound operator cannot be null");
            Objects.requireNonNull(conditions, "Conditions cannot be null");
            if (conditions.isEmpty()) {
                throw new IllegalArgumentException(logic + " requires at least one condition");
            }
            conditions = List.copyOf(conditions);
        }
    }

    /**
     * Negation of a nested condition.
     */
    record Not(FilterCondition condition) implements FilterCondition {

        public Not {
            Objects.requireNonNull(condition, "Negated condition cannot be null");
        }
    }

    enum Logic {
        AND,
        OR;

        public static Logic fromSymbol(String symbol) {
            String normalized = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
            if (normalized.equals("AND")) {
                return AND;
            }
            if (normalized.equals("OR")) {
                return OR;
            }
            throw new UnsupportedOperatorException(String.valueOf(symbol), List.of("AND", "OR"));
        }
    }

    // ==================== Factories ====================

    static FilterCondition compare(String field, String operator, Object value) {
        FilterOperator op = FilterOperator.fromSymbol(operator);
        if (op.isMembership()) {
            if (!(value instanceof List<?> list)) {
                throw new IllegalArgumentException("Operator '" + operator + "' on field '" + field
                        + "' requires a list of values");
            }
            return new Comparison(field, op, null, new ArrayList<>(list));
        }
        return new Comparison(field, op, value, null);
    }

    static FilterCondition in(String field, List<?> values) {
        return new Comparison(field, FilterOperator.IN, null, new ArrayList<>(values));
    }

    static FilterCondition isNull(String field) {
        return new Comparison(field, FilterOperator.IS_NULL, null, null);
    }

    static FilterCondition isNotNull(String field) {
        return new Comparison(field, FilterOperator.IS_NOT_NULL, null, null);
    }

    static FilterCondition and(FilterCondition... conditions) {
        return new Compound(Logic.AND, List.of(conditions));
    }

    static FilterCondition or(FilterCondition... conditions) {
        return new Compound(Logic.OR, List.of(conditions));
    }

    static FilterCondition not(FilterCondition condition) {
        return new Not(condition);
    }
}
