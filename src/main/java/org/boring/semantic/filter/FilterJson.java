package org.boring.semantic.filter;

import org.boring.semantic.json.Json;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the structured filter wire format.
 *
 * <pre>
 * { "field": "customers.country", "operator": "=", "value": "US" }
 * { "field": "status", "operator": "in", "values": ["paid", "shipped"] }
 * { "operator": "AND", "conditions": [ ... ] }
 * { "operator": "NOT", "condition": { ... } }
 * </pre>
 */
public final class FilterJson {

    private FilterJson() {
    }

    /**
     * @throws FilterParseException if the text is not JSON or not a filter object
     * @throws UnsupportedOperatorException if an operator is unknown
     */
    public static FilterCondition parse(String json) {
        Object parsed;
        try {
            parsed = Json.parse(json);
        } catch (IllegalArgumentException e) {
            throw new FilterParseException("Malformed filter JSON: " + e.getMessage(), e);
        }
        return fromValue(parsed);
    }

    /**
     * Builds a condition from an already-parsed JSON value (nested maps and lists).
     */
    public static FilterCondition fromValue(Object value) {
        if (!(value instanceof Map<?, ?> object)) {
            throw new FilterParseException("Filter must be a JSON object, got: " + Json.toJson(value));
        }
        Object operator = object.get("operator");
        if (!(operator instanceof String op)) {
            throw new FilterParseException("Filter is missing a string 'operator': " + Json.toJson(value));
        }

        if (object.containsKey("conditions")) {
            if (!(object.get("conditions") instanceof List<?> nested)) {
                throw new FilterParseException("'conditions' must be an array");
            }
            List<FilterCondition> conditions = new ArrayList<>();
            for (Object item : nested) {
                conditions.add(fromValue(item));
            }
            return new FilterCondition.Compound(FilterCondition.Logic.fromSymbol(op), conditions);
        }
        if (op.equalsIgnoreCase("not") && object.containsKey("condition")) {
            return new FilterCondition.Not(fromValue(object.get("condition")));
        }

        if (!(object.get("field") instanceof String field)) {
            throw new FilterParseException("Filter is missing a string 'field': " + Json.toJson(value));
        }
        FilterOperator filterOperator = FilterOperator.fromSymbol(op);
        if (filterOperator.isMembership()) {
            Object values = object.get("values");
            if (values != null && !(values instanceof List<?>)) {
                throw new FilterParseException("'values' must be an array for operator '" + op + "'");
            }
            return new FilterCondition.Comparison(field, filterOperator, null,
                    values == null ? null : new ArrayList<>((List<?>) values));
        }
        return new FilterCondition.Comparison(field, filterOperator, object.get("value"), null);
    }

    public static String toJson(FilterCondition condition) {
        return Json.toJson(toValue(condition));
    }

    private static Map<String, Object> toValue(FilterCondition condition) {
        Map<String, Object> object = new LinkedHashMap<>();
        if (condition instanceof FilterCondition.Comparison comparison) {
            object.put("field", comparison.field());
            object.put("operator", comparison.operator().symbol());
            if (comparison.operator().isMembership()) {
                object.put("values", comparison.values());
            } else if (!comparison.operator().isNullCheck()) {
                object.put("value", comparison.value());
            }
        } else if (condition instanceof FilterCondition.Compound compound) {
            object.put("operator", compound.logic().name());
            object.put("conditions", compound.conditions().stream().map(FilterJson::toValue).toList());
        } else {
            object.put("operator", "NOT");
            object.put("condition", toValue(((FilterCondition.Not) condition).condition()));
        }
        return object;
    }
}
