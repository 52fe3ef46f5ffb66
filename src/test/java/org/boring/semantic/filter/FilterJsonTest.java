package org.boring.semantic.filter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterJsonTest {

    @Test
    @DisplayName("Parses nested compound filters")
    void testNested() {
        // GIVEN
        String json = """
                {"operator": "or", "conditions": [
                    {"field": "status", "operator": "in", "values": ["paid", "pending"]},
                    {"operator": "NOT", "condition": {"field": "amount", "operator": "lt", "value": 100}}
                ]}""";

        // WHEN
        FilterCondition condition = FilterJson.parse(json);

        // THEN
        var or = assertInstanceOf(FilterCondition.Compound.class, condition);
        assertEquals(FilterCondition.Logic.OR, or.logic());
        var in = assertInstanceOf(FilterCondition.Comparison.class, or.conditions().get(0));
        assertEquals(FilterOperator.IN, in.operator());
        assertEquals(List.of("paid", "pending"), in.values());
        var not = assertInstanceOf(FilterCondition.Not.class, or.conditions().get(1));
        var lt = assertInstanceOf(FilterCondition.Comparison.class, not.condition());
        assertEquals(FilterOperator.LESS_THAN, lt.operator());
    }

    @Test
    @DisplayName("Writes the canonical wire format")
    void testToJson() {
        // GIVEN
        FilterCondition condition = FilterCondition.and(
                FilterCondition.compare("status", "eq", "paid"),
                FilterCondition.isNull("region"));

        // WHEN
        String json = FilterJson.toJson(condition);

        // THEN
        assertEquals("{\"operator\":\"AND\",\"conditions\":["
                + "{\"field\":\"status\",\"operator\":\"=\",\"value\":\"paid\"},"
                + "{\"field\":\"region\",\"operator\":\"is null\"}]}", json);
        assertEquals(condition, FilterJson.parse(json));
    }

    @Test
    @DisplayName("Integer values stay exact integers")
    void testIntegerValues() {
        // GIVEN: 2^53 + 1 has no exact double
        String json = "{\"field\": \"order_id\", \"operator\": \"=\", \"value\": 9007199254740993}";

        // WHEN
        var id = assertInstanceOf(FilterCondition.Comparison.class, FilterJson.parse(json));
        var amount = assertInstanceOf(FilterCondition.Comparison.class,
                FilterJson.parse("{\"field\": \"amount\", \"operator\": \">=\", \"value\": 100}"));

        // THEN
        assertEquals(9007199254740993L, id.value());
        assertEquals(100L, amount.value());
        assertEquals(json.replace(" ", ""), FilterJson.toJson(id));
    }

    @Test
    @DisplayName("Decimals parse as BigDecimal and integers beyond long as BigInteger")
    void testWideNumbers() {
        // WHEN
        var decimal = assertInstanceOf(FilterCondition.Comparison.class,
                FilterJson.parse("{\"field\": \"amount\", \"operator\": \"<\", \"value\": 12.50}"));
        var huge = assertInstanceOf(FilterCondition.Comparison.class,
                FilterJson.parse("{\"field\": \"id\", \"operator\": \"in\", \"values\": [1, 123456789012345678901]}"));

        // THEN
        assertEquals(new BigDecimal("12.50"), decimal.value());
        assertEquals(List.of(1L, new BigInteger("123456789012345678901")), huge.values());
    }

    @Test
    @DisplayName("Rejects malformed filters")
    void testErrors() {
        assertThrows(FilterParseException.class, () -> FilterJson.parse("{\"field\": "));
        assertThrows(FilterParseException.class, () -> FilterJson.parse("[1, 2]"));
        assertThrows(FilterParseException.class, () -> FilterJson.parse("{\"field\": \"status\"}"));
        assertThrows(FilterParseException.class,
                () -> FilterJson.parse("{\"operator\": \"=\", \"value\": 1}"));
        assertThrows(IllegalArgumentException.class,
                () -> FilterJson.parse("{\"field\": \"status\", \"operator\": \"in\"}"));
        assertThrows(UnsupportedOperatorException.class,
                () -> FilterJson.parse("{\"field\": \"status\", \"operator\": \"~=\", \"value\": 1}"));
        assertThrows(UnsupportedOperatorException.class,
                () -> FilterJson.parse("{\"operator\": \"XOR\", \"conditions\": []}"));
    }
}
