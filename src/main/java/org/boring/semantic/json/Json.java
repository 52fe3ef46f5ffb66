package org.boring.semantic.json;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON for filter conditions and query results.
 *
 * Parsed values are {@code Map<String, Object>} (insertion ordered), {@code List<Object>},
 * {@code String}, {@code Boolean}, {@code null} and numbers typed the way filter literals are:
 * integers as {@code Long} ({@code BigInteger} beyond its range), anything with a fraction or
 * exponent as {@code BigDecimal}. No number is read through {@code double}, so identifiers
 * survive a round trip exactly.
 */
public final class Json {

    private Json() {
    }

    /**
     * @throws IllegalArgumentException if the text is not a single well-formed JSON value
     */
    public static Object parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("JSON text is empty");
        }
        Reader reader = new Reader(text);
        Object value = reader.value();
        reader.skipWhitespace();
        if (!reader.atEnd()) {
            throw reader.error("unexpected trailing content");
        }
        return value;
    }

    /**
     * Writes maps as objects, collections as arrays, numbers and booleans as themselves,
     * dates and timestamps as ISO strings, and anything else as its string form.
     * Non-finite floating point values become {@code null}.
     */
    public static String toJson(Object value) {
        StringBuilder out = new StringBuilder();
        write(out, value);
        return out.toString();
    }

    // ==================== Writing ====================

    private static void write(StringBuilder out, Object value) {
        if (value == null) {
            out.append("null");
        } else if (value instanceof Boolean || value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
            out.append(value);
        } else if (value instanceof BigDecimal decimal) {
            out.append(decimal.toPlainString());
        } else if (value instanceof Number number) {
            double d = number.doubleValue();
            out.append(Double.isFinite(d) ? number.toString() : "null");
        } else if (value instanceof Map<?, ?> map) {
            out.append('{');
            String separator = "";
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.append(separator);
                quote(out, String.valueOf(entry.getKey()));
                out.append(':');
                write(out, entry.getValue());
                separator = ",";
            }
            out.append('}');
        } else if (value instanceof Collection<?> items) {
            out.append('[');
            String separator = "";
            for (Object item : items) {
                out.append(separator);
                write(out, item);
                separator = ",";
            }
            out.append(']');
        } else if (value instanceof java.sql.Date date) {
            quote(out, date.toLocalDate().toString());
        } else if (value instanceof java.sql.Timestamp timestamp) {
            quote(out, timestamp.toLocalDateTime().toString());
        } else {
            quote(out, value.toString());
        }
    }

    private static void quote(StringBuilder out, String text) {
        out.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    // ==================== Reading ====================

    private static final class Reader {
        private final String text;
        private int pos;

        Reader(String text) {
            this.text = text;
        }

        Object value() {
            skipWhitespace();
            if (atEnd()) {
                throw error("unexpected end of input");
            }
            char c = text.charAt(pos);
            if (c == '{') {
                return object();
            }
            if (c == '[') {
                return array();
            }
            if (c == '"') {
                return string();
            }
            if (c == '-' || Character.isDigit(c)) {
                return number();
            }
            if (consume("true")) {
                return Boolean.TRUE;
            }
            if (consume("false")) {
                return Boolean.FALSE;
            }
            if (consume("null")) {
                return null;
            }
            throw error("unexpected character '" + c + "'");
        }

        private Map<String, Object> object() {
            Map<String, Object> members = new LinkedHashMap<>();
            pos++;
            if (closes('}')) {
                return members;
            }
            do {
                skipWhitespace();
                if (atEnd() || text.charAt(pos) != '"') {
                    throw error("expected a member name");
                }
                String name = string();
                skipWhitespace();
                require(':');
                members.put(name, value());
            } while (separated('}'));
            return members;
        }

        private List<Object> array() {
            List<Object> items = new ArrayList<>();
            pos++;
            if (closes(']')) {
                return items;
            }
            do {
                items.add(value());
            } while (separated(']'));
            return items;
        }

        private String string() {
            StringBuilder value = new StringBuilder();
            pos++;
            while (!atEnd()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return value.toString();
                }
                if (c != '\\') {
                    value.append(c);
                    continue;
                }
                if (atEnd()) {
                    break;
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case 'b' -> value.append('\b');
                    case 'f' -> value.append('\f');
                    case 'u' -> {
                        if (pos + 4 > text.length()) {
                            throw error("truncated unicode escape");
                        }
                        try {
                            value.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("Invalid unicode escape at position " + pos, e);
                        }
                        pos += 4;
                    }
                    default -> value.append(escaped);
                }
            }
            throw error("unterminated string");
        }

        private Number number() {
            int start = pos;
            if (text.charAt(pos) == '-') {
                pos++;
            }
            digits();
            boolean integral = true;
            if (!atEnd() && text.charAt(pos) == '.') {
                integral = false;
                pos++;
                digits();
            }
            if (!atEnd() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
                integral = false;
                pos++;
                if (!atEnd() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                    pos++;
                }
                digits();
            }
            String literal = text.substring(start, pos);
            try {
                if (!integral) {
                    return new BigDecimal(literal);
                }
                BigInteger value = new BigInteger(literal);
                if (value.bitLength() < Long.SIZE) {
                    return value.longValue();
                }
                return value;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number '" + literal + "' at position " + start, e);
            }
        }

        private void digits() {
            while (!atEnd() && Character.isDigit(text.charAt(pos))) {
                pos++;
            }
        }

        /**
         * Consumes the closing character of an empty object or array.
         */
        private boolean closes(char close) {
            skipWhitespace();
            if (!atEnd() && text.charAt(pos) == close) {
                pos++;
                return true;
            }
            return false;
        }

        /**
         * @return true after a ',' between members, false after the closing character
         */
        private boolean separated(char close) {
            skipWhitespace();
            if (atEnd()) {
                throw error("expected ',' or '" + close + "'");
            }
            char c = text.charAt(pos++);
            if (c == ',') {
                return true;
            }
            if (c == close) {
                return false;
            }
            throw error("expected ',' or '" + close + "'");
        }

        private boolean consume(String word) {
            if (text.startsWith(word, pos)) {
                pos += word.length();
                return true;
            }
            return false;
        }

        private void require(char expected) {
            if (atEnd() || text.charAt(pos) != expected) {
                throw error("expected '" + expected + "'");
            }
            pos++;
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        IllegalArgumentException error(String message) {
            return new IllegalArgumentException("Malformed JSON at position " + pos + ": " + message);
        }
    }
}
