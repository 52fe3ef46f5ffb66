package org.boring.semantic.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The canonical filter operators. Every accepted spelling collapses to one of these.
 */
public enum FilterOperator {
    EQUALS("=", "eq", "equals", "=="),
    NOT_EQUALS("!=", "<>", "ne", "not equals"),
    GREATER_THAN(">", "gt"),
    GREATER_THAN_OR_EQUALS(">=", "gte"),
    LESS_THAN("<", "lt"),
    LESS_THAN_OR_EQUALS("<=", "lte"),
    IN("in"),
    NOT_IN("not in"),
    LIKE("like"),
    NOT_LIKE("not like"),
    ILIKE("ilike"),
    NOT_ILIKE("not ilike"),
    IS_NULL("is null"),
    IS_NOT_NULL("is not null");

    private final List<String> aliases;

    FilterOperator(String... aliases) {
        this.aliases = List.of(aliases);
    }

    /**
     * @return The accepted spellings, canonical one first
     */
    public List<String> aliases() {
        return aliases;
    }

    /**
     * @return The canonical spelling
     */
    public String symbol() {
        return aliases.get(0);
    }

    /**
     * @return true for operators that take a list of values
     */
    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    /**
     * @return true for operators that take no value
     */
    public boolean isNullCheck() {
        return this == IS_NULL || this == IS_NOT_NULL;
    }

    /**
     * Resolves an operator spelling, ignoring case and repeated whitespace.
     *
     * @throws UnsupportedOperatorException if the spelling is unknown
     */
    public static FilterOperator fromSymbol(String symbol) {
        if (symbol == null) {
            throw new UnsupportedOperatorException("null", supportedSymbols());
        }
        String normalized = symbol.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        for (FilterOperator operator : values()) {
            if (operator.aliases.contains(normalized)) {
                return operator;
            }
        }
        throw new UnsupportedOperatorException(symbol, supportedSymbols());
    }

    /**
     * @return Every accepted spelling
     */
    public static List<String> supportedSymbols() {
        List<String> symbols = new ArrayList<>();
        for (FilterOperator operator : values()) {
            symbols.addAll(operator.aliases);
        }
        return symbols;
    }
}
