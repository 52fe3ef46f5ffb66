package org.boring.semantic.filter;

import org.boring.semantic.filter.antlr.AntlrFilterParserAdapter;

import java.util.Objects;

/**
 * A filter as supplied by a caller. Every form compiles to one {@link CompiledFilter}.
 *
 * <ul>
 *   <li>{@link Predicate}: a predicate builder over the fields in scope</li>
 *   <li>{@link Structured}: a {@link FilterCondition} (also the JSON wire format)</li>
 *   <li>{@link Text}: a string such as {@code status in ('paid', 'shipped') and amount > 10}</li>
 *   <li>{@link TimeRange}: inclusive bounds on a time dimension</li>
 * </ul>
 */
public sealed interface Filter permits Filter.Predicate, Filter.Structured, Filter.Text, Filter.TimeRange {

    CompiledFilter compile();

    record Predicate(CompiledFilter predicate) implements Filter {

        public Predicate {
            Objects.requireNonNull(predicate, "Predicate cannot be null");
        }

        @Override
        public CompiledFilter compile() {
            return predicate;
        }
    }

    record Structured(FilterCondition condition) implements Filter {

        public Structured {
            Objects.requireNonNull(condition, "Filter condition cannot be null");
        }

        @Override
        public CompiledFilter compile() {
            return FilterCompiler.compile(condition);
        }
    }

    /**
     * A filter in the string grammar. Parsed on construction so syntax errors surface
     * while the query is being built.
     */
    record Text(String text, FilterCondition condition) implements Filter {

        public Text {
            Objects.requireNonNull(text, "Filter text cannot be null");
            Objects.requireNonNull(condition, "Filter condition cannot be null");
        }

        public Text(String text) {
            this(text, AntlrFilterParserAdapter.parse(text));
        }

        @Override
        public CompiledFilter compile() {
            return FilterCompiler.compile(condition);
        }
    }

    /**
     * {@code dimension >= start AND dimension <= end} on the raw dimension expression.
     * Either bound may be null.
     */
    record TimeRange(String dimension, Object start, Object end) implements Filter {

        public TimeRange {
            Objects.requireNonNull(dimension, "Time dimension cannot be null");
            if (start == null && end == null) {
                throw new IllegalArgumentException("Time range on '" + dimension + "' needs a start or an end");
            }
        }

        @Override
        public CompiledFilter compile() {
            return FilterCompiler.compileRange(dimension, start, end);
        }
    }

    // ==================== Factories ====================

    static Filter predicate(CompiledFilter predicate) {
        return new Predicate(predicate);
    }

    static Filter where(FilterCondition condition) {
        return new Structured(condition);
    }

    static Filter expression(String text) {
        return new Text(text);
    }

    static Filter json(String json) {
        return new Structured(FilterJson.parse(json));
    }

    static Filter timeRange(String dimension, Object start, Object end) {
        return new TimeRange(dimension, start, end);
    }
}
