package org.boring.semantic.api;

import org.boring.semantic.execution.Backend;
import org.boring.semantic.execution.BufferedResult;
import org.boring.semantic.filter.Filter;
import org.boring.semantic.ir.SortKey;
import org.boring.semantic.model.TimeGrain;
import org.boring.semantic.resolve.FieldResolution;
import org.boring.semantic.resolve.ResolvedField;
import org.boring.semantic.transpiler.LoweringOptions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A query described by parameters rather than built operation by operation.
 *
 * Compiles to: filters (and the time range), then group by the dimensions with the time
 * grain applied to every time dimension among them, then the measures, then ordering
 * and limit. Without dimensions the measures are grand totals; without measures the
 * dimensions yield their distinct values; with neither the filtered rows are returned.
 *
 * Example:
 * <pre>
 * SemanticQuery.on(orders)
 *     .dimensions("order_date")
 *     .measures("revenue")
 *     .timeGrain(TimeGrain.MONTH)
 *     .timeRange("2024-01-01", "2024-06-30")
 *     .build()
 *     .execute(backend);
 * </pre>
 *
 * @param relation   The relation queried
 * @param dimensions Dimension names to group by
 * @param measures   Measure names to aggregate
 * @param filters    Filters applied before grouping
 * @param orderBy    Ordering of the result
 * @param limit      Maximum number of rows, null for all
 * @param timeGrain  Grain for the time dimensions among the dimensions, null for none
 * @param timeStart  Inclusive start of the time range, null for none
 * @param timeEnd    Inclusive end of the time range, null for none
 */
public record SemanticQuery(
        SemanticRelation relation,
        List<String> dimensions,
        List<String> measures,
        List<Filter> filters,
        List<SortKey> orderBy,
        Integer limit,
        TimeGrain timeGrain,
        Object timeStart,
        Object timeEnd) {

    public SemanticQuery {
        Objects.requireNonNull(relation, "Relation cannot be null");
        dimensions = List.copyOf(dimensions);
        measures = List.copyOf(measures);
        filters = List.copyOf(filters);
        orderBy = List.copyOf(orderBy);
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
    }

    public static Builder on(SemanticRelation relation) {
        return new Builder(relation);
    }

    /**
     * Compiles the parameters to a fluent relation.
     *
     * @throws IllegalArgumentException if a time range is requested without a time dimension
     *                                  among the dimensions
     */
    public SemanticRelation toRelation() {
        SemanticRelation result = relation;
        FieldResolution resolution = FieldResolution.of(relation.node());

        if (timeStart != null || timeEnd != null) {
            String timeDimension = firstTimeDimension(resolution).orElseThrow(() -> new IllegalArgumentException(
                    "A time range requires a time dimension among the query dimensions " + dimensions));
            result = result.filter(Filter.timeRange(timeDimension, timeStart, timeEnd));
        }
        for (Filter filter : filters) {
            result = result.filter(filter);
        }

        if (!dimensions.isEmpty()) {
            GroupedRelation grouped = result.groupBy(dimensions.toArray(new String[0]));
            if (timeGrain != null) {
                for (String dimension : dimensions) {
                    if (isTimeDimension(resolution, dimension)) {
                        grouped = grouped.timeGrain(dimension, timeGrain);
                    }
                }
            }
            result = measures.isEmpty()
                    ? grouped.distinct()
                    : grouped.aggregate(measures.toArray(new String[0]));
        } else if (!measures.isEmpty()) {
            result = result.aggregate(measures.toArray(new String[0]));
        }

        if (!orderBy.isEmpty()) {
            result = result.orderBy(orderBy.toArray(new SortKey[0]));
        }
        if (limit != null) {
            result = result.limit(limit);
        }
        return result;
    }

    private Optional<String> firstTimeDimension(FieldResolution resolution) {
        return dimensions.stream().filter(d -> isTimeDimension(resolution, d)).findFirst();
    }

    private static boolean isTimeDimension(FieldResolution resolution, String name) {
        return resolution.findDimension(name)
                .map(ResolvedField::dimension)
                .map(d -> d.timeDimension())
                .orElse(false);
    }

    public String sql() {
        return toRelation().sql();
    }

    public String sql(LoweringOptions options) {
        return toRelation().sql(options);
    }

    public BufferedResult execute(Backend backend) {
        return toRelation().execute(backend);
    }

    public BufferedResult execute(Backend backend, LoweringOptions options) {
        return toRelation().execute(backend, options);
    }

    /**
     * Collects query parameters.
     */
    public static final class Builder {
        private final SemanticRelation relation;
        private final List<String> dimensions = new ArrayList<>();
        private final List<String> measures = new ArrayList<>();
        private final List<Filter> filters = new ArrayList<>();
        private final List<SortKey> orderBy = new ArrayList<>();
        private Integer limit;
        private TimeGrain timeGrain;
        private Object timeStart;
        private Object timeEnd;

        private Builder(SemanticRelation relation) {
            this.relation = Objects.requireNonNull(relation, "Relation cannot be null");
        }

        public Builder dimensions(String... names) {
            dimensions.addAll(Arrays.asList(names));
            return this;
        }

        public Builder measures(String... names) {
            measures.addAll(Arrays.asList(names));
            return this;
        }

        public Builder filter(Filter filter) {
            filters.add(Objects.requireNonNull(filter, "Filter cannot be null"));
            return this;
        }

        /**
         * Adds a filter in the text grammar.
         */
        public Builder filter(String expression) {
            return filter(Filter.expression(expression));
        }

        /**
         * Adds a structured filter in its JSON wire format.
         */
        public Builder filterJson(String json) {
            return filter(Filter.json(json));
        }

        public Builder orderBy(String field, String direction) {
            orderBy.add(SortKey.of(field, direction));
            return this;
        }

        public Builder orderBy(SortKey key) {
            orderBy.add(Objects.requireNonNull(key, "Sort key cannot be null"));
            return this;
        }

        public Builder limit(int n) {
            this.limit = n;
            return this;
        }

        public Builder timeGrain(TimeGrain grain) {
            this.timeGrain = grain;
            return this;
        }

        /**
         * Parses a grain name such as {@code "month"} or {@code "TIME_GRAIN_MONTH"}.
         */
        public Builder timeGrain(String grain) {
            return timeGrain(TimeGrain.parse(grain));
        }

        /**
         * Restricts the first time dimension among the dimensions to an inclusive range.
         */
        public Builder timeRange(Object start, Object end) {
            this.timeStart = start;
            this.timeEnd = end;
            return this;
        }

        public SemanticQuery build() {
            return new SemanticQuery(relation, dimensions, measures, filters, orderBy, limit, timeGrain,
                    timeStart, timeEnd);
        }
    }
}
