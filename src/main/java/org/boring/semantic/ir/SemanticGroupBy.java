package org.boring.semantic.ir;

import org.boring.semantic.model.TimeGrain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups by dimension keys. Followed by a {@link SemanticAggregate}, it sets the grain of the
 * aggregation; on its own it yields the distinct key values.
 *
 * @param source     The grouped relation
 * @param keys       Dimension names, bare or qualified, in output order
 * @param timeGrains Grains requested for time dimension keys, by key
 */
public record SemanticGroupBy(
        SemanticNode source,
        List<String> keys,
        Map<String, TimeGrain> timeGrains) implements SemanticNode {

    public SemanticGroupBy {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(keys, "Keys cannot be null");
        Objects.requireNonNull(timeGrains, "Time grains cannot be null");
        keys = List.copyOf(keys);
        for (String key : timeGrains.keySet()) {
            if (!keys.contains(key)) {
                throw new IllegalArgumentException("Time grain requested for '" + key
                        + "' which is not a group by key: " + keys);
            }
        }
        timeGrains = Collections.unmodifiableMap(new LinkedHashMap<>(timeGrains));
    }

    public SemanticGroupBy(SemanticNode source, List<String> keys) {
        this(source, keys, Map.of());
    }

    @Override
    public <T> T accept(SemanticNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "GroupBy(" + keys + (timeGrains.isEmpty() ? "" : " " + timeGrains) + ", " + source + ")";
    }
}
