package org.boring.semantic.api;

import org.boring.semantic.ir.AggregateSpec;
import org.boring.semantic.ir.SemanticAggregate;
import org.boring.semantic.ir.SemanticGroupBy;
import org.boring.semantic.ir.SemanticNode;
import org.boring.semantic.model.TimeGrain;
import org.boring.semantic.planner.TimeDimensionPass;
import org.boring.semantic.resolve.FieldResolution;
import org.boring.semantic.resolve.ResolvedField;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A relation grouped by dimension keys, waiting for its aggregates.
 */
public final class GroupedRelation {

    private final SemanticNode source;
    private final List<String> keys;
    private final Map<String, TimeGrain> timeGrains;

    GroupedRelation(SemanticNode source, List<String> keys, Map<String, TimeGrain> timeGrains) {
        this.source = source;
        this.keys = List.copyOf(keys);
        this.timeGrains = Collections.unmodifiableMap(new LinkedHashMap<>(timeGrains));
    }

    /**
     * Groups a time dimension key at a coarser grain.
     *
     * @throws IllegalArgumentException if the key is not a grouped time dimension
     * @throws org.boring.semantic.model.GrainTooFineException if the grain is finer than the
     *         dimension supports
     */
    public GroupedRelation timeGrain(String key, TimeGrain grain) {
        if (!keys.contains(key)) {
            throw new IllegalArgumentException("'" + key + "' is not a group by key: " + keys);
        }
        ResolvedField dimension = FieldResolution.of(source).findDimension(key)
                .orElseThrow(() -> new IllegalArgumentException("Time grain '" + grain + "' requested for '" + key
                        + "', which is not a dimension"));
        TimeDimensionPass.validateGrain(key, dimension.dimension(), grain);
        Map<String, TimeGrain> grains = new LinkedHashMap<>(timeGrains);
        grains.put(key, grain);
        return new GroupedRelation(source, keys, grains);
    }

    /**
     * Aggregates declared measures per group, each output under the name it is requested by.
     */
    public SemanticRelation aggregate(String... measures) {
        return aggregate(SemanticRelation.measureSpecs(measures));
    }

    public SemanticRelation aggregate(Map<String, AggregateSpec> aggregates) {
        return new SemanticRelation(new SemanticAggregate(groupBy(), aggregates));
    }

    /**
     * @return The distinct key values, without aggregates
     */
    public SemanticRelation distinct() {
        return new SemanticRelation(groupBy());
    }

    private SemanticGroupBy groupBy() {
        return new SemanticGroupBy(source, keys, timeGrains);
    }
}
