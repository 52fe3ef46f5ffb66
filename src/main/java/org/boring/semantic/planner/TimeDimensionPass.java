package org.boring.semantic.planner;

import org.boring.semantic.ir.SemanticGroupBy;
import org.boring.semantic.ir.SemanticNode;
import org.boring.semantic.model.Dimension;
import org.boring.semantic.model.GrainTooFineException;
import org.boring.semantic.model.TimeGrain;
import org.boring.semantic.resolve.FieldResolution;
import org.boring.semantic.resolve.ResolvedField;

import java.util.Map;
import java.util.Optional;

/**
 * Validates the time grains requested on group-by keys.
 *
 * The grain must be applied to a time dimension and be no finer than the dimension's
 * smallest declared grain. Truncation itself happens when the group-by is lowered.
 */
public final class TimeDimensionPass extends SemanticRewriter {

    public static SemanticNode apply(SemanticNode node) {
        return new TimeDimensionPass().rewrite(node);
    }

    @Override
    public SemanticNode visit(SemanticGroupBy groupBy) {
        SemanticNode source = rewrite(groupBy.source());
        if (!groupBy.timeGrains().isEmpty()) {
            FieldResolution resolution = FieldResolution.of(source);
            for (Map.Entry<String, TimeGrain> entry : groupBy.timeGrains().entrySet()) {
                Optional<ResolvedField> dimension = resolution.findDimension(entry.getKey());
                if (dimension.isEmpty()) {
                    throw new IllegalArgumentException("Time grain '" + entry.getValue()
                            + "' requested for '" + entry.getKey() + "', which is not a dimension");
                }
                validateGrain(entry.getKey(), dimension.get().dimension(), entry.getValue());
            }
        }
        return new SemanticGroupBy(source, groupBy.keys(), groupBy.timeGrains());
    }

    /**
     * @throws IllegalArgumentException if the dimension is not a time dimension
     * @throws GrainTooFineException    if the grain is finer than the dimension supports
     */
    public static void validateGrain(String key, Dimension dimension, TimeGrain grain) {
        if (!dimension.timeDimension()) {
            throw new IllegalArgumentException("Time grain '" + grain + "' requested for '" + key
                    + "', which is not a time dimension");
        }
        TimeGrain smallest = dimension.smallestTimeGrain();
        if (smallest != null && grain.isFinerThan(smallest)) {
            throw new GrainTooFineException(key, grain, smallest);
        }
    }
}
