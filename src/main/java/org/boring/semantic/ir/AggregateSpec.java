package org.boring.semantic.ir;

import org.boring.semantic.model.MeasureExpr;
import org.boring.semantic.plan.AggregateExpression.AggregateFunction;

import java.util.Objects;

/**
 * One requested aggregate of a {@link SemanticAggregate}.
 */
public sealed interface AggregateSpec
        permits AggregateSpec.MeasureRef, AggregateSpec.Calculated, AggregateSpec.FieldAggregate {

    /**
     * A declared measure, by bare or qualified name.
     */
    record MeasureRef(String measure) implements AggregateSpec {
        public MeasureRef {
            Objects.requireNonNull(measure, "Measure name cannot be null");
        }
    }

    /**
     * An inline calculated measure over other measures.
     */
    record Calculated(MeasureExpr expr) implements AggregateSpec {
        public Calculated {
            Objects.requireNonNull(expr, "Measure expression cannot be null");
        }
    }

    /**
     * An inline aggregation of a field; a null field with COUNT counts rows.
     */
    record FieldAggregate(AggregateFunction function, String field) implements AggregateSpec {
        public FieldAggregate {
            Objects.requireNonNull(function, "Aggregate function cannot be null");
            if (field == null && function != AggregateFunction.COUNT) {
                throw new IllegalArgumentException(function + " requires a field");
            }
        }
    }

    static AggregateSpec measure(String name) {
        return new MeasureRef(name);
    }

    static AggregateSpec calculated(MeasureExpr expr) {
        return new Calculated(expr);
    }

    static AggregateSpec sum(String field) {
        return new FieldAggregate(AggregateFunction.SUM, field);
    }

    static AggregateSpec avg(String field) {
        return new FieldAggregate(AggregateFunction.AVG, field);
    }

    static AggregateSpec min(String field) {
        return new FieldAggregate(AggregateFunction.MIN, field);
    }

    static AggregateSpec max(String field) {
        return new FieldAggregate(AggregateFunction.MAX, field);
    }

    static AggregateSpec count() {
        return new FieldAggregate(AggregateFunction.COUNT, null);
    }

    static AggregateSpec countDistinct(String field) {
        return new FieldAggregate(AggregateFunction.COUNT_DISTINCT, field);
    }
}
