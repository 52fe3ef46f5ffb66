package org.boring.semantic.model;

import org.boring.semantic.store.Table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named relation with its reusable vocabulary of dimensions and measures.
 *
 * Semantic tables are immutable: every builder method returns a new table, so one table
 * can be shared by any number of queries.
 *
 * @param name        The semantic name, used to qualify fields after joins
 * @param source      The external relation the table reads from
 * @param dimensions  Dimensions by name, in declaration order
 * @param measures    Measures by name, in declaration order
 * @param primaryKey  The primary key column, null when undeclared
 * @param description Free-form documentation, never null
 */
public record SemanticTable(
        String name,
        Table source,
        Map<String, Dimension> dimensions,
        Map<String, Measure> measures,
        String primaryKey,
        String description) {

    public SemanticTable {
        Objects.requireNonNull(name, "Semantic table name cannot be null");
        Objects.requireNonNull(source, "Source table cannot be null");
        Objects.requireNonNull(dimensions, "Dimensions cannot be null");
        Objects.requireNonNull(measures, "Measures cannot be null");
        if (name.isBlank() || name.contains(".")) {
            throw new IllegalArgumentException("Invalid semantic table name '" + name + "': must be non-blank without '.'");
        }
        if (primaryKey != null) {
            source.column(primaryKey);
        }
        dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        measures = Collections.unmodifiableMap(new LinkedHashMap<>(measures));
        description = description == null ? "" : description;
    }

    /**
     * Creates an empty semantic table over a source table, named after it.
     */
    public static SemanticTable from(Table source) {
        return of(source.name(), source);
    }

    /**
     * Creates an empty semantic table over a source table.
     */
    public static SemanticTable of(String name, Table source) {
        return new SemanticTable(name, source, Map.of(), Map.of(), null, "");
    }

    // ==================== Builders ====================

    public SemanticTable withDimensions(Dimension... newDimensions) {
        return withDimensions(List.of(newDimensions), false);
    }

    /**
     * Adds dimensions.
     *
     * @param allowOverride Whether an existing dimension of the same name may be replaced
     * @throws DuplicateFieldException if a name is already taken
     */
    public SemanticTable withDimensions(List<Dimension> newDimensions, boolean allowOverride) {
        Map<String, Dimension> merged = new LinkedHashMap<>(dimensions);
        List<String> added = new ArrayList<>();
        for (Dimension dimension : newDimensions) {
            String fieldName = dimension.name();
            boolean redefinition = merged.containsKey(fieldName) && !added.contains(fieldName);
            if (measures.containsKey(fieldName) || added.contains(fieldName) || (redefinition && !allowOverride)) {
                throw new DuplicateFieldException(name, fieldName, fieldNames());
            }
            merged.put(fieldName, dimension);
            added.add(fieldName);
        }
        return new SemanticTable(name, source, merged, measures, primaryKey, description);
    }

    public SemanticTable withMeasures(Measure... newMeasures) {
        return withMeasures(List.of(newMeasures), false);
    }

    /**
     * Adds measures.
     *
     * @param allowOverride Whether an existing measure of the same name may be replaced
     * @throws DuplicateFieldException if a name is already taken
     */
    public SemanticTable withMeasures(List<Measure> newMeasures, boolean allowOverride) {
        Map<String, Measure> merged = new LinkedHashMap<>(measures);
        List<String> added = new ArrayList<>();
        for (Measure measure : newMeasures) {
            String fieldName = measure.name();
            boolean redefinition = merged.containsKey(fieldName) && !added.contains(fieldName);
            if (dimensions.containsKey(fieldName) || added.contains(fieldName) || (redefinition && !allowOverride)) {
                throw new DuplicateFieldException(name, fieldName, fieldNames());
            }
            merged.put(fieldName, measure);
            added.add(fieldName);
        }
        return new SemanticTable(name, source, dimensions, merged, primaryKey, description);
    }

    /**
     * A copy of this table under another name, for self-joins and aliasing.
     */
    public SemanticTable named(String newName) {
        return new SemanticTable(newName, source, dimensions, measures, primaryKey, description);
    }

    public SemanticTable withPrimaryKey(String column) {
        return new SemanticTable(name, source, dimensions, measures, column, description);
    }

    public SemanticTable withDescription(String newDescription) {
        return new SemanticTable(name, source, dimensions, measures, primaryKey, newDescription);
    }

    // ==================== Introspection ====================

    public List<String> availableDimensions() {
        return List.copyOf(dimensions.keySet());
    }

    public List<String> availableMeasures() {
        return List.copyOf(measures.keySet());
    }

    public Optional<Dimension> dimension(String dimensionName) {
        return Optional.ofNullable(dimensions.get(dimensionName));
    }

    public Optional<Measure> measure(String measureName) {
        return Optional.ofNullable(measures.get(measureName));
    }

    public Optional<String> primaryKeyColumn() {
        return Optional.ofNullable(primaryKey);
    }

    /**
     * Describes the table for documentation and tooling.
     */
    public Map<String, Object> describe() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", name);
        result.put("description", description);
        result.put("source", source.qualifiedName());
        result.put("primary_key", primaryKey);

        List<Map<String, Object>> dimensionInfo = new ArrayList<>();
        for (Dimension dimension : dimensions.values()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("name", dimension.name());
            info.put("description", dimension.description());
            info.put("is_time_dimension", dimension.timeDimension());
            info.put("smallest_time_grain",
                    dimension.smallestTimeGrain() == null ? null : dimension.smallestTimeGrain().name());
            dimensionInfo.add(info);
        }
        result.put("dimensions", dimensionInfo);

        List<Map<String, Object>> measureInfo = new ArrayList<>();
        for (Measure measure : measures.values()) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("name", measure.name());
            info.put("kind", measure.kind().name());
            info.put("description", measure.description());
            measureInfo.add(info);
        }
        result.put("measures", measureInfo);
        return result;
    }

    private List<String> fieldNames() {
        List<String> names = new ArrayList<>(dimensions.keySet());
        names.addAll(measures.keySet());
        return names;
    }

    @Override
    public String toString() {
        return "SemanticTable(" + name + " <- " + source.qualifiedName()
                + ", dimensions=" + dimensions.keySet() + ", measures=" + measures.keySet() + ")";
    }
}
