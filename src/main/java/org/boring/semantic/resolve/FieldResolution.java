package org.boring.semantic.resolve;

import org.boring.semantic.ir.SemanticAggregate;
import org.boring.semantic.ir.SemanticFilter;
import org.boring.semantic.ir.SemanticGroupBy;
import org.boring.semantic.ir.SemanticJoin;
import org.boring.semantic.ir.SemanticLimit;
import org.boring.semantic.ir.SemanticMutate;
import org.boring.semantic.ir.SemanticNode;
import org.boring.semantic.ir.SemanticOrderBy;
import org.boring.semantic.ir.SemanticPreAggregate;
import org.boring.semantic.ir.SemanticProject;
import org.boring.semantic.ir.SemanticSource;
import org.boring.semantic.model.SemanticTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The field names visible in a (possibly joined) semantic relation.
 *
 * Tables are walked left to right, depth first. Every dimension and measure is
 * registered as {@code table.field}; the bare {@code field} belongs to the first table
 * that declares it. Lookup tries the exact name, then the bare name, then a unique
 * {@code .field} suffix, then drops leading qualifiers of a nested name
 * ({@code orders.customers.country} finds {@code customers.country}).
 */
public final class FieldResolution {

    private final List<SemanticTable> tables;
    private final Map<String, ResolvedField> dimensions = new LinkedHashMap<>();
    private final Map<String, ResolvedField> measures = new LinkedHashMap<>();

    private FieldResolution(List<SemanticTable> tables) {
        this.tables = Collections.unmodifiableList(tables);
        for (SemanticTable table : tables) {
            for (String name : table.availableDimensions()) {
                register(dimensions, table, name);
            }
            for (String name : table.availableMeasures()) {
                register(measures, table, name);
            }
        }
    }

    private static void register(Map<String, ResolvedField> target, SemanticTable table, String name) {
        ResolvedField field = new ResolvedField(table, name);
        target.put(field.qualifiedName(), field);
        target.putIfAbsent(name, field);
    }

    /**
     * Builds the resolution for the tables under a node.
     *
     * @throws IllegalArgumentException if two joined tables share a name
     */
    public static FieldResolution of(SemanticNode node) {
        List<SemanticTable> tables = new ArrayList<>();
        collectTables(node, tables);
        List<String> seen = new ArrayList<>();
        for (SemanticTable table : tables) {
            if (seen.contains(table.name())) {
                throw new IllegalArgumentException("Table '" + table.name()
                        + "' appears twice in a join; rename one side with SemanticTable.named()");
            }
            seen.add(table.name());
        }
        return new FieldResolution(tables);
    }

    private static void collectTables(SemanticNode node, List<SemanticTable> tables) {
        if (node instanceof SemanticSource source) {
            tables.add(source.table());
        } else if (node instanceof SemanticPreAggregate preAggregate) {
            tables.add(preAggregate.source().table());
        } else if (node instanceof SemanticJoin join) {
            collectTables(join.left(), tables);
            collectTables(join.right(), tables);
        } else if (node instanceof SemanticFilter filter) {
            collectTables(filter.source(), tables);
        } else if (node instanceof SemanticGroupBy groupBy) {
            collectTables(groupBy.source(), tables);
        } else if (node instanceof SemanticAggregate aggregate) {
            collectTables(aggregate.source(), tables);
        } else if (node instanceof SemanticMutate mutate) {
            collectTables(mutate.source(), tables);
        } else if (node instanceof SemanticOrderBy orderBy) {
            collectTables(orderBy.source(), tables);
        } else if (node instanceof SemanticLimit limit) {
            collectTables(limit.source(), tables);
        } else if (node instanceof SemanticProject project) {
            collectTables(project.source(), tables);
        }
    }

    /**
     * @return The tables in join order
     */
    public List<SemanticTable> tables() {
        return tables;
    }

    /**
     * @return The leftmost table
     */
    public SemanticTable leftmost() {
        return tables.get(0);
    }

    public Optional<SemanticTable> table(String name) {
        return tables.stream().filter(t -> t.name().equals(name)).findFirst();
    }

    public Optional<ResolvedField> findDimension(String name) {
        return lookup(dimensions, name);
    }

    public Optional<ResolvedField> findMeasure(String name) {
        return lookup(measures, name);
    }

    /**
     * @throws UnresolvedFieldException if no dimension matches
     */
    public ResolvedField dimension(String name) {
        return findDimension(name)
                .orElseThrow(() -> new UnresolvedFieldException(name, "dimension", dimensionNames()));
    }

    /**
     * @throws UnresolvedFieldException if no measure matches
     */
    public ResolvedField measure(String name) {
        return findMeasure(name)
                .orElseThrow(() -> new UnresolvedFieldException(name, "measure", measureNames()));
    }

    /**
     * Resolves a measure name the way a calculated measure of {@code owner} sees it:
     * a bare name is first tried on the owner itself.
     */
    public ResolvedField measure(String name, String owner) {
        if (owner != null && !name.contains(".")) {
            ResolvedField own = measures.get(owner + "." + name);
            if (own != null) {
                return own;
            }
        }
        return measure(name);
    }

    public List<String> dimensionNames() {
        return List.copyOf(dimensions.keySet());
    }

    public List<String> measureNames() {
        return List.copyOf(measures.keySet());
    }

    private static Optional<ResolvedField> lookup(Map<String, ResolvedField> fields, String name) {
        ResolvedField exact = fields.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        String suffix = "." + name;
        List<ResolvedField> matches = new ArrayList<>();
        for (Map.Entry<String, ResolvedField> entry : fields.entrySet()) {
            if (entry.getKey().endsWith(suffix) && !matches.contains(entry.getValue())) {
                matches.add(entry.getValue());
            }
        }
        if (matches.size() == 1) {
            return Optional.of(matches.get(0));
        }
        int dot = name.indexOf('.');
        if (dot > 0 && name.indexOf('.', dot + 1) > 0) {
            return lookup(fields, name.substring(dot + 1));
        }
        return Optional.empty();
    }
}
