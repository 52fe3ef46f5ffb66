package org.boring.semantic.transpiler;

import org.boring.semantic.plan.Expression;
import org.boring.semantic.plan.FilterNode;
import org.boring.semantic.plan.LimitNode;
import org.boring.semantic.plan.RelationNode;
import org.boring.semantic.plan.SortNode;
import org.boring.semantic.resolve.FieldResolution;
import org.boring.semantic.store.SqlDataType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The lowered form of one semantic node.
 *
 * A ROW stage is still a row-level FROM tree: its conditions, ordering and limit are kept
 * apart so that later filters and joins can be merged into the same query block, and its
 * fields are referenced as {@code "table"."column"}. GROUPED and COLUMNS stages are finished
 * relations whose output columns are referenced by name.
 *
 * @param stage      The stage
 * @param relation   The FROM tree (ROW) or the finished relation
 * @param conditions Row conditions not yet applied (ROW only)
 * @param resolution The fields of the FROM tree (ROW only)
 * @param sort       Pending ordering (ROW only)
 * @param limit      Pending limit, null for none (ROW only)
 * @param offset     Pending offset (ROW only)
 * @param columns    Output columns and their types (GROUPED and COLUMNS only)
 */
record Lowered(
        Stage stage,
        RelationNode relation,
        List<Expression> conditions,
        FieldResolution resolution,
        List<SortNode.SortColumn> sort,
        Integer limit,
        int offset,
        Map<String, SqlDataType> columns) {

    enum Stage {
        /** Row-level relation, fields resolved through dimensions and raw columns. */
        ROW,
        /** Aggregated result. */
        GROUPED,
        /** Projected result. */
        COLUMNS
    }

    Lowered {
        conditions = List.copyOf(conditions);
        sort = List.copyOf(sort);
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    static Lowered row(RelationNode from, FieldResolution resolution) {
        return new Lowered(Stage.ROW, from, List.of(), resolution, List.of(), null, 0, Map.of());
    }

    static Lowered result(Stage stage, RelationNode relation, Map<String, SqlDataType> columns) {
        return new Lowered(stage, relation, List.of(), null, List.of(), null, 0, columns);
    }

    boolean isRow() {
        return stage == Stage.ROW;
    }

    /**
     * @return true when a ROW stage has ordering or a limit waiting to be applied
     */
    boolean hasPendingShape() {
        return !sort.isEmpty() || limit != null || offset > 0;
    }

    Lowered withCondition(Expression condition) {
        List<Expression> newConditions = new ArrayList<>(conditions);
        newConditions.add(condition);
        return new Lowered(stage, relation, newConditions, resolution, sort, limit, offset, columns);
    }

    Lowered withSort(List<SortNode.SortColumn> newSort) {
        return new Lowered(stage, relation, conditions, resolution, newSort, limit, offset, columns);
    }

    Lowered withLimit(Integer newLimit, int newOffset) {
        return new Lowered(stage, relation, conditions, resolution, sort, newLimit, newOffset, columns);
    }

    /**
     * @return The FROM tree with its conditions applied
     */
    RelationNode filtered() {
        return FilterNode.where(relation, conditions);
    }

    /**
     * Applies pending ordering and limit on top of a relation built from this stage.
     */
    RelationNode shaped(RelationNode base) {
        RelationNode result = base;
        if (!sort.isEmpty()) {
            result = new SortNode(result, sort);
        }
        return LimitNode.apply(result, limit, offset);
    }

    /**
     * @return The complete relation of this stage
     */
    RelationNode toRelation() {
        return isRow() ? shaped(filtered()) : relation;
    }
}
