/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.tessera.planner.optimizer;

import com.tessera.common.filter.Filter;
import com.tessera.common.filter.Filters;
import com.tessera.common.model.JoinType;
import com.tessera.common.schema.FieldRef;
import com.tessera.planner.logical.ScanKind;
import com.tessera.planner.physical.Estimate;
import com.tessera.planner.physical.HashAggregate;
import com.tessera.planner.physical.HashDistinct;
import com.tessera.planner.physical.HashJoin;
import com.tessera.planner.physical.IndexScan;
import com.tessera.planner.physical.MergeJoin;
import com.tessera.planner.physical.NestedLoopJoin;
import com.tessera.planner.physical.PhysicalFilter;
import com.tessera.planner.physical.PhysicalLimit;
import com.tessera.planner.physical.PhysicalNode;
import com.tessera.planner.physical.PhysicalProject;
import com.tessera.planner.physical.PhysicalSort;
import com.tessera.planner.physical.PhysicalUnion;
import com.tessera.planner.physical.SortAggregate;
import com.tessera.planner.physical.TableScan;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link Estimate}s bottom-up. Every operator charges a constant per row it processes;
 * a node's cost is its own charge plus the cost of its inputs.
 */
public final class CostModel {
    static final double SEARCH_SELECTIVITY = 0.1;
    static final double GROUPING_FACTOR = 0.1;
    static final double HAVING_SELECTIVITY = 0.5;

    static final double TABLE_SCAN_ROW = 1.0;
    static final double INDEX_SEEK = 10.0;
    static final double INDEX_SCAN_ROW = 2.0;
    static final double FILTER_ROW = 0.2;
    static final double PROJECT_ROW = 0.1;
    static final double SORT_ROW = 2.0;
    static final double HASH_AGGREGATE_ROW = 1.5;
    static final double SORT_AGGREGATE_ROW = 1.0;
    static final double HASH_JOIN_ROW = 1.5;
    static final double MERGE_JOIN_ROW = 1.0;
    static final double NESTED_LOOP_PAIR = 0.1;
    static final double DISTINCT_ROW = 1.2;

    private final StatisticsLookup statistics;
    private final OptimizerSettings settings;

    public CostModel(StatisticsLookup statistics, OptimizerSettings settings) {
        this.statistics = statistics;
        this.settings = settings;
    }

    /**
     * Returns a copy of the tree with every node's estimate recomputed.
     */
    public PhysicalNode annotate(PhysicalNode node) {
        List<PhysicalNode> children = new ArrayList<>(node.children().size());
        for (PhysicalNode child : node.children()) {
            children.add(annotate(child));
        }
        PhysicalNode rebuilt = children.isEmpty() ? node : node.withChildren(children);
        return rebuilt.withEstimate(estimate(rebuilt));
    }

    private Estimate estimate(PhysicalNode node) {
        if (node instanceof TableScan scan) {
            double cardinality = cardinality(scan.entity());
            double rows = scan.kind() == ScanKind.TABLE ? cardinality : cardinality * SEARCH_SELECTIVITY;
            return new Estimate(rows, cardinality * TABLE_SCAN_ROW);
        }
        if (node instanceof IndexScan scan) {
            double rows = cardinality(scan.entity()) * SelectivityEstimator.estimate(scan.predicate(), statistics);
            return new Estimate(rows, INDEX_SEEK + rows * INDEX_SCAN_ROW);
        }
        if (node instanceof PhysicalFilter filter) {
            Estimate input = filter.input().estimate();
            double rows = input.rows() * residualSelectivity(filter);
            return new Estimate(rows, input.cost() + input.rows() * FILTER_ROW);
        }
        if (node instanceof PhysicalProject project) {
            return perRow(project.input().estimate(), PROJECT_ROW);
        }
        if (node instanceof PhysicalSort sort) {
            return perRow(sort.input().estimate(), SORT_ROW);
        }
        if (node instanceof PhysicalLimit limit) {
            Estimate input = limit.input().estimate();
            return new Estimate(Math.min(input.rows(), limit.limit()), input.cost());
        }
        if (node instanceof HashAggregate aggregate) {
            Estimate input = aggregate.input().estimate();
            return new Estimate(groups(input.rows(), aggregate.groupBy(), aggregate.having() != null),
                    input.cost() + input.rows() * HASH_AGGREGATE_ROW);
        }
        if (node instanceof SortAggregate aggregate) {
            Estimate input = aggregate.input().estimate();
            return new Estimate(groups(input.rows(), aggregate.groupBy(), aggregate.having() != null),
                    input.cost() + input.rows() * SORT_AGGREGATE_ROW);
        }
        if (node instanceof HashJoin join) {
            return join(join.left().estimate(), join.right().estimate(), join.joinType(), HASH_JOIN_ROW);
        }
        if (node instanceof MergeJoin join) {
            return join(join.left().estimate(), join.right().estimate(), join.joinType(), MERGE_JOIN_ROW);
        }
        if (node instanceof NestedLoopJoin join) {
            Estimate left = join.left().estimate();
            Estimate right = join.right().estimate();
            double rows = joinRows(left.rows(), right.rows(), join.joinType());
            return new Estimate(rows, left.cost() + right.cost() + left.rows() * right.rows() * NESTED_LOOP_PAIR);
        }
        if (node instanceof PhysicalUnion union) {
            double rows = 0;
            double cost = 0;
            for (PhysicalNode input : union.inputs()) {
                rows += input.estimate().rows();
                cost += input.estimate().cost();
            }
            return new Estimate(rows, cost);
        }
        if (node instanceof HashDistinct distinct) {
            return perRow(distinct.input().estimate(), DISTINCT_ROW);
        }
        throw new IllegalStateException("Unknown physical node: " + node.getClass().getSimpleName());
    }

    private double cardinality(String entity) {
        return statistics.cardinality(entity).orElse(settings.defaultCardinality());
    }

    /**
     * An index scan already applied its condition; the filter above it only removes what the
     * remaining conjuncts reject.
     */
    private double residualSelectivity(PhysicalFilter filter) {
        if (!(filter.input() instanceof IndexScan scan)) {
            return SelectivityEstimator.estimate(filter.predicate(), statistics);
        }
        List<Filter<FieldRef>> residual = new ArrayList<>(Filters.conjuncts(filter.predicate()));
        residual.remove(scan.predicate());
        if (residual.isEmpty()) {
            return 1.0;
        }
        return SelectivityEstimator.estimate(Filters.conjunction(residual), statistics);
    }

    private static Estimate perRow(Estimate input, double rowCost) {
        return new Estimate(input.rows(), input.cost() + input.rows() * rowCost);
    }

    private static double groups(double inputRows, List<FieldRef> groupBy, boolean having) {
        double rows = groupBy.isEmpty() ? 1.0 : Math.max(1.0, Math.min(inputRows, inputRows * GROUPING_FACTOR));
        return having ? rows * HAVING_SELECTIVITY : rows;
    }

    private static Estimate join(Estimate left, Estimate right, JoinType joinType, double rowCost) {
        double rows = joinRows(left.rows(), right.rows(), joinType);
        return new Estimate(rows, left.cost() + right.cost() + (left.rows() + right.rows()) * rowCost);
    }

    static double joinRows(double left, double right, JoinType joinType) {
        switch (joinType) {
            case INNER:
                return Math.min(left, right);
            case LEFT:
                return left;
            case RIGHT:
                return right;
            case FULL:
                return Math.max(left, right);
            default:
                throw new IllegalStateException("Unknown join type: " + joinType);
        }
    }
}
