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

package com.tessera.planner.explain;

import com.tessera.common.filter.Filters;
import com.tessera.common.schema.FieldRef;
import com.tessera.planner.logical.ScanKind;
import com.tessera.planner.physical.HashAggregate;
import com.tessera.planner.physical.HashDistinct;
import com.tessera.planner.physical.HashJoin;
import com.tessera.planner.physical.IndexScan;
import com.tessera.planner.physical.MergeJoin;
import com.tessera.planner.physical.NestedLoopJoin;
import com.tessera.planner.physical.PhysicalFilter;
import com.tessera.planner.physical.PhysicalLimit;
import com.tessera.planner.physical.PhysicalNode;
import com.tessera.planner.physical.PhysicalPlan;
import com.tessera.planner.physical.PhysicalPlanVisitor;
import com.tessera.planner.physical.PhysicalProject;
import com.tessera.planner.physical.PhysicalSort;
import com.tessera.planner.physical.PhysicalUnion;
import com.tessera.planner.physical.SortAggregate;
import com.tessera.planner.physical.TableScan;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Builds {@link ExplainReport}s for physical plans.
 * <p>
 * With execution stats, every node's estimate is compared with the rows it actually produced.
 * A node whose estimate is off by more than the misestimate ratio, in either direction, yields a
 * recommendation: a scan points at stale statistics, a filter over a full scan points at the
 * unindexed fields it filters on, and any other node reports the misestimate itself.
 */
public class Explainer {
    public static final double DEFAULT_MISESTIMATE_RATIO = 10.0;

    private final double misestimateRatio;

    public Explainer() {
        this(DEFAULT_MISESTIMATE_RATIO);
    }

    public Explainer(double misestimateRatio) {
        if (misestimateRatio <= 1.0) {
            throw new IllegalArgumentException("misestimateRatio must be greater than 1");
        }
        this.misestimateRatio = misestimateRatio;
    }

    public ExplainReport explain(PhysicalPlan plan) {
        return explain(plan, null);
    }

    public ExplainReport explain(PhysicalPlan plan, @Nullable ExecutionStats stats) {
        List<NodeReport> nodes = new ArrayList<>();
        List<Recommendation> recommendations = new ArrayList<>();
        walk(plan.root(), 0, stats, nodes, recommendations);
        return new ExplainReport(plan.queryId(), nodes, plan.totalCost(), plan.costed(), plan.warnings(), recommendations);
    }

    private void walk(PhysicalNode node, int depth, @Nullable ExecutionStats stats, List<NodeReport> nodes,
                      List<Recommendation> recommendations) {
        Long actual = null;
        Double ratio = null;
        if (stats != null) {
            OptionalLong rows = stats.actualRows(node.id());
            if (rows.isPresent()) {
                actual = rows.getAsLong();
                ratio = ratio(node.estimate().rows(), actual);
                if (ratio > misestimateRatio) {
                    recommend(node, actual, ratio, recommendations);
                }
            }
        }
        nodes.add(new NodeReport(node.id(), node.logicalId(), depth, operatorName(node), node.accept(DetailVisitor.INSTANCE),
                node.estimate().rows(), node.estimate().cost(), actual, ratio));
        for (PhysicalNode child : node.children()) {
            walk(child, depth + 1, stats, nodes, recommendations);
        }
    }

    static double ratio(double estimated, long actual) {
        double high = Math.max(estimated, actual);
        double low = Math.max(1.0, Math.min(estimated, actual));
        return high / low;
    }

    private void recommend(PhysicalNode node, long actual, double ratio, List<Recommendation> sink) {
        String observed = String.format(Locale.ROOT, "estimated %.0f rows, observed %d (x%.1f)",
                node.estimate().rows(), actual, ratio);
        if (node instanceof TableScan scan) {
            sink.add(new Recommendation(Recommendation.Kind.REFRESH_STATISTICS, node.id(), scan.entity(),
                    "refresh statistics for entity " + scan.entity() + ": " + observed));
            return;
        }
        if (node instanceof IndexScan scan) {
            sink.add(new Recommendation(Recommendation.Kind.REFRESH_STATISTICS, node.id(), scan.entity(),
                    "refresh statistics for entity " + scan.entity() + ": " + observed));
            return;
        }
        if (node instanceof PhysicalFilter filter && filter.input() instanceof TableScan scan && scan.kind() == ScanKind.TABLE) {
            Set<String> unindexed = new LinkedHashSet<>();
            for (FieldRef field : Filters.fields(filter.predicate())) {
                if (!field.indexed() && field.qualifier().equals(scan.alias())) {
                    unindexed.add(field.path());
                }
            }
            for (String field : unindexed) {
                sink.add(new Recommendation(Recommendation.Kind.MISSING_INDEX, node.id(), field,
                        "missing index on field " + field + ": " + observed));
            }
            if (!unindexed.isEmpty()) {
                return;
            }
        }
        sink.add(new Recommendation(Recommendation.Kind.CARDINALITY_MISESTIMATE, node.id(), operatorName(node),
                "cardinality misestimate at " + operatorName(node) + " #" + node.id() + ": " + observed));
    }

    static String operatorName(PhysicalNode node) {
        if (node instanceof TableScan scan) {
            switch (scan.kind()) {
                case FULL_TEXT:
                    return "FULL_TEXT_SEARCH";
                case SEMANTIC:
                    return "VECTOR_SEARCH";
                default:
                    return "TABLE_SCAN";
            }
        }
        if (node instanceof IndexScan) return "INDEX_SCAN";
        if (node instanceof PhysicalFilter) return "FILTER";
        if (node instanceof PhysicalProject) return "PROJECT";
        if (node instanceof PhysicalSort) return "SORT";
        if (node instanceof PhysicalLimit) return "LIMIT";
        if (node instanceof HashAggregate) return "HASH_AGGREGATE";
        if (node instanceof SortAggregate) return "SORT_AGGREGATE";
        if (node instanceof HashJoin) return "HASH_JOIN";
        if (node instanceof MergeJoin) return "MERGE_JOIN";
        if (node instanceof NestedLoopJoin) return "NESTED_LOOP_JOIN";
        if (node instanceof PhysicalUnion) return "UNION";
        if (node instanceof HashDistinct) return "HASH_DISTINCT";
        throw new IllegalStateException("Unknown physical node: " + node.getClass().getSimpleName());
    }

    /**
     * Short operator specific description shown next to the operator name.
     */
    private static final class DetailVisitor implements PhysicalPlanVisitor<String> {
        static final DetailVisitor INSTANCE = new DetailVisitor();

        @Override
        public String visitTableScan(TableScan node) {
            String target = node.alias().isEmpty() ? node.entity() : node.entity() + " AS " + node.alias();
            if (node.search() == null) {
                return target;
            }
            return target + " search='" + node.search().query() + "'";
        }

        @Override
        public String visitIndexScan(IndexScan node) {
            String target = node.alias().isEmpty() ? node.entity() : node.entity() + " AS " + node.alias();
            return target + " index=" + node.field().path() + " [" + node.predicate() + "]";
        }

        @Override
        public String visitFilter(PhysicalFilter node) {
            return Filters.render(node.predicate());
        }

        @Override
        public String visitProject(PhysicalProject node) {
            return node.fields().toString();
        }

        @Override
        public String visitSort(PhysicalSort node) {
            return node.keys().toString();
        }

        @Override
        public String visitLimit(PhysicalLimit node) {
            String detail = "limit=" + node.limit();
            if (node.offset() > 0) {
                detail += " offset=" + node.offset();
            }
            return node.cursor() == null ? detail : detail + " cursor";
        }

        @Override
        public String visitHashAggregate(HashAggregate node) {
            return aggregate(node.groupBy(), node.aggregates().toString(), node.having() == null ? null : Filters.render(node.having()));
        }

        @Override
        public String visitSortAggregate(SortAggregate node) {
            return aggregate(node.groupBy(), node.aggregates().toString(), node.having() == null ? null : Filters.render(node.having()));
        }

        private static String aggregate(List<FieldRef> groupBy, String aggregates, @Nullable String having) {
            String detail = "group_by=" + groupBy + " " + aggregates;
            return having == null ? detail : detail + " having " + having;
        }

        @Override
        public String visitHashJoin(HashJoin node) {
            return join(node.joinType().name(), node.leftKey(), node.rightKey());
        }

        @Override
        public String visitMergeJoin(MergeJoin node) {
            return join(node.joinType().name(), node.leftKey(), node.rightKey());
        }

        @Override
        public String visitNestedLoopJoin(NestedLoopJoin node) {
            return join(node.joinType().name(), node.leftKey(), node.rightKey());
        }

        private static String join(String joinType, FieldRef left, FieldRef right) {
            return joinType + " ON " + left.path() + " = " + right.path();
        }

        @Override
        public String visitUnion(PhysicalUnion node) {
            return "";
        }

        @Override
        public String visitHashDistinct(HashDistinct node) {
            return "";
        }
    }
}
