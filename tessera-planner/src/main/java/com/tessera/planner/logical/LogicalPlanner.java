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

package com.tessera.planner.logical;

import com.tessera.common.filter.Filter;
import com.tessera.common.filter.Filters;
import com.tessera.common.model.JoinType;
import com.tessera.common.model.SearchMode;
import com.tessera.common.schema.FieldRef;
import com.tessera.planner.PlannerContext;
import com.tessera.planner.cqm.CanonicalAggregation;
import com.tessera.planner.cqm.CanonicalQuery;
import com.tessera.planner.cqm.CanonicalSearch;
import com.tessera.planner.cqm.ResolvedRelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * LogicalPlanner turns a {@link CanonicalQuery} into a tree of relational operators.
 * <p>
 * The plan is built bottom-up:
 * <ol>
 *   <li>a scan of the queried entity (two scans under a DISTINCT UNION for hybrid search),</li>
 *   <li>one join per relation, parents first, each joining a scan of the related entity,</li>
 *   <li>a PROJECT carrying exactly the canonical projection, then DISTINCT, AGGREGATE and SORT
 *       when the query asks for them,</li>
 *   <li>a LIMIT at the root.</li>
 * </ol>
 * Top-level conjuncts of the filter are placed as low as their fields allow: conjuncts over the
 * queried entity directly above its scan, every other conjunct directly above the join that makes
 * the last of its fields available. A RIGHT or FULL join above that position keeps unmatched right
 * rows, so the conjunct moves above it.
 */
public final class LogicalPlanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogicalPlanner.class);

    private final LogicalPlanValidator validator;

    public LogicalPlanner() {
        this.validator = new LogicalPlanValidator();
    }

    public LogicalPlan plan(CanonicalQuery query) {
        Objects.requireNonNull(query, "query must not be null");
        PlannerContext context = new PlannerContext();

        List<ResolvedRelation> relations = query.relations();
        Map<String, Integer> stageOfAlias = new HashMap<>();
        stageOfAlias.put("", 0);
        for (int i = 0; i < relations.size(); i++) {
            stageOfAlias.put(relations.get(i).alias(), i + 1);
        }

        List<Filter<FieldRef>> conjuncts = query.filter() == null ? List.of() : Filters.conjuncts(query.filter());
        List<JoinType> joinTypes = new ArrayList<>(relations.size());
        for (ResolvedRelation relation : relations) {
            joinTypes.add(effectiveJoinType(relation, conjuncts));
        }
        List<List<Filter<FieldRef>>> byStage = new ArrayList<>();
        for (int i = 0; i <= relations.size(); i++) {
            byStage.add(new ArrayList<>());
        }
        for (Filter<FieldRef> conjunct : conjuncts) {
            byStage.get(stageOf(conjunct, stageOfAlias, joinTypes)).add(conjunct);
        }

        LogicalNode current = baseInput(query, byStage.get(0), context);
        for (int i = 0; i < relations.size(); i++) {
            ResolvedRelation relation = relations.get(i);
            LogicalNode right = new LogicalScan(context.nextId(), relation.entity(), relation.alias(), ScanKind.TABLE, null);
            current = new LogicalJoin(context.nextId(), current, right, joinTypes.get(i), relation.localKey(),
                    relation.foreignKey(), relation.alias());
            current = filterAbove(current, byStage.get(i + 1), context);
        }

        current = new LogicalProject(context.nextId(), current, query.projection());
        if (query.options().distinct()) {
            current = new LogicalDistinct(context.nextId(), current);
        }
        CanonicalAggregation aggregation = query.aggregation();
        if (aggregation != null) {
            current = new LogicalAggregate(context.nextId(), current, aggregation.groupBy(), aggregation.aggregates(),
                    aggregation.having());
        }
        if (!query.sorts().isEmpty()) {
            current = new LogicalSort(context.nextId(), current, query.sorts());
        }
        current = new LogicalLimit(context.nextId(), current, query.limit(), query.offset(), query.cursor());

        LogicalPlan plan = new LogicalPlan(query.queryId(), current);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Planned query {} with {} logical nodes", query.queryId(), plan.nodes().size());
        }
        return plan;
    }

    /**
     * Plans the query and checks the result against {@link LogicalPlanValidator}.
     *
     * @throws LogicalPlanValidationException if the plan violates a structural invariant
     */
    public LogicalPlan planAndValidate(CanonicalQuery query) {
        LogicalPlan plan = plan(query);
        LogicalPlanValidator.ValidationResult result = validator.validate(plan, query);
        if (!result.valid()) {
            throw new LogicalPlanValidationException("Invalid logical plan for query " + query.queryId(), result);
        }
        return plan;
    }

    public LogicalPlanValidator.ValidationResult validate(LogicalPlan plan, CanonicalQuery query) {
        return validator.validate(plan, query);
    }

    private LogicalNode baseInput(CanonicalQuery query, List<Filter<FieldRef>> conjuncts, PlannerContext context) {
        CanonicalSearch search = query.search();
        if (search == null) {
            return filterAbove(new LogicalScan(context.nextId(), query.entity(), "", ScanKind.TABLE, null), conjuncts, context);
        }
        if (search.mode() != SearchMode.HYBRID) {
            ScanKind kind = search.mode() == SearchMode.FULL_TEXT ? ScanKind.FULL_TEXT : ScanKind.SEMANTIC;
            return filterAbove(new LogicalScan(context.nextId(), query.entity(), "", kind, search), conjuncts, context);
        }
        LogicalNode text = filterAbove(
                new LogicalScan(context.nextId(), query.entity(), "", ScanKind.FULL_TEXT, search), conjuncts, context);
        LogicalNode vector = filterAbove(
                new LogicalScan(context.nextId(), query.entity(), "", ScanKind.SEMANTIC, search), conjuncts, context);
        LogicalNode union = new LogicalUnion(context.nextId(), List.of(text, vector));
        return new LogicalDistinct(context.nextId(), union);
    }

    private LogicalNode filterAbove(LogicalNode input, List<Filter<FieldRef>> conjuncts, PlannerContext context) {
        if (conjuncts.isEmpty()) {
            return input;
        }
        return new LogicalFilter(context.nextId(), input, Filters.conjunction(conjuncts));
    }

    /**
     * Index of the join a conjunct sits directly above, 0 meaning the base scan. A conjunct never
     * goes below a later RIGHT or FULL join, since that join pads the left input with nulls.
     */
    private int stageOf(Filter<FieldRef> conjunct, Map<String, Integer> stageOfAlias, List<JoinType> joinTypes) {
        int stage = 0;
        for (FieldRef field : Filters.fields(conjunct)) {
            Integer fieldStage = stageOfAlias.get(field.qualifier());
            if (fieldStage == null) {
                throw new IllegalStateException("Field " + field.path() + " is reached through unknown relation '"
                        + field.qualifier() + "'");
            }
            stage = Math.max(stage, fieldStage);
        }
        for (int join = stage + 1; join <= joinTypes.size(); join++) {
            JoinType joinType = joinTypes.get(join - 1);
            if (joinType == JoinType.RIGHT || joinType == JoinType.FULL) {
                stage = join;
            }
        }
        return stage;
    }

    /**
     * Explicit relations keep the requested type. An implicit relation only needs to keep unmatched
     * rows when no top-level conjunct already drops them, so it becomes INNER as soon as a
     * conjunct rejects missing values of one of its fields (or of a relation nested under it).
     */
    static JoinType effectiveJoinType(ResolvedRelation relation, List<Filter<FieldRef>> conjuncts) {
        if (relation.explicit()) {
            return relation.joinType();
        }
        String alias = relation.alias();
        for (Filter<FieldRef> conjunct : conjuncts) {
            for (FieldRef field : Filters.fields(conjunct)) {
                boolean reachedThrough = field.qualifier().equals(alias) || field.qualifier().startsWith(alias + ".");
                if (reachedThrough && Filters.rejectsNullsOf(conjunct, field)) {
                    return JoinType.INNER;
                }
            }
        }
        return JoinType.LEFT;
    }
}
