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

import com.tessera.common.Deadline;
import com.tessera.common.statistics.StatisticsView;
import com.tessera.planner.PlannerContext;
import com.tessera.planner.logical.LogicalPlan;
import com.tessera.planner.physical.PhysicalNode;
import com.tessera.planner.physical.PhysicalPlan;
import com.tessera.planner.physical.PlanWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cost-based physical optimizer.
 * <p>
 * Every logical node is first translated to its default strategy; the rules then run in priority
 * order, repeatedly, until a pass changes nothing or {@link OptimizerSettings#maxOptimizationPasses()}
 * is reached. Estimates are recomputed after every change so that later rules see current numbers.
 * <p>
 * Missing statistics never fail optimization: affected nodes keep their default strategy and
 * estimates, the plan is marked as not costed and a {@link PlanWarning} names each entity.
 */
public class PhysicalOptimizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PhysicalOptimizer.class);

    private final List<PhysicalOptimizationRule> rules;
    private final OptimizerSettings settings;

    public PhysicalOptimizer() {
        this(OptimizerSettings.DEFAULT);
    }

    public PhysicalOptimizer(OptimizerSettings settings) {
        this(settings, defaultRules());
    }

    public PhysicalOptimizer(OptimizerSettings settings, List<PhysicalOptimizationRule> rules) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        List<PhysicalOptimizationRule> sorted = new ArrayList<>(rules);
        // Sort by priority (higher priority first)
        sorted.sort((r1, r2) -> Integer.compare(r2.getPriority(), r1.getPriority()));
        this.rules = List.copyOf(sorted);
    }

    private static List<PhysicalOptimizationRule> defaultRules() {
        List<PhysicalOptimizationRule> rules = new ArrayList<>();

        // Access paths
        rules.add(new IndexScanSelectionRule());

        // Join strategies
        rules.add(new MergeJoinSelectionRule());
        rules.add(new NestedLoopJoinSelectionRule());

        // Aggregation strategies
        rules.add(new SortAggregateSelectionRule());
        return rules;
    }

    public List<PhysicalOptimizationRule> getRules() {
        return rules;
    }

    /**
     * Produces the physical plan for a logical plan.
     *
     * @param plan       logical plan to implement
     * @param statistics statistics snapshot; may know nothing
     * @param deadline   planning deadline, checked before every statistics lookup
     * @throws com.tessera.common.error.PlanningTimeoutException if the deadline passes
     */
    public PhysicalPlan optimize(LogicalPlan plan, StatisticsView statistics, Deadline deadline) {
        Objects.requireNonNull(plan, "plan must not be null");
        StatisticsLookup lookup = new StatisticsLookup(statistics, deadline);
        OptimizerContext context = new OptimizerContext(lookup, settings, new PlannerContext());
        CostModel costModel = new CostModel(lookup, settings);

        PhysicalNode current = costModel.annotate(new PhysicalTranslator(context.ids()).translate(plan.root()));
        List<PlanWarning> warnings = new ArrayList<>();

        boolean changed;
        int iterations = 0;
        do {
            changed = false;
            lookup.checkDeadline();

            for (PhysicalOptimizationRule rule : rules) {
                if (rule.canApply(current)) {
                    PhysicalNode optimized = rule.apply(current, context);
                    if (!optimized.equals(current)) {
                        LOGGER.debug("Rule {} rewrote plan of query {}", rule.getName(), plan.queryId());
                        current = costModel.annotate(optimized);
                        changed = true;
                    }
                }
            }

            iterations++;
        } while (changed && iterations < settings.maxOptimizationPasses());

        if (changed) {
            warnings.add(new PlanWarning(PlanWarning.OPTIMIZER_PASS_LIMIT, null,
                    "Optimizer stopped after " + iterations + " passes without reaching a fixed point"));
        }
        for (String entity : lookup.missingEntities()) {
            warnings.add(new PlanWarning(PlanWarning.STATISTICS_UNAVAILABLE, entity,
                    "No statistics for entity '" + entity + "'; estimates assume " + settings.defaultCardinality() + " rows"));
        }
        boolean costed = lookup.missingEntities().isEmpty();
        if (!costed) {
            LOGGER.info("Query {} planned without statistics for {}", plan.queryId(), lookup.missingEntities());
        }
        return new PhysicalPlan(plan.queryId(), current, costed, warnings);
    }
}
