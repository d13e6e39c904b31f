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

import com.tessera.common.filter.Condition;
import com.tessera.common.filter.Filter;
import com.tessera.common.filter.Filters;
import com.tessera.common.filter.Operator;
import com.tessera.common.schema.FieldRef;
import com.tessera.planner.logical.ScanKind;
import com.tessera.planner.physical.IndexScan;
import com.tessera.planner.physical.PhysicalFilter;
import com.tessera.planner.physical.PhysicalNode;
import com.tessera.planner.physical.TableScan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Replaces {@code FILTER(TABLE_SCAN)} with {@code FILTER(INDEX_SCAN)} when a top-level conjunct
 * over an indexed field of the scanned entity is selective enough. The filter keeps its full
 * predicate; the index only narrows the rows it reads.
 * <p>
 * Only conjuncts with a statistics-backed selectivity are considered, over an entity with a known
 * cardinality: without statistics the table scan stays.
 */
public class IndexScanSelectionRule extends BottomUpRule {
    private static final Logger LOGGER = LoggerFactory.getLogger(IndexScanSelectionRule.class);
    private static final Set<Operator> INDEXABLE = EnumSet.of(
            Operator.EQ, Operator.IN, Operator.LT, Operator.LTE, Operator.GT, Operator.GTE, Operator.BETWEEN,
            Operator.STARTS_WITH, Operator.ARRAY_CONTAINS, Operator.ARRAY_CONTAINS_ANY
    );

    public IndexScanSelectionRule() {
        super(PhysicalFilter.class);
    }

    @Override
    protected PhysicalNode rewrite(PhysicalNode node, OptimizerContext context) {
        PhysicalFilter filter = (PhysicalFilter) node;
        if (!(filter.input() instanceof TableScan scan) || scan.kind() != ScanKind.TABLE
                || !context.statistics().hasCardinality(scan.entity())) {
            return node;
        }

        Condition<FieldRef> best = null;
        double bestSelectivity = Double.POSITIVE_INFINITY;
        for (Filter<FieldRef> conjunct : Filters.conjuncts(filter.predicate())) {
            if (!(conjunct instanceof Condition<FieldRef> condition) || !isIndexable(condition, scan)) {
                continue;
            }
            OptionalDouble selectivity = context.statistics().selectivity(condition);
            if (selectivity.isEmpty()) {
                continue;
            }
            if (selectivity.getAsDouble() < bestSelectivity) {
                best = condition;
                bestSelectivity = selectivity.getAsDouble();
            }
        }

        if (best == null || bestSelectivity >= context.settings().indexSelectivityThreshold()) {
            return node;
        }
        LOGGER.debug("Using index on {} (selectivity {}) for entity '{}'", best.field().path(), bestSelectivity, scan.entity());
        IndexScan indexScan = new IndexScan(context.ids().nextId(), scan.logicalId(), scan.entity(), scan.alias(),
                best.field(), best, scan.estimate());
        return filter.withChildren(List.of(indexScan));
    }

    private static boolean isIndexable(Condition<FieldRef> condition, TableScan scan) {
        FieldRef field = condition.field();
        return field.indexed()
                && field.qualifier().equals(scan.alias())
                && field.entity().equals(scan.entity())
                && condition.caseSensitive()
                && INDEXABLE.contains(condition.operator());
    }

    @Override
    public int getPriority() {
        return 100;
    }
}
