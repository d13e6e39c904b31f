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
import com.tessera.common.filter.Condition;
import com.tessera.common.schema.FieldRef;
import com.tessera.common.statistics.StatisticsUnavailableException;
import com.tessera.common.statistics.StatisticsView;
import com.tessera.planner.physical.IndexScan;
import com.tessera.planner.physical.PhysicalNode;
import com.tessera.planner.physical.TableScan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Statistics access for one optimization run. Checks the deadline before every lookup, turns
 * {@link StatisticsUnavailableException} into "unknown" and remembers which entities had no
 * cardinality.
 */
public final class StatisticsLookup {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatisticsLookup.class);
    private static final String STAGE = "physical optimization";

    private final StatisticsView statistics;
    private final Deadline deadline;
    private final Set<String> missingEntities = new LinkedHashSet<>();

    public StatisticsLookup(StatisticsView statistics, Deadline deadline) {
        this.statistics = statistics;
        this.deadline = deadline;
    }

    public OptionalLong cardinality(String entity) {
        deadline.check(STAGE);
        OptionalLong result;
        try {
            result = statistics.cardinality(entity);
        } catch (StatisticsUnavailableException e) {
            LOGGER.warn("Statistics unavailable for entity '{}': {}", entity, e.getMessage());
            result = OptionalLong.empty();
        }
        if (result.isEmpty()) {
            missingEntities.add(entity);
        }
        return result;
    }

    public OptionalDouble selectivity(Condition<FieldRef> condition) {
        deadline.check(STAGE);
        FieldRef field = condition.field();
        try {
            return statistics.selectivity(field.entity(), field.fieldId(), condition.operator(), condition.values());
        } catch (StatisticsUnavailableException e) {
            LOGGER.warn("Selectivity unavailable for field '{}': {}", field.fieldId(), e.getMessage());
            return OptionalDouble.empty();
        }
    }

    public boolean isSorted(String entity, List<FieldRef> fields) {
        deadline.check(STAGE);
        List<String> fieldIds = new ArrayList<>(fields.size());
        for (FieldRef field : fields) {
            fieldIds.add(field.fieldId());
        }
        try {
            return statistics.isSorted(entity, fieldIds);
        } catch (StatisticsUnavailableException e) {
            LOGGER.warn("Sort order unavailable for entity '{}': {}", entity, e.getMessage());
            return false;
        }
    }

    public boolean hasCardinality(String entity) {
        return !missingEntities.contains(entity);
    }

    /**
     * Whether every entity scanned below {@code node} had a cardinality. Rules that pick a
     * strategy other than the default only fire over such subtrees.
     */
    public boolean coversScansOf(PhysicalNode node) {
        if (node instanceof TableScan scan && !hasCardinality(scan.entity())) {
            return false;
        }
        if (node instanceof IndexScan scan && !hasCardinality(scan.entity())) {
            return false;
        }
        for (PhysicalNode child : node.children()) {
            if (!coversScansOf(child)) {
                return false;
            }
        }
        return true;
    }

    public Set<String> missingEntities() {
        return Collections.unmodifiableSet(missingEntities);
    }

    public void checkDeadline() {
        deadline.check(STAGE);
    }
}
