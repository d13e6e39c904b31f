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

import com.tessera.common.model.SortDirection;
import com.tessera.common.schema.FieldRef;
import com.tessera.planner.cqm.CanonicalSort;
import com.tessera.planner.cqm.SortKey;
import com.tessera.planner.logical.ScanKind;
import com.tessera.planner.physical.IndexScan;
import com.tessera.planner.physical.MergeJoin;
import com.tessera.planner.physical.NestedLoopJoin;
import com.tessera.planner.physical.PhysicalFilter;
import com.tessera.planner.physical.PhysicalLimit;
import com.tessera.planner.physical.PhysicalNode;
import com.tessera.planner.physical.PhysicalProject;
import com.tessera.planner.physical.PhysicalSort;
import com.tessera.planner.physical.TableScan;

import java.util.List;

/**
 * Answers whether a node's output is ordered on a list of fields.
 */
final class Orderings {

    private Orderings() {
    }

    static boolean isSortedOn(PhysicalNode node, List<FieldRef> keys, StatisticsLookup statistics) {
        if (keys.isEmpty()) {
            return false;
        }
        if (node instanceof TableScan scan) {
            if (scan.kind() != ScanKind.TABLE) {
                return false;
            }
            for (FieldRef key : keys) {
                if (!key.qualifier().equals(scan.alias())) {
                    return false;
                }
            }
            return statistics.isSorted(scan.entity(), keys);
        }
        if (node instanceof IndexScan scan) {
            return keys.size() == 1 && keys.get(0).equals(scan.field());
        }
        if (node instanceof PhysicalFilter filter) {
            return isSortedOn(filter.input(), keys, statistics);
        }
        if (node instanceof PhysicalLimit limit) {
            return isSortedOn(limit.input(), keys, statistics);
        }
        if (node instanceof PhysicalProject project) {
            return project.fields().containsAll(keys) && isSortedOn(project.input(), keys, statistics);
        }
        if (node instanceof PhysicalSort sort) {
            return sortKeysStartWith(sort.keys(), keys);
        }
        if (node instanceof MergeJoin join) {
            return isSortedOn(join.left(), keys, statistics);
        }
        if (node instanceof NestedLoopJoin join) {
            return isSortedOn(join.left(), keys, statistics);
        }
        return false;
    }

    private static boolean sortKeysStartWith(List<CanonicalSort> sorts, List<FieldRef> keys) {
        if (sorts.size() < keys.size()) {
            return false;
        }
        for (int i = 0; i < keys.size(); i++) {
            CanonicalSort sort = sorts.get(i);
            if (sort.direction() != SortDirection.ASC) {
                return false;
            }
            if (!(sort.key() instanceof SortKey.Field field) || !field.field().equals(keys.get(i))) {
                return false;
            }
        }
        return true;
    }
}
