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

import com.tessera.planner.physical.HashJoin;
import com.tessera.planner.physical.MergeJoin;
import com.tessera.planner.physical.PhysicalNode;

import java.util.List;

/**
 * Replaces a hash join by a merge join when both inputs already arrive ordered on their join keys.
 */
public class MergeJoinSelectionRule extends BottomUpRule {

    public MergeJoinSelectionRule() {
        super(HashJoin.class);
    }

    @Override
    protected PhysicalNode rewrite(PhysicalNode node, OptimizerContext context) {
        HashJoin join = (HashJoin) node;
        StatisticsLookup statistics = context.statistics();
        if (!statistics.coversScansOf(join)
                || !Orderings.isSortedOn(join.left(), List.of(join.leftKey()), statistics)
                || !Orderings.isSortedOn(join.right(), List.of(join.rightKey()), statistics)) {
            return node;
        }
        return new MergeJoin(join.id(), join.logicalId(), join.left(), join.right(), join.joinType(), join.leftKey(),
                join.rightKey(), join.alias(), join.estimate());
    }

    @Override
    public int getPriority() {
        return 80;
    }
}
