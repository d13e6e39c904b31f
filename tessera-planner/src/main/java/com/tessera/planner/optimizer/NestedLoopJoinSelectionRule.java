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
import com.tessera.planner.physical.NestedLoopJoin;
import com.tessera.planner.physical.PhysicalNode;

/**
 * Replaces a hash join by a nested loop join when one input is known, from statistics, to be tiny.
 * Estimates resting on default cardinalities never qualify.
 */
public class NestedLoopJoinSelectionRule extends BottomUpRule {

    public NestedLoopJoinSelectionRule() {
        super(HashJoin.class);
    }

    @Override
    protected PhysicalNode rewrite(PhysicalNode node, OptimizerContext context) {
        HashJoin join = (HashJoin) node;
        long maxRows = context.settings().nestedLoopMaxRows();
        boolean smallLeft = isSmall(join.left(), maxRows, context.statistics());
        boolean smallRight = isSmall(join.right(), maxRows, context.statistics());
        if (!smallLeft && !smallRight) {
            return node;
        }
        return new NestedLoopJoin(join.id(), join.logicalId(), join.left(), join.right(), join.joinType(),
                join.leftKey(), join.rightKey(), join.alias(), join.estimate());
    }

    private static boolean isSmall(PhysicalNode node, long maxRows, StatisticsLookup statistics) {
        return node.estimate().rows() <= maxRows && statistics.coversScansOf(node);
    }

    @Override
    public int getPriority() {
        return 60;
    }
}
