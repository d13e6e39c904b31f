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

import com.tessera.planner.physical.HashAggregate;
import com.tessera.planner.physical.PhysicalNode;
import com.tessera.planner.physical.SortAggregate;

/**
 * Streams groups with a sort aggregate when the input is already ordered on the group-by fields.
 */
public class SortAggregateSelectionRule extends BottomUpRule {

    public SortAggregateSelectionRule() {
        super(HashAggregate.class);
    }

    @Override
    protected PhysicalNode rewrite(PhysicalNode node, OptimizerContext context) {
        HashAggregate aggregate = (HashAggregate) node;
        if (aggregate.groupBy().isEmpty()
                || !context.statistics().coversScansOf(aggregate.input())
                || !Orderings.isSortedOn(aggregate.input(), aggregate.groupBy(), context.statistics())) {
            return node;
        }
        return new SortAggregate(aggregate.id(), aggregate.logicalId(), aggregate.input(), aggregate.groupBy(),
                aggregate.aggregates(), aggregate.having(), aggregate.estimate());
    }

    @Override
    public int getPriority() {
        return 40;
    }
}
