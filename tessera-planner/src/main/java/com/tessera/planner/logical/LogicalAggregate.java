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
import com.tessera.common.schema.FieldRef;
import com.tessera.planner.cqm.CanonicalAggregate;
import com.tessera.planner.cqm.OutputColumn;

import javax.annotation.Nullable;
import java.util.List;

public record LogicalAggregate(int id, LogicalNode input, List<FieldRef> groupBy, List<CanonicalAggregate> aggregates,
                               @Nullable Filter<OutputColumn> having) implements LogicalNode {
    public LogicalAggregate {
        groupBy = List.copyOf(groupBy);
        aggregates = List.copyOf(aggregates);
    }

    @Override
    public List<LogicalNode> children() {
        return List.of(input);
    }

    @Override
    public <R> R accept(LogicalPlanVisitor<R> visitor) {
        return visitor.visitAggregate(this);
    }
}
