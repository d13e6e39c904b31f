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

package com.tessera.planner.cqm;

import com.tessera.common.filter.Filter;
import com.tessera.common.schema.FieldRef;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

public record CanonicalAggregation(List<FieldRef> groupBy, List<CanonicalAggregate> aggregates,
                                   @Nullable Filter<OutputColumn> having) {
    public CanonicalAggregation {
        groupBy = List.copyOf(groupBy);
        aggregates = List.copyOf(aggregates);
    }

    /**
     * Group-by columns followed by aggregate columns, in declaration order.
     */
    public List<OutputColumn> outputColumns() {
        List<OutputColumn> columns = new ArrayList<>(groupBy.size() + aggregates.size());
        for (FieldRef field : groupBy) {
            columns.add(OutputColumn.of(field));
        }
        for (CanonicalAggregate aggregate : aggregates) {
            columns.add(aggregate.output());
        }
        return columns;
    }

    /**
     * Fields the aggregation reads from its input.
     */
    public List<FieldRef> inputFields() {
        List<FieldRef> fields = new ArrayList<>(groupBy);
        for (CanonicalAggregate aggregate : aggregates) {
            if (aggregate.field() != null && !fields.contains(aggregate.field())) {
                fields.add(aggregate.field());
            }
        }
        return fields;
    }
}
