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

package com.tessera.planner.physical;

import com.tessera.common.filter.Filter;
import com.tessera.common.schema.FieldRef;
import com.tessera.planner.cqm.CanonicalAggregate;
import com.tessera.planner.cqm.OutputColumn;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Aggregates by building a hash table keyed on the group-by fields.
 */
public record HashAggregate(int id, int logicalId, PhysicalNode input, List<FieldRef> groupBy,
        List<CanonicalAggregate> aggregates, @Nullable Filter<OutputColumn> having, Estimate estimate)
        implements PhysicalNode {
    @Override
    public List<PhysicalNode> children() {
        return List.of(input);
    }

    @Override
    public PhysicalNode withChildren(List<PhysicalNode> children) {
        return new HashAggregate(id, logicalId, children.get(0), groupBy, aggregates, having, estimate);
    }

    @Override
    public HashAggregate withEstimate(Estimate next) {
        return new HashAggregate(id, logicalId, input, groupBy, aggregates, having, next);
    }

    @Override
    public <R> R accept(PhysicalPlanVisitor<R> visitor) {
        return visitor.visitHashAggregate(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof HashAggregate other)) return false;
        return Objects.equals(input, other.input) &&
               Objects.equals(groupBy, other.groupBy) &&
               Objects.equals(aggregates, other.aggregates) &&
               Objects.equals(having, other.having);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, groupBy, aggregates, having);
    }
}
