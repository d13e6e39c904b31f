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

import java.util.List;
import java.util.Objects;

public record PhysicalFilter(int id, int logicalId, PhysicalNode input, Filter<FieldRef> predicate,
        Estimate estimate)
        implements PhysicalNode {
    @Override
    public List<PhysicalNode> children() {
        return List.of(input);
    }

    @Override
    public PhysicalNode withChildren(List<PhysicalNode> children) {
        return new PhysicalFilter(id, logicalId, children.get(0), predicate, estimate);
    }

    @Override
    public PhysicalFilter withEstimate(Estimate next) {
        return new PhysicalFilter(id, logicalId, input, predicate, next);
    }

    @Override
    public <R> R accept(PhysicalPlanVisitor<R> visitor) {
        return visitor.visitFilter(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PhysicalFilter other)) return false;
        return Objects.equals(input, other.input) &&
               Objects.equals(predicate, other.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, predicate);
    }
}
