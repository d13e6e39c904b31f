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

import com.tessera.planner.cqm.CanonicalSort;

import java.util.List;
import java.util.Objects;

public record PhysicalSort(int id, int logicalId, PhysicalNode input, List<CanonicalSort> keys, Estimate estimate)
        implements PhysicalNode {
    public PhysicalSort {
        keys = List.copyOf(keys);
    }

    @Override
    public List<PhysicalNode> children() {
        return List.of(input);
    }

    @Override
    public PhysicalNode withChildren(List<PhysicalNode> children) {
        return new PhysicalSort(id, logicalId, children.get(0), keys, estimate);
    }

    @Override
    public PhysicalSort withEstimate(Estimate next) {
        return new PhysicalSort(id, logicalId, input, keys, next);
    }

    @Override
    public <R> R accept(PhysicalPlanVisitor<R> visitor) {
        return visitor.visitSort(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PhysicalSort other)) return false;
        return Objects.equals(input, other.input) &&
               Objects.equals(keys, other.keys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, keys);
    }
}
