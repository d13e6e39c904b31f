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

import java.util.List;
import java.util.Objects;

public record PhysicalUnion(int id, int logicalId, List<PhysicalNode> inputs, Estimate estimate)
        implements PhysicalNode {
    public PhysicalUnion {
        inputs = List.copyOf(inputs);
    }

    @Override
    public List<PhysicalNode> children() {
        return inputs;
    }

    @Override
    public PhysicalNode withChildren(List<PhysicalNode> children) {
        return new PhysicalUnion(id, logicalId, children, estimate);
    }

    @Override
    public PhysicalUnion withEstimate(Estimate next) {
        return new PhysicalUnion(id, logicalId, inputs, next);
    }

    @Override
    public <R> R accept(PhysicalPlanVisitor<R> visitor) {
        return visitor.visitUnion(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PhysicalUnion other)) return false;
        return Objects.equals(inputs, other.inputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inputs);
    }
}
