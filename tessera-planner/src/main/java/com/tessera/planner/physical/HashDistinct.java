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

public record HashDistinct(int id, int logicalId, PhysicalNode input, Estimate estimate) implements PhysicalNode {
    @Override
    public List<PhysicalNode> children() {
        return List.of(input);
    }

    @Override
    public PhysicalNode withChildren(List<PhysicalNode> children) {
        return new HashDistinct(id, logicalId, children.get(0), estimate);
    }

    @Override
    public HashDistinct withEstimate(Estimate next) {
        return new HashDistinct(id, logicalId, input, next);
    }

    @Override
    public <R> R accept(PhysicalPlanVisitor<R> visitor) {
        return visitor.visitHashDistinct(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof HashDistinct other)) return false;
        return Objects.equals(input, other.input);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input);
    }
}
