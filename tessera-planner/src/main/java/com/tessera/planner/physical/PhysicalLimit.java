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

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

public record PhysicalLimit(int id, int logicalId, PhysicalNode input, int limit, int offset,
        @Nullable String cursor, Estimate estimate)
        implements PhysicalNode {
    @Override
    public List<PhysicalNode> children() {
        return List.of(input);
    }

    @Override
    public PhysicalNode withChildren(List<PhysicalNode> children) {
        return new PhysicalLimit(id, logicalId, children.get(0), limit, offset, cursor, estimate);
    }

    @Override
    public PhysicalLimit withEstimate(Estimate next) {
        return new PhysicalLimit(id, logicalId, input, limit, offset, cursor, next);
    }

    @Override
    public <R> R accept(PhysicalPlanVisitor<R> visitor) {
        return visitor.visitLimit(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PhysicalLimit other)) return false;
        return Objects.equals(input, other.input) &&
               Objects.equals(limit, other.limit) &&
               Objects.equals(offset, other.offset) &&
               Objects.equals(cursor, other.cursor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, limit, offset, cursor);
    }
}
