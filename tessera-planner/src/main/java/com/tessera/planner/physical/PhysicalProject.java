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

import com.tessera.common.schema.FieldRef;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record PhysicalProject(int id, int logicalId, PhysicalNode input, Set<FieldRef> fields, Estimate estimate)
        implements PhysicalNode {
    public PhysicalProject {
        fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
    }

    @Override
    public List<PhysicalNode> children() {
        return List.of(input);
    }

    @Override
    public PhysicalNode withChildren(List<PhysicalNode> children) {
        return new PhysicalProject(id, logicalId, children.get(0), fields, estimate);
    }

    @Override
    public PhysicalProject withEstimate(Estimate next) {
        return new PhysicalProject(id, logicalId, input, fields, next);
    }

    @Override
    public <R> R accept(PhysicalPlanVisitor<R> visitor) {
        return visitor.visitProject(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PhysicalProject other)) return false;
        return Objects.equals(input, other.input) &&
               Objects.equals(fields, other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, fields);
    }
}
