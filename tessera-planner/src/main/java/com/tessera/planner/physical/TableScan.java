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

import com.tessera.planner.cqm.CanonicalSearch;
import com.tessera.planner.logical.ScanKind;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Reads every row of an entity, or every hit of a text/vector search over it.
 */
public record TableScan(int id, int logicalId, String entity, String alias, ScanKind kind,
        @Nullable CanonicalSearch search, Estimate estimate)
        implements PhysicalNode {
    @Override
    public List<PhysicalNode> children() {
        return List.of();
    }

    @Override
    public PhysicalNode withChildren(List<PhysicalNode> children) {
        return this;
    }

    @Override
    public TableScan withEstimate(Estimate next) {
        return new TableScan(id, logicalId, entity, alias, kind, search, next);
    }

    @Override
    public <R> R accept(PhysicalPlanVisitor<R> visitor) {
        return visitor.visitTableScan(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableScan other)) return false;
        return Objects.equals(entity, other.entity) &&
               Objects.equals(alias, other.alias) &&
               Objects.equals(kind, other.kind) &&
               Objects.equals(search, other.search);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, alias, kind, search);
    }
}
