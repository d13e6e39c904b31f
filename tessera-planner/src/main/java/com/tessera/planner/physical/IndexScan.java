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

import com.tessera.common.filter.Condition;
import com.tessera.common.schema.FieldRef;

import java.util.List;
import java.util.Objects;

/**
 * Reads the rows matching {@code predicate} through the secondary index on {@code field}. Rows come
 * out ordered by the indexed field.
 */
public record IndexScan(int id, int logicalId, String entity, String alias, FieldRef field,
        Condition<FieldRef> predicate, Estimate estimate)
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
    public IndexScan withEstimate(Estimate next) {
        return new IndexScan(id, logicalId, entity, alias, field, predicate, next);
    }

    @Override
    public <R> R accept(PhysicalPlanVisitor<R> visitor) {
        return visitor.visitIndexScan(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IndexScan other)) return false;
        return Objects.equals(entity, other.entity) &&
               Objects.equals(alias, other.alias) &&
               Objects.equals(field, other.field) &&
               Objects.equals(predicate, other.predicate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, alias, field, predicate);
    }
}
