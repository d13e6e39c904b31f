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

import com.tessera.common.model.JoinType;
import com.tessera.common.schema.FieldRef;

import java.util.List;
import java.util.Objects;

/**
 * Builds a hash table on the right input and probes it with the left.
 */
public record HashJoin(int id, int logicalId, PhysicalNode left, PhysicalNode right, JoinType joinType,
        FieldRef leftKey, FieldRef rightKey, String alias, Estimate estimate)
        implements PhysicalNode {
    @Override
    public List<PhysicalNode> children() {
        return List.of(left, right);
    }

    @Override
    public PhysicalNode withChildren(List<PhysicalNode> children) {
        return new HashJoin(id, logicalId, children.get(0), children.get(1), joinType, leftKey, rightKey, alias, estimate);
    }

    @Override
    public HashJoin withEstimate(Estimate next) {
        return new HashJoin(id, logicalId, left, right, joinType, leftKey, rightKey, alias, next);
    }

    @Override
    public <R> R accept(PhysicalPlanVisitor<R> visitor) {
        return visitor.visitHashJoin(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof HashJoin other)) return false;
        return Objects.equals(left, other.left) &&
               Objects.equals(right, other.right) &&
               Objects.equals(joinType, other.joinType) &&
               Objects.equals(leftKey, other.leftKey) &&
               Objects.equals(rightKey, other.rightKey) &&
               Objects.equals(alias, other.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, right, joinType, leftKey, rightKey, alias);
    }
}
