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

package com.tessera.planner.logical;

import com.tessera.common.model.JoinType;
import com.tessera.common.schema.FieldRef;

import java.util.List;

/**
 * Equi-join {@code leftKey = rightKey}. The right input scans the related entity under {@code alias}.
 */
public record LogicalJoin(int id, LogicalNode left, LogicalNode right, JoinType joinType, FieldRef leftKey,
                          FieldRef rightKey, String alias) implements LogicalNode {

    @Override
    public List<LogicalNode> children() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(LogicalPlanVisitor<R> visitor) {
        return visitor.visitJoin(this);
    }
}
