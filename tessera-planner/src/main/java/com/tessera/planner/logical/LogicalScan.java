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

import com.tessera.planner.cqm.CanonicalSearch;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Reads one entity. {@code alias} is empty for the queried entity and the relation alias otherwise.
 */
public record LogicalScan(int id, String entity, String alias, ScanKind kind, @Nullable CanonicalSearch search)
        implements LogicalNode {

    @Override
    public List<LogicalNode> children() {
        return List.of();
    }

    @Override
    public <R> R accept(LogicalPlanVisitor<R> visitor) {
        return visitor.visitScan(this);
    }
}
