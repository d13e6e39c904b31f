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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A planned query: the root node plus the id of the canonical query it was planned from.
 */
public record LogicalPlan(String queryId, LogicalNode root) {
    public LogicalPlan {
        Objects.requireNonNull(queryId, "queryId must not be null");
        Objects.requireNonNull(root, "root must not be null");
    }

    /**
     * All nodes in pre-order.
     */
    public List<LogicalNode> nodes() {
        List<LogicalNode> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    public <T extends LogicalNode> List<T> nodesOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (LogicalNode node : nodes()) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }

    private static void collect(LogicalNode node, List<LogicalNode> sink) {
        sink.add(node);
        for (LogicalNode child : node.children()) {
            collect(child, sink);
        }
    }
}
