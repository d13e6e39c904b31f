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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The optimizer's output.
 *
 * @param queryId  id of the canonical query
 * @param root     root node, always a {@link PhysicalLimit}
 * @param costed   false when some estimate fell back to defaults because statistics were missing
 * @param warnings advisory warnings gathered while optimizing
 */
public record PhysicalPlan(String queryId, PhysicalNode root, boolean costed, List<PlanWarning> warnings) {
    public PhysicalPlan {
        Objects.requireNonNull(queryId, "queryId must not be null");
        Objects.requireNonNull(root, "root must not be null");
        warnings = List.copyOf(warnings);
    }

    public double totalCost() {
        return root.estimate().cost();
    }

    /**
     * All nodes in pre-order.
     */
    public List<PhysicalNode> nodes() {
        List<PhysicalNode> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    public <T extends PhysicalNode> List<T> nodesOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (PhysicalNode node : nodes()) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }

    private static void collect(PhysicalNode node, List<PhysicalNode> sink) {
        sink.add(node);
        for (PhysicalNode child : node.children()) {
            collect(child, sink);
        }
    }
}
