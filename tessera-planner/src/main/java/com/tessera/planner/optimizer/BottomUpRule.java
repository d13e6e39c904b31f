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

package com.tessera.planner.optimizer;

import com.tessera.planner.physical.PhysicalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for rules that rewrite individual nodes. The tree is walked bottom-up so that a
 * node is rewritten after its inputs.
 */
abstract class BottomUpRule implements PhysicalOptimizationRule {
    private final Class<? extends PhysicalNode> target;

    protected BottomUpRule(Class<? extends PhysicalNode> target) {
        this.target = target;
    }

    /**
     * Rewrites a single node whose children have already been processed.
     */
    protected abstract PhysicalNode rewrite(PhysicalNode node, OptimizerContext context);

    @Override
    public PhysicalNode apply(PhysicalNode node, OptimizerContext context) {
        List<PhysicalNode> children = new ArrayList<>(node.children().size());
        boolean changed = false;
        for (PhysicalNode child : node.children()) {
            PhysicalNode rewritten = apply(child, context);
            changed |= rewritten != child;
            children.add(rewritten);
        }
        PhysicalNode current = changed ? node.withChildren(children) : node;
        if (target.isInstance(current)) {
            return rewrite(current, context);
        }
        return current;
    }

    @Override
    public boolean canApply(PhysicalNode node) {
        if (target.isInstance(node)) {
            return true;
        }
        for (PhysicalNode child : node.children()) {
            if (canApply(child)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String getName() {
        return getClass().getSimpleName();
    }
}
