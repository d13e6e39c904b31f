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

import java.util.List;

/**
 * Node of a physical plan: a concrete execution strategy for one logical node.
 * <p>
 * Equality ignores {@link #id()} and {@link #estimate()}, so that an optimization rule returning an
 * equal tree is recognized as a no-op.
 */
public sealed interface PhysicalNode permits TableScan, IndexScan, PhysicalFilter, PhysicalProject, PhysicalSort,
        PhysicalLimit, HashAggregate, SortAggregate, HashJoin, MergeJoin, NestedLoopJoin, PhysicalUnion, HashDistinct {

    int id();

    /**
     * Id of the logical node this node implements.
     */
    int logicalId();

    Estimate estimate();

    List<PhysicalNode> children();

    /**
     * Returns a copy with the given children, in the order of {@link #children()}.
     */
    PhysicalNode withChildren(List<PhysicalNode> children);

    PhysicalNode withEstimate(Estimate estimate);

    <R> R accept(PhysicalPlanVisitor<R> visitor);
}
