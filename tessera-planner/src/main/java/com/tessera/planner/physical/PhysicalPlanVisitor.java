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

public interface PhysicalPlanVisitor<R> {
    R visitTableScan(TableScan node);

    R visitIndexScan(IndexScan node);

    R visitFilter(PhysicalFilter node);

    R visitProject(PhysicalProject node);

    R visitSort(PhysicalSort node);

    R visitLimit(PhysicalLimit node);

    R visitHashAggregate(HashAggregate node);

    R visitSortAggregate(SortAggregate node);

    R visitHashJoin(HashJoin node);

    R visitMergeJoin(MergeJoin node);

    R visitNestedLoopJoin(NestedLoopJoin node);

    R visitUnion(PhysicalUnion node);

    R visitHashDistinct(HashDistinct node);
}
