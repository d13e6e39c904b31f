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

import java.util.List;

/**
 * Node of a logical plan. Every node carries an id that is unique within its plan.
 */
public sealed interface LogicalNode permits LogicalScan, LogicalFilter, LogicalProject, LogicalSort, LogicalLimit,
        LogicalAggregate, LogicalJoin, LogicalUnion, LogicalDistinct {

    int id();

    List<LogicalNode> children();

    <R> R accept(LogicalPlanVisitor<R> visitor);
}
