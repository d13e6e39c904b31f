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

import com.tessera.planner.PlannerContext;
import com.tessera.planner.logical.LogicalAggregate;
import com.tessera.planner.logical.LogicalDistinct;
import com.tessera.planner.logical.LogicalFilter;
import com.tessera.planner.logical.LogicalJoin;
import com.tessera.planner.logical.LogicalLimit;
import com.tessera.planner.logical.LogicalNode;
import com.tessera.planner.logical.LogicalPlanVisitor;
import com.tessera.planner.logical.LogicalProject;
import com.tessera.planner.logical.LogicalScan;
import com.tessera.planner.logical.LogicalSort;
import com.tessera.planner.logical.LogicalUnion;
import com.tessera.planner.physical.Estimate;
import com.tessera.planner.physical.HashAggregate;
import com.tessera.planner.physical.HashDistinct;
import com.tessera.planner.physical.HashJoin;
import com.tessera.planner.physical.PhysicalFilter;
import com.tessera.planner.physical.PhysicalLimit;
import com.tessera.planner.physical.PhysicalNode;
import com.tessera.planner.physical.PhysicalProject;
import com.tessera.planner.physical.PhysicalSort;
import com.tessera.planner.physical.PhysicalUnion;
import com.tessera.planner.physical.TableScan;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps every logical node to its default physical strategy: table scans, hash joins, hash
 * aggregation and hash distinct.
 */
final class PhysicalTranslator implements LogicalPlanVisitor<PhysicalNode> {
    private final PlannerContext context;

    PhysicalTranslator(PlannerContext context) {
        this.context = context;
    }

    PhysicalNode translate(LogicalNode node) {
        return node.accept(this);
    }

    @Override
    public PhysicalNode visitScan(LogicalScan node) {
        return new TableScan(context.nextId(), node.id(), node.entity(), node.alias(), node.kind(), node.search(),
                Estimate.ZERO);
    }

    @Override
    public PhysicalNode visitFilter(LogicalFilter node) {
        return new PhysicalFilter(context.nextId(), node.id(), translate(node.input()), node.predicate(), Estimate.ZERO);
    }

    @Override
    public PhysicalNode visitProject(LogicalProject node) {
        return new PhysicalProject(context.nextId(), node.id(), translate(node.input()), node.fields(), Estimate.ZERO);
    }

    @Override
    public PhysicalNode visitSort(LogicalSort node) {
        return new PhysicalSort(context.nextId(), node.id(), translate(node.input()), node.keys(), Estimate.ZERO);
    }

    @Override
    public PhysicalNode visitLimit(LogicalLimit node) {
        return new PhysicalLimit(context.nextId(), node.id(), translate(node.input()), node.limit(), node.offset(),
                node.cursor(), Estimate.ZERO);
    }

    @Override
    public PhysicalNode visitAggregate(LogicalAggregate node) {
        return new HashAggregate(context.nextId(), node.id(), translate(node.input()), node.groupBy(), node.aggregates(),
                node.having(), Estimate.ZERO);
    }

    @Override
    public PhysicalNode visitJoin(LogicalJoin node) {
        return new HashJoin(context.nextId(), node.id(), translate(node.left()), translate(node.right()),
                node.joinType(), node.leftKey(), node.rightKey(), node.alias(), Estimate.ZERO);
    }

    @Override
    public PhysicalNode visitUnion(LogicalUnion node) {
        List<PhysicalNode> inputs = new ArrayList<>(node.inputs().size());
        for (LogicalNode input : node.inputs()) {
            inputs.add(translate(input));
        }
        return new PhysicalUnion(context.nextId(), node.id(), inputs, Estimate.ZERO);
    }

    @Override
    public PhysicalNode visitDistinct(LogicalDistinct node) {
        return new HashDistinct(context.nextId(), node.id(), translate(node.input()), Estimate.ZERO);
    }
}
