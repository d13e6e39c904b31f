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

import com.tessera.common.Deadline;
import com.tessera.common.error.PlanningTimeoutException;
import com.tessera.common.filter.Filters;
import com.tessera.common.filter.Operator;
import com.tessera.common.model.AggregateFunction;
import com.tessera.common.statistics.EntityStatistics;
import com.tessera.common.statistics.InMemoryStatisticsProvider;
import com.tessera.common.statistics.StatisticsView;
import com.tessera.common.type.FieldType;
import com.tessera.common.value.Value;
import com.tessera.common.value.Values;
import com.tessera.planner.cqm.CanonicalAggregate;
import com.tessera.planner.cqm.CanonicalAggregation;
import com.tessera.planner.cqm.CanonicalQuery;
import com.tessera.planner.cqm.OutputColumn;
import com.tessera.planner.logical.LogicalPlan;
import com.tessera.planner.logical.LogicalPlanner;
import com.tessera.planner.physical.HashAggregate;
import com.tessera.planner.physical.HashJoin;
import com.tessera.planner.physical.IndexScan;
import com.tessera.planner.physical.MergeJoin;
import com.tessera.planner.physical.NestedLoopJoin;
import com.tessera.planner.physical.PhysicalFilter;
import com.tessera.planner.physical.PhysicalLimit;
import com.tessera.planner.physical.PhysicalNode;
import com.tessera.planner.physical.PhysicalPlan;
import com.tessera.planner.physical.PlanWarning;
import com.tessera.planner.physical.SortAggregate;
import com.tessera.planner.physical.TableScan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalLong;

import static com.tessera.planner.PlanFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PhysicalOptimizerTest {
    private final LogicalPlanner planner = new LogicalPlanner();
    private final PhysicalOptimizer optimizer = new PhysicalOptimizer();
    private InMemoryStatisticsProvider statistics;

    @BeforeEach
    void setUp() {
        statistics = new InMemoryStatisticsProvider();
    }

    private PhysicalPlan optimize(CanonicalQuery query, StatisticsView view) {
        LogicalPlan logical = planner.planAndValidate(query);
        return optimizer.optimize(logical, view.snapshot(), Deadline.none());
    }

    private static CanonicalQuery paidOrders() {
        return query().filter(Filters.eq(STATUS, Values.of("paid"))).project(ID, STATUS).build();
    }

    @Nested
    @DisplayName("access paths")
    class AccessPaths {

        @Test
        void shouldUseIndexForSelectiveCondition() {
            statistics.update(EntityStatistics.builder("orders", 100_000).field("orders:status", 50, 0.0).build());

            PhysicalPlan plan = optimize(paidOrders(), statistics);

            PhysicalFilter filter = plan.nodesOfType(PhysicalFilter.class).get(0);
            IndexScan scan = assertInstanceOf(IndexScan.class, filter.input());
            assertEquals(STATUS, scan.field());
            assertEquals(Filters.eq(STATUS, Values.of("paid")), scan.predicate());
            assertTrue(plan.costed());
            assertTrue(plan.warnings().isEmpty());
            assertEquals(2_000, scan.estimate().rows(), 1e-6);
        }

        @Test
        void shouldKeepTableScanForUnselectiveCondition() {
            statistics.update(EntityStatistics.builder("orders", 100_000).field("orders:status", 5, 0.0).build());
            PhysicalPlan plan = optimize(paidOrders(), statistics);
            assertTrue(plan.nodesOfType(IndexScan.class).isEmpty());
            assertEquals(1, plan.nodesOfType(TableScan.class).size());
        }

        @Test
        void shouldIgnoreUnindexedFields() {
            statistics.update(EntityStatistics.builder("orders", 100_000).field("orders:total", 90_000, 0.0).build());
            CanonicalQuery query = query().filter(Filters.eq(TOTAL, Values.of(12.5))).project(ID).build();
            assertTrue(optimize(query, statistics).nodesOfType(IndexScan.class).isEmpty());
        }

        @Test
        void shouldFallBackWithoutStatistics() {
            PhysicalPlan plan = optimize(paidOrders(), StatisticsView.NONE);

            assertFalse(plan.costed());
            assertTrue(plan.nodesOfType(IndexScan.class).isEmpty());
            assertEquals(1, plan.warnings().size());
            PlanWarning warning = plan.warnings().get(0);
            assertEquals(PlanWarning.STATISTICS_UNAVAILABLE, warning.code());
            assertEquals("orders", warning.subject());
            TableScan scan = plan.nodesOfType(TableScan.class).get(0);
            assertEquals(OptimizerSettings.DEFAULT.defaultCardinality(), scan.estimate().rows(), 1e-6);
        }
    }

    @Nested
    @DisplayName("joins")
    class Joins {
        private CanonicalQuery withCustomer() {
            return query().project(ID, CUSTOMER_NAME).relation(CUSTOMER).build();
        }

        @Test
        void shouldHashJoinLargeInputs() {
            statistics.update(EntityStatistics.builder("orders", 100_000).build());
            statistics.update(EntityStatistics.builder("customers", 20_000).build());
            PhysicalPlan plan = optimize(withCustomer(), statistics);
            assertEquals(1, plan.nodesOfType(HashJoin.class).size());
        }

        @Test
        void shouldUseNestedLoopForTinyInput() {
            statistics.update(EntityStatistics.builder("orders", 100_000).build());
            statistics.update(EntityStatistics.builder("customers", 40).build());
            PhysicalPlan plan = optimize(withCustomer(), statistics);
            assertEquals(1, plan.nodesOfType(NestedLoopJoin.class).size());
            assertTrue(plan.nodesOfType(HashJoin.class).isEmpty());
        }

        @Test
        void shouldNotTrustDefaultCardinalityForNestedLoop() {
            OptimizerSettings tinyDefault = new OptimizerSettings(0.1, 100, 5, 10);
            statistics.update(EntityStatistics.builder("orders", 100_000).build());
            LogicalPlan logical = planner.planAndValidate(withCustomer());
            PhysicalPlan plan = new PhysicalOptimizer(tinyDefault).optimize(logical, statistics.snapshot(), Deadline.none());
            assertEquals(1, plan.nodesOfType(HashJoin.class).size());
            assertFalse(plan.costed());
        }

        @Test
        void shouldMergeJoinSortedInputs() {
            statistics.update(EntityStatistics.builder("orders", 100_000).sortedOn("orders:customer_id").build());
            statistics.update(EntityStatistics.builder("customers", 20_000).sortedOn("customers:id").build());
            PhysicalPlan plan = optimize(withCustomer(), statistics);
            MergeJoin join = plan.nodesOfType(MergeJoin.class).get(0);
            assertEquals(CUSTOMER_ID, join.leftKey());
            assertEquals(CUSTOMER_KEY, join.rightKey());
        }
    }

    @Nested
    @DisplayName("aggregation")
    class Aggregation {
        private CanonicalQuery countByStatus() {
            CanonicalAggregate count = new CanonicalAggregate(AggregateFunction.COUNT, null, null,
                    new OutputColumn("n", FieldType.INT64, null));
            return query().project(STATUS)
                    .aggregation(new CanonicalAggregation(List.of(STATUS), List.of(count), null))
                    .build();
        }

        @Test
        void shouldHashAggregateByDefault() {
            statistics.update(EntityStatistics.builder("orders", 100_000).build());
            PhysicalPlan plan = optimize(countByStatus(), statistics);
            HashAggregate aggregate = plan.nodesOfType(HashAggregate.class).get(0);
            assertEquals(10_000, aggregate.estimate().rows(), 1e-6);
        }

        @Test
        void shouldSortAggregateSortedInput() {
            statistics.update(EntityStatistics.builder("orders", 100_000).sortedOn("orders:status").build());
            PhysicalPlan plan = optimize(countByStatus(), statistics);
            assertEquals(1, plan.nodesOfType(SortAggregate.class).size());
            assertTrue(plan.nodesOfType(HashAggregate.class).isEmpty());
        }
    }

    @Nested
    @DisplayName("entities without cardinality")
    class MissingCardinality {
        // Answers everything except the row count.
        private final StatisticsView partial = new StatisticsView() {
            @Override
            public OptionalLong cardinality(String entity) {
                return OptionalLong.empty();
            }

            @Override
            public OptionalDouble selectivity(String entity, String fieldId, Operator operator, List<Value> values) {
                return OptionalDouble.of(0.001);
            }

            @Override
            public boolean isSorted(String entity, List<String> fieldIds) {
                return true;
            }
        };

        @Test
        void shouldKeepTableScan() {
            PhysicalPlan plan = optimize(paidOrders(), partial);
            assertTrue(plan.nodesOfType(IndexScan.class).isEmpty());
            assertFalse(plan.costed());
        }

        @Test
        void shouldKeepHashJoin() {
            PhysicalPlan plan = optimize(query().project(ID, CUSTOMER_NAME).relation(CUSTOMER).build(), partial);
            assertEquals(1, plan.nodesOfType(HashJoin.class).size());
            assertTrue(plan.nodesOfType(MergeJoin.class).isEmpty());
            assertTrue(plan.nodesOfType(NestedLoopJoin.class).isEmpty());
        }

        @Test
        void shouldKeepHashAggregate() {
            CanonicalAggregate count = new CanonicalAggregate(AggregateFunction.COUNT, null, null,
                    new OutputColumn("n", FieldType.INT64, null));
            CanonicalQuery query = query().project(STATUS)
                    .aggregation(new CanonicalAggregation(List.of(STATUS), List.of(count), null))
                    .build();

            PhysicalPlan plan = optimize(query, partial);

            assertTrue(plan.nodesOfType(SortAggregate.class).isEmpty());
            assertEquals(1, plan.nodesOfType(HashAggregate.class).size());
            assertEquals(PlanWarning.STATISTICS_UNAVAILABLE, plan.warnings().get(0).code());
        }
    }

    @Test
    void shouldProduceCumulativeCosts() {
        statistics.update(EntityStatistics.builder("orders", 1_000).field("orders:status", 4, 0.0).build());
        PhysicalPlan plan = optimize(paidOrders(), statistics);
        for (PhysicalNode node : plan.nodes()) {
            for (PhysicalNode child : node.children()) {
                assertTrue(node.estimate().cost() >= child.estimate().cost());
            }
        }
        PhysicalLimit limit = assertInstanceOf(PhysicalLimit.class, plan.root());
        assertEquals(plan.totalCost(), limit.estimate().cost());
        assertEquals(50, limit.estimate().rows(), 1e-6);
    }

    @Test
    void shouldAbortWhenDeadlinePassed() {
        LogicalPlan logical = planner.planAndValidate(paidOrders());
        Deadline expired = Deadline.after(Duration.ZERO);
        assertThrows(PlanningTimeoutException.class, () -> optimizer.optimize(logical, statistics, expired));
    }

    @Test
    void shouldStopAfterPassLimit() {
        PhysicalOptimizationRule growingLimit = new PhysicalOptimizationRule() {
            @Override
            public PhysicalNode apply(PhysicalNode node, OptimizerContext context) {
                PhysicalLimit limit = (PhysicalLimit) node;
                return new PhysicalLimit(limit.id(), limit.logicalId(), limit.input(), limit.limit() + 1,
                        limit.offset(), limit.cursor(), limit.estimate());
            }

            @Override
            public String getName() {
                return "growing-limit";
            }

            @Override
            public int getPriority() {
                return 1;
            }

            @Override
            public boolean canApply(PhysicalNode node) {
                return node instanceof PhysicalLimit;
            }
        };
        PhysicalOptimizer looping = new PhysicalOptimizer(new OptimizerSettings(0.1, 100, 3, 1_000), List.of(growingLimit));
        statistics.update(EntityStatistics.builder("orders", 10).build());

        PhysicalPlan plan = looping.optimize(planner.planAndValidate(paidOrders()), statistics, Deadline.none());

        assertEquals(53, ((PhysicalLimit) plan.root()).limit());
        assertEquals(PlanWarning.OPTIMIZER_PASS_LIMIT, plan.warnings().get(0).code());
    }
}
