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

package com.tessera;

import com.google.common.base.Ticker;
import com.tessera.common.error.ErrorCode;
import com.tessera.common.error.PlanningTimeoutException;
import com.tessera.common.error.QueryExecutionException;
import com.tessera.common.error.QueryValidationException;
import com.tessera.common.filter.Operator;
import com.tessera.common.model.QueryOptions;
import com.tessera.common.schema.InMemorySchemaRegistry;
import com.tessera.common.statistics.EntityStatistics;
import com.tessera.common.statistics.InMemoryStatisticsProvider;
import com.tessera.common.statistics.StatisticsView;
import com.tessera.common.value.Value;
import com.tessera.common.value.Values;
import com.tessera.cqm.PermissionView;
import com.tessera.executor.ExecutionResult;
import com.tessera.planner.explain.ExecutionStats;
import com.tessera.planner.explain.ExplainReport;
import com.tessera.planner.explain.NodeReport;
import com.tessera.planner.logical.LogicalAggregate;
import com.tessera.planner.logical.LogicalFilter;
import com.tessera.planner.logical.LogicalLimit;
import com.tessera.planner.logical.LogicalProject;
import com.tessera.planner.logical.LogicalScan;
import com.tessera.planner.physical.HashAggregate;
import com.tessera.planner.physical.IndexScan;
import com.tessera.planner.physical.PhysicalFilter;
import com.tessera.planner.physical.PhysicalLimit;
import com.tessera.planner.physical.PhysicalPlan;
import com.tessera.planner.physical.PhysicalProject;
import com.tessera.planner.physical.PlanWarning;
import com.tessera.planner.physical.TableScan;
import com.tessera.query.Aggregate;
import com.tessera.query.Aggregation;
import com.tessera.query.Query;
import com.tessera.query.QueryBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

import static com.tessera.query.Where.eq;
import static org.junit.jupiter.api.Assertions.*;

class QueryCompilerTest {
    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = new Ticker() {
        @Override
        public long read() {
            return nanos.get();
        }
    };

    private InMemorySchemaRegistry schema;
    private InMemoryStatisticsProvider statistics;
    private QueryCompiler compiler;

    @BeforeEach
    void setUp() {
        schema = TestSchemas.orders();
        statistics = new InMemoryStatisticsProvider();
        compiler = new QueryCompiler(CompilerSettings.load(), ticker, () -> "q-1");
    }

    private static QueryBuilder paidOrdersPerCustomer() {
        return Query.builder("orders", "acme")
                .where(eq("status", "paid"))
                .aggregate(new Aggregation(List.of("customer_id"), List.of(Aggregate.count("orders"))))
                .pageSize(10);
    }

    private CompiledQuery compile(QueryBuilder query) {
        return compiler.compile(query.build(), schema, PermissionView.ALLOW_ALL, statistics);
    }

    @Nested
    @DisplayName("pipeline")
    class Pipeline {

        @Test
        void shouldCompileAggregationOverSelectiveIndexedFilter() {
            statistics.update(EntityStatistics.builder("orders", 100_000).field("orders:status", 50, 0.0).build());

            CompiledQuery compiled = compile(paidOrdersPerCustomer());
            assertEquals("q-1", compiled.queryId());
            assertNull(compiled.explain());

            LogicalLimit logicalLimit = assertInstanceOf(LogicalLimit.class, compiled.logical().root());
            assertEquals(10, logicalLimit.limit());
            LogicalAggregate logicalAggregate = assertInstanceOf(LogicalAggregate.class, logicalLimit.input());
            LogicalProject logicalProject = assertInstanceOf(LogicalProject.class, logicalAggregate.input());
            LogicalFilter logicalFilter = assertInstanceOf(LogicalFilter.class, logicalProject.input());
            LogicalScan logicalScan = assertInstanceOf(LogicalScan.class, logicalFilter.input());
            assertEquals("orders", logicalScan.entity());

            PhysicalPlan physical = compiled.physical();
            assertTrue(physical.costed());
            assertTrue(physical.warnings().isEmpty());
            PhysicalLimit limit = assertInstanceOf(PhysicalLimit.class, physical.root());
            HashAggregate aggregate = assertInstanceOf(HashAggregate.class, limit.input());
            PhysicalProject project = assertInstanceOf(PhysicalProject.class, aggregate.input());
            PhysicalFilter filter = assertInstanceOf(PhysicalFilter.class, project.input());
            IndexScan scan = assertInstanceOf(IndexScan.class, filter.input());
            assertEquals("status", scan.field().path());
            assertEquals(Operator.EQ, scan.predicate().operator());
        }

        @Test
        void shouldScanTableWhenFilterIsNotSelective() {
            statistics.update(EntityStatistics.builder("orders", 100_000).field("orders:status", 4, 0.0).build());

            PhysicalPlan physical = compile(paidOrdersPerCustomer()).physical();
            assertTrue(physical.nodesOfType(IndexScan.class).isEmpty());
            assertEquals(1, physical.nodesOfType(TableScan.class).size());
        }

        @Test
        void shouldPlanWithoutStatistics() {
            CompiledQuery compiled = compiler.compile(paidOrdersPerCustomer().build(), schema,
                    PermissionView.ALLOW_ALL, StatisticsView.NONE);

            PhysicalPlan physical = compiled.physical();
            assertFalse(physical.costed());
            assertTrue(physical.nodesOfType(IndexScan.class).isEmpty());
            assertEquals(PlanWarning.STATISTICS_UNAVAILABLE, physical.warnings().get(0).code());
        }

        @Test
        void shouldPropagateValidationErrors() {
            QueryValidationException e = assertThrows(QueryValidationException.class,
                    () -> compile(Query.builder("orders", "acme").where(eq("nope", 1)).include("missing")));
            assertEquals(2, e.getErrors().size());
            assertTrue(e.hasError(ErrorCode.UNKNOWN_FIELD));
        }

        @Test
        void shouldAttachExplainReportWhenRequested() {
            statistics.update(EntityStatistics.builder("orders", 100_000).field("orders:status", 50, 0.0).build());

            CompiledQuery compiled = compile(paidOrdersPerCustomer()
                    .options(QueryOptions.builder().explain(true).build()));

            ExplainReport report = compiled.explain();
            assertNotNull(report);
            assertEquals("q-1", report.queryId());
            assertEquals(compiled.physical().nodes().size(), report.nodes().size());
            assertEquals("LIMIT", report.nodes().get(0).operator());
            assertTrue(report.costed());
        }
    }

    @Nested
    @DisplayName("deadline")
    class Deadlines {

        @Test
        void shouldTimeOutBeforeCanonicalization() {
            Ticker fast = new Ticker() {
                @Override
                public long read() {
                    return nanos.addAndGet(Duration.ofMillis(10).toNanos());
                }
            };
            QueryCompiler impatient = new QueryCompiler(CompilerSettings.load(), fast, () -> "q-1");

            PlanningTimeoutException e = assertThrows(PlanningTimeoutException.class,
                    () -> impatient.compile(paidOrdersPerCustomer().timeoutMillis(5).build(), schema,
                            PermissionView.ALLOW_ALL, statistics));
            assertEquals("canonicalization", e.getStage());
            assertEquals(ErrorCode.PLANNING_TIMEOUT, e.toQueryError().code());
        }

        @Test
        void shouldTimeOutDuringSlowStatisticsLookups() {
            StatisticsView slow = new StatisticsView() {
                @Override
                public OptionalLong cardinality(String entity) {
                    nanos.addAndGet(Duration.ofSeconds(1).toNanos());
                    return OptionalLong.of(100_000);
                }

                @Override
                public OptionalDouble selectivity(String entity, String fieldId, Operator operator,
                                                  List<Value> values) {
                    nanos.addAndGet(Duration.ofSeconds(1).toNanos());
                    return OptionalDouble.of(0.01);
                }

                @Override
                public boolean isSorted(String entity, List<String> fieldIds) {
                    return false;
                }
            };

            PlanningTimeoutException e = assertThrows(PlanningTimeoutException.class,
                    () -> compiler.compile(paidOrdersPerCustomer().timeoutMillis(100).build(), schema,
                            PermissionView.ALLOW_ALL, slow));
            assertEquals("physical optimization", e.getStage());
        }

        @Test
        void shouldCompileWithLargestTimeout() {
            CompiledQuery compiled = compiler.compile(paidOrdersPerCustomer().timeoutMillis(Long.MAX_VALUE).build(),
                    schema, PermissionView.ALLOW_ALL, statistics);
            assertNotNull(compiled.physical());
        }

        @Test
        void shouldFallBackToConfiguredTimeout() {
            assertEquals(Duration.ofSeconds(5), compiler.getSettings().getDefaultTimeout());

            nanos.addAndGet(Duration.ofSeconds(4).toNanos());
            assertNotNull(compile(paidOrdersPerCustomer()).physical());
        }
    }

    @Nested
    @DisplayName("execution")
    class Execution {

        @Test
        void shouldHandPlanToExecutor() {
            CompiledQuery compiled = compile(paidOrdersPerCustomer());
            Map<String, Value> row = Map.of("customer_id", Values.of("c-1"), "orders", Values.of(3L));

            ExecutionResult result = compiler.execute(compiled, (plan, tenant) -> {
                assertSame(compiled.physical(), plan);
                assertEquals("acme", tenant);
                return new ExecutionResult(List.of(row), null);
            }, "corr-1");

            assertEquals(List.of(row), result.rows());
            assertTrue(result.statistics().isEmpty());
        }

        @Test
        void shouldWrapExecutorFailures() {
            CompiledQuery compiled = compile(paidOrdersPerCustomer());
            IOException failure = new IOException("storage node unreachable");

            QueryExecutionException e = assertThrows(QueryExecutionException.class,
                    () -> compiler.execute(compiled, (plan, tenant) -> {
                        throw failure;
                    }, "corr-7"));

            assertEquals("q-1", e.getQueryId());
            assertEquals("corr-7", e.getCorrelationId());
            assertSame(failure, e.getCause());
            assertEquals(ErrorCode.EXECUTION_ERROR, e.toQueryError().code());
        }

        @Test
        void shouldExplainWithActualRows() {
            statistics.update(EntityStatistics.builder("orders", 100_000).field("orders:status", 50, 0.0).build());
            CompiledQuery compiled = compile(paidOrdersPerCustomer());
            int rootId = compiled.physical().root().id();

            ExplainReport report = compiler.explain(compiled,
                    new ExecutionResult(List.of(), new ExecutionStats(Map.of(rootId, 7L), 12)));

            NodeReport root = report.nodes().get(0);
            assertEquals(Long.valueOf(7), root.actualRows());
            assertNotNull(root.ratio());
        }
    }
}
