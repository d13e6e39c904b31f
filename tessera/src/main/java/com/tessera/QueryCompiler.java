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
import com.tessera.common.Deadline;
import com.tessera.common.error.PlanningTimeoutException;
import com.tessera.common.error.QueryExecutionException;
import com.tessera.common.schema.SchemaView;
import com.tessera.common.statistics.StatisticsView;
import com.tessera.cqm.CanonicalQueryBuilder;
import com.tessera.cqm.PermissionView;
import com.tessera.executor.ExecutionResult;
import com.tessera.executor.QueryExecutor;
import com.tessera.planner.cqm.CanonicalQuery;
import com.tessera.planner.explain.ExplainReport;
import com.tessera.planner.explain.Explainer;
import com.tessera.planner.logical.LogicalPlan;
import com.tessera.planner.logical.LogicalPlanner;
import com.tessera.planner.optimizer.PhysicalOptimizer;
import com.tessera.planner.physical.PhysicalPlan;
import com.tessera.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Compiles client queries into physical plans:
 * {@code Query -> CanonicalQuery -> LogicalPlan -> PhysicalPlan}.
 * <p>
 * A compiler holds no per-query state and may be shared between threads. Each compilation runs
 * under its own deadline, taken from the query's {@code timeout_ms} or the configured default, and
 * reads one snapshot of the schema and statistics views.
 */
public class QueryCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryCompiler.class);

    private final CompilerSettings settings;
    private final Ticker ticker;
    private final CanonicalQueryBuilder builder;
    private final LogicalPlanner logicalPlanner = new LogicalPlanner();
    private final PhysicalOptimizer optimizer;
    private final Explainer explainer;

    public QueryCompiler() {
        this(CompilerSettings.load());
    }

    public QueryCompiler(CompilerSettings settings) {
        this(settings, Ticker.systemTicker(), () -> UUID.randomUUID().toString());
    }

    public QueryCompiler(CompilerSettings settings, Ticker ticker, Supplier<String> idGenerator) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
        this.builder = new CanonicalQueryBuilder(settings.getBuildSettings(), idGenerator);
        this.optimizer = new PhysicalOptimizer(settings.getOptimizerSettings());
        this.explainer = new Explainer(settings.getMisestimateRatio());
    }

    public CompilerSettings getSettings() {
        return settings;
    }

    /**
     * Runs the whole pipeline.
     *
     * @throws com.tessera.common.error.QueryValidationException with every problem of an invalid query
     * @throws PlanningTimeoutException                         if compilation outlives the deadline
     */
    public CompiledQuery compile(Query query, SchemaView schema, PermissionView permissions,
                                 StatisticsView statistics) {
        Objects.requireNonNull(query, "query must not be null");
        Deadline deadline = deadlineFor(query);

        CanonicalQuery canonical = builder.build(query, schema, permissions, deadline);
        deadline.check("logical planning");
        LogicalPlan logical = logicalPlanner.planAndValidate(canonical);
        deadline.check("physical optimization");
        PhysicalPlan physical = optimizer.optimize(logical, statistics.snapshot(), deadline);
        ExplainReport explain = canonical.options().explain() ? explainer.explain(physical) : null;

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Compiled query {} on '{}': {} physical nodes, total cost {}{}", canonical.queryId(),
                    canonical.entity(), physical.nodes().size(), physical.totalCost(),
                    physical.costed() ? "" : " (uncosted)");
        }
        return new CompiledQuery(canonical, logical, physical, explain);
    }

    /**
     * Hands a compiled plan to an executor. Executor failures are never interpreted or retried.
     *
     * @throws QueryExecutionException wrapping whatever the executor threw
     */
    public ExecutionResult execute(CompiledQuery compiled, QueryExecutor executor, String correlationId) {
        Objects.requireNonNull(executor, "executor must not be null");
        String queryId = compiled.queryId();
        try {
            return executor.execute(compiled.physical(), compiled.canonical().tenant());
        } catch (Exception e) {
            LOGGER.warn("Execution of query {} failed (correlation id: {})", queryId, correlationId, e);
            throw new QueryExecutionException(queryId, correlationId, e);
        }
    }

    /**
     * Explains a plan after it ran, comparing estimated and actual row counts.
     */
    public ExplainReport explain(CompiledQuery compiled, ExecutionResult result) {
        return explainer.explain(compiled.physical(), result.stats());
    }

    private Deadline deadlineFor(Query query) {
        Long timeoutMillis = query.options().timeoutMillis();
        Duration budget = timeoutMillis == null ? settings.getDefaultTimeout() : Duration.ofMillis(timeoutMillis);
        return Deadline.after(budget, ticker);
    }
}
