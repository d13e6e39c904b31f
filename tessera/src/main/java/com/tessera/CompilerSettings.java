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

import com.tessera.cqm.BuildSettings;
import com.tessera.planner.optimizer.OptimizerSettings;
import com.tessera.psl.ProjectionLimits;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the whole compilation pipeline, read from the {@code tessera} block of a Typesafe
 * {@link Config}. Defaults live in {@code reference.conf}.
 */
public final class CompilerSettings {
    private final BuildSettings buildSettings;
    private final OptimizerSettings optimizerSettings;
    private final Duration defaultTimeout;
    private final double misestimateRatio;

    public CompilerSettings(BuildSettings buildSettings, OptimizerSettings optimizerSettings, Duration defaultTimeout,
                            double misestimateRatio) {
        this.buildSettings = Objects.requireNonNull(buildSettings, "buildSettings must not be null");
        this.optimizerSettings = Objects.requireNonNull(optimizerSettings, "optimizerSettings must not be null");
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout, "defaultTimeout must not be null");
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be positive");
        }
        this.misestimateRatio = misestimateRatio;
    }

    /**
     * Loads {@code application.conf} layered over {@code reference.conf}.
     */
    public static CompilerSettings load() {
        return fromConfig(ConfigFactory.load());
    }

    public static CompilerSettings fromConfig(Config root) {
        Config config = root.getConfig("tessera");
        ProjectionLimits limits = new ProjectionLimits(
                config.getInt("projection.max_patterns"),
                config.getInt("projection.max_segments"),
                config.getInt("projection.max_recursive_wildcards"));
        BuildSettings build = new BuildSettings(
                config.getInt("query.default_page_size"),
                config.getInt("query.max_page_size"),
                config.getInt("query.max_filter_depth"),
                limits);
        OptimizerSettings optimizer = new OptimizerSettings(
                config.getDouble("optimizer.index_selectivity_threshold"),
                config.getLong("optimizer.nested_loop_max_rows"),
                config.getInt("optimizer.max_optimization_passes"),
                config.getLong("optimizer.default_cardinality"));
        return new CompilerSettings(build, optimizer, config.getDuration("query.default_timeout"),
                config.getDouble("explain.misestimate_ratio"));
    }

    public BuildSettings getBuildSettings() {
        return buildSettings;
    }

    public OptimizerSettings getOptimizerSettings() {
        return optimizerSettings;
    }

    /**
     * Compilation budget for queries that do not set {@code timeout_ms}.
     */
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public double getMisestimateRatio() {
        return misestimateRatio;
    }

    @Override
    public String toString() {
        return "CompilerSettings{build=" + buildSettings + ", optimizer=" + optimizerSettings
                + ", defaultTimeout=" + defaultTimeout + ", misestimateRatio=" + misestimateRatio + "}";
    }
}
