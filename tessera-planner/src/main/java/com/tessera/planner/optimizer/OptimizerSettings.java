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

/**
 * Tuning knobs of the physical optimizer.
 *
 * @param indexSelectivityThreshold an index scan is chosen only when the predicate keeps fewer
 *                                  than this fraction of rows
 * @param nestedLoopMaxRows         a join side with at most this many estimated rows may be
 *                                  joined by nested loops
 * @param maxOptimizationPasses     upper bound on rule passes before giving up on a fixed point
 * @param defaultCardinality        row count assumed for entities without statistics
 */
public record OptimizerSettings(double indexSelectivityThreshold, long nestedLoopMaxRows, int maxOptimizationPasses,
                                long defaultCardinality) {
    public static final OptimizerSettings DEFAULT = new OptimizerSettings(0.1, 100, 5, 1000);

    public OptimizerSettings {
        if (indexSelectivityThreshold <= 0 || indexSelectivityThreshold > 1) {
            throw new IllegalArgumentException("indexSelectivityThreshold must be within (0, 1]");
        }
        if (nestedLoopMaxRows < 0) {
            throw new IllegalArgumentException("nestedLoopMaxRows must not be negative");
        }
        if (maxOptimizationPasses < 1) {
            throw new IllegalArgumentException("maxOptimizationPasses must be at least 1");
        }
        if (defaultCardinality < 1) {
            throw new IllegalArgumentException("defaultCardinality must be at least 1");
        }
    }
}
