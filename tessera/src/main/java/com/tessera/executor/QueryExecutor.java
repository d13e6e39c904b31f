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

package com.tessera.executor;

import com.tessera.planner.physical.PhysicalPlan;

/**
 * Runs physical plans against a storage engine. Implementations live outside the compiler.
 */
@FunctionalInterface
public interface QueryExecutor {

    /**
     * @param plan   plan to run
     * @param tenant isolation key of the query; the executor enforces isolation
     * @throws Exception any failure; the compiler reports it unchanged, wrapped with the query and
     *                   correlation ids
     */
    ExecutionResult execute(PhysicalPlan plan, String tenant) throws Exception;
}
