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

import com.tessera.common.value.Value;
import com.tessera.planner.explain.ExecutionStats;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rows produced by an executor, keyed by projected field path, and optional runtime statistics.
 */
public record ExecutionResult(List<Map<String, Value>> rows, @Nullable ExecutionStats stats) {
    public ExecutionResult {
        rows = List.copyOf(rows);
    }

    public Optional<ExecutionStats> statistics() {
        return Optional.ofNullable(stats);
    }
}
