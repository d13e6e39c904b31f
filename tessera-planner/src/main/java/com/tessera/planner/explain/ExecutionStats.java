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

package com.tessera.planner.explain;

import java.util.Map;
import java.util.OptionalLong;

/**
 * Runtime numbers reported by an executor, keyed by physical node id.
 *
 * @param actualRows    rows each node produced
 * @param elapsedMillis wall clock time of the execution
 */
public record ExecutionStats(Map<Integer, Long> actualRows, long elapsedMillis) {
    public ExecutionStats {
        actualRows = Map.copyOf(actualRows);
    }

    public OptionalLong actualRows(int nodeId) {
        Long rows = actualRows.get(nodeId);
        return rows == null ? OptionalLong.empty() : OptionalLong.of(rows);
    }
}
