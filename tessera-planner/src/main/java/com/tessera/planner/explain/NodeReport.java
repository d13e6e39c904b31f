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

import javax.annotation.Nullable;

/**
 * Explain line of one physical node.
 *
 * @param id            physical node id
 * @param logicalId     id of the implemented logical node
 * @param depth         distance from the root
 * @param operator      operator name, e.g. {@code HASH_JOIN}
 * @param detail        operator specific description
 * @param estimatedRows estimated output rows
 * @param estimatedCost cumulative estimated cost
 * @param actualRows    rows produced at runtime, null without execution stats
 * @param ratio         misestimate factor ({@code >= 1}), null without execution stats
 */
public record NodeReport(int id, int logicalId, int depth, String operator, String detail, double estimatedRows,
                         double estimatedCost, @Nullable Long actualRows, @Nullable Double ratio) {
}
