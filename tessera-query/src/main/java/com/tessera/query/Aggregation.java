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

package com.tessera.query;

import com.tessera.common.filter.Filter;

import javax.annotation.Nullable;
import java.util.List;

/**
 * Grouping and aggregate functions. {@code having} filters on aggregate aliases and group-by fields.
 */
public record Aggregation(List<String> groupBy, List<Aggregate> aggregates, @Nullable Filter<String> having) {
    public Aggregation {
        groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        aggregates = aggregates == null ? List.of() : List.copyOf(aggregates);
    }

    public Aggregation(List<String> groupBy, List<Aggregate> aggregates) {
        this(groupBy, aggregates, null);
    }
}
