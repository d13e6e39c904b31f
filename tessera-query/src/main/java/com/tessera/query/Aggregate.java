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

import com.tessera.common.model.AggregateFunction;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * One aggregate output column.
 *
 * @param function   aggregate function
 * @param field      input field path, may be null for {@link AggregateFunction#COUNT}
 * @param alias      output column name
 * @param percentile percentile in {@code [0, 100]}, only for {@link AggregateFunction#PERCENTILE}
 */
public record Aggregate(AggregateFunction function, @Nullable String field, String alias, @Nullable Double percentile) {
    public Aggregate {
        Objects.requireNonNull(function, "function must not be null");
        Objects.requireNonNull(alias, "alias must not be null");
    }

    public static Aggregate count(String alias) {
        return new Aggregate(AggregateFunction.COUNT, null, alias, null);
    }

    public static Aggregate of(AggregateFunction function, String field, String alias) {
        return new Aggregate(function, field, alias, null);
    }

    public static Aggregate percentile(String field, double percentile, String alias) {
        return new Aggregate(AggregateFunction.PERCENTILE, field, alias, percentile);
    }
}
