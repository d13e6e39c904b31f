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

import com.tessera.common.model.SortDirection;
import com.tessera.common.model.NullOrdering;

import java.util.Objects;

/**
 * One sort key. {@code field} is either a field path or, for aggregation queries, an aggregate alias.
 */
public record Sort(String field, SortDirection direction, NullOrdering nulls) {
    public Sort {
        Objects.requireNonNull(field, "field must not be null");
        direction = direction == null ? SortDirection.ASC : direction;
        nulls = nulls == null ? NullOrdering.DEFAULT : nulls;
    }

    public static Sort asc(String field) {
        return new Sort(field, SortDirection.ASC, NullOrdering.DEFAULT);
    }

    public static Sort desc(String field) {
        return new Sort(field, SortDirection.DESC, NullOrdering.DEFAULT);
    }

    public Sort nulls(NullOrdering ordering) {
        return new Sort(field, direction, ordering);
    }
}
