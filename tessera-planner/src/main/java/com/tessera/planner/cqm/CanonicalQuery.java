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

package com.tessera.planner.cqm;

import com.tessera.common.filter.Filter;
import com.tessera.common.model.QueryOptions;
import com.tessera.common.schema.FieldRef;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fully resolved, validated and normalized form of a query. Every field is a {@link FieldRef},
 * the filter is normalized, the projection is an explicit field set and every join is listed in
 * {@link #relations()} parent first.
 *
 * @param queryId     unique id stamped at construction
 * @param entity      queried entity
 * @param tenant      tenant key, passed through to the executor
 * @param filter      normalized filter, null when the query has none
 * @param sorts       sort keys in priority order
 * @param projection  insertion ordered set of selected fields
 * @param aggregation aggregation, null for plain queries
 * @param search      search, null when the query has none
 * @param relations   joins, parents before children
 * @param limit       page size
 * @param offset      rows to skip
 * @param cursor      opaque continuation token, passed through
 * @param options     execution options
 */
public record CanonicalQuery(
        String queryId,
        String entity,
        String tenant,
        @Nullable Filter<FieldRef> filter,
        List<CanonicalSort> sorts,
        Set<FieldRef> projection,
        @Nullable CanonicalAggregation aggregation,
        @Nullable CanonicalSearch search,
        List<ResolvedRelation> relations,
        int limit,
        int offset,
        @Nullable String cursor,
        QueryOptions options
) {
    public CanonicalQuery {
        Objects.requireNonNull(queryId, "queryId must not be null");
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(tenant, "tenant must not be null");
        Objects.requireNonNull(options, "options must not be null");
        sorts = List.copyOf(sorts);
        projection = Collections.unmodifiableSet(new LinkedHashSet<>(projection));
        relations = List.copyOf(relations);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive integer");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
    }

    public boolean isAggregation() {
        return aggregation != null;
    }

    @Nullable
    public ResolvedRelation relation(String alias) {
        for (ResolvedRelation relation : relations) {
            if (relation.alias().equals(alias)) {
                return relation;
            }
        }
        return null;
    }
}
