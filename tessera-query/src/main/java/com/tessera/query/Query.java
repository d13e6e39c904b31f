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
import com.tessera.common.model.QueryOptions;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * A client query as submitted, before any resolution against the schema. Field references are
 * raw path strings; nothing here has been validated beyond being non-null where required.
 *
 * @see QueryBuilder
 * @see QueryReader
 */
public final class Query {
    private final String entity;
    private final String tenant;
    private final Filter<String> filter;
    private final List<Sort> sorts;
    private final Projection projection;
    private final Aggregation aggregation;
    private final Search search;
    private final List<Relation> relations;
    private final Pagination pagination;
    private final QueryOptions options;

    Query(QueryBuilder builder) {
        this.entity = Objects.requireNonNull(builder.entity, "entity must not be null");
        this.tenant = Objects.requireNonNull(builder.tenant, "tenant must not be null");
        this.filter = builder.filter;
        this.sorts = List.copyOf(builder.sorts);
        this.projection = new Projection(builder.include, builder.exclude);
        this.aggregation = builder.aggregation;
        this.search = builder.search;
        this.relations = List.copyOf(builder.relations);
        this.pagination = builder.pagination;
        this.options = builder.options;
    }

    public static QueryBuilder builder(String entity, String tenant) {
        return new QueryBuilder(entity, tenant);
    }

    public String entity() {
        return entity;
    }

    /**
     * Tenant key. Isolation itself is enforced by the executor; the compiler only carries it.
     */
    public String tenant() {
        return tenant;
    }

    @Nullable
    public Filter<String> filter() {
        return filter;
    }

    public List<Sort> sorts() {
        return sorts;
    }

    public Projection projection() {
        return projection;
    }

    @Nullable
    public Aggregation aggregation() {
        return aggregation;
    }

    @Nullable
    public Search search() {
        return search;
    }

    public List<Relation> relations() {
        return relations;
    }

    public Pagination pagination() {
        return pagination;
    }

    public QueryOptions options() {
        return options;
    }

    @Override
    public String toString() {
        return "Query{entity='" + entity + "', tenant='" + tenant + "', filter=" + filter + ", sorts=" + sorts
                + ", projection=" + projection + ", aggregation=" + aggregation + ", search=" + search
                + ", relations=" + relations + ", pagination=" + pagination + ", options=" + options + "}";
    }
}
