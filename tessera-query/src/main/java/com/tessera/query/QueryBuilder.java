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
import com.tessera.common.filter.Filters;
import com.tessera.common.model.JoinType;
import com.tessera.common.model.QueryOptions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fluent builder for {@link Query}.
 *
 * <pre>{@code
 * Query query = Query.builder("orders", "acme")
 *     .where(Where.and(Where.eq("status", "paid"), Where.gt("total", 100)))
 *     .include("id", "total", "customer.name")
 *     .orderBy(Sort.desc("created_at"))
 *     .pageSize(20)
 *     .build();
 * }</pre>
 */
public class QueryBuilder {
    final String entity;
    final String tenant;
    final List<Sort> sorts = new ArrayList<>();
    final List<String> include = new ArrayList<>();
    final List<String> exclude = new ArrayList<>();
    final List<Relation> relations = new ArrayList<>();
    Filter<String> filter;
    Aggregation aggregation;
    Search search;
    Pagination pagination = Pagination.DEFAULT;
    QueryOptions options = QueryOptions.DEFAULT;

    QueryBuilder(String entity, String tenant) {
        this.entity = entity;
        this.tenant = tenant;
    }

    /**
     * Sets the filter; calling it again ANDs the new filter with the existing one.
     */
    public QueryBuilder where(Filter<String> filter) {
        this.filter = this.filter == null ? filter : Filters.and(this.filter, filter);
        return this;
    }

    public QueryBuilder orderBy(Sort... sorts) {
        this.sorts.addAll(Arrays.asList(sorts));
        return this;
    }

    public QueryBuilder include(String... patterns) {
        this.include.addAll(Arrays.asList(patterns));
        return this;
    }

    public QueryBuilder exclude(String... patterns) {
        this.exclude.addAll(Arrays.asList(patterns));
        return this;
    }

    public QueryBuilder aggregate(Aggregation aggregation) {
        this.aggregation = aggregation;
        return this;
    }

    public QueryBuilder search(Search search) {
        this.search = search;
        return this;
    }

    public QueryBuilder join(Relation relation) {
        this.relations.add(relation);
        return this;
    }

    public QueryBuilder join(String entity, String alias, JoinType joinType, String localField, String foreignField) {
        return join(new Relation(entity, alias, joinType, localField, foreignField));
    }

    public QueryBuilder pagination(Pagination pagination) {
        this.pagination = pagination == null ? Pagination.DEFAULT : pagination;
        return this;
    }

    public QueryBuilder pageSize(int pageSize) {
        this.pagination = new Pagination(pageSize, pagination.cursor(), pagination.offset());
        return this;
    }

    public QueryBuilder cursor(String cursor) {
        this.pagination = new Pagination(pagination.pageSize(), cursor, pagination.offset());
        return this;
    }

    public QueryBuilder offset(int offset) {
        this.pagination = new Pagination(pagination.pageSize(), pagination.cursor(), offset);
        return this;
    }

    public QueryBuilder options(QueryOptions options) {
        this.options = options == null ? QueryOptions.DEFAULT : options;
        return this;
    }

    public QueryBuilder timeoutMillis(long timeoutMillis) {
        this.options = options.toBuilder().timeoutMillis(timeoutMillis).build();
        return this;
    }

    public Query build() {
        return new Query(this);
    }
}
