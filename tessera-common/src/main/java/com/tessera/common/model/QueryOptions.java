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

package com.tessera.common.model;

import javax.annotation.Nullable;

/**
 * Immutable execution options travelling with a query from the client down to the physical plan.
 *
 * <pre>{@code
 * QueryOptions options = QueryOptions.builder()
 *     .timeoutMillis(200)
 *     .explain(true)
 *     .build();
 * }</pre>
 */
public class QueryOptions {
    public static final QueryOptions DEFAULT = builder().build();

    /**
     * Planning budget; null means the configured default applies.
     */
    private final Long timeoutMillis;
    private final boolean explain;
    private final boolean countTotal;
    private final boolean distinct;
    private final Consistency consistency;

    private QueryOptions(Builder builder) {
        this.timeoutMillis = builder.timeoutMillis;
        this.explain = builder.explain;
        this.countTotal = builder.countTotal;
        this.distinct = builder.distinct;
        this.consistency = builder.consistency;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    public Long timeoutMillis() {
        return timeoutMillis;
    }

    /**
     * Whether the compiler should attach an explain report to the compiled query.
     */
    public boolean explain() {
        return explain;
    }

    /**
     * Whether the executor should compute the total number of matching rows.
     */
    public boolean countTotal() {
        return countTotal;
    }

    /**
     * Whether duplicate result rows must be removed.
     */
    public boolean distinct() {
        return distinct;
    }

    public Consistency consistency() {
        return consistency;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.timeoutMillis = timeoutMillis;
        builder.explain = explain;
        builder.countTotal = countTotal;
        builder.distinct = distinct;
        builder.consistency = consistency;
        return builder;
    }

    @Override
    public String toString() {
        return "QueryOptions{timeoutMillis=" + timeoutMillis + ", explain=" + explain + ", countTotal=" + countTotal
                + ", distinct=" + distinct + ", consistency=" + consistency + "}";
    }

    public static class Builder {
        private Long timeoutMillis;
        private boolean explain = false;
        private boolean countTotal = false;
        private boolean distinct = false;
        private Consistency consistency = Consistency.STRONG;

        public Builder timeoutMillis(long timeoutMillis) {
            if (timeoutMillis <= 0) {
                throw new IllegalArgumentException("timeoutMillis must be a positive integer");
            }
            this.timeoutMillis = timeoutMillis;
            return this;
        }

        public Builder explain(boolean explain) {
            this.explain = explain;
            return this;
        }

        public Builder countTotal(boolean countTotal) {
            this.countTotal = countTotal;
            return this;
        }

        public Builder distinct(boolean distinct) {
            this.distinct = distinct;
            return this;
        }

        public Builder consistency(Consistency consistency) {
            if (consistency == null) {
                throw new IllegalArgumentException("consistency must not be null");
            }
            this.consistency = consistency;
            return this;
        }

        public QueryOptions build() {
            return new QueryOptions(this);
        }
    }
}
