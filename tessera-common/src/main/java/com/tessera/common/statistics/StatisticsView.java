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

package com.tessera.common.statistics;

import com.tessera.common.filter.Operator;
import com.tessera.common.value.Value;

import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Read-only access to data statistics. Empty results, and
 * {@link StatisticsUnavailableException}, mean the answer is not known.
 */
public interface StatisticsView {

    /**
     * A view that knows nothing.
     */
    StatisticsView NONE = new StatisticsView() {
        @Override
        public OptionalLong cardinality(String entity) {
            return OptionalLong.empty();
        }

        @Override
        public OptionalDouble selectivity(String entity, String fieldId, Operator operator, List<Value> values) {
            return OptionalDouble.empty();
        }

        @Override
        public boolean isSorted(String entity, List<String> fieldIds) {
            return false;
        }
    };

    OptionalLong cardinality(String entity);

    /**
     * Fraction of rows, in {@code [0, 1]}, expected to satisfy {@code field operator values}.
     */
    OptionalDouble selectivity(String entity, String fieldId, Operator operator, List<Value> values);

    /**
     * Returns true if the entity's natural scan order is sorted on {@code fieldIds}, in that order.
     */
    boolean isSorted(String entity, List<String> fieldIds);

    default StatisticsView snapshot() {
        return this;
    }
}
