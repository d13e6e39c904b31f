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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Statistics kept in memory and published as immutable snapshots.
 * <p>
 * Selectivity is derived from distinct counts and null fractions; range and string operators use
 * a fixed fraction of the non-null rows. Operators the collected statistics say nothing about
 * return empty.
 */
public class InMemoryStatisticsProvider implements StatisticsView {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryStatisticsProvider.class);
    static final double RANGE_FRACTION = 1.0 / 3.0;
    static final double STRING_MATCH_FRACTION = 0.1;

    private final AtomicReference<Snapshot> current = new AtomicReference<>(new Snapshot(Map.of()));

    public void update(EntityStatistics statistics) {
        current.updateAndGet(snapshot -> {
            Map<String, EntityStatistics> next = new HashMap<>(snapshot.entities);
            next.put(statistics.entity(), statistics);
            return new Snapshot(next);
        });
        LOGGER.debug("Updated statistics for entity '{}': {} rows", statistics.entity(), statistics.rowCount());
    }

    public void remove(String entity) {
        current.updateAndGet(snapshot -> {
            Map<String, EntityStatistics> next = new HashMap<>(snapshot.entities);
            next.remove(entity);
            return new Snapshot(next);
        });
    }

    @Override
    public StatisticsView snapshot() {
        return current.get();
    }

    @Override
    public OptionalLong cardinality(String entity) {
        return current.get().cardinality(entity);
    }

    @Override
    public OptionalDouble selectivity(String entity, String fieldId, Operator operator, List<Value> values) {
        return current.get().selectivity(entity, fieldId, operator, values);
    }

    @Override
    public boolean isSorted(String entity, List<String> fieldIds) {
        return current.get().isSorted(entity, fieldIds);
    }

    static final class Snapshot implements StatisticsView {
        private final Map<String, EntityStatistics> entities;

        Snapshot(Map<String, EntityStatistics> entities) {
            this.entities = Collections.unmodifiableMap(new HashMap<>(entities));
        }

        @Override
        public OptionalLong cardinality(String entity) {
            EntityStatistics statistics = entities.get(entity);
            return statistics == null ? OptionalLong.empty() : OptionalLong.of(statistics.rowCount());
        }

        @Override
        public OptionalDouble selectivity(String entity, String fieldId, Operator operator, List<Value> values) {
            EntityStatistics statistics = entities.get(entity);
            if (statistics == null) {
                return OptionalDouble.empty();
            }
            FieldStatistics field = statistics.fields().get(fieldId);
            if (field == null) {
                return OptionalDouble.empty();
            }
            double nonNull = 1.0 - field.nullFraction();
            double perValue = field.distinctCount() == 0 ? 0.0 : nonNull / field.distinctCount();
            switch (operator) {
                case IS_NULL:
                    return OptionalDouble.of(field.nullFraction());
                case IS_NOT_NULL:
                    return OptionalDouble.of(nonNull);
                case EQ:
                case ARRAY_CONTAINS:
                    return OptionalDouble.of(perValue);
                case NE:
                    return OptionalDouble.of(Math.max(0.0, nonNull - perValue));
                case IN:
                case ARRAY_CONTAINS_ANY:
                    return OptionalDouble.of(Math.min(nonNull, perValue * values.size()));
                case NOT_IN:
                    return OptionalDouble.of(Math.max(0.0, nonNull - perValue * values.size()));
                case LT:
                case LTE:
                case GT:
                case GTE:
                case BETWEEN:
                    return OptionalDouble.of(nonNull * RANGE_FRACTION);
                case CONTAINS:
                case STARTS_WITH:
                case ENDS_WITH:
                case MATCHES:
                    return OptionalDouble.of(nonNull * STRING_MATCH_FRACTION);
                default:
                    return OptionalDouble.empty();
            }
        }

        @Override
        public boolean isSorted(String entity, List<String> fieldIds) {
            EntityStatistics statistics = entities.get(entity);
            if (statistics == null || fieldIds.isEmpty()) {
                return false;
            }
            for (List<String> order : statistics.sortOrders()) {
                if (order.size() >= fieldIds.size() && order.subList(0, fieldIds.size()).equals(fieldIds)) {
                    return true;
                }
            }
            return false;
        }
    }
}
