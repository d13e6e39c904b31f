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

package com.tessera.planner.optimizer;

import com.tessera.common.Deadline;
import com.tessera.common.filter.Condition;
import com.tessera.common.filter.Filter;
import com.tessera.common.filter.Filters;
import com.tessera.common.filter.Operator;
import com.tessera.common.schema.FieldRef;
import com.tessera.common.statistics.EntityStatistics;
import com.tessera.common.statistics.InMemoryStatisticsProvider;
import com.tessera.common.statistics.StatisticsUnavailableException;
import com.tessera.common.statistics.StatisticsView;
import com.tessera.common.value.Value;
import com.tessera.common.value.Values;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalLong;

import static com.tessera.planner.PlanFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SelectivityEstimatorTest {
    private static final double DELTA = 1e-9;

    private final Filter<FieldRef> paid = Filters.eq(STATUS, Values.of("paid"));
    private final Filter<FieldRef> large = Filters.condition(TOTAL, Operator.GT, Values.of(100.0));

    private static StatisticsLookup lookup(StatisticsView view) {
        return new StatisticsLookup(view, Deadline.none());
    }

    @Test
    void shouldUseDefaultsWithoutStatistics() {
        StatisticsLookup none = lookup(StatisticsView.NONE);
        assertEquals(0.1, SelectivityEstimator.estimate(paid, none), DELTA);
        assertEquals(0.3, SelectivityEstimator.estimate(large, none), DELTA);
        assertEquals(0.25, SelectivityEstimator.estimate(
                Filters.condition(TOTAL, Operator.BETWEEN, Values.of(1.0), Values.of(2.0)), none), DELTA);
        assertEquals(0.3, SelectivityEstimator.estimate(
                Filters.condition(STATUS, Operator.IN, Values.of("a"), Values.of("b"), Values.of("c")), none), DELTA);
    }

    @Test
    void shouldCombineCompoundsAsIndependentEvents() {
        StatisticsLookup none = lookup(StatisticsView.NONE);
        assertEquals(0.03, SelectivityEstimator.estimate(Filters.and(paid, large), none), DELTA);
        assertEquals(1 - 0.9 * 0.7, SelectivityEstimator.estimate(Filters.or(paid, large), none), DELTA);
        assertEquals(0.9, SelectivityEstimator.estimate(Filters.not(paid), none), DELTA);
    }

    @Test
    void shouldPreferStatistics() {
        InMemoryStatisticsProvider provider = new InMemoryStatisticsProvider();
        provider.update(EntityStatistics.builder("orders", 1_000).field("orders:status", 4, 0.0).build());
        assertEquals(0.25, SelectivityEstimator.estimate(paid, lookup(provider)), DELTA);
    }

    @Test
    void shouldNeverEstimateZero() {
        Filter<FieldRef> allOf = Filters.condition(STATUS, Operator.ARRAY_CONTAINS_ALL,
                Values.of("a"), Values.of("b"), Values.of("c"), Values.of("d"), Values.of("e"));
        assertEquals(SelectivityEstimator.EPSILON, SelectivityEstimator.estimate(allOf, lookup(StatisticsView.NONE)), DELTA);
    }

    @Test
    void shouldTreatUnavailableStatisticsAsUnknown() {
        StatisticsView failing = new StatisticsView() {
            @Override
            public OptionalLong cardinality(String entity) {
                throw new StatisticsUnavailableException("provider offline");
            }

            @Override
            public OptionalDouble selectivity(String entity, String fieldId, Operator operator, List<Value> values) {
                throw new StatisticsUnavailableException("provider offline");
            }

            @Override
            public boolean isSorted(String entity, List<String> fieldIds) {
                throw new StatisticsUnavailableException("provider offline");
            }
        };
        StatisticsLookup lookup = lookup(failing);
        assertEquals(0.1, SelectivityEstimator.estimate((Condition<FieldRef>) paid, lookup), DELTA);
        assertTrue(lookup.cardinality("orders").isEmpty());
        assertFalse(lookup.hasCardinality("orders"));
        assertFalse(lookup.isSorted("orders", List.of(ID)));
    }
}
