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
import com.tessera.common.value.Values;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStatisticsProviderTest {
    private InMemoryStatisticsProvider provider;

    @BeforeEach
    void setUp() {
        provider = new InMemoryStatisticsProvider();
        provider.update(EntityStatistics.builder("orders", 10_000)
                .field("orders:status", 5, 0.2)
                .field("orders:total", 9_000, 0.0)
                .sortedOn("orders:created_at", "orders:id")
                .build());
    }

    @Test
    void shouldReportCardinality() {
        assertEquals(10_000, provider.cardinality("orders").getAsLong());
        assertTrue(provider.cardinality("customers").isEmpty());
    }

    @Test
    void shouldDeriveSelectivityFromDistinctCounts() {
        assertEquals(0.16, provider.selectivity("orders", "orders:status", Operator.EQ,
                List.of(Values.of("shipped"))).getAsDouble(), 1e-9);
        assertEquals(0.32, provider.selectivity("orders", "orders:status", Operator.IN,
                List.of(Values.of("a"), Values.of("b"))).getAsDouble(), 1e-9);
        assertEquals(0.2, provider.selectivity("orders", "orders:status", Operator.IS_NULL,
                List.of()).getAsDouble(), 1e-9);
        assertEquals(1.0 / 3.0, provider.selectivity("orders", "orders:total", Operator.GT,
                List.of(Values.of(10L))).getAsDouble(), 1e-9);
    }

    @Test
    void shouldReturnEmptyForUnknownFields() {
        assertTrue(provider.selectivity("orders", "orders:region", Operator.EQ,
                List.of(Values.of("eu"))).isEmpty());
        assertTrue(provider.selectivity("customers", "customers:id", Operator.EQ,
                List.of(Values.of("c1"))).isEmpty());
    }

    @Test
    void shouldMatchSortOrderPrefixes() {
        assertTrue(provider.isSorted("orders", List.of("orders:created_at")));
        assertTrue(provider.isSorted("orders", List.of("orders:created_at", "orders:id")));
        assertFalse(provider.isSorted("orders", List.of("orders:id")));
        assertFalse(provider.isSorted("orders", List.of()));
    }

    @Test
    void shouldKeepSnapshotsStable() {
        StatisticsView snapshot = provider.snapshot();
        provider.remove("orders");
        assertTrue(provider.cardinality("orders").isEmpty());
        assertEquals(10_000, snapshot.cardinality("orders").getAsLong());
    }

    @Test
    void shouldKnowNothingWithoutStatistics() {
        assertTrue(StatisticsView.NONE.cardinality("orders").isEmpty());
        assertFalse(StatisticsView.NONE.isSorted("orders", List.of("orders:id")));
    }
}
