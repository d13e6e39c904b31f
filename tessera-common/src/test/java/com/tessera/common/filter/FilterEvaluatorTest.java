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

package com.tessera.common.filter;

import com.tessera.common.value.ArrayVal;
import com.tessera.common.value.Value;
import com.tessera.common.value.Values;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FilterEvaluatorTest {
    private final Map<String, Value> row = Map.of(
            "status", Values.of("Shipped"),
            "total", Values.of(120L),
            "discount", Values.of(0.5),
            "tags", ArrayVal.of(Values.of("gift"), Values.of("rush")));

    private boolean matches(Filter<String> filter) {
        return FilterEvaluator.evaluate(filter, row::get);
    }

    private static Filter<String> insensitive(String field, Operator operator, Value value) {
        return new Condition<>(field, operator, List.of(value), false);
    }

    @Test
    void shouldCompareNumbersAcrossKinds() {
        assertTrue(matches(Filters.eq("total", Values.of(120.0))));
        assertTrue(matches(Filters.condition("total", Operator.BETWEEN, Values.of(100L), Values.of(120L))));
        assertFalse(matches(Filters.condition("discount", Operator.GT, Values.of(1L))));
    }

    @Test
    void shouldFailOrderingBetweenIncomparableValues() {
        assertFalse(matches(Filters.condition("status", Operator.LT, Values.of(5L))));
        assertFalse(matches(Filters.condition("status", Operator.GTE, Values.of(5L))));
    }

    @Test
    void shouldTreatMissingValuesAsFalseExceptIsNull() {
        assertFalse(matches(Filters.eq("region", Values.of("eu"))));
        assertFalse(matches(Filters.condition("region", Operator.NE, Values.of("eu"))));
        assertTrue(matches(Filters.condition("region", Operator.IS_NULL)));
        assertTrue(matches(Filters.not(Filters.eq("region", Values.of("eu")))));
    }

    @Test
    void shouldHonorCaseSensitivity() {
        assertFalse(matches(Filters.eq("status", Values.of("shipped"))));
        assertTrue(matches(insensitive("status", Operator.EQ, Values.of("shipped"))));
        assertTrue(matches(insensitive("status", Operator.STARTS_WITH, Values.of("SHIP"))));
        assertTrue(matches(insensitive("status", Operator.MATCHES, Values.of("^ship"))));
    }

    @Test
    void shouldFindRegularExpressionAnywhere() {
        assertTrue(matches(Filters.condition("status", Operator.MATCHES, Values.of("ipp"))));
        assertFalse(matches(Filters.condition("status", Operator.MATCHES, Values.of("^ipp"))));
    }

    @Test
    void shouldEvaluateSetOperators() {
        assertTrue(matches(Filters.condition("total", Operator.IN, Values.of(1L), Values.of(120L))));
        assertFalse(matches(Filters.condition("total", Operator.NOT_IN, Values.of(120L))));
    }

    @Test
    void shouldEvaluateArrayOperators() {
        assertTrue(matches(Filters.condition("tags", Operator.ARRAY_CONTAINS, Values.of("gift"))));
        assertTrue(matches(Filters.condition("tags", Operator.ARRAY_CONTAINS_ANY, Values.of("x"), Values.of("rush"))));
        assertFalse(matches(Filters.condition("tags", Operator.ARRAY_CONTAINS_ALL, Values.of("gift"), Values.of("x"))));
        assertFalse(matches(Filters.condition("status", Operator.ARRAY_CONTAINS, Values.of("Shipped"))));
    }

    @Test
    void shouldShortCircuitCompounds() {
        Filter<String> filter = Filters.or(
                Filters.and(Filters.eq("total", Values.of(120L)), Filters.condition("tags", Operator.IS_NOT_NULL)),
                Filters.eq("status", Values.of("pending")));
        assertTrue(matches(filter));
        assertFalse(matches(Filters.not(filter)));
    }
}
