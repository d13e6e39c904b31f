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

import com.tessera.common.value.Value;
import com.tessera.common.value.Values;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FiltersTest {
    private final Filter<String> a = Filters.eq("status", Values.of("shipped"));
    private final Filter<String> b = Filters.condition("total", Operator.GT, Values.of(100L));
    private final Filter<String> c = Filters.condition("region", Operator.IS_NULL);

    /**
     * Every combination of present/absent values for the three fields used in this test.
     */
    private static List<Map<String, Value>> rows() {
        List<Map<String, Value>> rows = new ArrayList<>();
        List<Value> statuses = new ArrayList<>();
        statuses.add(null);
        statuses.add(Values.of("shipped"));
        statuses.add(Values.of("pending"));
        List<Value> totals = new ArrayList<>();
        totals.add(null);
        totals.add(Values.of(50L));
        totals.add(Values.of(150L));
        List<Value> regions = new ArrayList<>();
        regions.add(null);
        regions.add(Values.of("eu"));
        for (Value status : statuses) {
            for (Value total : totals) {
                for (Value region : regions) {
                    Map<String, Value> row = new HashMap<>();
                    row.put("status", status);
                    row.put("total", total);
                    row.put("region", region);
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    private static void assertEquivalent(Filter<String> expected, Filter<String> actual) {
        for (Map<String, Value> row : rows()) {
            assertEquals(FilterEvaluator.evaluate(expected, row::get), FilterEvaluator.evaluate(actual, row::get),
                    () -> "rows disagree on " + row + " for " + expected + " and " + actual);
        }
    }

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        void shouldIgnoreOperandOrder() {
            assertEquals(Filters.normalize(Filters.and(a, b, c)), Filters.normalize(Filters.and(c, a, b)));
            assertEquals(Filters.normalize(Filters.or(a, b)), Filters.normalize(Filters.or(b, a)));
        }

        @Test
        void shouldBeIdempotent() {
            Filter<String> filter = Filters.or(Filters.and(b, a), Filters.not(Filters.not(c)), Filters.and(a, b));
            Filter<String> once = Filters.normalize(filter);
            assertEquals(once, Filters.normalize(once));
        }

        @Test
        void shouldFlattenNestedCompoundsWithTheSameOperator() {
            Filter<String> normalized = Filters.normalize(Filters.and(Filters.and(a, b), c));
            Compound<String> compound = assertInstanceOf(Compound.class, normalized);
            assertEquals(LogicalOperator.AND, compound.operator());
            assertEquals(3, compound.children().size());
        }

        @Test
        void shouldNotFlattenAcrossOperators() {
            Filter<String> normalized = Filters.normalize(Filters.and(Filters.or(a, b), c));
            Compound<String> compound = assertInstanceOf(Compound.class, normalized);
            assertEquals(2, compound.children().size());
        }

        @Test
        void shouldRemoveDuplicatesAndUnwrapSingleChild() {
            assertEquals(a, Filters.normalize(Filters.and(a, a)));
            assertEquals(a, Filters.normalize(Filters.or(a)));
        }

        @Test
        void shouldCollapseDoubleNegation() {
            assertEquals(a, Filters.normalize(Filters.not(Filters.not(a))));
        }

        @Test
        void shouldPreserveMeaning() {
            Filter<String> filter = Filters.or(Filters.and(b, Filters.and(a, c)), Filters.not(Filters.not(b)));
            assertEquivalent(filter, Filters.normalize(filter));
        }
    }

    @Nested
    @DisplayName("pushNegation")
    class PushNegation {

        @Test
        void shouldApplyDeMorganToConjunctions() {
            Filter<String> filter = Filters.not(Filters.and(a, b));
            Filter<String> pushed = Filters.pushNegation(filter);
            Compound<String> compound = assertInstanceOf(Compound.class, pushed);
            assertEquals(LogicalOperator.OR, compound.operator());
            assertEquivalent(filter, pushed);
        }

        @Test
        void shouldApplyDeMorganToDisjunctions() {
            Filter<String> filter = Filters.not(Filters.or(a, Filters.not(c)));
            Filter<String> pushed = Filters.pushNegation(filter);
            Compound<String> compound = assertInstanceOf(Compound.class, pushed);
            assertEquals(LogicalOperator.AND, compound.operator());
            assertEquivalent(filter, pushed);
        }
    }

    @Test
    void shouldSplitConjunctsAndRebuildThem() {
        Filter<String> filter = Filters.and(a, Filters.or(b, c));
        List<Filter<String>> conjuncts = Filters.conjuncts(filter);
        assertEquals(2, conjuncts.size());
        assertEquivalent(filter, Filters.conjunction(conjuncts));
        assertEquals(List.of(b), Filters.conjuncts(b));
    }

    @Test
    void shouldCollectReferencedFields() {
        Filter<String> filter = Filters.or(a, Filters.not(Filters.and(b, c)));
        assertEquals(3, Filters.fields(filter).size());
        assertTrue(Filters.fields(filter).contains("region"));
    }

    @Nested
    @DisplayName("rejectsNullsOf")
    class RejectsNulls {

        @Test
        void shouldRejectNullsThroughAnyConjunct() {
            assertTrue(Filters.rejectsNullsOf(Filters.and(a, c), "status"));
            assertFalse(Filters.rejectsNullsOf(Filters.and(a, c), "region"));
        }

        @Test
        void shouldRequireEveryDisjunctToRejectNulls() {
            assertTrue(Filters.rejectsNullsOf(Filters.or(a, Filters.eq("status", Values.of("pending"))), "status"));
            assertFalse(Filters.rejectsNullsOf(Filters.or(a, b), "status"));
        }

        @Test
        void shouldNeverRejectNullsUnderNegation() {
            assertFalse(Filters.rejectsNullsOf(Filters.not(a), "status"));
        }
    }

    @Test
    void shouldRenderDeterministically() {
        Filter<String> filter = Filters.and(b, a);
        assertEquals(Filters.render(Filters.normalize(Filters.and(a, b))), Filters.render(Filters.normalize(filter)));
        assertTrue(Filters.render(filter).startsWith("AND("));
        assertEquals("region IS_NULL", Filters.render(c));
    }
}
