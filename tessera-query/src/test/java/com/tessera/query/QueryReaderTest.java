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

import com.tessera.common.error.ErrorCode;
import com.tessera.common.error.QueryError;
import com.tessera.common.error.QueryValidationException;
import com.tessera.common.filter.Compound;
import com.tessera.common.filter.Condition;
import com.tessera.common.filter.LogicalOperator;
import com.tessera.common.filter.Operator;
import com.tessera.common.model.AggregateFunction;
import com.tessera.common.model.JoinType;
import com.tessera.common.model.SearchMode;
import com.tessera.common.model.SortDirection;
import com.tessera.common.value.Values;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryReaderTest {

    /**
     * Lets test documents use single quotes.
     */
    private static Query read(String json) {
        return QueryReader.read(json.replace('\'', '"'));
    }

    private static QueryValidationException readInvalid(String json) {
        return assertThrows(QueryValidationException.class, () -> read(json));
    }

    @Test
    void shouldReadMinimalQuery() {
        Query query = read("{'entity': 'orders', 'tenant': 'acme'}");
        assertEquals("orders", query.entity());
        assertEquals("acme", query.tenant());
        assertNull(query.filter());
        assertTrue(query.sorts().isEmpty());
        assertTrue(query.projection().include().isEmpty());
        assertNull(query.options().timeoutMillis());
    }

    @Nested
    @DisplayName("filter")
    class FilterSection {

        @Test
        void shouldReadNestedCompounds() {
            Query query = read("{'entity': 'orders', 'tenant': 'acme', 'filter': {'and': ["
                    + "{'field': 'status', 'operator': 'EQ', 'value': 'paid'},"
                    + "{'or': [{'field': 'total', 'operator': 'gt', 'value': 100},"
                    + "        {'not': {'field': 'region', 'operator': 'IN', 'values': ['eu', 'us']}}]}]}}");

            Compound<String> and = assertInstanceOf(Compound.class, query.filter());
            assertEquals(LogicalOperator.AND, and.operator());
            Condition<String> status = assertInstanceOf(Condition.class, and.children().get(0));
            assertEquals("status", status.field());
            assertEquals(List.of(Values.of("paid")), status.values());

            Compound<String> or = assertInstanceOf(Compound.class, and.children().get(1));
            Condition<String> total = assertInstanceOf(Condition.class, or.children().get(0));
            assertEquals(Operator.GT, total.operator());
            assertEquals(List.of(Values.of(100L)), total.values());
            Compound<String> not = assertInstanceOf(Compound.class, or.children().get(1));
            assertEquals(LogicalOperator.NOT, not.operator());
        }

        @Test
        void shouldReadCaseInsensitiveConditions() {
            Query query = read("{'entity': 'orders', 'tenant': 'acme', 'filter': "
                    + "{'field': 'status', 'operator': 'EQ', 'value': 'PAID', 'case_sensitive': false}}");
            Condition<String> condition = assertInstanceOf(Condition.class, query.filter());
            assertFalse(condition.caseSensitive());
        }

        @Test
        void shouldCollectEveryProblem() {
            QueryValidationException e = readInvalid("{'entity': 'orders', 'tenant': 'acme', 'filter': {'and': ["
                    + "{'field': 'status', 'operator': 'LIKE', 'value': 'x'},"
                    + "{'field': 'total', 'operator': 'EQ', 'value': null},"
                    + "{'operator': 'EQ', 'value': 1}]}}");
            assertEquals(3, e.getErrors().size());
            for (QueryError error : e.getErrors()) {
                assertEquals(ErrorCode.SYNTAX_ERROR, error.code());
            }
        }

        @Test
        void shouldRejectValueAndValuesTogether() {
            QueryValidationException e = readInvalid("{'entity': 'orders', 'tenant': 'acme', 'filter': "
                    + "{'field': 'total', 'operator': 'EQ', 'value': 1, 'values': [1]}}");
            assertEquals("total", e.getErrors().get(0).subject());
        }

        @Test
        void shouldRejectEmptyCompound() {
            readInvalid("{'entity': 'orders', 'tenant': 'acme', 'filter': {'or': []}}");
        }
    }

    @Test
    void shouldReadSortsAndProjection() {
        Query query = read("{'entity': 'orders', 'tenant': 'acme',"
                + "'sorts': ['id', {'field': 'created_at', 'direction': 'desc', 'nulls': 'LAST'}],"
                + "'projection': {'include': ['id', 'customer.*'], 'exclude': ['customer.email']}}");
        assertEquals(2, query.sorts().size());
        assertEquals(SortDirection.ASC, query.sorts().get(0).direction());
        assertEquals(SortDirection.DESC, query.sorts().get(1).direction());
        assertEquals(List.of("id", "customer.*"), query.projection().include());
        assertEquals(List.of("customer.email"), query.projection().exclude());
    }

    @Test
    void shouldReadAggregation() {
        Query query = read("{'entity': 'orders', 'tenant': 'acme', 'aggregation': {"
                + "'group_by': ['status'],"
                + "'aggregates': [{'function': 'COUNT', 'alias': 'n'},"
                + "               {'function': 'PERCENTILE', 'field': 'total', 'alias': 'p95', 'percentile': 95}],"
                + "'having': {'field': 'n', 'operator': 'GT', 'value': 10}}}");
        Aggregation aggregation = query.aggregation();
        assertEquals(List.of("status"), aggregation.groupBy());
        assertEquals(AggregateFunction.COUNT, aggregation.aggregates().get(0).function());
        assertEquals(95.0, aggregation.aggregates().get(1).percentile());
        assertNotNull(aggregation.having());
    }

    @Test
    void shouldReadSearchRelationsAndPagination() {
        Query query = read("{'entity': 'orders', 'tenant': 'acme',"
                + "'search': {'query': 'red shoes', 'mode': 'HYBRID', 'fields': ['title'], 'boost': {'title': 2.0},"
                + "           'embedding': [0.1, 0.2], 'min_score': 0.5},"
                + "'relations': [{'entity': 'customers', 'alias': 'c', 'join_type': 'LEFT',"
                + "               'local_field': 'customer_id', 'foreign_field': 'id'}],"
                + "'pagination': {'page_size': 20, 'cursor': 'abc'},"
                + "'options': {'explain': true, 'timeout_ms': 250}}");
        Search search = query.search();
        assertEquals(SearchMode.HYBRID, search.mode());
        assertEquals(List.of(0.1, 0.2), search.embedding());
        assertEquals(2.0, search.boost().get("title"));
        assertEquals(0.5, search.minScore());

        Relation relation = query.relations().get(0);
        assertEquals("c", relation.alias());
        assertEquals(JoinType.LEFT, relation.joinType());

        assertEquals(20, query.pagination().pageSize());
        assertEquals("abc", query.pagination().cursor());
        assertTrue(query.options().explain());
        assertEquals(250L, query.options().timeoutMillis());
    }

    @Test
    void shouldDefaultRelationAliasToEntity() {
        Query query = read("{'entity': 'orders', 'tenant': 'acme', 'relations': "
                + "[{'entity': 'customers', 'local_field': 'customer_id', 'foreign_field': 'id'}]}");
        assertEquals("customers", query.relations().get(0).alias());
        assertEquals(JoinType.INNER, query.relations().get(0).joinType());
    }

    @Test
    void shouldRejectMissingEntityAndTenant() {
        QueryValidationException e = readInvalid("{'filter': null}");
        assertEquals(2, e.getErrors().size());
    }

    @Test
    void shouldRejectNonPositiveTimeout() {
        QueryValidationException e = readInvalid("{'entity': 'orders', 'tenant': 'acme', 'timeout_ms': 0}");
        assertEquals("timeout_ms", e.getErrors().get(0).subject());
    }

    @Test
    void shouldRejectMalformedJson() {
        QueryValidationException e = assertThrows(QueryValidationException.class,
                () -> QueryReader.read("{\"entity\": "));
        assertEquals(ErrorCode.SYNTAX_ERROR, e.getErrors().get(0).code());
    }
}
