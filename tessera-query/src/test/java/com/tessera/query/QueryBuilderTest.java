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

import com.tessera.common.filter.Compound;
import com.tessera.common.filter.Condition;
import com.tessera.common.filter.LogicalOperator;
import com.tessera.common.filter.Operator;
import com.tessera.common.model.JoinType;
import com.tessera.common.value.Values;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class QueryBuilderTest {

    @Test
    void shouldBuildQuery() {
        Query query = Query.builder("orders", "acme")
                .where(Where.eq("status", "paid"))
                .include("id", "total")
                .exclude("customer.email")
                .orderBy(Sort.desc("created_at"), Sort.asc("id"))
                .join("customers", "c", JoinType.LEFT, "customer_id", "id")
                .pageSize(25)
                .timeoutMillis(300)
                .build();

        assertEquals("orders", query.entity());
        assertThat(query.projection().include()).containsExactly("id", "total");
        assertThat(query.projection().exclude()).containsExactly("customer.email");
        assertThat(query.sorts()).extracting(Sort::field).containsExactly("created_at", "id");
        assertEquals("c", query.relations().get(0).alias());
        assertEquals(25, query.pagination().pageSize());
        assertEquals(300L, query.options().timeoutMillis());
    }

    @Test
    void shouldAndRepeatedWhereClauses() {
        Query query = Query.builder("orders", "acme")
                .where(Where.eq("status", "paid"))
                .where(Where.gt("total", 100))
                .build();
        Compound<String> filter = assertInstanceOf(Compound.class, query.filter());
        assertEquals(LogicalOperator.AND, filter.operator());
        assertEquals(2, filter.children().size());
    }

    @Test
    void shouldConvertOperandsToValues() {
        Condition<String> between = assertInstanceOf(Condition.class, Where.between("total", 10, 20.5));
        assertEquals(Operator.BETWEEN, between.operator());
        assertEquals(List.of(Values.of(10L), Values.of(20.5)), between.values());

        Condition<String> ignoreCase = assertInstanceOf(Condition.class, Where.eqIgnoreCase("status", "PAID"));
        assertFalse(ignoreCase.caseSensitive());

        Condition<String> isNull = assertInstanceOf(Condition.class, Where.isNull("region"));
        assertTrue(isNull.values().isEmpty());
    }

    @Test
    void shouldKeepPaginationParts() {
        Query query = Query.builder("orders", "acme").pageSize(10).offset(30).build();
        assertEquals(10, query.pagination().pageSize());
        assertEquals(30, query.pagination().offset());
        assertNull(query.pagination().cursor());
    }

    @Test
    void shouldRequireEntityAndTenant() {
        assertThrows(NullPointerException.class, () -> Query.builder(null, "acme").build());
        assertThrows(NullPointerException.class, () -> Query.builder("orders", null).build());
    }
}
