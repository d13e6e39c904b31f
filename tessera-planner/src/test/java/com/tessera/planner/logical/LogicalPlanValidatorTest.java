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

package com.tessera.planner.logical;

import com.tessera.common.filter.Filters;
import com.tessera.common.model.JoinType;
import com.tessera.common.value.Values;
import com.tessera.planner.cqm.CanonicalQuery;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.tessera.planner.PlanFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LogicalPlanValidatorTest {
    private final LogicalPlanValidator validator = new LogicalPlanValidator();

    private static LogicalScan orders(int id) {
        return new LogicalScan(id, "orders", "", ScanKind.TABLE, null);
    }

    @Test
    void shouldAcceptPlannerOutput() {
        CanonicalQuery query = query().filter(Filters.eq(CUSTOMER_NAME, Values.of("Ada")))
                .project(ID, CUSTOMER_NAME).relation(CUSTOMER).build();
        LogicalPlan plan = new LogicalPlanner().plan(query);
        LogicalPlanValidator.ValidationResult result = validator.validate(plan, query);
        assertTrue(result.valid(), () -> result.issues().toString());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void shouldRequireLimitAtRootAndSingleProject() {
        LogicalNode plan = new LogicalProject(2, new LogicalProject(3, orders(4), Set.of(ID)), Set.of(ID));
        LogicalPlanValidator.ValidationResult result = validator.validate(new LogicalPlan("q", plan));
        assertFalse(result.valid());
        assertEquals(2, result.errors().size());
    }

    @Test
    void shouldRejectDuplicateIds() {
        LogicalNode root = new LogicalLimit(1, new LogicalProject(1, orders(2), Set.of(ID)), 10, 0, null);
        assertFalse(validator.isWellFormed(new LogicalPlan("q", root)));
    }

    @Test
    void shouldRejectFieldsReadBeforeTheirJoin() {
        LogicalNode filter = new LogicalFilter(2, orders(3), Filters.eq(CUSTOMER_NAME, Values.of("Ada")));
        LogicalNode join = new LogicalJoin(4, filter, new LogicalScan(5, "customers", "customer", ScanKind.TABLE, null),
                JoinType.INNER, CUSTOMER_ID, CUSTOMER_KEY, "customer");
        LogicalNode root = new LogicalLimit(1, new LogicalProject(6, join, Set.of(ID)), 10, 0, null);

        LogicalPlanValidator.ValidationResult result = validator.validate(new LogicalPlan("q", root));

        assertFalse(result.valid());
        assertEquals("customer.name", result.errors().get(0).field());
    }

    @Test
    void shouldRejectProjectionThatDiffersFromQuery() {
        CanonicalQuery query = query().project(ID, TOTAL).build();
        LogicalNode root = new LogicalLimit(1, new LogicalProject(2, orders(3), Set.of(ID)), 10, 0, null);
        assertFalse(validator.validate(new LogicalPlan("q", root), query).valid());
    }

    @Test
    void shouldWarnAboutUnmergedFiltersAndDoubleNegation() {
        LogicalNode inner = new LogicalFilter(3, orders(4), Filters.eq(STATUS, Values.of("paid")));
        LogicalNode outer = new LogicalFilter(2, inner,
                Filters.not(Filters.not(Filters.eq(TOTAL, Values.of(1.0)))));
        LogicalNode root = new LogicalLimit(1, new LogicalProject(5, outer, Set.of(ID)), 10, 0, null);

        LogicalPlanValidator.ValidationResult result = validator.validate(new LogicalPlan("q", root));

        assertTrue(result.valid());
        assertEquals(2, result.warnings().size());
    }
}
