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

import com.tessera.common.error.ErrorCode;
import com.tessera.common.error.QueryError;
import com.tessera.common.error.QueryValidationException;
import com.tessera.common.schema.FieldRef;
import com.tessera.common.type.FieldType;
import com.tessera.common.value.ArrayVal;
import com.tessera.common.value.Values;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilterTypeCheckerTest {
    private static final FieldRef STATUS = field("status", FieldType.STRING, false);
    private static final FieldRef TOTAL = field("total", FieldType.FLOAT64, true);
    private static final FieldRef QUANTITY = field("quantity", FieldType.INT64, true);
    private static final FieldRef TAGS = field("tags", FieldType.arrayOf(FieldType.STRING), true);
    private static final FieldRef ADDRESS = field("address", FieldType.OBJECT, true);

    private static FieldRef field(String name, FieldType type, boolean nullable) {
        return new FieldRef("orders." + name, name, type, nullable, false, false, "orders", name, "");
    }

    @Test
    void shouldAcceptWellTypedFilter() {
        Filter<FieldRef> filter = Filters.and(
                Filters.eq(STATUS, Values.of("shipped")),
                Filters.condition(TOTAL, Operator.BETWEEN, Values.of(10L), Values.of(99.5)),
                Filters.condition(TAGS, Operator.ARRAY_CONTAINS_ANY, Values.of("gift"), Values.of("rush")),
                Filters.condition(TOTAL, Operator.IS_NULL));
        assertTrue(FilterTypeChecker.evaluateTypes(filter).isEmpty());
        assertDoesNotThrow(() -> FilterTypeChecker.check(filter));
    }

    @Test
    void shouldReportEveryProblem() {
        Filter<FieldRef> filter = Filters.or(
                Filters.condition(STATUS, Operator.GT),
                Filters.condition(TAGS, Operator.LT, Values.of("x")),
                Filters.eq(QUANTITY, Values.of("ten")));
        List<QueryError> errors = FilterTypeChecker.evaluateTypes(filter);
        assertEquals(3, errors.size());
        assertEquals(ErrorCode.SYNTAX_ERROR, errors.get(0).code());
        assertEquals(ErrorCode.TYPE_MISMATCH, errors.get(1).code());
        assertEquals(ErrorCode.TYPE_MISMATCH, errors.get(2).code());
        assertEquals("quantity", errors.get(2).subject());
    }

    @Test
    void shouldThrowValidationException() {
        QueryValidationException e = assertThrows(QueryValidationException.class,
                () -> FilterTypeChecker.check(Filters.condition(STATUS, Operator.BETWEEN, Values.of("a"))));
        assertTrue(e.hasError(ErrorCode.SYNTAX_ERROR));
    }

    @Test
    void shouldRejectNullChecksOnRequiredFields() {
        List<QueryError> errors = FilterTypeChecker.evaluateTypes(Filters.condition(STATUS, Operator.IS_NOT_NULL));
        assertEquals(1, errors.size());
        assertEquals(ErrorCode.TYPE_MISMATCH, errors.get(0).code());
    }

    @Test
    void shouldRejectStringOperatorsOnNumbers() {
        List<QueryError> errors = FilterTypeChecker.evaluateTypes(
                Filters.condition(TOTAL, Operator.STARTS_WITH, Values.of("1")));
        assertEquals(ErrorCode.TYPE_MISMATCH, errors.get(0).code());
    }

    @Test
    void shouldRejectInvalidRegularExpression() {
        List<QueryError> errors = FilterTypeChecker.evaluateTypes(
                Filters.condition(STATUS, Operator.MATCHES, Values.of("ship(")));
        assertEquals(1, errors.size());
        assertEquals(ErrorCode.SYNTAX_ERROR, errors.get(0).code());
    }

    @ParameterizedTest
    @EnumSource(value = Operator.class, names = {"EQ", "NE", "IN", "NOT_IN"})
    void shouldRejectEqualityOnObjects(Operator operator) {
        List<QueryError> errors = FilterTypeChecker.evaluateTypes(
                Filters.condition(ADDRESS, operator, Values.of("x")));
        assertEquals(ErrorCode.TYPE_MISMATCH, errors.get(0).code());
    }

    @Test
    void shouldRejectIntegersOutsideTheFieldRange() {
        assertTrue(FilterTypeChecker.isAssignable(FieldType.INT64, Values.of(0x1p62)));
        assertFalse(FilterTypeChecker.isAssignable(FieldType.INT64, Values.of(0x1p63)));
        assertFalse(FilterTypeChecker.isAssignable(FieldType.INT64, Values.of(1e300)));
        assertTrue(FilterTypeChecker.isAssignable(FieldType.INT32, Values.of((long) Integer.MAX_VALUE)));
        assertFalse(FilterTypeChecker.isAssignable(FieldType.INT32, Values.of(Integer.MAX_VALUE + 1L)));
        assertFalse(FilterTypeChecker.isAssignable(FieldType.INT32, Values.of(3_000_000_000.0)));

        List<QueryError> errors = FilterTypeChecker.evaluateTypes(
                Filters.condition(QUANTITY, Operator.GT, Values.of(0x1p63)));
        assertEquals(ErrorCode.TYPE_MISMATCH, errors.get(0).code());
    }

    @Test
    void shouldCheckArrayOperandsAgainstElementType() {
        assertTrue(FilterTypeChecker.isAssignable(FieldType.arrayOf(FieldType.INT64),
                ArrayVal.of(Values.of(1L), Values.of(2.0))));
        assertFalse(FilterTypeChecker.isAssignable(FieldType.arrayOf(FieldType.INT64),
                ArrayVal.of(Values.of(1L), Values.of(2.5))));
        List<QueryError> errors = FilterTypeChecker.evaluateTypes(
                Filters.condition(TAGS, Operator.ARRAY_CONTAINS, Values.of(3L)));
        assertEquals(ErrorCode.TYPE_MISMATCH, errors.get(0).code());
    }
}
