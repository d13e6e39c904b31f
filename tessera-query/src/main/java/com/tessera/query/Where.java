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

import com.tessera.common.filter.Condition;
import com.tessera.common.filter.Filter;
import com.tessera.common.filter.Filters;
import com.tessera.common.filter.Operator;
import com.tessera.common.value.Value;
import com.tessera.common.value.Values;

import java.util.ArrayList;
import java.util.List;

/**
 * Static factories for client filters over raw field paths. Operands are plain Java objects and
 * are converted with {@link Values#of(Object)}.
 */
public final class Where {

    private Where() {
    }

    @SafeVarargs
    public static Filter<String> and(Filter<String>... children) {
        return Filters.and(children);
    }

    @SafeVarargs
    public static Filter<String> or(Filter<String>... children) {
        return Filters.or(children);
    }

    public static Filter<String> not(Filter<String> child) {
        return Filters.not(child);
    }

    public static Filter<String> condition(String field, Operator operator, Object... operands) {
        return new Condition<>(field, operator, values(operands));
    }

    public static Filter<String> eq(String field, Object value) {
        return condition(field, Operator.EQ, value);
    }

    public static Filter<String> eqIgnoreCase(String field, String value) {
        return new Condition<>(field, Operator.EQ, List.of(Values.of(value)), false);
    }

    public static Filter<String> ne(String field, Object value) {
        return condition(field, Operator.NE, value);
    }

    public static Filter<String> lt(String field, Object value) {
        return condition(field, Operator.LT, value);
    }

    public static Filter<String> lte(String field, Object value) {
        return condition(field, Operator.LTE, value);
    }

    public static Filter<String> gt(String field, Object value) {
        return condition(field, Operator.GT, value);
    }

    public static Filter<String> gte(String field, Object value) {
        return condition(field, Operator.GTE, value);
    }

    public static Filter<String> between(String field, Object lower, Object upper) {
        return condition(field, Operator.BETWEEN, lower, upper);
    }

    public static Filter<String> in(String field, Object... values) {
        return condition(field, Operator.IN, values);
    }

    public static Filter<String> notIn(String field, Object... values) {
        return condition(field, Operator.NOT_IN, values);
    }

    public static Filter<String> contains(String field, String value) {
        return condition(field, Operator.CONTAINS, value);
    }

    public static Filter<String> startsWith(String field, String value) {
        return condition(field, Operator.STARTS_WITH, value);
    }

    public static Filter<String> isNull(String field) {
        return condition(field, Operator.IS_NULL);
    }

    public static Filter<String> isNotNull(String field) {
        return condition(field, Operator.IS_NOT_NULL);
    }

    public static Filter<String> arrayContains(String field, Object value) {
        return condition(field, Operator.ARRAY_CONTAINS, value);
    }

    private static List<Value> values(Object[] operands) {
        List<Value> values = new ArrayList<>(operands.length);
        for (Object operand : operands) {
            values.add(Values.of(operand));
        }
        return values;
    }
}
