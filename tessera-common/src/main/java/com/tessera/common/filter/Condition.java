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

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A leaf predicate. Operand arity is not enforced here since client input is checked later and
 * reported alongside every other problem of the query; see {@link FilterTypeChecker}.
 */
public record Condition<F>(F field, Operator operator, List<Value> values, boolean caseSensitive) implements Filter<F> {
    public Condition {
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        values = List.copyOf(values);
    }

    public Condition(F field, Operator operator, List<Value> values) {
        this(field, operator, values, true);
    }

    public Condition<F> withValues(List<Value> next) {
        return new Condition<>(field, operator, next, caseSensitive);
    }

    @Override
    public <G> Filter<G> map(Function<? super F, ? extends G> mapper) {
        return new Condition<G>(mapper.apply(field), operator, values, caseSensitive);
    }

    @Override
    public int depth() {
        return 1;
    }

    @Override
    public String toString() {
        return Filters.render(this);
    }
}
