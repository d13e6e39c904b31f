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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

public record Compound<F>(LogicalOperator operator, List<Filter<F>> children) implements Filter<F> {
    public Compound {
        Objects.requireNonNull(operator, "operator must not be null");
        children = List.copyOf(children);
        if (operator == LogicalOperator.NOT && children.size() != 1) {
            throw new IllegalArgumentException("NOT takes exactly one child, got " + children.size());
        }
        if (children.isEmpty()) {
            throw new IllegalArgumentException(operator + " requires at least one child");
        }
    }

    @Override
    public <G> Filter<G> map(Function<? super F, ? extends G> mapper) {
        List<Filter<G>> mapped = new ArrayList<>(children.size());
        for (Filter<F> child : children) {
            mapped.add(child.map(mapper));
        }
        return new Compound<>(operator, mapped);
    }

    @Override
    public int depth() {
        int max = 0;
        for (Filter<F> child : children) {
            max = Math.max(max, child.depth());
        }
        return max + 1;
    }

    @Override
    public String toString() {
        return Filters.render(this);
    }
}
