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

package com.tessera.common.value;

import java.util.List;
import java.util.stream.Collectors;

public record ArrayVal(List<Value> elements) implements Value {
    public ArrayVal {
        elements = List.copyOf(elements);
    }

    public static ArrayVal of(Value... elements) {
        return new ArrayVal(List.of(elements));
    }

    public int size() {
        return elements.size();
    }

    @Override
    public ValueKind kind() {
        return ValueKind.ARRAY;
    }

    @Override
    public Object raw() {
        return elements.stream().map(Value::raw).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return elements.stream().map(Value::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
