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

import java.util.function.Function;

/**
 * A boolean filter tree over fields of type {@code F}. Client queries carry raw paths
 * ({@code Filter<String>}), canonical queries resolved fields.
 */
public sealed interface Filter<F> permits Compound, Condition {

    /**
     * Rebuilds the tree with every field replaced by {@code mapper(field)}.
     */
    <G> Filter<G> map(Function<? super F, ? extends G> mapper);

    /**
     * Nesting depth; a single condition has depth 1.
     */
    int depth();
}
