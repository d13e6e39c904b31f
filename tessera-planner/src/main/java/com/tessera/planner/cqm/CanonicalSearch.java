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

package com.tessera.planner.cqm;

import com.tessera.common.model.SearchMode;
import com.tessera.common.schema.FieldRef;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Collections;

public record CanonicalSearch(String query, SearchMode mode, List<FieldRef> fields, @Nullable FieldRef vectorField,
                              List<Double> embedding, double minScore, Map<FieldRef, Double> boost) {
    public CanonicalSearch {
        fields = List.copyOf(fields);
        embedding = List.copyOf(embedding);
        boost = Collections.unmodifiableMap(new LinkedHashMap<>(boost));
    }

    public boolean usesText() {
        return mode != SearchMode.SEMANTIC;
    }

    public boolean usesVector() {
        return mode != SearchMode.FULL_TEXT;
    }
}
