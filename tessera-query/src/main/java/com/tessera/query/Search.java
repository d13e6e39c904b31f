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

import com.tessera.common.model.SearchMode;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Full-text and/or vector search attached to a query.
 *
 * @param query       search text
 * @param mode        search mode
 * @param fields      text fields searched by FULL_TEXT and HYBRID
 * @param vectorField embedding field used by SEMANTIC and HYBRID
 * @param embedding   query embedding; may be empty when the executor embeds {@code query} itself
 * @param minScore    minimum relevance score
 * @param boost       per-field weight for text matching
 */
public record Search(String query, SearchMode mode, List<String> fields, @Nullable String vectorField,
                     List<Double> embedding, double minScore, Map<String, Double> boost) {
    public Search {
        Objects.requireNonNull(query, "query must not be null");
        mode = mode == null ? SearchMode.FULL_TEXT : mode;
        fields = fields == null ? List.of() : List.copyOf(fields);
        embedding = embedding == null ? List.of() : List.copyOf(embedding);
        boost = boost == null ? Map.of() : Map.copyOf(boost);
    }

    public static Search fullText(String query, String... fields) {
        return new Search(query, SearchMode.FULL_TEXT, List.of(fields), null, List.of(), 0.0, Map.of());
    }

    public static Search semantic(String query, String vectorField) {
        return new Search(query, SearchMode.SEMANTIC, List.of(), vectorField, List.of(), 0.0, Map.of());
    }
}
