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

package com.tessera.common.error;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tessera.common.json.JSONUtil;

import java.util.List;

/**
 * Renders error responses in their wire shape.
 */
public final class QueryErrors {

    private QueryErrors() {
    }

    public static ArrayNode toJsonNode(List<QueryError> errors) {
        ArrayNode array = JSONUtil.objectMapper.createArrayNode();
        for (QueryError error : errors) {
            ObjectNode node = array.addObject();
            node.put("error_code", error.code().name());
            node.put("pattern_or_field", error.subject());
            node.put("message", error.message());
            node.put("position", error.position());
        }
        return array;
    }

    public static String toJson(List<QueryError> errors) {
        return JSONUtil.writeValueAsString(toJsonNode(errors));
    }
}
