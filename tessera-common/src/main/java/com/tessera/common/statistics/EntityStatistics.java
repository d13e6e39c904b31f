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

package com.tessera.common.statistics;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collected statistics of one entity.
 *
 * @param entity     entity name
 * @param rowCount   number of rows
 * @param fields     per-field statistics keyed by field id
 * @param sortOrders field id sequences the entity is physically sorted on
 */
public record EntityStatistics(String entity, long rowCount, Map<String, FieldStatistics> fields,
                               List<List<String>> sortOrders) {
    public EntityStatistics {
        Objects.requireNonNull(entity, "entity must not be null");
        fields = Map.copyOf(fields);
        List<List<String>> orders = new ArrayList<>(sortOrders.size());
        for (List<String> order : sortOrders) {
            orders.add(List.copyOf(order));
        }
        sortOrders = List.copyOf(orders);
    }

    public static Builder builder(String entity, long rowCount) {
        return new Builder(entity, rowCount);
    }

    public static final class Builder {
        private final String entity;
        private final long rowCount;
        private final Map<String, FieldStatistics> fields = new HashMap<>();
        private final List<List<String>> sortOrders = new ArrayList<>();

        private Builder(String entity, long rowCount) {
            this.entity = entity;
            this.rowCount = rowCount;
        }

        public Builder field(String fieldId, long distinctCount, double nullFraction) {
            fields.put(fieldId, new FieldStatistics(distinctCount, nullFraction));
            return this;
        }

        public Builder sortedOn(String... fieldIds) {
            sortOrders.add(List.of(fieldIds));
            return this;
        }

        public EntityStatistics build() {
            return new EntityStatistics(entity, rowCount, fields, sortOrders);
        }
    }
}
