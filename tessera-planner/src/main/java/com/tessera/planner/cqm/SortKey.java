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

import com.tessera.common.schema.FieldRef;

/**
 * What a canonical sort orders by: a resolved field, or an aggregation output column.
 */
public sealed interface SortKey permits SortKey.Field, SortKey.Column {

    String name();

    record Field(FieldRef field) implements SortKey {
        @Override
        public String name() {
            return field.path();
        }
    }

    record Column(OutputColumn column) implements SortKey {
        @Override
        public String name() {
            return column.name();
        }
    }
}
