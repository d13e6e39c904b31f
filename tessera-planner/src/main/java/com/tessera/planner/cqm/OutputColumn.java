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
import com.tessera.common.type.FieldType;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A column produced by an aggregation: either a group-by field or an aggregate alias.
 *
 * @param name   column name as referenced by HAVING and sort keys
 * @param type   result type
 * @param source group-by field this column passes through, null for aggregate outputs
 */
public record OutputColumn(String name, FieldType type, @Nullable FieldRef source) {
    public OutputColumn {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    public static OutputColumn of(FieldRef groupBy) {
        return new OutputColumn(groupBy.path(), groupBy.fieldType(), groupBy);
    }

    public boolean isAggregate() {
        return source == null;
    }

    @Override
    public String toString() {
        return name;
    }
}
