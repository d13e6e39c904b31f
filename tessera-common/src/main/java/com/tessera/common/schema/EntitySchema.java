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

package com.tessera.common.schema;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Field declarations of one entity (collection).
 */
public record EntitySchema(String name, List<SchemaField> fields) {
    public EntitySchema {
        Objects.requireNonNull(name, "name must not be null");
        fields = List.copyOf(fields);
        checkUniqueNames(name, fields);
    }

    public static EntitySchema of(String name, SchemaField... fields) {
        return new EntitySchema(name, List.of(fields));
    }

    private static void checkUniqueNames(String owner, List<SchemaField> fields) {
        Set<String> names = new HashSet<>();
        for (SchemaField field : fields) {
            if (!names.add(field.name())) {
                throw new IllegalArgumentException("Duplicate field '" + field.name() + "' in " + owner);
            }
            checkUniqueNames(owner + "." + field.name(), field.children());
        }
    }
}
