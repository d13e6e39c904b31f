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

import com.tessera.common.type.FieldType;

import java.util.Objects;

/**
 * A field resolved against the schema registry.
 *
 * @param fieldId   registry-unique identifier of the field within its entity
 * @param fieldName last component of the path
 * @param fieldType declared type
 * @param nullable  whether the field may be absent
 * @param indexed   whether the storage keeps a secondary index on the field
 * @param pii       whether reading the field requires elevated permission
 * @param entity    entity that owns the field
 * @param path      canonical path as seen from the query root, e.g. {@code customer.name}
 * @param qualifier alias of the relation the field is reached through, empty for the queried entity
 */
public record FieldRef(
        String fieldId,
        String fieldName,
        FieldType fieldType,
        boolean nullable,
        boolean indexed,
        boolean pii,
        String entity,
        String path,
        String qualifier
) {
    public FieldRef {
        Objects.requireNonNull(fieldId, "fieldId must not be null");
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(fieldType, "fieldType must not be null");
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(path, "path must not be null");
        qualifier = qualifier == null ? "" : qualifier;
    }

    /**
     * Returns this field as seen through a relation alias, e.g. {@code name} becomes {@code customer.name}.
     */
    public FieldRef qualify(String alias) {
        String nextQualifier = qualifier.isEmpty() ? alias : alias + "." + qualifier;
        return new FieldRef(fieldId, fieldName, fieldType, nullable, indexed, pii, entity, alias + "." + path, nextQualifier);
    }

    public boolean isBase() {
        return qualifier.isEmpty();
    }

    @Override
    public String toString() {
        return path;
    }
}
