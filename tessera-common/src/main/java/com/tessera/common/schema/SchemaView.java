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

import com.tessera.common.path.FieldPath;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view over the schema registry. Implementations must tolerate concurrent readers; a
 * single compilation works against one {@link #snapshot()}.
 * <p>
 * Paths are resolved within one entity: relation fields resolve to an OBJECT field whose
 * {@link #relation(String, String)} describes the entity on the other side, and the caller is
 * responsible for continuing resolution there.
 */
public interface SchemaView {

    boolean hasEntity(String entity);

    /**
     * Resolves a concrete path ({@code literal}, {@code []}, {@code [*]} and {@code ['key']} segments).
     *
     * @return the field, or empty if the path does not exist in the entity
     */
    Optional<FieldRef> resolve(String entity, FieldPath path);

    /**
     * Returns the named members of the node at {@code prefix}; arrays and maps are descended
     * transparently into their element or value type. {@link FieldPath#ROOT} lists the entity's
     * top level fields.
     */
    List<FieldRef> children(String entity, FieldPath prefix);

    Optional<RelationDescriptor> relation(String entity, String fieldId);

    /**
     * Returns a view that stays consistent for the rest of a compilation.
     */
    default SchemaView snapshot() {
        return this;
    }
}
