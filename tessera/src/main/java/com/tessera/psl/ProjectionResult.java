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

package com.tessera.psl;

import com.tessera.common.error.QueryError;
import com.tessera.common.schema.FieldRef;
import com.tessera.planner.cqm.ResolvedRelation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of matching a projection against a schema.
 *
 * @param fields    selected fields ordered by path, ancestors included
 * @param relations relations the selected fields are reached through, parents first
 * @param errors    validation problems; when present, {@code fields} is empty
 */
public record ProjectionResult(Set<FieldRef> fields, List<ResolvedRelation> relations, List<QueryError> errors) {
    public ProjectionResult {
        fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
        relations = List.copyOf(relations);
        errors = List.copyOf(errors);
    }

    static ProjectionResult failed(List<QueryError> errors) {
        return new ProjectionResult(Set.of(), List.of(), errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean contains(String path) {
        for (FieldRef field : fields) {
            if (field.path().equals(path)) {
                return true;
            }
        }
        return false;
    }
}
