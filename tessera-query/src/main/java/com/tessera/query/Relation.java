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

import com.tessera.common.model.JoinType;

import java.util.Objects;

/**
 * An explicitly requested join with another entity, {@code localField = entity.foreignField}.
 * The alias becomes the prefix under which the related fields are addressed.
 */
public record Relation(String entity, String alias, JoinType joinType, String localField, String foreignField) {
    public Relation {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(localField, "localField must not be null");
        Objects.requireNonNull(foreignField, "foreignField must not be null");
        alias = alias == null || alias.isEmpty() ? entity : alias;
        joinType = joinType == null ? JoinType.INNER : joinType;
    }
}
