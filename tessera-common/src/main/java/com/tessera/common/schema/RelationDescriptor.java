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

/**
 * Describes a field that crosses into another entity.
 *
 * @param fieldId      identifier of the relation field in the source entity
 * @param name         name of the relation field, used as the default alias
 * @param sourceEntity entity declaring the relation
 * @param targetEntity related entity
 * @param localKey     key field in the source entity
 * @param foreignKey   key field in the target entity
 * @param toMany       whether one source row may match many target rows
 */
public record RelationDescriptor(
        String fieldId,
        String name,
        String sourceEntity,
        String targetEntity,
        String localKey,
        String foreignKey,
        boolean toMany
) {
}
