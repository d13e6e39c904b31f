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

import com.tessera.common.model.JoinType;
import com.tessera.common.schema.FieldRef;

/**
 * A join the query needs, either requested explicitly or implied by a path that crosses a
 * relation field.
 *
 * @param alias       prefix under which the related entity's fields are addressed
 * @param parentAlias alias of the side the relation starts from, empty for the queried entity
 * @param entity      related entity
 * @param localKey    join key on the parent side
 * @param foreignKey  join key on the related side
 * @param joinType    requested join type; for implicit relations this is LEFT and the planner
 *                    may tighten it
 * @param explicit    whether the client asked for this join
 */
public record ResolvedRelation(String alias, String parentAlias, String entity, FieldRef localKey, FieldRef foreignKey,
                               JoinType joinType, boolean explicit) {
}
