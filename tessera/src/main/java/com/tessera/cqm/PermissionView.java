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

package com.tessera.cqm;

import com.tessera.common.schema.FieldRef;

import java.util.Set;

/**
 * Read permissions of the caller compiling a query.
 * <p>
 * Unreadable fields are dropped from projections without an error; filtering, sorting, grouping
 * or searching on one is rejected.
 */
@FunctionalInterface
public interface PermissionView {
    PermissionView ALLOW_ALL = field -> true;

    /**
     * Denies every field flagged as personally identifiable.
     */
    PermissionView DENY_PII = field -> !field.pii();

    boolean canRead(FieldRef field);

    /**
     * Denies the given field ids in addition to whatever this view denies.
     */
    default PermissionView denying(Set<String> fieldIds) {
        Set<String> denied = Set.copyOf(fieldIds);
        return field -> !denied.contains(field.fieldId()) && canRead(field);
    }
}
