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

package com.tessera.common.error;

/**
 * Error taxonomy reported to clients. Validation-class codes are collected during canonical
 * query construction and returned together; planning and execution codes are raised on their own.
 */
public enum ErrorCode {
    SYNTAX_ERROR(Category.VALIDATION),
    UNKNOWN_FIELD(Category.VALIDATION),
    TYPE_MISMATCH(Category.VALIDATION),
    INVALID_TRAVERSAL(Category.VALIDATION),
    LIMIT_EXCEEDED(Category.VALIDATION),
    PERMISSION_DENIED(Category.VALIDATION),
    UNRESOLVABLE_RELATION(Category.VALIDATION),
    PLANNING_TIMEOUT(Category.PLANNING),
    EXECUTION_ERROR(Category.EXECUTION);

    private final Category category;

    ErrorCode(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    public enum Category {
        VALIDATION,
        PLANNING,
        EXECUTION
    }
}
