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

package com.tessera.common.model;

public enum AggregateFunction {
    COUNT(false, false),
    COUNT_DISTINCT(true, false),
    SUM(true, true),
    AVG(true, true),
    MIN(true, false),
    MAX(true, false),
    PERCENTILE(true, true),
    STDDEV(true, true),
    VARIANCE(true, true);

    private final boolean requiresField;
    private final boolean requiresNumericField;

    AggregateFunction(boolean requiresField, boolean requiresNumericField) {
        this.requiresField = requiresField;
        this.requiresNumericField = requiresNumericField;
    }

    /**
     * COUNT may be used without a field, counting rows.
     */
    public boolean requiresField() {
        return requiresField;
    }

    public boolean requiresNumericField() {
        return requiresNumericField;
    }
}
