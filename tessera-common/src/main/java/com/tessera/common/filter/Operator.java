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

package com.tessera.common.filter;

/**
 * Comparison operators of a filter condition. Each operator declares how many operand values it
 * takes and which family of field types it applies to.
 */
public enum Operator {
    EQ(Family.EQUALITY, 1, 1),
    NE(Family.EQUALITY, 1, 1),
    LT(Family.ORDERING, 1, 1),
    LTE(Family.ORDERING, 1, 1),
    GT(Family.ORDERING, 1, 1),
    GTE(Family.ORDERING, 1, 1),
    IN(Family.SET, 1, Integer.MAX_VALUE),
    NOT_IN(Family.SET, 1, Integer.MAX_VALUE),
    BETWEEN(Family.RANGE, 2, 2),
    CONTAINS(Family.STRING, 1, 1),
    STARTS_WITH(Family.STRING, 1, 1),
    ENDS_WITH(Family.STRING, 1, 1),
    MATCHES(Family.STRING, 1, 1),
    IS_NULL(Family.NULL, 0, 0),
    IS_NOT_NULL(Family.NULL, 0, 0),
    ARRAY_CONTAINS(Family.ARRAY, 1, 1),
    ARRAY_CONTAINS_ANY(Family.ARRAY, 1, Integer.MAX_VALUE),
    ARRAY_CONTAINS_ALL(Family.ARRAY, 1, Integer.MAX_VALUE);

    private final Family family;
    private final int minValues;
    private final int maxValues;

    Operator(Family family, int minValues, int maxValues) {
        this.family = family;
        this.minValues = minValues;
        this.maxValues = maxValues;
    }

    public Family family() {
        return family;
    }

    public int minValues() {
        return minValues;
    }

    public int maxValues() {
        return maxValues;
    }

    public boolean acceptsValueCount(int count) {
        return count >= minValues && count <= maxValues;
    }

    /**
     * True when a row whose field is missing can never satisfy the condition.
     */
    public boolean isNullRejecting() {
        return this != IS_NULL;
    }

    public String describeArity() {
        if (minValues == maxValues) {
            return minValues == 1 ? "exactly one value" : "exactly " + minValues + " values";
        }
        return "at least " + minValues + (minValues == 1 ? " value" : " values");
    }

    public enum Family {
        EQUALITY,
        ORDERING,
        SET,
        RANGE,
        STRING,
        NULL,
        ARRAY
    }
}
