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

package com.tessera.common.statistics;

/**
 * @param distinctCount number of distinct non-null values
 * @param nullFraction  fraction of rows where the field is missing
 */
public record FieldStatistics(long distinctCount, double nullFraction) {
    public FieldStatistics {
        if (distinctCount < 0) {
            throw new IllegalArgumentException("distinctCount must not be negative");
        }
        if (nullFraction < 0 || nullFraction > 1) {
            throw new IllegalArgumentException("nullFraction must be within [0, 1]");
        }
    }
}
