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

/**
 * Structural limits applied to projection patterns before they are evaluated.
 *
 * @param maxPatterns           include and exclude patterns combined
 * @param maxSegments           dotted components per pattern
 * @param maxRecursiveWildcards {@code **} segments per pattern
 */
public record ProjectionLimits(int maxPatterns, int maxSegments, int maxRecursiveWildcards) {
    public static final ProjectionLimits DEFAULT = new ProjectionLimits(200, 50, 3);

    public ProjectionLimits {
        if (maxPatterns <= 0 || maxSegments <= 0 || maxRecursiveWildcards < 0) {
            throw new IllegalArgumentException("projection limits must be positive");
        }
    }
}
