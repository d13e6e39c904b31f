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

import com.tessera.psl.ProjectionLimits;

/**
 * Limits applied while building a canonical query.
 *
 * @param defaultPageSize  page size used when the query does not ask for one
 * @param maxPageSize      largest page size a query may ask for
 * @param maxFilterDepth   deepest filter tree accepted
 * @param projectionLimits structural limits of projection patterns
 */
public record BuildSettings(int defaultPageSize, int maxPageSize, int maxFilterDepth,
                            ProjectionLimits projectionLimits) {
    public static final BuildSettings DEFAULT = new BuildSettings(50, 1000, 32, ProjectionLimits.DEFAULT);

    public BuildSettings {
        if (defaultPageSize <= 0 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException("page sizes must satisfy 0 < default <= max");
        }
        if (maxFilterDepth <= 0) {
            throw new IllegalArgumentException("maxFilterDepth must be positive");
        }
    }
}
