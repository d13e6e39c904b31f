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

package com.tessera;

import com.tessera.planner.cqm.CanonicalQuery;
import com.tessera.planner.explain.ExplainReport;
import com.tessera.planner.logical.LogicalPlan;
import com.tessera.planner.physical.PhysicalPlan;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Every representation a query passed through on its way to a physical plan.
 *
 * @param explain report of the physical plan, present when the query asked for it
 */
public record CompiledQuery(CanonicalQuery canonical, LogicalPlan logical, PhysicalPlan physical,
                            @Nullable ExplainReport explain) {
    public CompiledQuery {
        Objects.requireNonNull(canonical, "canonical must not be null");
        Objects.requireNonNull(logical, "logical must not be null");
        Objects.requireNonNull(physical, "physical must not be null");
    }

    public String queryId() {
        return canonical.queryId();
    }
}
