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

import com.tessera.common.model.AggregateFunction;
import com.tessera.common.schema.FieldRef;

import javax.annotation.Nullable;

/**
 * @param function   aggregate function
 * @param field      resolved input, null for a row COUNT
 * @param percentile only set for PERCENTILE
 * @param output     output column named after the alias
 */
public record CanonicalAggregate(AggregateFunction function, @Nullable FieldRef field, @Nullable Double percentile,
                                 OutputColumn output) {

    public String alias() {
        return output.name();
    }

    @Override
    public String toString() {
        String argument = field == null ? "*" : field.path();
        if (percentile != null) {
            argument = argument + ", " + percentile;
        }
        return function + "(" + argument + ") AS " + output.name();
    }
}
