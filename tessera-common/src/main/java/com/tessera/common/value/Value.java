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

package com.tessera.common.value;

/**
 * Closed tagged union of the scalar and array values that flow through the query pipeline.
 * <p>
 * Values are immutable once constructed. Client-facing values are only shape-checked; values
 * stored in a canonical query have already been coerced to the type of their field.
 */
public sealed interface Value permits BoolVal, Int64Val, Float64Val, StringVal, BytesVal, IdentifierVal,
        TimestampVal, DateVal, TimeVal, DurationVal, ArrayVal {

    ValueKind kind();

    /**
     * Returns the wrapped Java object, used for rendering and for building error messages.
     */
    Object raw();
}
