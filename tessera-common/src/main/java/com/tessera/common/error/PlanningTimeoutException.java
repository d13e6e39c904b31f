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

import com.tessera.common.TesseraException;

/**
 * Thrown when compilation runs past the caller supplied deadline. Only compilation is aborted.
 */
public class PlanningTimeoutException extends TesseraException {
    private final String stage;

    public PlanningTimeoutException(String stage, long budgetMillis) {
        super(String.format("Query compilation exceeded its deadline of %d ms during %s", budgetMillis, stage));
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }

    public QueryError toQueryError() {
        return QueryError.of(ErrorCode.PLANNING_TIMEOUT, stage, getMessage());
    }
}
