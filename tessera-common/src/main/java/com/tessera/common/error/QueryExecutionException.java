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
 * Wraps a failure reported by the executor. The cause is kept unchanged; the compiler never
 * interprets or retries it.
 */
public class QueryExecutionException extends TesseraException {
    private final String queryId;
    private final String correlationId;

    public QueryExecutionException(String queryId, String correlationId, Throwable cause) {
        super(String.format("Execution of query %s failed (correlation id: %s): %s",
                queryId, correlationId, cause.getMessage()), cause);
        this.queryId = queryId;
        this.correlationId = correlationId;
    }

    public String getQueryId() {
        return queryId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public QueryError toQueryError() {
        return QueryError.of(ErrorCode.EXECUTION_ERROR, queryId, getCause().getMessage() == null
                ? getCause().getClass().getSimpleName()
                : getCause().getMessage());
    }
}
