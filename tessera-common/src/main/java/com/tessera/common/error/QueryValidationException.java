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

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a query is rejected. Carries every validation error found, in discovery order,
 * so a client can fix a request in one round trip.
 */
public class QueryValidationException extends TesseraException {
    private final List<QueryError> errors;

    public QueryValidationException(List<QueryError> errors) {
        super(buildMessage(errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty");
        }
        this.errors = List.copyOf(errors);
    }

    public QueryValidationException(QueryError error) {
        this(List.of(error));
    }

    private static String buildMessage(List<QueryError> errors) {
        if (errors.size() == 1) {
            return errors.get(0).toString();
        }
        return errors.size() + " validation errors: " +
                errors.stream().map(QueryError::toString).collect(Collectors.joining("; "));
    }

    public List<QueryError> getErrors() {
        return errors;
    }

    public boolean hasError(ErrorCode code) {
        return errors.stream().anyMatch(error -> error.code() == code);
    }
}
