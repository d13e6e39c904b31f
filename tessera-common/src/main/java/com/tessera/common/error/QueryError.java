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

import java.util.Objects;

/**
 * One entry of an error response.
 *
 * @param code     error class
 * @param subject  the offending field path or pattern text
 * @param message  human readable description
 * @param position approximate segment (component) index inside the subject, {@code -1} when unknown
 */
public record QueryError(ErrorCode code, String subject, String message, int position) {
    public static final int UNKNOWN_POSITION = -1;

    public QueryError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        subject = subject == null ? "" : subject;
    }

    public static QueryError of(ErrorCode code, String subject, String message) {
        return new QueryError(code, subject, message, UNKNOWN_POSITION);
    }

    @Override
    public String toString() {
        String location = position >= 0 ? " at segment " + position : "";
        return code + " '" + subject + "'" + location + ": " + message;
    }
}
