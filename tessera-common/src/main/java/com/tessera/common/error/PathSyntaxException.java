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
 * Thrown by the path parser for malformed field paths and selector patterns.
 */
public class PathSyntaxException extends TesseraException {
    private final String text;
    private final int position;

    public PathSyntaxException(String text, int position, String message) {
        super(String.format("%s (in '%s' at segment %d)", message, text, position));
        this.text = text;
        this.position = position;
    }

    public String getText() {
        return text;
    }

    /**
     * Zero based index of the component that failed to parse.
     */
    public int getPosition() {
        return position;
    }

    public QueryError toQueryError(String reason) {
        return new QueryError(ErrorCode.SYNTAX_ERROR, text, reason, position);
    }
}
