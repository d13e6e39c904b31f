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

package com.tessera.common.path;

import com.tessera.common.error.PathSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Hand written scanner for the selector grammar:
 * <pre>
 * pattern   := component ("." component)*
 * component := segment ("[]" | "[" ("*" | "'" chars "'") "]")?
 * segment   := identifier | "*" | "**" | "`" chars "`"
 * </pre>
 * Only shape is validated here; whether a path exists or may be traversed is decided against a schema.
 */
final class PathParser {
    private final String text;
    private final List<PathSegment> segments = new ArrayList<>();
    private int cursor;
    private int component;

    private PathParser(String text) {
        this.text = text;
    }

    static FieldPath parse(String text) {
        if (text == null) {
            throw new PathSyntaxException("", 0, "Path must not be null");
        }
        PathParser parser = new PathParser(text);
        parser.parsePattern();
        return new FieldPath(parser.segments);
    }

    private void parsePattern() {
        if (text.isEmpty()) {
            throw error("Empty path");
        }
        parseComponent();
        while (cursor < text.length()) {
            char c = text.charAt(cursor);
            if (c != '.') {
                throw error("Unexpected character '" + c + "'");
            }
            cursor++;
            component++;
            parseComponent();
        }
    }

    private void parseComponent() {
        if (cursor >= text.length() || text.charAt(cursor) == '.') {
            throw error("Empty segment");
        }
        char c = text.charAt(cursor);
        if (c == '*') {
            if (cursor + 1 < text.length() && text.charAt(cursor + 1) == '*') {
                cursor += 2;
                segments.add(new PathSegment.RecursiveWildcard(component));
            } else {
                cursor++;
                segments.add(new PathSegment.Wildcard(component));
            }
            if (cursor < text.length() && isIdentifierPart(text.charAt(cursor))) {
                throw error("Wildcards cannot be combined with other characters");
            }
            if (cursor < text.length() && text.charAt(cursor) == '*') {
                throw error("Too many '*' characters in one segment");
            }
        } else if (c == '`') {
            int end = text.indexOf('`', cursor + 1);
            if (end < 0) {
                throw error("Unmatched quote '`'");
            }
            String name = text.substring(cursor + 1, end);
            if (name.isEmpty()) {
                throw error("Empty segment");
            }
            segments.add(new PathSegment.Literal(name, true, component));
            cursor = end + 1;
        } else if (isIdentifierStart(c)) {
            int start = cursor;
            while (cursor < text.length() && isIdentifierPart(text.charAt(cursor))) {
                cursor++;
            }
            segments.add(new PathSegment.Literal(text.substring(start, cursor), false, component));
        } else if (c == '[') {
            throw error("Index suffix without a field name");
        } else {
            throw error("Unexpected character '" + c + "'");
        }
        parseSuffix();
    }

    private void parseSuffix() {
        if (cursor >= text.length() || text.charAt(cursor) != '[') {
            return;
        }
        cursor++;
        if (cursor >= text.length()) {
            throw error("Unterminated '['");
        }
        char c = text.charAt(cursor);
        if (c == ']') {
            cursor++;
            segments.add(new PathSegment.ListMarker(component));
        } else if (c == '*') {
            cursor++;
            expect(']');
            segments.add(new PathSegment.MapWildcard(component));
        } else if (c == '\'') {
            int end = text.indexOf('\'', cursor + 1);
            if (end < 0) {
                throw error("Unmatched quote \"'\"");
            }
            String key = text.substring(cursor + 1, end);
            if (key.isEmpty()) {
                throw error("Empty map key");
            }
            cursor = end + 1;
            expect(']');
            segments.add(new PathSegment.MapKey(key, component));
        } else {
            throw error("Expected ']', '*' or a quoted key after '['");
        }
        if (cursor < text.length() && text.charAt(cursor) == '[') {
            throw error("Only one index suffix is allowed per segment");
        }
    }

    private void expect(char expected) {
        if (cursor >= text.length() || text.charAt(cursor) != expected) {
            throw error("Expected '" + expected + "'");
        }
        cursor++;
    }

    private PathSyntaxException error(String message) {
        return new PathSyntaxException(text, component, message);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '$';
    }
}
