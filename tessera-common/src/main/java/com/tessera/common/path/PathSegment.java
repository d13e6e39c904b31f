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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One step of a {@link FieldPath}. {@code position} is the index of the dotted component the
 * segment was parsed from; suffix segments ({@code []}, {@code [*]}, {@code ['key']}) share the
 * position of the component they are attached to.
 */
public sealed interface PathSegment permits PathSegment.Literal, PathSegment.Wildcard,
        PathSegment.RecursiveWildcard, PathSegment.ListMarker, PathSegment.MapWildcard, PathSegment.MapKey {

    int position();

    /**
     * True for segments that attach to the previous component instead of starting a new one.
     */
    default boolean isSuffix() {
        return false;
    }

    String render();

    record Literal(String name, boolean quoted, int position) implements PathSegment {
        private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$\\-]*");

        public Literal {
            Objects.requireNonNull(name, "name must not be null");
        }

        public Literal(String name) {
            this(name, false, 0);
        }

        @Override
        public String render() {
            return IDENTIFIER.matcher(name).matches() ? name : "`" + name + "`";
        }
    }

    record Wildcard(int position) implements PathSegment {
        @Override
        public String render() {
            return "*";
        }
    }

    record RecursiveWildcard(int position) implements PathSegment {
        @Override
        public String render() {
            return "**";
        }
    }

    record ListMarker(int position) implements PathSegment {
        @Override
        public boolean isSuffix() {
            return true;
        }

        @Override
        public String render() {
            return "[]";
        }
    }

    record MapWildcard(int position) implements PathSegment {
        @Override
        public boolean isSuffix() {
            return true;
        }

        @Override
        public String render() {
            return "[*]";
        }
    }

    record MapKey(String key, int position) implements PathSegment {
        public MapKey {
            Objects.requireNonNull(key, "key must not be null");
        }

        @Override
        public boolean isSuffix() {
            return true;
        }

        @Override
        public String render() {
            return "['" + key + "']";
        }
    }
}
