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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable, parsed field path or projection pattern. Equality is defined by the canonical
 * rendering so that {@code a.`b`} and {@code a.b} denote the same path.
 */
public final class FieldPath {
    public static final FieldPath ROOT = new FieldPath(List.of());

    private final List<PathSegment> segments;
    private final String text;

    FieldPath(List<PathSegment> segments) {
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
        this.text = render(this.segments);
    }

    /**
     * Parses a path using the projection selector grammar.
     *
     * @throws com.tessera.common.error.PathSyntaxException if the text is malformed
     */
    public static FieldPath parse(String text) {
        return PathParser.parse(text);
    }

    /**
     * Builds a path made of plain literal segments.
     */
    public static FieldPath of(String... names) {
        List<PathSegment> segments = new ArrayList<>(names.length);
        for (int i = 0; i < names.length; i++) {
            segments.add(new PathSegment.Literal(names[i], false, i));
        }
        return new FieldPath(segments);
    }

    private static String render(List<PathSegment> segments) {
        StringBuilder builder = new StringBuilder();
        for (PathSegment segment : segments) {
            if (!segment.isSuffix() && builder.length() > 0) {
                builder.append('.');
            }
            builder.append(segment.render());
        }
        return builder.toString();
    }

    public List<PathSegment> segments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    public PathSegment get(int index) {
        return segments.get(index);
    }

    public PathSegment last() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("root path has no segments");
        }
        return segments.get(segments.size() - 1);
    }

    /**
     * Number of dotted components, i.e. segments that are not suffixes.
     */
    public int componentCount() {
        int count = 0;
        for (PathSegment segment : segments) {
            if (!segment.isSuffix()) {
                count++;
            }
        }
        return count;
    }

    public int recursiveWildcardCount() {
        int count = 0;
        for (PathSegment segment : segments) {
            if (segment instanceof PathSegment.RecursiveWildcard) {
                count++;
            }
        }
        return count;
    }

    /**
     * A concrete path addresses exactly one field: it contains no {@code *}, {@code **} or {@code [*]}.
     */
    public boolean isConcrete() {
        for (PathSegment segment : segments) {
            if (segment instanceof PathSegment.Wildcard
                    || segment instanceof PathSegment.RecursiveWildcard
                    || segment instanceof PathSegment.MapWildcard) {
                return false;
            }
        }
        return true;
    }

    public FieldPath append(PathSegment segment) {
        List<PathSegment> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new FieldPath(next);
    }

    public FieldPath append(FieldPath other) {
        List<PathSegment> next = new ArrayList<>(segments.size() + other.segments.size());
        next.addAll(segments);
        next.addAll(other.segments);
        return new FieldPath(next);
    }

    public FieldPath prefix(int length) {
        return new FieldPath(segments.subList(0, length));
    }

    public FieldPath suffix(int from) {
        return new FieldPath(segments.subList(from, segments.size()));
    }

    public boolean startsWith(FieldPath other) {
        if (other.segments.size() > segments.size()) {
            return false;
        }
        return prefix(other.segments.size()).equals(other);
    }

    public String text() {
        return text;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FieldPath other)) return false;
        return text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
