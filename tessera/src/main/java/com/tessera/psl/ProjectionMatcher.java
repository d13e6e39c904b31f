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

package com.tessera.psl;

import com.tessera.common.error.ErrorCode;
import com.tessera.common.error.PathSyntaxException;
import com.tessera.common.error.QueryError;
import com.tessera.common.path.FieldPath;
import com.tessera.common.path.PathSegment;
import com.tessera.common.schema.FieldRef;
import com.tessera.common.schema.SchemaView;
import com.tessera.planner.cqm.ResolvedRelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Predicate;

/**
 * Expands include and exclude projection patterns against an entity's schema into an explicit
 * field set.
 * <p>
 * Every include pattern is expanded into the fields it selects; selecting a container selects
 * everything below it. Exclude patterns are expanded the same way. A field matched by both sides
 * is dropped when the best exclude pattern is at least as specific as the best include pattern
 * (see {@link Specificity}). The containers above every surviving field are retained.
 * <p>
 * Patterns are validated before anything is expanded. Unknown fields and traversal mismatches are
 * only reported while the pattern prefix is free of wildcards, since a wildcard legitimately
 * reaches positions where the rest of the pattern does not apply.
 */
public class ProjectionMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectionMatcher.class);
    private static final String SELECT_ALL = "**";

    private final ProjectionLimits limits;

    public ProjectionMatcher() {
        this(ProjectionLimits.DEFAULT);
    }

    public ProjectionMatcher(ProjectionLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    public ProjectionLimits limits() {
        return limits;
    }

    public ProjectionResult match(String entity, List<String> include, List<String> exclude, SchemaView schema) {
        return match(entity, include, exclude, schema, field -> true);
    }

    /**
     * Matches the patterns and keeps only fields accepted by {@code readable}. Rejected fields are
     * dropped silently, before ancestors are retained, so an unreadable subtree leaves no trace.
     */
    public ProjectionResult match(String entity, List<String> include, List<String> exclude, SchemaView schema,
                                  Predicate<FieldRef> readable) {
        if (!schema.hasEntity(entity)) {
            return ProjectionResult.failed(List.of(
                    QueryError.of(ErrorCode.UNKNOWN_FIELD, entity, "unknown entity '" + entity + "'")));
        }
        return match(SchemaCursor.root(schema, entity), Map.of(), include, exclude, readable);
    }

    /**
     * Matches patterns relative to {@code root}. A pattern whose first component is a key of
     * {@code joined} continues at that root instead, so declared join aliases can be projected;
     * wildcards never reach them.
     */
    public ProjectionResult match(SchemaCursor root, Map<String, SchemaCursor> joined, List<String> include,
                                  List<String> exclude, Predicate<FieldRef> readable) {
        List<QueryError> errors = new ArrayList<>();
        int total = include.size() + exclude.size();
        if (total > limits.maxPatterns()) {
            errors.add(QueryError.of(ErrorCode.LIMIT_EXCEEDED, "projection",
                    total + " patterns exceed the limit of " + limits.maxPatterns()));
        }
        List<Pattern> includes = compile(include, Side.INCLUDE, errors);
        List<Pattern> excludes = compile(exclude, Side.EXCLUDE, errors);
        if (!errors.isEmpty()) {
            return ProjectionResult.failed(errors);
        }
        if (includes.isEmpty()) {
            includes = List.of(new Pattern(Side.INCLUDE, 0, SELECT_ALL, FieldPath.parse(SELECT_ALL)));
        }

        Map<String, Selection> included = new TreeMap<>();
        Map<String, Selection> excluded = new TreeMap<>();
        for (Pattern pattern : includes) {
            start(root, joined, pattern, included, errors);
        }
        for (Pattern pattern : excludes) {
            start(root, joined, pattern, excluded, errors);
        }
        if (!errors.isEmpty()) {
            return ProjectionResult.failed(errors);
        }

        Map<String, FieldRef> selected = new TreeMap<>();
        Map<String, ResolvedRelation> relations = new LinkedHashMap<>();
        for (Map.Entry<String, Selection> entry : included.entrySet()) {
            Selection inclusion = entry.getValue();
            Selection exclusion = excluded.get(entry.getKey());
            if (exclusion != null && Specificity.excludeWins(inclusion.score(), exclusion.score())) {
                LOGGER.trace("Field {} excluded by '{}' ({} >= {})", entry.getKey(), exclusion.pattern(),
                        exclusion.score(), inclusion.score());
                continue;
            }
            FieldRef field = inclusion.cursor().ref();
            if (!readable.test(field)) {
                continue;
            }
            selected.put(field.path(), field);
            for (FieldRef ancestor : inclusion.cursor().ancestors()) {
                if (readable.test(ancestor)) {
                    selected.putIfAbsent(ancestor.path(), ancestor);
                }
            }
            for (ResolvedRelation relation : inclusion.cursor().relations()) {
                relations.putIfAbsent(relation.alias(), relation);
            }
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Projection on '{}' selected {} of {} candidate fields through {} relations", root.entity(),
                    selected.size(), included.size(), relations.size());
        }
        return new ProjectionResult(new LinkedHashSet<>(selected.values()), new ArrayList<>(relations.values()),
                List.of());
    }

    private List<Pattern> compile(List<String> texts, Side side, List<QueryError> errors) {
        List<Pattern> patterns = new ArrayList<>(texts.size());
        for (int index = 0; index < texts.size(); index++) {
            String text = texts.get(index);
            if (text == null || text.isBlank()) {
                errors.add(new QueryError(ErrorCode.SYNTAX_ERROR, "", side.label(index) + ": empty pattern", 0));
                continue;
            }
            FieldPath path;
            try {
                path = FieldPath.parse(text);
            } catch (PathSyntaxException e) {
                errors.add(e.toQueryError(side.label(index) + ": " + e.getMessage()));
                continue;
            }
            boolean withinLimits = true;
            if (path.componentCount() > limits.maxSegments()) {
                errors.add(new QueryError(ErrorCode.LIMIT_EXCEEDED, text, side.label(index) + ": "
                        + path.componentCount() + " segments exceed the limit of " + limits.maxSegments(),
                        limits.maxSegments()));
                withinLimits = false;
            }
            if (path.recursiveWildcardCount() > limits.maxRecursiveWildcards()) {
                errors.add(new QueryError(ErrorCode.LIMIT_EXCEEDED, text, side.label(index) + ": "
                        + path.recursiveWildcardCount() + " '**' segments exceed the limit of "
                        + limits.maxRecursiveWildcards(), excessWildcardPosition(path)));
                withinLimits = false;
            }
            if (withinLimits) {
                patterns.add(new Pattern(side, index, text, path));
            }
        }
        return patterns;
    }

    private int excessWildcardPosition(FieldPath path) {
        int seen = 0;
        for (PathSegment segment : path.segments()) {
            if (segment instanceof PathSegment.RecursiveWildcard && ++seen > limits.maxRecursiveWildcards()) {
                return segment.position();
            }
        }
        return QueryError.UNKNOWN_POSITION;
    }

    private void start(SchemaCursor root, Map<String, SchemaCursor> joined, Pattern pattern,
                       Map<String, Selection> sink, List<QueryError> errors) {
        PathSegment first = pattern.path().get(0);
        if (first instanceof PathSegment.Literal literal && joined.containsKey(literal.name())) {
            expand(joined.get(literal.name()), pattern, 1, true, sink, errors);
            return;
        }
        expand(root, pattern, 0, true, sink, errors);
    }

    private void expand(SchemaCursor cursor, Pattern pattern, int index, boolean concrete,
                        Map<String, Selection> sink, List<QueryError> errors) {
        List<PathSegment> segments = pattern.path().segments();
        if (index == segments.size()) {
            select(cursor, pattern, concrete, sink, errors);
            return;
        }
        PathSegment segment = segments.get(index);

        // A relation named by a literal is entered before any further segment, wildcards included.
        if (cursor.isRelation()) {
            SchemaCursor.Step crossed = cursor.cross();
            if (!crossed.isSuccess()) {
                report(crossed, pattern, segment, concrete, errors);
                return;
            }
            cursor = crossed.cursor();
        }

        if (segment instanceof PathSegment.RecursiveWildcard) {
            if (index == segments.size() - 1) {
                select(cursor, pattern, false, sink, errors);
                return;
            }
            for (SchemaCursor descendant : cursor.descendants()) {
                expand(descendant, pattern, index + 1, false, sink, errors);
            }
            return;
        }
        if (segment instanceof PathSegment.Wildcard) {
            for (SchemaCursor child : cursor.children()) {
                expand(child, pattern, index + 1, false, sink, errors);
            }
            return;
        }
        SchemaCursor.Step step = cursor.step(segment);
        if (!step.isSuccess()) {
            report(step, pattern, segment, concrete, errors);
            return;
        }
        expand(step.cursor(), pattern, index + 1, concrete, sink, errors);
    }

    private void select(SchemaCursor cursor, Pattern pattern, boolean concrete, Map<String, Selection> sink,
                        List<QueryError> errors) {
        List<SchemaCursor> leaves = new ArrayList<>();
        SchemaCursor.Step step = cursor.leaves(leaves);
        if (!step.isSuccess()) {
            if (concrete) {
                errors.add(new QueryError(step.code(), pattern.text(), pattern.label() + ": " + step.message(),
                        pattern.path().isEmpty() ? 0 : pattern.path().last().position()));
            }
            return;
        }
        for (SchemaCursor leaf : leaves) {
            sink.merge(leaf.ref().path(), new Selection(leaf, pattern.score(), pattern.text()),
                    (left, right) -> left.score() >= right.score() ? left : right);
        }
    }

    private void report(SchemaCursor.Step step, Pattern pattern, PathSegment segment, boolean concrete,
                        List<QueryError> errors) {
        if (concrete) {
            errors.add(new QueryError(step.code(), pattern.text(), pattern.label() + ": " + step.message(),
                    segment.position()));
        }
    }

    private enum Side {
        INCLUDE,
        EXCLUDE;

        String label(int index) {
            return name().toLowerCase(Locale.ROOT) + " pattern #" + index;
        }
    }

    private record Pattern(Side side, int index, String text, FieldPath path) {
        int score() {
            return Specificity.of(path);
        }

        String label() {
            return side.label(index);
        }
    }

    private record Selection(SchemaCursor cursor, int score, String pattern) {
    }
}
