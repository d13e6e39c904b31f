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

package com.tessera.cqm;

import com.tessera.common.Deadline;
import com.tessera.common.error.ErrorCode;
import com.tessera.common.error.PathSyntaxException;
import com.tessera.common.error.QueryError;
import com.tessera.common.path.FieldPath;
import com.tessera.common.path.PathSegment;
import com.tessera.common.schema.FieldRef;
import com.tessera.common.schema.SchemaView;
import com.tessera.planner.cqm.ResolvedRelation;
import com.tessera.psl.SchemaCursor;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the concrete field paths of one query and remembers every relation they cross, so that
 * a relation reached from several clauses becomes a single join.
 */
final class FieldResolver {
    private final SchemaView schema;
    private final String entity;
    private final Deadline deadline;
    private final List<QueryError> errors;
    private final Map<String, SchemaCursor> explicitRoots = new LinkedHashMap<>();
    private final Map<String, ResolvedRelation> relations = new LinkedHashMap<>();

    FieldResolver(SchemaView schema, String entity, Deadline deadline, List<QueryError> errors) {
        this.schema = schema;
        this.entity = entity;
        this.deadline = deadline;
        this.errors = errors;
    }

    SchemaCursor root() {
        return SchemaCursor.root(schema, entity);
    }

    /**
     * Registers a relation the client declared explicitly; paths starting with its alias are
     * resolved in the joined entity.
     */
    void declare(ResolvedRelation relation) {
        explicitRoots.put(relation.alias(), SchemaCursor.root(schema, relation.entity(), relation.alias()));
        relations.put(relation.alias(), relation);
    }

    boolean isDeclared(String alias) {
        return explicitRoots.containsKey(alias);
    }

    /**
     * Roots of the declared relations keyed by alias.
     */
    Map<String, SchemaCursor> declaredRoots() {
        return Collections.unmodifiableMap(explicitRoots);
    }

    /**
     * Resolves a path of the queried entity, or of a declared relation when its first component is
     * the relation's alias.
     *
     * @param clause where the path appears, used in error messages
     * @return the field, or {@code null} after recording why it could not be resolved
     */
    @Nullable
    FieldRef resolve(String text, String clause) {
        return resolve(text, clause, true);
    }

    /**
     * Same as {@link #resolve(String, String)}, but rejects paths that leave the queried entity.
     */
    @Nullable
    FieldRef resolveLocal(String text, String clause) {
        return resolve(text, clause, false);
    }

    @Nullable
    FieldRef resolveIn(SchemaCursor start, String text, String clause) {
        FieldPath path = parse(text, clause);
        if (path == null) {
            return null;
        }
        SchemaCursor cursor = walk(start, path, 0, text, clause);
        return cursor == null ? null : cursor.ref();
    }

    @Nullable
    private FieldRef resolve(String text, String clause, boolean crossRelations) {
        FieldPath path = parse(text, clause);
        if (path == null) {
            return null;
        }
        SchemaCursor start = root();
        int first = 0;
        if (path.get(0) instanceof PathSegment.Literal literal && explicitRoots.containsKey(literal.name())) {
            if (!crossRelations || path.size() == 1) {
                errors.add(new QueryError(ErrorCode.INVALID_TRAVERSAL, text,
                        clause + ": '" + literal.name() + "' names a relation, not a field", 0));
                return null;
            }
            start = explicitRoots.get(literal.name());
            first = 1;
        }
        SchemaCursor cursor = walk(start, path, first, text, clause);
        if (cursor == null) {
            return null;
        }
        if (!crossRelations && !cursor.relations().isEmpty()) {
            errors.add(new QueryError(ErrorCode.INVALID_TRAVERSAL, text,
                    clause + ": field must belong to '" + entity + "'", QueryError.UNKNOWN_POSITION));
            return null;
        }
        if (cursor.isRelation()) {
            errors.add(new QueryError(ErrorCode.INVALID_TRAVERSAL, text,
                    clause + ": '" + text + "' names a relation, not a field", path.last().position()));
            return null;
        }
        for (ResolvedRelation relation : cursor.relations()) {
            relations.putIfAbsent(relation.alias(), relation);
        }
        return cursor.ref();
    }

    @Nullable
    private FieldPath parse(String text, String clause) {
        if (text == null || text.isBlank()) {
            errors.add(new QueryError(ErrorCode.SYNTAX_ERROR, "", clause + ": empty field path", 0));
            return null;
        }
        FieldPath path;
        try {
            path = FieldPath.parse(text);
        } catch (PathSyntaxException e) {
            errors.add(e.toQueryError(clause + ": " + e.getMessage()));
            return null;
        }
        if (!path.isConcrete()) {
            errors.add(new QueryError(ErrorCode.SYNTAX_ERROR, text,
                    clause + ": wildcards are only allowed in projection patterns", firstWildcard(path)));
            return null;
        }
        return path;
    }

    @Nullable
    private SchemaCursor walk(SchemaCursor start, FieldPath path, int first, String text, String clause) {
        deadline.check("field resolution");
        SchemaCursor cursor = start;
        for (int i = first; i < path.size(); i++) {
            PathSegment segment = path.get(i);
            SchemaCursor.Step step = cursor.step(segment);
            if (!step.isSuccess()) {
                errors.add(new QueryError(step.code(), text, clause + ": " + step.message(), segment.position()));
                return null;
            }
            cursor = step.cursor();
        }
        return cursor;
    }

    private static int firstWildcard(FieldPath path) {
        for (PathSegment segment : path.segments()) {
            if (segment instanceof PathSegment.Wildcard || segment instanceof PathSegment.RecursiveWildcard
                    || segment instanceof PathSegment.MapWildcard) {
                return segment.position();
            }
        }
        return QueryError.UNKNOWN_POSITION;
    }

    void addRelations(List<ResolvedRelation> crossed) {
        for (ResolvedRelation relation : crossed) {
            relations.putIfAbsent(relation.alias(), relation);
        }
    }

    /**
     * Every relation registered so far, explicit ones first, parents before their children.
     */
    List<ResolvedRelation> relations() {
        return new ArrayList<>(relations.values());
    }
}
