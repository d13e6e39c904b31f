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
import com.tessera.common.model.JoinType;
import com.tessera.common.path.FieldPath;
import com.tessera.common.path.PathSegment;
import com.tessera.common.schema.FieldRef;
import com.tessera.common.schema.RelationDescriptor;
import com.tessera.common.schema.SchemaView;
import com.tessera.common.type.FieldType;
import com.tessera.planner.cqm.ResolvedRelation;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable position in the schema tree of one entity, as reached from the queried entity.
 * <p>
 * A cursor knows the relations that were crossed to reach it and the container fields above it,
 * so callers can derive implicit joins and retained ancestors without walking the path again.
 * Only literal segments cross relations; {@link #children()} never leaves the current entity.
 */
public final class SchemaCursor {
    private final SchemaView schema;
    private final String entity;
    private final String alias;
    private final FieldPath path;
    private final FieldRef ref;
    private final FieldRef component;
    private final List<FieldRef> ancestors;
    private final List<ResolvedRelation> relations;

    private SchemaCursor(SchemaView schema, String entity, String alias, FieldPath path, @Nullable FieldRef ref,
                         @Nullable FieldRef component, List<FieldRef> ancestors, List<ResolvedRelation> relations) {
        this.schema = schema;
        this.entity = entity;
        this.alias = alias;
        this.path = path;
        this.ref = ref;
        this.component = component;
        this.ancestors = ancestors;
        this.relations = relations;
    }

    /**
     * Cursor at the root of {@code entity}. Fields below it are qualified with {@code alias},
     * which is empty for the queried entity.
     */
    public static SchemaCursor root(SchemaView schema, String entity, String alias) {
        return new SchemaCursor(schema, entity, alias, FieldPath.ROOT, null, null, List.of(), List.of());
    }

    public static SchemaCursor root(SchemaView schema, String entity) {
        return root(schema, entity, "");
    }

    public boolean isRoot() {
        return ref == null;
    }

    public String entity() {
        return entity;
    }

    public String alias() {
        return alias;
    }

    /**
     * Resolved field at this position, qualified with the relation alias it was reached through.
     *
     * @throws IllegalStateException at an entity root
     */
    public FieldRef ref() {
        if (ref == null) {
            throw new IllegalStateException("entity root has no field");
        }
        return ref;
    }

    @Nullable
    public FieldType type() {
        return ref == null ? null : ref.fieldType();
    }

    /**
     * Named container fields above this position, outermost first. Relation fields are never
     * listed: the joined entity's fields stand for them.
     */
    public List<FieldRef> ancestors() {
        return ancestors;
    }

    /**
     * Relations crossed on the way here, outermost first.
     */
    public List<ResolvedRelation> relations() {
        return relations;
    }

    public boolean isRelation() {
        return relationDescriptor().isPresent();
    }

    private Optional<RelationDescriptor> relationDescriptor() {
        if (ref == null || !ref.fieldType().isObject()) {
            return Optional.empty();
        }
        return schema.relation(entity, entity + ":" + path.text());
    }

    /**
     * Moves one segment down. Literal, list and map segments are supported; wildcards are expanded
     * by the caller through {@link #children()} and {@link #descendants()}.
     */
    public Step step(PathSegment segment) {
        if (segment instanceof PathSegment.Wildcard || segment instanceof PathSegment.RecursiveWildcard) {
            return Step.failed(ErrorCode.SYNTAX_ERROR, "wildcard '" + segment.render() + "' cannot address a single field");
        }
        if (segment instanceof PathSegment.Literal) {
            Optional<RelationDescriptor> descriptor = relationDescriptor();
            if (descriptor.isPresent()) {
                Step crossed = cross(descriptor.get());
                if (!crossed.isSuccess()) {
                    return crossed;
                }
                return crossed.cursor().step(segment);
            }
        }

        FieldPath next = path.append(segment);
        Optional<FieldRef> resolved = schema.resolve(entity, next);
        if (resolved.isPresent()) {
            FieldRef nextRef = qualified(resolved.get());
            if (segment.isSuffix()) {
                return Step.of(new SchemaCursor(schema, entity, alias, next, nextRef, component, ancestors, relations));
            }
            return Step.of(new SchemaCursor(schema, entity, alias, next, nextRef, nextRef, childAncestors(), relations));
        }
        return Step.failed(classify(segment), describeFailure(segment));
    }

    /**
     * Crosses the relation at this position and returns a cursor at the root of the related entity.
     */
    public Step cross() {
        Optional<RelationDescriptor> descriptor = relationDescriptor();
        if (descriptor.isEmpty()) {
            return Step.failed(ErrorCode.INVALID_TRAVERSAL, "'" + describe() + "' is not a relation");
        }
        return cross(descriptor.get());
    }

    private Step cross(RelationDescriptor descriptor) {
        String target = descriptor.targetEntity();
        if (!schema.hasEntity(target)) {
            return Step.failed(ErrorCode.UNRESOLVABLE_RELATION,
                    "relation '" + ref.path() + "' points to unknown entity '" + target + "'");
        }
        String nextAlias = ref.path();
        FieldRef localKey = resolveKey(entity, descriptor.localKey(), alias);
        if (localKey == null) {
            return Step.failed(ErrorCode.UNRESOLVABLE_RELATION,
                    "local key '" + descriptor.localKey() + "' of relation '" + ref.path() + "' does not exist in " + entity);
        }
        FieldRef foreignKey = resolveKey(target, descriptor.foreignKey(), nextAlias);
        if (foreignKey == null) {
            return Step.failed(ErrorCode.UNRESOLVABLE_RELATION,
                    "foreign key '" + descriptor.foreignKey() + "' of relation '" + ref.path() + "' does not exist in " + target);
        }
        List<ResolvedRelation> crossed = new ArrayList<>(relations);
        crossed.add(new ResolvedRelation(nextAlias, alias, target, localKey, foreignKey, JoinType.LEFT, false));
        return Step.of(new SchemaCursor(schema, target, nextAlias, FieldPath.ROOT, null, null, ancestors,
                Collections.unmodifiableList(crossed)));
    }

    @Nullable
    private FieldRef resolveKey(String owner, String key, String keyAlias) {
        try {
            Optional<FieldRef> resolved = schema.resolve(owner, FieldPath.parse(key));
            if (resolved.isEmpty() || !resolved.get().fieldType().isScalar()) {
                return null;
            }
            return keyAlias.isEmpty() ? resolved.get() : resolved.get().qualify(keyAlias);
        } catch (PathSyntaxException e) {
            return null;
        }
    }

    /**
     * Direct named members of this position. Lists and maps are descended into their element or
     * value type; relation fields are skipped.
     */
    public List<SchemaCursor> children() {
        List<FieldRef> members = schema.children(entity, path);
        List<SchemaCursor> result = new ArrayList<>(members.size());
        List<FieldRef> nextAncestors = childAncestors();
        for (FieldRef member : members) {
            FieldPath memberPath = FieldPath.parse(member.path());
            SchemaCursor child = new SchemaCursor(schema, entity, alias, memberPath, qualified(member),
                    qualified(member), nextAncestors, relations);
            if (!child.isRelation()) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * This position followed by every position below it in the same entity, depth first.
     */
    public List<SchemaCursor> descendants() {
        List<SchemaCursor> result = new ArrayList<>();
        collectDescendants(this, result);
        return result;
    }

    private static void collectDescendants(SchemaCursor cursor, List<SchemaCursor> sink) {
        sink.add(cursor);
        for (SchemaCursor child : cursor.children()) {
            collectDescendants(child, sink);
        }
    }

    /**
     * Positions selected when this one is selected: itself if it has no members, otherwise every
     * member-less position below it. A relation selects the related entity's fields. A member-less
     * position reached through list or map suffixes stands for the named field that holds it, so
     * {@code attrs}, {@code attrs[*]} and {@code attrs['k']} all select {@code attrs}.
     */
    public Step leaves(List<SchemaCursor> sink) {
        SchemaCursor start = this;
        if (isRelation()) {
            Step crossed = cross();
            if (!crossed.isSuccess()) {
                return crossed;
            }
            start = crossed.cursor();
        }
        collectLeaves(start, sink);
        return Step.of(start);
    }

    private static void collectLeaves(SchemaCursor cursor, List<SchemaCursor> sink) {
        List<SchemaCursor> children = cursor.children();
        if (children.isEmpty()) {
            if (!cursor.isRoot()) {
                sink.add(cursor.owner());
            }
            return;
        }
        for (SchemaCursor child : children) {
            collectLeaves(child, sink);
        }
    }

    /**
     * This position with trailing list and map suffixes removed.
     */
    private SchemaCursor owner() {
        if (component == null || ref.path().equals(component.path())) {
            return this;
        }
        int length = path.size();
        while (length > 0 && path.get(length - 1).isSuffix()) {
            length--;
        }
        return new SchemaCursor(schema, entity, alias, path.prefix(length), component, component, ancestors, relations);
    }

    private List<FieldRef> childAncestors() {
        if (component == null || isRelation()) {
            return ancestors;
        }
        List<FieldRef> next = new ArrayList<>(ancestors.size() + 1);
        next.addAll(ancestors);
        next.add(component);
        return Collections.unmodifiableList(next);
    }

    private FieldRef qualified(FieldRef field) {
        return alias.isEmpty() ? field : field.qualify(alias);
    }

    private ErrorCode classify(PathSegment segment) {
        if (segment instanceof PathSegment.Literal) {
            if (ref != null && !ref.fieldType().isObject()) {
                return ErrorCode.INVALID_TRAVERSAL;
            }
            return ErrorCode.UNKNOWN_FIELD;
        }
        return ErrorCode.INVALID_TRAVERSAL;
    }

    private String describeFailure(PathSegment segment) {
        if (segment instanceof PathSegment.Literal literal) {
            if (ref == null) {
                return "entity '" + entity + "' has no field '" + literal.name() + "'";
            }
            FieldType type = ref.fieldType();
            if (type.isArray()) {
                return "'" + describe() + "' is a list; use '" + describe() + "[]' to address its elements";
            }
            if (type.isMap()) {
                return "'" + describe() + "' is a map; use '[*]' or ['key'] to address its values";
            }
            if (!type.isObject()) {
                return "cannot traverse into '" + describe() + "' of type " + type;
            }
            return "'" + describe() + "' has no field '" + literal.name() + "'";
        }
        if (segment instanceof PathSegment.ListMarker) {
            return "'[]' requires a list, but '" + describe() + "' is " + describeType();
        }
        return "'" + segment.render() + "' requires a map, but '" + describe() + "' is " + describeType();
    }

    private String describe() {
        return ref == null ? entity : ref.path();
    }

    private String describeType() {
        return ref == null ? "an entity" : ref.fieldType().toString();
    }

    @Override
    public String toString() {
        return "SchemaCursor{" + entity + ":" + describe() + "}";
    }

    /**
     * Outcome of moving a cursor: the new position, or the reason it does not exist.
     */
    public record Step(@Nullable SchemaCursor cursor, @Nullable ErrorCode code, @Nullable String message) {

        static Step of(SchemaCursor cursor) {
            return new Step(cursor, null, null);
        }

        static Step failed(ErrorCode code, String message) {
            return new Step(null, code, message);
        }

        public boolean isSuccess() {
            return cursor != null;
        }
    }
}
