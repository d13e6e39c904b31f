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

package com.tessera.common.schema;

import com.tessera.common.path.FieldPath;
import com.tessera.common.path.PathSegment;
import com.tessera.common.type.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Schema registry kept in memory. Updates build a new immutable {@link Snapshot} and publish it
 * atomically, so readers never observe a partially applied change.
 */
public class InMemorySchemaRegistry implements SchemaView {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemorySchemaRegistry.class);

    private final AtomicReference<Snapshot> current = new AtomicReference<>(new Snapshot(Map.of()));

    public InMemorySchemaRegistry() {
    }

    public InMemorySchemaRegistry(Collection<EntitySchema> schemas) {
        schemas.forEach(this::register);
    }

    /**
     * Registers or replaces the schema of an entity.
     */
    public void register(EntitySchema schema) {
        current.updateAndGet(snapshot -> {
            Map<String, EntitySchema> next = new HashMap<>(snapshot.entities);
            next.put(schema.name(), schema);
            return new Snapshot(next);
        });
        LOGGER.debug("Registered schema for entity '{}' with {} top level fields", schema.name(), schema.fields().size());
    }

    public boolean remove(String entity) {
        Snapshot before = current.getAndUpdate(snapshot -> {
            if (!snapshot.entities.containsKey(entity)) {
                return snapshot;
            }
            Map<String, EntitySchema> next = new HashMap<>(snapshot.entities);
            next.remove(entity);
            return new Snapshot(next);
        });
        return before.entities.containsKey(entity);
    }

    @Override
    public SchemaView snapshot() {
        return current.get();
    }

    @Override
    public boolean hasEntity(String entity) {
        return current.get().hasEntity(entity);
    }

    @Override
    public Optional<FieldRef> resolve(String entity, FieldPath path) {
        return current.get().resolve(entity, path);
    }

    @Override
    public List<FieldRef> children(String entity, FieldPath prefix) {
        return current.get().children(entity, prefix);
    }

    @Override
    public Optional<RelationDescriptor> relation(String entity, String fieldId) {
        return current.get().relation(entity, fieldId);
    }

    /**
     * Immutable registry state.
     */
    static final class Snapshot implements SchemaView {
        private final Map<String, EntitySchema> entities;
        private final Map<String, RelationDescriptor> relations;

        Snapshot(Map<String, EntitySchema> entities) {
            this.entities = Collections.unmodifiableMap(new HashMap<>(entities));
            Map<String, RelationDescriptor> descriptors = new HashMap<>();
            for (EntitySchema schema : this.entities.values()) {
                collectRelations(schema.name(), schema.fields(), FieldPath.ROOT, descriptors);
            }
            this.relations = Collections.unmodifiableMap(descriptors);
        }

        private static void collectRelations(String entity, List<SchemaField> fields, FieldPath prefix,
                                             Map<String, RelationDescriptor> sink) {
            for (SchemaField field : fields) {
                FieldPath path = prefix.append(new PathSegment.Literal(field.name()));
                if (field.isRelation()) {
                    SchemaField.Relation relation = field.relation();
                    String fieldId = fieldId(entity, path);
                    sink.put(fieldId, new RelationDescriptor(fieldId, field.name(), entity, relation.targetEntity(),
                            relation.localKey(), relation.foreignKey(), relation.toMany()));
                } else if (field.type().isObject()) {
                    collectRelations(entity, field.children(), path, sink);
                }
            }
        }

        private static String fieldId(String entity, FieldPath path) {
            return entity + ":" + path.text();
        }

        @Override
        public boolean hasEntity(String entity) {
            return entities.containsKey(entity);
        }

        @Override
        public Optional<FieldRef> resolve(String entity, FieldPath path) {
            if (path.isEmpty()) {
                return Optional.empty();
            }
            Node node = walk(entity, path);
            return node == null ? Optional.empty() : Optional.of(node.toRef(entity));
        }

        @Override
        public List<FieldRef> children(String entity, FieldPath prefix) {
            Node node = walk(entity, prefix);
            if (node == null) {
                return List.of();
            }
            if (node.type != null && node.type.isArray()) {
                node = node.step(new PathSegment.ListMarker(0));
            } else if (node.type != null && node.type.isMap()) {
                node = node.step(new PathSegment.MapWildcard(0));
            }
            if (node == null || (node.type != null && !node.type.isObject()) || node.isRelation()) {
                return List.of();
            }
            List<FieldRef> result = new ArrayList<>(node.members.size());
            for (SchemaField member : node.members.values()) {
                result.add(node.child(member).toRef(entity));
            }
            return result;
        }

        @Override
        public Optional<RelationDescriptor> relation(String entity, String fieldId) {
            RelationDescriptor descriptor = relations.get(fieldId);
            if (descriptor == null || !descriptor.sourceEntity().equals(entity)) {
                return Optional.empty();
            }
            return Optional.of(descriptor);
        }

        private Node walk(String entity, FieldPath path) {
            EntitySchema schema = entities.get(entity);
            if (schema == null) {
                return null;
            }
            Node node = Node.root(schema);
            for (PathSegment segment : path.segments()) {
                node = node.step(segment);
                if (node == null) {
                    return null;
                }
            }
            return node;
        }
    }

    /**
     * Cursor over the declared field tree. {@code type} is null only at the entity root.
     */
    private static final class Node {
        private final SchemaField field;
        private final FieldType type;
        private final FieldPath path;
        private final Map<String, SchemaField> members;
        private final boolean pii;

        private Node(SchemaField field, FieldType type, FieldPath path, List<SchemaField> members, boolean pii) {
            this.field = field;
            this.type = type;
            this.path = path;
            this.members = new LinkedHashMap<>();
            for (SchemaField member : members) {
                this.members.put(member.name(), member);
            }
            this.pii = pii;
        }

        static Node root(EntitySchema schema) {
            return new Node(null, null, FieldPath.ROOT, schema.fields(), false);
        }

        boolean isRelation() {
            return field != null && field.isRelation() && type.isObject();
        }

        Node child(SchemaField member) {
            return new Node(member, member.type(), path.append(new PathSegment.Literal(member.name())),
                    member.children(), pii || member.pii());
        }

        Node step(PathSegment segment) {
            if (segment instanceof PathSegment.Literal literal) {
                if (type != null && (!type.isObject() || isRelation())) {
                    return null;
                }
                SchemaField member = members.get(literal.name());
                return member == null ? null : child(member);
            }
            if (segment instanceof PathSegment.ListMarker) {
                if (type == null || !type.isArray()) {
                    return null;
                }
                return new Node(field, type.elementType(), path.append(new PathSegment.ListMarker(path.size())),
                        field.children(), pii);
            }
            if (segment instanceof PathSegment.MapWildcard || segment instanceof PathSegment.MapKey) {
                if (type == null || !type.isMap()) {
                    return null;
                }
                return new Node(field, type.valueType(), path.append(segment), field.children(), pii);
            }
            return null;
        }

        FieldRef toRef(String entity) {
            String name = path.suffix(lastComponentStart()).text();
            return new FieldRef(entity + ":" + path.text(), name, type, field.nullable(), field.indexed(), pii,
                    entity, path.text(), "");
        }

        private int lastComponentStart() {
            int index = path.size() - 1;
            while (index > 0 && path.get(index).isSuffix()) {
                index--;
            }
            return index;
        }
    }
}
