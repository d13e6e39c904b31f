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

import com.tessera.common.type.FieldType;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of one field of an entity. Members of OBJECT fields, and of arrays or maps whose
 * elements are objects, are declared as children.
 */
public final class SchemaField {
    private final String name;
    private final FieldType type;
    private final boolean nullable;
    private final boolean indexed;
    private final boolean pii;
    private final List<SchemaField> children;
    private final Relation relation;

    private SchemaField(Builder builder) {
        this.name = builder.name;
        this.type = builder.type;
        this.nullable = builder.nullable;
        this.indexed = builder.indexed;
        this.pii = builder.pii;
        this.children = List.copyOf(builder.children);
        this.relation = builder.relation;
    }

    public static Builder builder(String name, FieldType type) {
        return new Builder(name, type);
    }

    public static SchemaField of(String name, FieldType type) {
        return builder(name, type).build();
    }

    public static SchemaField indexed(String name, FieldType type) {
        return builder(name, type).indexed().build();
    }

    public static SchemaField object(String name, SchemaField... children) {
        return builder(name, FieldType.OBJECT).children(children).build();
    }

    /**
     * Declares a relation field named {@code name} pointing at {@code targetEntity} by joining
     * {@code localKey = targetEntity.foreignKey}.
     */
    public static SchemaField relation(String name, String targetEntity, String localKey, String foreignKey) {
        return builder(name, FieldType.OBJECT).relation(targetEntity, localKey, foreignKey, false).build();
    }

    public String name() {
        return name;
    }

    public FieldType type() {
        return type;
    }

    public boolean nullable() {
        return nullable;
    }

    public boolean indexed() {
        return indexed;
    }

    public boolean pii() {
        return pii;
    }

    public List<SchemaField> children() {
        return children;
    }

    @Nullable
    public Relation relation() {
        return relation;
    }

    public boolean isRelation() {
        return relation != null;
    }

    public record Relation(String targetEntity, String localKey, String foreignKey, boolean toMany) {
    }

    public static final class Builder {
        private final String name;
        private final FieldType type;
        private final List<SchemaField> children = new ArrayList<>();
        private boolean nullable = true;
        private boolean indexed;
        private boolean pii;
        private Relation relation;

        private Builder(String name, FieldType type) {
            this.name = Objects.requireNonNull(name, "name must not be null");
            this.type = Objects.requireNonNull(type, "type must not be null");
        }

        public Builder required() {
            this.nullable = false;
            return this;
        }

        public Builder indexed() {
            this.indexed = true;
            return this;
        }

        public Builder pii() {
            this.pii = true;
            return this;
        }

        public Builder children(SchemaField... fields) {
            this.children.addAll(List.of(fields));
            return this;
        }

        public Builder child(SchemaField field) {
            this.children.add(field);
            return this;
        }

        public Builder relation(String targetEntity, String localKey, String foreignKey, boolean toMany) {
            this.relation = new Relation(targetEntity, localKey, foreignKey, toMany);
            return this;
        }

        public SchemaField build() {
            if (!children.isEmpty()) {
                FieldType member = type;
                if (type.isArray()) {
                    member = type.elementType();
                } else if (type.isMap()) {
                    member = type.valueType();
                }
                if (!member.isObject()) {
                    throw new IllegalArgumentException("Field '" + name + "' of type " + type + " cannot declare children");
                }
            }
            if (relation != null && (!type.isObject() || !children.isEmpty())) {
                throw new IllegalArgumentException("Relation field '" + name + "' must be a plain OBJECT without children");
            }
            return new SchemaField(this);
        }
    }
}
