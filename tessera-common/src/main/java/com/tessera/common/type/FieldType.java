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

package com.tessera.common.type;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Type of a schema field. Containers carry the type of their elements (ARRAY) or values (MAP);
 * OBJECT fields describe their members through the schema tree, not through the type.
 */
public final class FieldType {
    public static final FieldType BOOLEAN = new FieldType(Kind.BOOLEAN, null);
    public static final FieldType INT32 = new FieldType(Kind.INT32, null);
    public static final FieldType INT64 = new FieldType(Kind.INT64, null);
    public static final FieldType FLOAT32 = new FieldType(Kind.FLOAT32, null);
    public static final FieldType FLOAT64 = new FieldType(Kind.FLOAT64, null);
    public static final FieldType STRING = new FieldType(Kind.STRING, null);
    public static final FieldType BYTES = new FieldType(Kind.BYTES, null);
    public static final FieldType IDENTIFIER = new FieldType(Kind.IDENTIFIER, null);
    public static final FieldType TIMESTAMP = new FieldType(Kind.TIMESTAMP, null);
    public static final FieldType DATE = new FieldType(Kind.DATE, null);
    public static final FieldType TIME = new FieldType(Kind.TIME, null);
    public static final FieldType DURATION = new FieldType(Kind.DURATION, null);
    public static final FieldType OBJECT = new FieldType(Kind.OBJECT, null);

    private final Kind kind;
    private final FieldType component;

    private FieldType(Kind kind, @Nullable FieldType component) {
        this.kind = kind;
        this.component = component;
    }

    public static FieldType arrayOf(FieldType elementType) {
        return new FieldType(Kind.ARRAY, Objects.requireNonNull(elementType, "elementType"));
    }

    public static FieldType mapOf(FieldType valueType) {
        return new FieldType(Kind.MAP, Objects.requireNonNull(valueType, "valueType"));
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Element type of an ARRAY.
     *
     * @throws IllegalStateException if this is not an array type
     */
    public FieldType elementType() {
        if (kind != Kind.ARRAY) {
            throw new IllegalStateException(this + " has no element type");
        }
        return component;
    }

    /**
     * Value type of a MAP.
     *
     * @throws IllegalStateException if this is not a map type
     */
    public FieldType valueType() {
        if (kind != Kind.MAP) {
            throw new IllegalStateException(this + " has no value type");
        }
        return component;
    }

    public boolean isArray() {
        return kind == Kind.ARRAY;
    }

    public boolean isMap() {
        return kind == Kind.MAP;
    }

    public boolean isObject() {
        return kind == Kind.OBJECT;
    }

    public boolean isContainer() {
        return kind == Kind.ARRAY || kind == Kind.MAP || kind == Kind.OBJECT;
    }

    public boolean isScalar() {
        return !isContainer();
    }

    public boolean isNumeric() {
        return kind == Kind.INT32 || kind == Kind.INT64 || kind == Kind.FLOAT32 || kind == Kind.FLOAT64;
    }

    public boolean isIntegral() {
        return kind == Kind.INT32 || kind == Kind.INT64;
    }

    public boolean isTemporal() {
        return kind == Kind.TIMESTAMP || kind == Kind.DATE || kind == Kind.TIME || kind == Kind.DURATION;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    /**
     * Numeric, temporal and string fields can be ordered.
     */
    public boolean isOrderable() {
        return isNumeric() || isTemporal() || kind == Kind.STRING || kind == Kind.IDENTIFIER;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FieldType other)) return false;
        return kind == other.kind && Objects.equals(component, other.component);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, component);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ARRAY -> "ARRAY<" + component + ">";
            case MAP -> "MAP<" + component + ">";
            default -> kind.name();
        };
    }

    public enum Kind {
        BOOLEAN,
        INT32,
        INT64,
        FLOAT32,
        FLOAT64,
        STRING,
        BYTES,
        IDENTIFIER,
        TIMESTAMP,
        DATE,
        TIME,
        DURATION,
        ARRAY,
        MAP,
        OBJECT
    }
}
