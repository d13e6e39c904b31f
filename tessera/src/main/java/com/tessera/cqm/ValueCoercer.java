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

import com.google.common.io.BaseEncoding;
import com.tessera.common.type.FieldType;
import com.tessera.common.value.ArrayVal;
import com.tessera.common.value.BytesVal;
import com.tessera.common.value.DateVal;
import com.tessera.common.value.DurationVal;
import com.tessera.common.value.Float64Val;
import com.tessera.common.value.IdentifierVal;
import com.tessera.common.value.Int64Val;
import com.tessera.common.value.StringVal;
import com.tessera.common.value.TimeVal;
import com.tessera.common.value.TimestampVal;
import com.tessera.common.value.Value;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts client values into the representation of the field they are compared with.
 * <p>
 * Only lossless conversions and the textual encodings a JSON client has to use are applied:
 * integers widen to floats, whole floats narrow to integers, ISO-8601 strings become temporal
 * values, base64 strings become bytes and strings become identifiers. Anything else is returned
 * unchanged and left for the type checker to reject.
 */
final class ValueCoercer {

    private ValueCoercer() {
    }

    static Value coerce(FieldType type, Value value) {
        switch (type.kind()) {
            case INT32:
            case INT64:
                if (value instanceof Float64Val f && f.value() == Math.rint(f.value())
                        && f.value() >= -0x1p63 && f.value() < 0x1p63) {
                    return new Int64Val((long) f.value());
                }
                return value;
            case FLOAT32:
            case FLOAT64:
                if (value instanceof Int64Val i) {
                    return new Float64Val(i.value());
                }
                return value;
            case IDENTIFIER:
                if (value instanceof StringVal s) {
                    return new IdentifierVal(s.value());
                }
                return value;
            case TIMESTAMP:
                if (value instanceof StringVal s) {
                    Instant instant = parseInstant(s.value());
                    return instant == null ? value : new TimestampVal(instant);
                }
                return value;
            case DATE:
                if (value instanceof StringVal s) {
                    try {
                        return new DateVal(LocalDate.parse(s.value()));
                    } catch (DateTimeParseException e) {
                        return value;
                    }
                }
                return value;
            case TIME:
                if (value instanceof StringVal s) {
                    try {
                        return new TimeVal(LocalTime.parse(s.value()));
                    } catch (DateTimeParseException e) {
                        return value;
                    }
                }
                return value;
            case DURATION:
                if (value instanceof StringVal s) {
                    try {
                        return new DurationVal(Duration.parse(s.value()));
                    } catch (DateTimeParseException e) {
                        return value;
                    }
                }
                return value;
            case BYTES:
                if (value instanceof StringVal s) {
                    try {
                        return new BytesVal(BaseEncoding.base64().decode(s.value()));
                    } catch (IllegalArgumentException e) {
                        return value;
                    }
                }
                return value;
            case ARRAY:
                if (value instanceof ArrayVal array) {
                    List<Value> elements = new ArrayList<>(array.elements().size());
                    for (Value element : array.elements()) {
                        elements.add(coerce(type.elementType(), element));
                    }
                    return new ArrayVal(elements);
                }
                return value;
            default:
                return value;
        }
    }

    static List<Value> coerceAll(FieldType type, List<Value> values) {
        List<Value> result = new ArrayList<>(values.size());
        for (Value value : values) {
            result.add(coerce(type, value));
        }
        return result;
    }

    private static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
