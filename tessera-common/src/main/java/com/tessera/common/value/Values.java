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

package com.tessera.common.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Static helpers for building and comparing {@link Value}s.
 */
public final class Values {

    private Values() {
    }

    public static Value of(boolean value) {
        return value ? BoolVal.TRUE : BoolVal.FALSE;
    }

    public static Value of(long value) {
        return new Int64Val(value);
    }

    public static Value of(double value) {
        return new Float64Val(value);
    }

    public static Value of(String value) {
        return new StringVal(value);
    }

    /**
     * Maps a loosely typed Java object (as produced by a JSON reader or a client library) into the
     * closed value union. Integral numbers become {@link Int64Val}, fractional numbers
     * {@link Float64Val}, collections {@link ArrayVal}; temporal JDK types keep their kind.
     *
     * @throws IllegalArgumentException if the object has no value representation, including {@code null}
     */
    public static Value of(Object object) {
        if (object == null) {
            throw new IllegalArgumentException("null has no value representation");
        }
        if (object instanceof Value value) {
            return value;
        }
        if (object instanceof Boolean b) {
            return of(b.booleanValue());
        }
        if (object instanceof Byte || object instanceof Short || object instanceof Integer || object instanceof Long) {
            return new Int64Val(((Number) object).longValue());
        }
        if (object instanceof BigInteger big) {
            return new Int64Val(big.longValueExact());
        }
        if (object instanceof BigDecimal decimal) {
            if (decimal.stripTrailingZeros().scale() <= 0) {
                try {
                    return new Int64Val(decimal.longValueExact());
                } catch (ArithmeticException e) {
                    return new Float64Val(decimal.doubleValue());
                }
            }
            return new Float64Val(decimal.doubleValue());
        }
        if (object instanceof Float || object instanceof Double) {
            return new Float64Val(((Number) object).doubleValue());
        }
        if (object instanceof CharSequence chars) {
            return new StringVal(chars.toString());
        }
        if (object instanceof byte[] bytes) {
            return new BytesVal(bytes);
        }
        if (object instanceof Instant instant) {
            return new TimestampVal(instant);
        }
        if (object instanceof LocalDate date) {
            return new DateVal(date);
        }
        if (object instanceof LocalTime time) {
            return new TimeVal(time);
        }
        if (object instanceof Duration duration) {
            return new DurationVal(duration);
        }
        if (object instanceof Collection<?> collection) {
            List<Value> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(of(element));
            }
            return new ArrayVal(elements);
        }
        throw new IllegalArgumentException("Unsupported value type: " + object.getClass().getName());
    }

    /**
     * Returns true if both values are numeric ({@link Int64Val} or {@link Float64Val}).
     */
    public static boolean areNumeric(Value left, Value right) {
        return left.kind().isNumeric() && right.kind().isNumeric();
    }

    /**
     * Returns true if the two values can be ordered against each other.
     */
    public static boolean isComparable(Value left, Value right) {
        if (areNumeric(left, right)) {
            return true;
        }
        return left.kind() == right.kind() && left.kind() != ValueKind.BOOL && left.kind() != ValueKind.ARRAY;
    }

    /**
     * Equality with numeric widening: {@code 5} equals {@code 5.0}.
     */
    public static boolean equal(Value left, Value right) {
        if (areNumeric(left, right)) {
            return compare(left, right) == 0;
        }
        return left.equals(right);
    }

    /**
     * Orders two values of compatible kinds. Numbers are compared by magnitude regardless of their
     * representation; strings lexicographically; temporal values chronologically.
     *
     * @throws IllegalArgumentException if the values cannot be ordered against each other
     */
    public static int compare(Value left, Value right) {
        if (areNumeric(left, right)) {
            if (left instanceof Int64Val l && right instanceof Int64Val r) {
                return Long.compare(l.value(), r.value());
            }
            return Double.compare(asDouble(left), asDouble(right));
        }
        if (left.kind() != right.kind()) {
            throw new IllegalArgumentException("Cannot compare " + left.kind() + " with " + right.kind());
        }
        switch (left.kind()) {
            case STRING:
                return ((StringVal) left).value().compareTo(((StringVal) right).value());
            case IDENTIFIER:
                return ((IdentifierVal) left).value().compareTo(((IdentifierVal) right).value());
            case BYTES:
                return ((BytesVal) left).compareTo((BytesVal) right);
            case TIMESTAMP:
                return ((TimestampVal) left).value().compareTo(((TimestampVal) right).value());
            case DATE:
                return ((DateVal) left).value().compareTo(((DateVal) right).value());
            case TIME:
                return ((TimeVal) left).value().compareTo(((TimeVal) right).value());
            case DURATION:
                return ((DurationVal) left).value().compareTo(((DurationVal) right).value());
            default:
                throw new IllegalArgumentException("Values of kind " + left.kind() + " are not ordered");
        }
    }

    public static double asDouble(Value value) {
        if (value instanceof Int64Val i) {
            return i.value();
        }
        if (value instanceof Float64Val f) {
            return f.value();
        }
        throw new IllegalArgumentException("Value is not numeric: " + value);
    }
}
