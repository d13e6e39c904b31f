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

package com.tessera.common.filter;

import com.tessera.common.error.ErrorCode;
import com.tessera.common.error.QueryError;
import com.tessera.common.error.QueryValidationException;
import com.tessera.common.schema.FieldRef;
import com.tessera.common.type.FieldType;
import com.tessera.common.value.ArrayVal;
import com.tessera.common.value.Float64Val;
import com.tessera.common.value.Int64Val;
import com.tessera.common.value.StringVal;
import com.tessera.common.value.Value;
import com.tessera.common.value.ValueKind;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks operator arity and operator/field-type legality of a resolved filter. Values are
 * expected to be coerced to the field types already; anything still incompatible is reported.
 */
public final class FilterTypeChecker {

    private FilterTypeChecker() {
    }

    /**
     * Returns every problem found in the filter, or an empty list if it is well typed.
     */
    public static List<QueryError> evaluateTypes(Filter<FieldRef> filter) {
        List<QueryError> errors = new ArrayList<>();
        visit(filter, errors);
        return errors;
    }

    /**
     * @throws QueryValidationException if the filter is not well typed
     */
    public static void check(Filter<FieldRef> filter) {
        List<QueryError> errors = evaluateTypes(filter);
        if (!errors.isEmpty()) {
            throw new QueryValidationException(errors);
        }
    }

    private static void visit(Filter<FieldRef> filter, List<QueryError> errors) {
        if (filter instanceof Compound<FieldRef> compound) {
            for (Filter<FieldRef> child : compound.children()) {
                visit(child, errors);
            }
            return;
        }
        checkCondition((Condition<FieldRef>) filter, errors);
    }

    private static void checkCondition(Condition<FieldRef> condition, List<QueryError> errors) {
        FieldRef field = condition.field();
        Operator operator = condition.operator();
        FieldType type = field.fieldType();

        if (!operator.acceptsValueCount(condition.values().size())) {
            errors.add(error(ErrorCode.SYNTAX_ERROR, field,
                    operator + " takes " + operator.describeArity() + ", got " + condition.values().size()));
            return;
        }

        switch (operator.family()) {
            case EQUALITY:
                if (type.isObject() || type.isMap()) {
                    errors.add(error(ErrorCode.TYPE_MISMATCH, field, operator + " is not defined on " + type));
                    return;
                }
                checkOperands(condition, type, errors);
                break;
            case ORDERING:
            case RANGE:
                if (!type.isOrderable()) {
                    errors.add(error(ErrorCode.TYPE_MISMATCH, field, operator + " requires an orderable field, got " + type));
                    return;
                }
                checkOperands(condition, type, errors);
                break;
            case SET:
                if (!type.isScalar()) {
                    errors.add(error(ErrorCode.TYPE_MISMATCH, field, operator + " requires a scalar field, got " + type));
                    return;
                }
                checkOperands(condition, type, errors);
                break;
            case STRING:
                if (!type.isString()) {
                    errors.add(error(ErrorCode.TYPE_MISMATCH, field, operator + " requires a STRING field, got " + type));
                    return;
                }
                checkOperands(condition, type, errors);
                if (operator == Operator.MATCHES && condition.values().get(0) instanceof StringVal pattern) {
                    try {
                        Pattern.compile(pattern.value());
                    } catch (PatternSyntaxException e) {
                        errors.add(error(ErrorCode.SYNTAX_ERROR, field, "Invalid regular expression: " + e.getDescription()));
                    }
                }
                break;
            case NULL:
                if (!field.nullable()) {
                    errors.add(error(ErrorCode.TYPE_MISMATCH, field, operator + " on a field that is never null"));
                }
                break;
            case ARRAY:
                if (!type.isArray()) {
                    errors.add(error(ErrorCode.TYPE_MISMATCH, field, operator + " requires an ARRAY field, got " + type));
                    return;
                }
                checkOperands(condition, type.elementType(), errors);
                break;
            default:
                throw new IllegalStateException("Unknown operator family: " + operator.family());
        }
    }

    private static void checkOperands(Condition<FieldRef> condition, FieldType expected, List<QueryError> errors) {
        for (Value value : condition.values()) {
            if (!isAssignable(expected, value)) {
                errors.add(error(ErrorCode.TYPE_MISMATCH, condition.field(),
                        "Value " + value + " of kind " + value.kind() + " is not compatible with " + expected));
            }
        }
    }

    /**
     * Returns true if {@code value} can be compared against a field of type {@code type} without
     * further conversion.
     */
    public static boolean isAssignable(FieldType type, Value value) {
        switch (type.kind()) {
            case BOOLEAN:
                return value.kind() == ValueKind.BOOL;
            case INT32:
            case INT64:
                if (value instanceof Float64Val f) {
                    double d = f.value();
                    return d == Math.rint(d) && (type.kind() == FieldType.Kind.INT32
                            ? d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE
                            : d >= -0x1p63 && d < 0x1p63);
                }
                if (value instanceof Int64Val i) {
                    return type.kind() == FieldType.Kind.INT64
                            || (i.value() >= Integer.MIN_VALUE && i.value() <= Integer.MAX_VALUE);
                }
                return false;
            case FLOAT32:
            case FLOAT64:
                return value.kind().isNumeric();
            case STRING:
                return value.kind() == ValueKind.STRING;
            case IDENTIFIER:
                return value.kind() == ValueKind.IDENTIFIER
                        || value.kind() == ValueKind.STRING;
            case BYTES:
                return value.kind() == ValueKind.BYTES;
            case TIMESTAMP:
                return value.kind() == ValueKind.TIMESTAMP;
            case DATE:
                return value.kind() == ValueKind.DATE;
            case TIME:
                return value.kind() == ValueKind.TIME;
            case DURATION:
                return value.kind() == ValueKind.DURATION;
            case ARRAY:
                if (!(value instanceof ArrayVal array)) {
                    return false;
                }
                for (Value element : array.elements()) {
                    if (!isAssignable(type.elementType(), element)) {
                        return false;
                    }
                }
                return true;
            default:
                return false;
        }
    }

    private static QueryError error(ErrorCode code, FieldRef field, String message) {
        return QueryError.of(code, field.path(), message);
    }
}
