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

import com.tessera.common.value.ArrayVal;
import com.tessera.common.value.StringVal;
import com.tessera.common.value.Value;
import com.tessera.common.value.Values;

import java.util.List;
import java.util.Locale;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * Evaluates a filter against a single row with two-valued logic: a missing value fails every
 * operator except {@link Operator#IS_NULL}, and NOT is plain boolean negation.
 */
public final class FilterEvaluator {

    private FilterEvaluator() {
    }

    public static <F> boolean evaluate(Filter<F> filter, RowAccessor<F> row) {
        if (filter instanceof Condition<F> condition) {
            return evaluateCondition(condition, row.get(condition.field()));
        }
        Compound<F> compound = (Compound<F>) filter;
        switch (compound.operator()) {
            case AND:
                for (Filter<F> child : compound.children()) {
                    if (!evaluate(child, row)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (Filter<F> child : compound.children()) {
                    if (evaluate(child, row)) {
                        return true;
                    }
                }
                return false;
            case NOT:
                return !evaluate(compound.children().get(0), row);
            default:
                throw new IllegalStateException("Unknown logical operator: " + compound.operator());
        }
    }

    private static <F> boolean evaluateCondition(Condition<F> condition, Value actual) {
        Operator operator = condition.operator();
        if (operator == Operator.IS_NULL) {
            return actual == null;
        }
        if (operator == Operator.IS_NOT_NULL) {
            return actual != null;
        }
        if (actual == null) {
            return false;
        }
        List<Value> operands = condition.values();
        boolean caseSensitive = condition.caseSensitive();
        switch (operator) {
            case EQ:
                return equal(actual, operands.get(0), caseSensitive);
            case NE:
                return !equal(actual, operands.get(0), caseSensitive);
            case LT:
                return ordered(actual, operands.get(0), caseSensitive, (c) -> c < 0);
            case LTE:
                return ordered(actual, operands.get(0), caseSensitive, (c) -> c <= 0);
            case GT:
                return ordered(actual, operands.get(0), caseSensitive, (c) -> c > 0);
            case GTE:
                return ordered(actual, operands.get(0), caseSensitive, (c) -> c >= 0);
            case BETWEEN:
                return ordered(actual, operands.get(0), caseSensitive, (c) -> c >= 0)
                        && ordered(actual, operands.get(1), caseSensitive, (c) -> c <= 0);
            case IN:
                return containsEqual(operands, actual, caseSensitive);
            case NOT_IN:
                return !containsEqual(operands, actual, caseSensitive);
            case CONTAINS:
                return stringTest(actual, operands.get(0), caseSensitive, Operator.CONTAINS);
            case STARTS_WITH:
                return stringTest(actual, operands.get(0), caseSensitive, Operator.STARTS_WITH);
            case ENDS_WITH:
                return stringTest(actual, operands.get(0), caseSensitive, Operator.ENDS_WITH);
            case MATCHES:
                return stringTest(actual, operands.get(0), caseSensitive, Operator.MATCHES);
            case ARRAY_CONTAINS:
                return actual instanceof ArrayVal array && containsEqual(array.elements(), operands.get(0), caseSensitive);
            case ARRAY_CONTAINS_ANY:
                if (!(actual instanceof ArrayVal any)) {
                    return false;
                }
                for (Value operand : operands) {
                    if (containsEqual(any.elements(), operand, caseSensitive)) {
                        return true;
                    }
                }
                return false;
            case ARRAY_CONTAINS_ALL:
                if (!(actual instanceof ArrayVal all)) {
                    return false;
                }
                for (Value operand : operands) {
                    if (!containsEqual(all.elements(), operand, caseSensitive)) {
                        return false;
                    }
                }
                return true;
            default:
                throw new IllegalStateException("Unknown operator: " + operator);
        }
    }

    private static boolean equal(Value left, Value right, boolean caseSensitive) {
        if (!caseSensitive && left instanceof StringVal l && right instanceof StringVal r) {
            return l.value().equalsIgnoreCase(r.value());
        }
        return Values.equal(left, right);
    }

    /**
     * Values that cannot be ordered against each other fail every ordering operator.
     */
    private static boolean ordered(Value left, Value right, boolean caseSensitive, IntPredicate test) {
        if (!Values.isComparable(left, right)) {
            return false;
        }
        if (!caseSensitive && left instanceof StringVal l && right instanceof StringVal r) {
            return test.test(l.value().compareToIgnoreCase(r.value()));
        }
        return test.test(Values.compare(left, right));
    }

    private static boolean containsEqual(List<Value> candidates, Value value, boolean caseSensitive) {
        for (Value candidate : candidates) {
            if (equal(candidate, value, caseSensitive)) {
                return true;
            }
        }
        return false;
    }

    private static boolean stringTest(Value actual, Value operand, boolean caseSensitive, Operator operator) {
        if (!(actual instanceof StringVal a) || !(operand instanceof StringVal o)) {
            return false;
        }
        if (operator == Operator.MATCHES) {
            int flags = caseSensitive ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
            return Pattern.compile(o.value(), flags).matcher(a.value()).find();
        }
        String subject = caseSensitive ? a.value() : a.value().toLowerCase(Locale.ROOT);
        String needle = caseSensitive ? o.value() : o.value().toLowerCase(Locale.ROOT);
        switch (operator) {
            case CONTAINS:
                return subject.contains(needle);
            case STARTS_WITH:
                return subject.startsWith(needle);
            case ENDS_WITH:
                return subject.endsWith(needle);
            default:
                throw new IllegalStateException("Not a string operator: " + operator);
        }
    }
}
