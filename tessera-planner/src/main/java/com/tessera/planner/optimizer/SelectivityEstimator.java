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

package com.tessera.planner.optimizer;

import com.tessera.common.filter.Compound;
import com.tessera.common.filter.Condition;
import com.tessera.common.filter.Filter;
import com.tessera.common.schema.FieldRef;

import java.util.OptionalDouble;

/**
 * Estimates the fraction of rows a predicate keeps.
 * <p>
 * Conditions use the statistics provider when it answers and fixed per-operator defaults
 * otherwise. Conjunctions multiply, disjunctions combine as {@code 1 - Π(1 - s)} and negations
 * complement, assuming independent conditions.
 * <p>
 * Estimates are clamped to [{@code EPSILON}, 1] so that no predicate is ever considered to remove
 * every row.
 */
public final class SelectivityEstimator {
    static final double EPSILON = 0.0001;

    private SelectivityEstimator() {
    }

    public static double estimate(Filter<FieldRef> filter, StatisticsLookup statistics) {
        return clamp(estimateRaw(filter, statistics));
    }

    public static double estimate(Condition<FieldRef> condition, StatisticsLookup statistics) {
        OptionalDouble known = statistics.selectivity(condition);
        return clamp(known.isPresent() ? known.getAsDouble() : defaultSelectivity(condition));
    }

    private static double estimateRaw(Filter<FieldRef> filter, StatisticsLookup statistics) {
        if (filter instanceof Condition<FieldRef> condition) {
            return estimate(condition, statistics);
        }
        Compound<FieldRef> compound = (Compound<FieldRef>) filter;
        switch (compound.operator()) {
            case AND: {
                double result = 1.0;
                for (Filter<FieldRef> child : compound.children()) {
                    result *= estimateRaw(child, statistics);
                }
                return result;
            }
            case OR: {
                double none = 1.0;
                for (Filter<FieldRef> child : compound.children()) {
                    none *= 1.0 - estimateRaw(child, statistics);
                }
                return 1.0 - none;
            }
            case NOT:
                return 1.0 - estimateRaw(compound.children().get(0), statistics);
            default:
                throw new IllegalStateException("Unknown logical operator: " + compound.operator());
        }
    }

    static double defaultSelectivity(Condition<FieldRef> condition) {
        int operands = condition.values().size();
        switch (condition.operator()) {
            case EQ:
            case ARRAY_CONTAINS:
                return 0.1;
            case NE:
                return 0.9;
            case LT:
            case LTE:
            case GT:
            case GTE:
                return 0.3;
            case BETWEEN:
                return 0.25;
            case IN:
            case ARRAY_CONTAINS_ANY:
                return Math.min(1.0, 0.1 * operands);
            case NOT_IN:
                return Math.max(0.0, 1.0 - 0.1 * operands);
            case ARRAY_CONTAINS_ALL:
                return Math.pow(0.1, operands);
            case CONTAINS:
            case STARTS_WITH:
            case ENDS_WITH:
            case MATCHES:
                return 0.2;
            case IS_NULL:
                return 0.05;
            case IS_NOT_NULL:
                return 0.95;
            default:
                return 0.5;
        }
    }

    private static double clamp(double value) {
        return Math.max(EPSILON, Math.min(1.0, value));
    }
}
