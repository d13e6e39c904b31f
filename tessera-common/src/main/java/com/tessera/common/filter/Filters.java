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

import com.tessera.common.value.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Construction helpers and algebraic rewrites for {@link Filter} trees.
 */
public final class Filters {

    private Filters() {
    }

    @SafeVarargs
    public static <F> Filter<F> and(Filter<F>... children) {
        return new Compound<>(LogicalOperator.AND, Arrays.asList(children));
    }

    @SafeVarargs
    public static <F> Filter<F> or(Filter<F>... children) {
        return new Compound<>(LogicalOperator.OR, Arrays.asList(children));
    }

    public static <F> Filter<F> not(Filter<F> child) {
        return new Compound<>(LogicalOperator.NOT, List.of(child));
    }

    public static <F> Filter<F> condition(F field, Operator operator, Value... values) {
        return new Condition<>(field, operator, Arrays.asList(values));
    }

    public static <F> Filter<F> eq(F field, Value value) {
        return condition(field, Operator.EQ, value);
    }

    /**
     * Puts a filter into canonical form:
     * <ul>
     *     <li>nested compounds with the same operator are flattened,</li>
     *     <li>AND/OR with a single child is replaced by the child,</li>
     *     <li>{@code NOT(NOT(x))} collapses to {@code x},</li>
     *     <li>duplicate children are removed and the remaining ones sorted by their rendering.</li>
     * </ul>
     * Two filters that differ only in the order of AND/OR operands normalize to equal trees, and
     * {@code normalize(normalize(f))} equals {@code normalize(f)}.
     */
    public static <F> Filter<F> normalize(Filter<F> filter) {
        if (filter instanceof Condition<F>) {
            return filter;
        }
        Compound<F> compound = (Compound<F>) filter;
        if (compound.operator() == LogicalOperator.NOT) {
            Filter<F> child = normalize(compound.children().get(0));
            if (child instanceof Compound<F> inner && inner.operator() == LogicalOperator.NOT) {
                return inner.children().get(0);
            }
            return not(child);
        }

        Set<Filter<F>> unique = new LinkedHashSet<>();
        for (Filter<F> child : compound.children()) {
            Filter<F> normalized = normalize(child);
            if (normalized instanceof Compound<F> inner && inner.operator() == compound.operator()) {
                unique.addAll(inner.children());
            } else {
                unique.add(normalized);
            }
        }
        if (unique.size() == 1) {
            return unique.iterator().next();
        }
        List<Filter<F>> ordered = new ArrayList<>(unique);
        ordered.sort(Comparator.comparing(Filters::render));
        return new Compound<>(compound.operator(), ordered);
    }

    /**
     * Pushes negations down to the conditions using De Morgan's laws, removing double negations on
     * the way. The result has NOT only directly above conditions.
     */
    public static <F> Filter<F> pushNegation(Filter<F> filter) {
        if (filter instanceof Condition<F>) {
            return filter;
        }
        Compound<F> compound = (Compound<F>) filter;
        if (compound.operator() != LogicalOperator.NOT) {
            List<Filter<F>> children = new ArrayList<>(compound.children().size());
            for (Filter<F> child : compound.children()) {
                children.add(pushNegation(child));
            }
            return new Compound<>(compound.operator(), children);
        }
        Filter<F> child = compound.children().get(0);
        if (child instanceof Condition<F>) {
            return compound;
        }
        Compound<F> inner = (Compound<F>) child;
        switch (inner.operator()) {
            case NOT:
                return pushNegation(inner.children().get(0));
            case AND:
                return new Compound<>(LogicalOperator.OR, negateAll(inner.children()));
            case OR:
                return new Compound<>(LogicalOperator.AND, negateAll(inner.children()));
            default:
                throw new IllegalStateException("Unknown logical operator: " + inner.operator());
        }
    }

    private static <F> List<Filter<F>> negateAll(List<Filter<F>> children) {
        List<Filter<F>> negated = new ArrayList<>(children.size());
        for (Filter<F> child : children) {
            negated.add(pushNegation(not(child)));
        }
        return negated;
    }

    /**
     * Returns the operands of a top-level AND, or the filter itself.
     */
    public static <F> List<Filter<F>> conjuncts(Filter<F> filter) {
        if (filter instanceof Compound<F> compound && compound.operator() == LogicalOperator.AND) {
            return compound.children();
        }
        return List.of(filter);
    }

    /**
     * Joins conjuncts back into one filter; a single conjunct is returned unchanged.
     */
    public static <F> Filter<F> conjunction(List<Filter<F>> conjuncts) {
        if (conjuncts.isEmpty()) {
            throw new IllegalArgumentException("conjunction requires at least one filter");
        }
        if (conjuncts.size() == 1) {
            return conjuncts.get(0);
        }
        return new Compound<>(LogicalOperator.AND, conjuncts);
    }

    /**
     * Every field referenced by the filter, in first-seen order.
     */
    public static <F> Set<F> fields(Filter<F> filter) {
        Set<F> sink = new LinkedHashSet<>();
        collectFields(filter, sink);
        return sink;
    }

    private static <F> void collectFields(Filter<F> filter, Set<F> sink) {
        if (filter instanceof Condition<F> condition) {
            sink.add(condition.field());
            return;
        }
        for (Filter<F> child : ((Compound<F>) filter).children()) {
            collectFields(child, sink);
        }
    }

    /**
     * Every condition of the filter grouped by field, in first-seen order.
     */
    public static <F> Map<F, List<Condition<F>>> conditionsByField(Filter<F> filter) {
        Map<F, List<Condition<F>>> sink = new LinkedHashMap<>();
        collectConditions(filter, sink);
        return sink;
    }

    private static <F> void collectConditions(Filter<F> filter, Map<F, List<Condition<F>>> sink) {
        if (filter instanceof Condition<F> condition) {
            sink.computeIfAbsent(condition.field(), (k) -> new ArrayList<>()).add(condition);
            return;
        }
        for (Filter<F> child : ((Compound<F>) filter).children()) {
            collectConditions(child, sink);
        }
    }

    /**
     * True when no row with a missing value for {@code field} can satisfy the filter.
     */
    public static <F> boolean rejectsNullsOf(Filter<F> filter, F field) {
        if (filter instanceof Condition<F> condition) {
            return condition.field().equals(field) && condition.operator().isNullRejecting();
        }
        Compound<F> compound = (Compound<F>) filter;
        switch (compound.operator()) {
            case AND:
                for (Filter<F> child : compound.children()) {
                    if (rejectsNullsOf(child, field)) {
                        return true;
                    }
                }
                return false;
            case OR:
                for (Filter<F> child : compound.children()) {
                    if (!rejectsNullsOf(child, field)) {
                        return false;
                    }
                }
                return true;
            default:
                // NOT(x) may hold for missing values even when x rejects them.
                return false;
        }
    }

    /**
     * Deterministic textual form used for canonical ordering and plan output.
     */
    public static <F> String render(Filter<F> filter) {
        StringBuilder builder = new StringBuilder();
        render(filter, builder);
        return builder.toString();
    }

    private static <F> void render(Filter<F> filter, StringBuilder builder) {
        if (filter instanceof Condition<F> condition) {
            builder.append(condition.field()).append(' ').append(condition.operator());
            if (!condition.values().isEmpty()) {
                builder.append(' ');
                if (condition.values().size() == 1) {
                    builder.append(condition.values().get(0));
                } else {
                    builder.append(condition.values());
                }
            }
            if (!condition.caseSensitive()) {
                builder.append(" /i");
            }
            return;
        }
        Compound<F> compound = (Compound<F>) filter;
        builder.append(compound.operator()).append('(');
        for (int i = 0; i < compound.children().size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            render(compound.children().get(i), builder);
        }
        builder.append(')');
    }
}
