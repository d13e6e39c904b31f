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

package com.tessera.planner.logical;

import com.tessera.common.filter.Compound;
import com.tessera.common.filter.Filter;
import com.tessera.common.filter.Filters;
import com.tessera.common.filter.LogicalOperator;
import com.tessera.common.schema.FieldRef;
import com.tessera.planner.cqm.CanonicalQuery;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validates logical plans for structural correctness.
 *
 * <p>This validator focuses on:
 * <ul>
 *   <li><b>Structural Integrity</b>: unique node ids, LIMIT at the root, a single PROJECT</li>
 *   <li><b>Field Availability</b>: every field a filter or join reads is produced by a scan below it</li>
 *   <li><b>Projection</b>: the PROJECT node carries exactly the canonical projection</li>
 *   <li><b>Optimization Quality</b>: patterns the planner should not emit, reported as warnings</li>
 * </ul>
 */
public final class LogicalPlanValidator {

    /**
     * Validates a plan on its own.
     */
    public ValidationResult validate(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        List<ValidationIssue> issues = new ArrayList<>();

        checkStructure(plan, issues);
        checkFieldAvailability(plan.root(), issues);
        checkOptimizationQuality(plan.root(), issues);

        boolean valid = issues.stream().noneMatch(issue -> issue.severity() == Severity.ERROR);
        return new ValidationResult(valid, issues);
    }

    /**
     * Validates a plan and checks that it preserves the canonical query's projection.
     */
    public ValidationResult validate(LogicalPlan plan, CanonicalQuery query) {
        ValidationResult result = validate(plan);
        List<ValidationIssue> issues = new ArrayList<>(result.issues());
        List<LogicalProject> projects = plan.nodesOfType(LogicalProject.class);
        if (projects.size() == 1 && !projects.get(0).fields().equals(query.projection())) {
            issues.add(new ValidationIssue(Severity.ERROR,
                    "PROJECT fields " + projects.get(0).fields() + " differ from the query projection " + query.projection(),
                    null, projects.get(0)));
        }
        boolean valid = issues.stream().noneMatch(issue -> issue.severity() == Severity.ERROR);
        return new ValidationResult(valid, issues);
    }

    public boolean isWellFormed(LogicalPlan plan) {
        return validate(plan).valid();
    }

    private void checkStructure(LogicalPlan plan, List<ValidationIssue> issues) {
        if (!(plan.root() instanceof LogicalLimit)) {
            issues.add(new ValidationIssue(Severity.ERROR, "Plan root must be a LIMIT", null, plan.root()));
        }
        Set<Integer> ids = new HashSet<>();
        for (LogicalNode node : plan.nodes()) {
            if (!ids.add(node.id())) {
                issues.add(new ValidationIssue(Severity.ERROR, "Duplicate node id " + node.id(), null, node));
            }
        }
        int projects = plan.nodesOfType(LogicalProject.class).size();
        if (projects != 1) {
            issues.add(new ValidationIssue(Severity.ERROR, "Plan must contain exactly one PROJECT, found " + projects,
                    null, plan.root()));
        }
        if (plan.root() instanceof LogicalLimit limit && limit.limit() <= 0) {
            issues.add(new ValidationIssue(Severity.ERROR, "LIMIT must be positive", null, limit));
        }
    }

    /**
     * Returns the aliases produced by the subtree and reports fields that are read before they exist.
     */
    private Set<String> checkFieldAvailability(LogicalNode node, List<ValidationIssue> issues) {
        Set<String> available = new HashSet<>();
        for (LogicalNode child : node.children()) {
            available.addAll(checkFieldAvailability(child, issues));
        }
        if (node instanceof LogicalScan scan) {
            available.add(scan.alias());
        } else if (node instanceof LogicalFilter filter) {
            for (FieldRef field : Filters.fields(filter.predicate())) {
                requireAvailable(field, available, node, issues);
            }
        } else if (node instanceof LogicalJoin join) {
            requireAvailable(join.leftKey(), available, node, issues);
            requireAvailable(join.rightKey(), available, node, issues);
            if (!join.rightKey().qualifier().equals(join.alias())) {
                issues.add(new ValidationIssue(Severity.ERROR, "Join key " + join.rightKey().path()
                        + " does not belong to relation '" + join.alias() + "'", join.rightKey().path(), node));
            }
        } else if (node instanceof LogicalProject project) {
            for (FieldRef field : project.fields()) {
                requireAvailable(field, available, node, issues);
            }
        }
        return available;
    }

    private void requireAvailable(FieldRef field, Set<String> available, LogicalNode node, List<ValidationIssue> issues) {
        if (!available.contains(field.qualifier())) {
            issues.add(new ValidationIssue(Severity.ERROR, "Field " + field.path() + " is not available below node "
                    + node.id(), field.path(), node));
        }
    }

    private void checkOptimizationQuality(LogicalNode node, List<ValidationIssue> issues) {
        if (node instanceof LogicalFilter filter) {
            if (filter.input() instanceof LogicalFilter) {
                issues.add(new ValidationIssue(Severity.WARNING, "Adjacent FILTER nodes should be merged", null, node));
            }
            if (hasDoubleNegation(filter.predicate())) {
                issues.add(new ValidationIssue(Severity.WARNING, "Predicate contains NOT(NOT(...))", null, node));
            }
        }
        for (LogicalNode child : node.children()) {
            checkOptimizationQuality(child, issues);
        }
    }

    private boolean hasDoubleNegation(Filter<FieldRef> filter) {
        if (filter instanceof Compound<FieldRef> compound) {
            if (compound.operator() == LogicalOperator.NOT
                    && compound.children().get(0) instanceof Compound<FieldRef> inner
                    && inner.operator() == LogicalOperator.NOT) {
                return true;
            }
            for (Filter<FieldRef> child : compound.children()) {
                if (hasDoubleNegation(child)) {
                    return true;
                }
            }
        }
        return false;
    }

    public enum Severity {
        ERROR,    // Plan is invalid and cannot be optimized
        WARNING   // Plan is valid but may be suboptimal
    }

    /**
     * Represents the result of a validation operation.
     */
    public record ValidationResult(boolean valid, List<ValidationIssue> issues) {
        public ValidationResult(boolean valid, List<ValidationIssue> issues) {
            this.valid = valid;
            this.issues = List.copyOf(issues);
        }

        public boolean hasErrors() {
            return !valid;
        }

        public List<ValidationIssue> errors() {
            return issues.stream().filter(issue -> issue.severity() == Severity.ERROR).toList();
        }

        public List<ValidationIssue> warnings() {
            return issues.stream().filter(issue -> issue.severity() == Severity.WARNING).toList();
        }
    }

    /**
     * One finding of the validator.
     */
    public record ValidationIssue(
            Severity severity,
            String message,
            @Nullable String field,
            LogicalNode node
    ) {
        @Nonnull
        @Override
        public String toString() {
            String location = field == null ? "" : " [" + field + "]";
            return severity + ": " + message + location + " (node " + node.id() + ")";
        }
    }
}
