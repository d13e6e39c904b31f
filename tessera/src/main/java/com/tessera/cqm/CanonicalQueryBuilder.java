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

import com.tessera.common.Deadline;
import com.tessera.common.error.ErrorCode;
import com.tessera.common.error.PathSyntaxException;
import com.tessera.common.error.QueryError;
import com.tessera.common.error.QueryValidationException;
import com.tessera.common.filter.Compound;
import com.tessera.common.filter.Condition;
import com.tessera.common.filter.Filter;
import com.tessera.common.filter.FilterTypeChecker;
import com.tessera.common.filter.Filters;
import com.tessera.common.filter.Operator;
import com.tessera.common.model.AggregateFunction;
import com.tessera.common.model.SearchMode;
import com.tessera.common.path.FieldPath;
import com.tessera.common.path.PathSegment;
import com.tessera.common.schema.FieldRef;
import com.tessera.common.schema.SchemaView;
import com.tessera.common.type.FieldType;
import com.tessera.planner.cqm.CanonicalAggregate;
import com.tessera.planner.cqm.CanonicalAggregation;
import com.tessera.planner.cqm.CanonicalQuery;
import com.tessera.planner.cqm.CanonicalSearch;
import com.tessera.planner.cqm.CanonicalSort;
import com.tessera.planner.cqm.OutputColumn;
import com.tessera.planner.cqm.ResolvedRelation;
import com.tessera.planner.cqm.SortKey;
import com.tessera.psl.ProjectionMatcher;
import com.tessera.psl.ProjectionResult;
import com.tessera.psl.SchemaCursor;
import com.tessera.query.Aggregate;
import com.tessera.query.Aggregation;
import com.tessera.query.Pagination;
import com.tessera.query.Projection;
import com.tessera.query.Query;
import com.tessera.query.Relation;
import com.tessera.query.Search;
import com.tessera.query.Sort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns a client {@link Query} into a {@link CanonicalQuery}: every field path resolved against
 * the schema, every filter value coerced and type checked, the projection expanded into an
 * explicit field set, the filter normalized, relations crossed by any clause collected as joins
 * and a query id assigned.
 * <p>
 * Validation never stops at the first problem. Every error found is collected and reported
 * together in one {@link QueryValidationException}, so a client can fix a request in a single
 * round trip. No canonical query is produced for an invalid request.
 */
public class CanonicalQueryBuilder {
    static final String DEFAULT_VECTOR_FIELD = "embedding";
    private static final Logger LOGGER = LoggerFactory.getLogger(CanonicalQueryBuilder.class);

    private final BuildSettings settings;
    private final ProjectionMatcher matcher;
    private final Supplier<String> idGenerator;

    public CanonicalQueryBuilder() {
        this(BuildSettings.DEFAULT);
    }

    public CanonicalQueryBuilder(BuildSettings settings) {
        this(settings, () -> UUID.randomUUID().toString());
    }

    public CanonicalQueryBuilder(BuildSettings settings, Supplier<String> idGenerator) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator must not be null");
        this.matcher = new ProjectionMatcher(settings.projectionLimits());
    }

    public CanonicalQuery build(Query query, SchemaView schema, PermissionView permissions) {
        return build(query, schema, permissions, Deadline.none());
    }

    /**
     * @throws QueryValidationException                           with every problem found in the query
     * @throws com.tessera.common.error.PlanningTimeoutException if the deadline passes while resolving
     */
    public CanonicalQuery build(Query query, SchemaView schemaView, PermissionView permissions, Deadline deadline) {
        Objects.requireNonNull(query, "query must not be null");
        deadline.check("canonicalization");
        SchemaView schema = schemaView.snapshot();
        String entity = query.entity();
        if (!schema.hasEntity(entity)) {
            throw new QueryValidationException(QueryError.of(ErrorCode.UNKNOWN_FIELD, entity,
                    "unknown entity '" + entity + "'"));
        }

        List<QueryError> errors = new ArrayList<>();
        FieldResolver resolver = new FieldResolver(schema, entity, deadline, errors);

        declareRelations(query.relations(), schema, resolver, errors);
        Filter<FieldRef> filter = query.filter() == null ? null
                : resolveFilter(query.filter(), resolver, permissions, errors);
        CanonicalAggregation aggregation = query.aggregation() == null ? null
                : resolveAggregation(query.aggregation(), entity, resolver, permissions, errors);
        List<CanonicalSort> sorts = resolveSorts(query.sorts(), aggregation, resolver, permissions, errors);
        CanonicalSearch search = query.search() == null ? null
                : resolveSearch(query.search(), resolver, permissions, errors);

        deadline.check("projection");
        Set<FieldRef> projection = resolveProjection(query.projection(), aggregation, sorts, resolver, permissions,
                errors);
        Paging paging = resolvePagination(query.pagination(), errors);

        if (!errors.isEmpty()) {
            LOGGER.debug("Query on '{}' rejected with {} validation errors", entity, errors.size());
            throw new QueryValidationException(errors);
        }

        if (filter != null) {
            filter = Filters.normalize(filter);
        }
        String queryId = idGenerator.get();
        CanonicalQuery canonical = new CanonicalQuery(queryId, entity, query.tenant(), filter, sorts, projection,
                aggregation, search, resolver.relations(), paging.limit(), paging.offset(), paging.cursor(),
                query.options());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Built canonical query {} on '{}': {} projected fields, {} relations", queryId, entity,
                    projection.size(), canonical.relations().size());
        }
        return canonical;
    }

    private void declareRelations(List<Relation> relations, SchemaView schema, FieldResolver resolver,
                                  List<QueryError> errors) {
        for (Relation relation : relations) {
            String alias = relation.alias();
            String clause = "relation '" + alias + "'";
            if (!schema.hasEntity(relation.entity())) {
                errors.add(QueryError.of(ErrorCode.UNRESOLVABLE_RELATION, alias,
                        clause + ": unknown entity '" + relation.entity() + "'"));
                continue;
            }
            if (resolver.isDeclared(alias)) {
                errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, alias, clause + ": alias is declared twice"));
                continue;
            }
            if (resolver.root().step(new PathSegment.Literal(alias)).isSuccess()) {
                errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, alias,
                        clause + ": alias shadows a field of the queried entity"));
                continue;
            }
            FieldRef localKey = resolver.resolveLocal(relation.localField(), clause);
            FieldRef foreignKey = resolver.resolveIn(SchemaCursor.root(schema, relation.entity(), alias),
                    relation.foreignField(), clause);
            if (localKey == null || foreignKey == null) {
                continue;
            }
            if (!localKey.fieldType().isScalar() || !foreignKey.fieldType().isScalar()) {
                errors.add(QueryError.of(ErrorCode.UNRESOLVABLE_RELATION, alias,
                        clause + ": join keys must be scalar fields"));
                continue;
            }
            resolver.declare(new ResolvedRelation(alias, "", relation.entity(), localKey, foreignKey,
                    relation.joinType(), true));
        }
    }

    @Nullable
    private Filter<FieldRef> resolveFilter(Filter<String> filter, FieldResolver resolver, PermissionView permissions,
                                           List<QueryError> errors) {
        if (filter.depth() > settings.maxFilterDepth()) {
            errors.add(QueryError.of(ErrorCode.LIMIT_EXCEEDED, "filter",
                    "filter depth " + filter.depth() + " exceeds the limit of " + settings.maxFilterDepth()));
            return null;
        }
        Filter<FieldRef> resolved = resolveFilterNode(filter, resolver, permissions, errors);
        if (resolved != null) {
            errors.addAll(FilterTypeChecker.evaluateTypes(resolved));
        }
        return resolved;
    }

    @Nullable
    private Filter<FieldRef> resolveFilterNode(Filter<String> filter, FieldResolver resolver,
                                               PermissionView permissions, List<QueryError> errors) {
        if (filter instanceof Compound<String> compound) {
            List<Filter<FieldRef>> children = new ArrayList<>(compound.children().size());
            boolean complete = true;
            for (Filter<String> child : compound.children()) {
                Filter<FieldRef> resolved = resolveFilterNode(child, resolver, permissions, errors);
                if (resolved == null) {
                    complete = false;
                } else {
                    children.add(resolved);
                }
            }
            return complete ? new Compound<>(compound.operator(), children) : null;
        }
        Condition<String> condition = (Condition<String>) filter;
        FieldRef field = resolver.resolve(condition.field(), "filter");
        if (field == null) {
            return null;
        }
        if (!permissions.canRead(field)) {
            errors.add(permissionDenied(field, "filter"));
            return null;
        }
        FieldType operandType = field.fieldType();
        if (condition.operator().family() == Operator.Family.ARRAY && operandType.isArray()) {
            operandType = operandType.elementType();
        }
        return new Condition<>(field, condition.operator(), ValueCoercer.coerceAll(operandType, condition.values()),
                condition.caseSensitive());
    }

    private CanonicalAggregation resolveAggregation(Aggregation aggregation, String entity, FieldResolver resolver,
                                                    PermissionView permissions, List<QueryError> errors) {
        if (aggregation.groupBy().isEmpty() && aggregation.aggregates().isEmpty()) {
            errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "aggregation",
                    "aggregation needs group_by fields or aggregates"));
        }

        List<FieldRef> groupBy = new ArrayList<>(aggregation.groupBy().size());
        for (String path : aggregation.groupBy()) {
            FieldRef field = resolver.resolve(path, "group_by");
            if (field == null) {
                continue;
            }
            if (!permissions.canRead(field)) {
                errors.add(permissionDenied(field, "group_by"));
                continue;
            }
            if (!field.fieldType().isScalar()) {
                errors.add(QueryError.of(ErrorCode.TYPE_MISMATCH, path,
                        "group_by: cannot group by " + field.fieldType() + " field"));
                continue;
            }
            if (!groupBy.contains(field)) {
                groupBy.add(field);
            }
        }

        Set<String> columnNames = new HashSet<>();
        for (FieldRef field : groupBy) {
            columnNames.add(field.path());
        }
        List<CanonicalAggregate> aggregates = new ArrayList<>(aggregation.aggregates().size());
        for (Aggregate aggregate : aggregation.aggregates()) {
            CanonicalAggregate resolved = resolveAggregate(aggregate, columnNames, resolver, permissions, errors);
            if (resolved != null) {
                aggregates.add(resolved);
            }
        }

        CanonicalAggregation partial = new CanonicalAggregation(groupBy, aggregates, null);
        if (aggregation.having() == null) {
            return partial;
        }
        Filter<OutputColumn> having = resolveHaving(aggregation.having(), partial.outputColumns(), entity, errors);
        return new CanonicalAggregation(groupBy, aggregates, having);
    }

    @Nullable
    private CanonicalAggregate resolveAggregate(Aggregate aggregate, Set<String> columnNames, FieldResolver resolver,
                                                PermissionView permissions, List<QueryError> errors) {
        String alias = aggregate.alias();
        AggregateFunction function = aggregate.function();
        String clause = "aggregate '" + alias + "'";
        if (alias.isBlank()) {
            errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, function.name(), "aggregate alias must not be empty"));
            return null;
        }
        if (!columnNames.add(alias)) {
            errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, alias, clause + ": output column is defined twice"));
            return null;
        }

        FieldRef field = null;
        if (aggregate.field() != null) {
            field = resolver.resolve(aggregate.field(), clause);
            if (field == null) {
                return null;
            }
            if (!permissions.canRead(field)) {
                errors.add(permissionDenied(field, clause));
                return null;
            }
        } else if (function.requiresField()) {
            errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, alias, clause + ": " + function + " requires a field"));
            return null;
        }

        if (field != null) {
            FieldType type = field.fieldType();
            if (function.requiresNumericField() && !type.isNumeric()) {
                errors.add(QueryError.of(ErrorCode.TYPE_MISMATCH, field.path(),
                        clause + ": " + function + " requires a numeric field, got " + type));
                return null;
            }
            if ((function == AggregateFunction.MIN || function == AggregateFunction.MAX) && !type.isOrderable()) {
                errors.add(QueryError.of(ErrorCode.TYPE_MISMATCH, field.path(),
                        clause + ": " + function + " requires an orderable field, got " + type));
                return null;
            }
            if (function == AggregateFunction.COUNT_DISTINCT && !type.isScalar()) {
                errors.add(QueryError.of(ErrorCode.TYPE_MISMATCH, field.path(),
                        clause + ": " + function + " requires a scalar field, got " + type));
                return null;
            }
        }

        Double percentile = aggregate.percentile();
        if (function == AggregateFunction.PERCENTILE) {
            if (percentile == null || percentile.isNaN() || percentile < 0 || percentile > 100) {
                errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, alias,
                        clause + ": PERCENTILE requires a percentile between 0 and 100"));
                return null;
            }
        } else if (percentile != null) {
            errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, alias,
                    clause + ": percentile is only allowed with PERCENTILE"));
            return null;
        }
        return new CanonicalAggregate(function, field, percentile, new OutputColumn(alias, outputType(function, field), null));
    }

    static FieldType outputType(AggregateFunction function, @Nullable FieldRef field) {
        switch (function) {
            case COUNT:
            case COUNT_DISTINCT:
                return FieldType.INT64;
            case SUM:
                return field != null && field.fieldType().isIntegral() ? FieldType.INT64 : FieldType.FLOAT64;
            case MIN:
            case MAX:
                return Objects.requireNonNull(field, "MIN and MAX take a field").fieldType();
            default:
                return FieldType.FLOAT64;
        }
    }

    @Nullable
    private Filter<OutputColumn> resolveHaving(Filter<String> having, List<OutputColumn> columns, String entity,
                                               List<QueryError> errors) {
        if (having.depth() > settings.maxFilterDepth()) {
            errors.add(QueryError.of(ErrorCode.LIMIT_EXCEEDED, "having",
                    "having depth " + having.depth() + " exceeds the limit of " + settings.maxFilterDepth()));
            return null;
        }
        Map<String, OutputColumn> byName = new LinkedHashMap<>();
        for (OutputColumn column : columns) {
            byName.put(column.name(), column);
        }
        Filter<OutputColumn> resolved = resolveHavingNode(having, byName, errors);
        if (resolved == null) {
            return null;
        }
        Filter<FieldRef> typed = resolved.map(column -> new FieldRef("having:" + column.name(), column.name(),
                column.type(), column.source() == null || column.source().nullable(), false, false, entity,
                column.name(), ""));
        List<QueryError> typeErrors = FilterTypeChecker.evaluateTypes(typed);
        for (QueryError error : typeErrors) {
            errors.add(new QueryError(error.code(), error.subject(), "having: " + error.message(), error.position()));
        }
        return typeErrors.isEmpty() ? Filters.normalize(resolved) : null;
    }

    @Nullable
    private Filter<OutputColumn> resolveHavingNode(Filter<String> filter, Map<String, OutputColumn> columns,
                                                   List<QueryError> errors) {
        if (filter instanceof Compound<String> compound) {
            List<Filter<OutputColumn>> children = new ArrayList<>(compound.children().size());
            boolean complete = true;
            for (Filter<String> child : compound.children()) {
                Filter<OutputColumn> resolved = resolveHavingNode(child, columns, errors);
                if (resolved == null) {
                    complete = false;
                } else {
                    children.add(resolved);
                }
            }
            return complete ? new Compound<>(compound.operator(), children) : null;
        }
        Condition<String> condition = (Condition<String>) filter;
        OutputColumn column = columns.get(condition.field());
        if (column == null) {
            errors.add(QueryError.of(ErrorCode.UNKNOWN_FIELD, condition.field(),
                    "having: '" + condition.field() + "' is neither a group_by field nor an aggregate alias"));
            return null;
        }
        return new Condition<>(column, condition.operator(), ValueCoercer.coerceAll(column.type(), condition.values()),
                condition.caseSensitive());
    }

    private List<CanonicalSort> resolveSorts(List<Sort> sorts, @Nullable CanonicalAggregation aggregation,
                                             FieldResolver resolver, PermissionView permissions,
                                             List<QueryError> errors) {
        Map<String, OutputColumn> columns = new LinkedHashMap<>();
        if (aggregation != null) {
            for (OutputColumn column : aggregation.outputColumns()) {
                columns.put(column.name(), column);
            }
        }
        List<CanonicalSort> result = new ArrayList<>(sorts.size());
        Set<String> seen = new HashSet<>();
        for (Sort sort : sorts) {
            SortKey key;
            if (aggregation != null) {
                OutputColumn column = columns.get(sort.field());
                if (column == null) {
                    errors.add(QueryError.of(ErrorCode.UNKNOWN_FIELD, sort.field(),
                            "sort: '" + sort.field() + "' is neither a group_by field nor an aggregate alias"));
                    continue;
                }
                key = new SortKey.Column(column);
            } else {
                FieldRef field = resolver.resolve(sort.field(), "sort");
                if (field == null) {
                    continue;
                }
                if (!permissions.canRead(field)) {
                    errors.add(permissionDenied(field, "sort"));
                    continue;
                }
                if (!field.fieldType().isScalar()) {
                    errors.add(QueryError.of(ErrorCode.TYPE_MISMATCH, sort.field(),
                            "sort: cannot sort by " + field.fieldType() + " field"));
                    continue;
                }
                key = new SortKey.Field(field);
            }
            if (seen.add(key.name())) {
                result.add(new CanonicalSort(key, sort.direction(), sort.nulls()));
            }
        }
        return result;
    }

    @Nullable
    private CanonicalSearch resolveSearch(Search search, FieldResolver resolver, PermissionView permissions,
                                          List<QueryError> errors) {
        int before = errors.size();
        SearchMode mode = search.mode();
        if (!Double.isFinite(search.minScore()) || search.minScore() < 0) {
            errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "search", "min_score must be a non-negative number"));
        }

        List<FieldRef> fields = new ArrayList<>();
        Map<FieldRef, Double> boost = new LinkedHashMap<>();
        if (mode != SearchMode.SEMANTIC) {
            if (search.query().isBlank()) {
                errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "search", mode + " search needs query text"));
            }
            if (search.fields().isEmpty()) {
                fields.addAll(defaultTextFields(resolver.root(), permissions));
                if (fields.isEmpty()) {
                    errors.add(QueryError.of(ErrorCode.TYPE_MISMATCH, "search", "no readable text fields to search"));
                }
            }
            for (String path : search.fields()) {
                FieldRef field = resolver.resolveLocal(path, "search");
                if (field == null) {
                    continue;
                }
                if (!permissions.canRead(field)) {
                    errors.add(permissionDenied(field, "search"));
                    continue;
                }
                if (!isText(field.fieldType())) {
                    errors.add(QueryError.of(ErrorCode.TYPE_MISMATCH, path,
                            "search: full-text search requires a STRING field, got " + field.fieldType()));
                    continue;
                }
                if (!fields.contains(field)) {
                    fields.add(field);
                }
            }
            for (Map.Entry<String, Double> entry : new TreeMap<>(search.boost()).entrySet()) {
                FieldRef field = findByPath(fields, entry.getKey());
                if (field == null) {
                    errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, entry.getKey(),
                            "search: boosted field is not one of the searched fields"));
                    continue;
                }
                Double weight = entry.getValue();
                if (weight == null || !Double.isFinite(weight) || weight <= 0) {
                    errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, entry.getKey(),
                            "search: boost must be a positive number"));
                    continue;
                }
                boost.put(field, weight);
            }
        } else if (!search.boost().isEmpty()) {
            errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "search", "boost only applies to full-text search"));
        }

        FieldRef vectorField = null;
        if (mode != SearchMode.FULL_TEXT) {
            String path = search.vectorField() == null ? DEFAULT_VECTOR_FIELD : search.vectorField();
            vectorField = resolver.resolveLocal(path, "search");
            if (vectorField != null && !permissions.canRead(vectorField)) {
                errors.add(permissionDenied(vectorField, "search"));
            } else if (vectorField != null && !isVector(vectorField.fieldType())) {
                errors.add(QueryError.of(ErrorCode.TYPE_MISMATCH, path,
                        "search: vector field must be an array of floats, got " + vectorField.fieldType()));
            }
            if (mode == SearchMode.SEMANTIC && search.query().isBlank() && search.embedding().isEmpty()) {
                errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "search",
                        "semantic search needs query text or an embedding"));
            }
            for (Double component : search.embedding()) {
                if (component == null || !Double.isFinite(component)) {
                    errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "search", "embedding must contain finite numbers"));
                    break;
                }
            }
        } else if (!search.embedding().isEmpty() || search.vectorField() != null) {
            errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "search",
                    "vector_field and embedding only apply to semantic or hybrid search"));
        }

        if (errors.size() > before) {
            return null;
        }
        return new CanonicalSearch(search.query(), mode, fields, vectorField, search.embedding(), search.minScore(),
                boost);
    }

    private static List<FieldRef> defaultTextFields(SchemaCursor root, PermissionView permissions) {
        List<FieldRef> fields = new ArrayList<>();
        for (SchemaCursor cursor : root.descendants()) {
            if (!cursor.isRoot() && isText(cursor.ref().fieldType()) && permissions.canRead(cursor.ref())) {
                fields.add(cursor.ref());
            }
        }
        return fields;
    }

    private static boolean isText(FieldType type) {
        return type.isString() || (type.isArray() && type.elementType().isString());
    }

    private static boolean isVector(FieldType type) {
        if (!type.isArray()) {
            return false;
        }
        FieldType.Kind element = type.elementType().kind();
        return element == FieldType.Kind.FLOAT32 || element == FieldType.Kind.FLOAT64;
    }

    @Nullable
    private static FieldRef findByPath(List<FieldRef> fields, String text) {
        String path;
        try {
            path = FieldPath.parse(text).text();
        } catch (PathSyntaxException e) {
            path = text;
        }
        for (FieldRef field : fields) {
            if (field.path().equals(path)) {
                return field;
            }
        }
        return null;
    }

    /**
     * Aggregation queries read their group-by and aggregate inputs plus whatever is included
     * explicitly; other queries read what the projection patterns select plus their sort fields.
     */
    private Set<FieldRef> resolveProjection(Projection projection, @Nullable CanonicalAggregation aggregation,
                                            List<CanonicalSort> sorts, FieldResolver resolver,
                                            PermissionView permissions, List<QueryError> errors) {
        Set<FieldRef> fields = new LinkedHashSet<>();
        if (aggregation != null) {
            fields.addAll(aggregation.inputFields());
            if (projection.include().isEmpty()) {
                return fields;
            }
        }

        ProjectionResult result = matcher.match(resolver.root(), resolver.declaredRoots(), projection.include(),
                projection.exclude(), permissions::canRead);
        if (!result.isValid()) {
            errors.addAll(result.errors());
            return fields;
        }
        resolver.addRelations(result.relations());
        fields.addAll(result.fields());

        if (aggregation == null) {
            for (CanonicalSort sort : sorts) {
                if (sort.key() instanceof SortKey.Field key) {
                    fields.add(key.field());
                }
            }
        }
        if (fields.isEmpty()) {
            errors.add(QueryError.of(ErrorCode.UNKNOWN_FIELD, "projection", "projection selects no readable fields"));
        }
        return fields;
    }

    private Paging resolvePagination(Pagination pagination, List<QueryError> errors) {
        int limit = settings.defaultPageSize();
        if (pagination.pageSize() != null) {
            int pageSize = pagination.pageSize();
            if (pageSize <= 0) {
                errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "pagination.page_size",
                        "page_size must be a positive integer"));
            } else if (pageSize > settings.maxPageSize()) {
                errors.add(QueryError.of(ErrorCode.LIMIT_EXCEEDED, "pagination.page_size",
                        "page_size " + pageSize + " exceeds the limit of " + settings.maxPageSize()));
            } else {
                limit = pageSize;
            }
        }
        if (pagination.cursor() != null && pagination.offset() != null) {
            errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "pagination", "cursor and offset are mutually exclusive"));
        }
        if (pagination.cursor() != null && pagination.cursor().isBlank()) {
            errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "pagination.cursor", "cursor must not be empty"));
        }
        int offset = 0;
        if (pagination.offset() != null) {
            if (pagination.offset() < 0) {
                errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, "pagination.offset", "offset must not be negative"));
            } else {
                offset = pagination.offset();
            }
        }
        return new Paging(limit, offset, pagination.cursor());
    }

    private static QueryError permissionDenied(FieldRef field, String clause) {
        return QueryError.of(ErrorCode.PERMISSION_DENIED, field.path(), clause + ": field is not readable");
    }

    private record Paging(int limit, int offset, @Nullable String cursor) {
    }
}
