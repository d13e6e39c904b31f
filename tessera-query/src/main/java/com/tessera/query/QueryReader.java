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

package com.tessera.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.tessera.common.error.ErrorCode;
import com.tessera.common.error.QueryError;
import com.tessera.common.error.QueryValidationException;
import com.tessera.common.filter.Compound;
import com.tessera.common.filter.Condition;
import com.tessera.common.filter.Filter;
import com.tessera.common.filter.LogicalOperator;
import com.tessera.common.filter.Operator;
import com.tessera.common.json.JSONUtil;
import com.tessera.common.model.AggregateFunction;
import com.tessera.common.model.Consistency;
import com.tessera.common.model.JoinType;
import com.tessera.common.model.NullOrdering;
import com.tessera.common.model.QueryOptions;
import com.tessera.common.model.SearchMode;
import com.tessera.common.model.SortDirection;
import com.tessera.common.value.Value;
import com.tessera.common.value.Values;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link Query} from its JSON wire shape:
 *
 * <pre>{@code
 * {
 *   "entity": "orders",
 *   "tenant": "acme",
 *   "filter": {"and": [{"field": "status", "operator": "EQ", "value": "paid"},
 *                      {"field": "total", "operator": "GT", "value": 100}]},
 *   "sorts": [{"field": "created_at", "direction": "DESC"}],
 *   "include": ["id", "total", "customer.name"],
 *   "pagination": {"page_size": 20},
 *   "timeout_ms": 200
 * }
 * }</pre>
 * <p>
 * Every structural problem found in the document is collected and reported together as
 * {@link ErrorCode#SYNTAX_ERROR} entries of a {@link QueryValidationException}.
 */
public final class QueryReader {
    private final List<QueryError> errors = new ArrayList<>();

    private QueryReader() {
    }

    public static Query read(String json) {
        JsonNode root;
        try {
            root = JSONUtil.objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new QueryValidationException(QueryError.of(ErrorCode.SYNTAX_ERROR, "", "Malformed JSON: " + e.getOriginalMessage()));
        }
        return read(root);
    }

    public static Query read(JsonNode root) {
        QueryReader reader = new QueryReader();
        Query query = reader.readQuery(root);
        if (!reader.errors.isEmpty()) {
            throw new QueryValidationException(reader.errors);
        }
        return query;
    }

    private Query readQuery(JsonNode root) {
        if (root == null || !root.isObject()) {
            error("", "Query must be a JSON object");
            return null;
        }
        String entity = requiredText(root, "entity");
        String tenant = requiredText(root, "tenant");
        if (entity == null || tenant == null) {
            return null;
        }
        QueryBuilder builder = Query.builder(entity, tenant);

        JsonNode filter = root.get("filter");
        if (filter != null && !filter.isNull()) {
            Filter<String> parsed = readFilter(filter, "filter");
            if (parsed != null) {
                builder.where(parsed);
            }
        }
        for (JsonNode sort : elements(root, "sorts")) {
            Sort parsed = readSort(sort);
            if (parsed != null) {
                builder.orderBy(parsed);
            }
        }
        JsonNode projection = root.path("projection");
        builder.include(texts(root.has("include") ? root : projection, "include").toArray(new String[0]));
        builder.exclude(texts(root.has("exclude") ? root : projection, "exclude").toArray(new String[0]));

        if (root.hasNonNull("aggregation")) {
            builder.aggregate(readAggregation(root.get("aggregation")));
        }
        if (root.hasNonNull("search")) {
            builder.search(readSearch(root.get("search")));
        }
        for (JsonNode relation : elements(root, "relations")) {
            Relation parsed = readRelation(relation);
            if (parsed != null) {
                builder.join(parsed);
            }
        }
        if (root.hasNonNull("pagination")) {
            builder.pagination(readPagination(root.get("pagination")));
        }
        builder.options(readOptions(root.path("options"), root.path("timeout_ms")));
        return builder.build();
    }

    @Nullable
    private Filter<String> readFilter(JsonNode node, String location) {
        if (!node.isObject()) {
            error(location, "Filter must be a JSON object");
            return null;
        }
        if (node.has("and") || node.has("or")) {
            LogicalOperator operator = node.has("and") ? LogicalOperator.AND : LogicalOperator.OR;
            String key = operator.name().toLowerCase(Locale.ROOT);
            JsonNode children = node.get(key);
            if (!children.isArray() || children.isEmpty()) {
                error(location + "." + key, "'" + key + "' requires a non-empty array");
                return null;
            }
            List<Filter<String>> parsed = new ArrayList<>(children.size());
            for (int i = 0; i < children.size(); i++) {
                Filter<String> child = readFilter(children.get(i), location + "." + key + "[" + i + "]");
                if (child != null) {
                    parsed.add(child);
                }
            }
            return parsed.size() == children.size() ? new Compound<>(operator, parsed) : null;
        }
        if (node.has("not")) {
            Filter<String> child = readFilter(node.get("not"), location + ".not");
            return child == null ? null : new Compound<>(LogicalOperator.NOT, List.of(child));
        }
        return readCondition(node, location);
    }

    @Nullable
    private Condition<String> readCondition(JsonNode node, String location) {
        String field = requiredText(node, "field");
        String operatorName = requiredText(node, "operator");
        if (field == null || operatorName == null) {
            return null;
        }
        Operator operator = enumValue(Operator.class, operatorName, field);
        if (operator == null) {
            return null;
        }
        if (node.has("value") && node.has("values")) {
            error(field, "A condition takes either 'value' or 'values', not both");
            return null;
        }
        List<Value> values = new ArrayList<>();
        if (node.has("value")) {
            Value value = toValue(node.get("value"), field);
            if (value == null) {
                return null;
            }
            values.add(value);
        } else if (node.has("values")) {
            JsonNode array = node.get("values");
            if (!array.isArray()) {
                error(field, "'values' must be an array");
                return null;
            }
            for (JsonNode element : array) {
                Value value = toValue(element, field);
                if (value == null) {
                    return null;
                }
                values.add(value);
            }
        }
        boolean caseSensitive = node.path("case_sensitive").asBoolean(true);
        return new Condition<>(field, operator, values, caseSensitive);
    }

    @Nullable
    private Value toValue(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            error(field, "null is not a valid operand, use IS_NULL instead");
            return null;
        }
        if (node.isObject()) {
            error(field, "Objects are not valid operands");
            return null;
        }
        Object object = JSONUtil.objectMapper.convertValue(node, Object.class);
        try {
            return Values.of(object);
        } catch (IllegalArgumentException | ArithmeticException e) {
            error(field, "Unsupported operand: " + e.getMessage());
            return null;
        }
    }

    @Nullable
    private Sort readSort(JsonNode node) {
        if (node.isTextual()) {
            return Sort.asc(node.asText());
        }
        String field = requiredText(node, "field");
        if (field == null) {
            return null;
        }
        SortDirection direction = optionalEnum(SortDirection.class, node.path("direction"), SortDirection.ASC, field);
        NullOrdering nulls = optionalEnum(NullOrdering.class, node.path("nulls"), NullOrdering.DEFAULT, field);
        return new Sort(field, direction, nulls);
    }

    private Aggregation readAggregation(JsonNode node) {
        List<Aggregate> aggregates = new ArrayList<>();
        for (JsonNode aggregate : elements(node, "aggregates")) {
            String alias = requiredText(aggregate, "alias");
            String functionName = requiredText(aggregate, "function");
            if (alias == null || functionName == null) {
                continue;
            }
            AggregateFunction function = enumValue(AggregateFunction.class, functionName, alias);
            if (function == null) {
                continue;
            }
            String field = aggregate.hasNonNull("field") ? aggregate.get("field").asText() : null;
            Double percentile = aggregate.hasNonNull("percentile") ? aggregate.get("percentile").asDouble() : null;
            aggregates.add(new Aggregate(function, field, alias, percentile));
        }
        Filter<String> having = null;
        if (node.hasNonNull("having")) {
            having = readFilter(node.get("having"), "aggregation.having");
        }
        return new Aggregation(texts(node, "group_by"), aggregates, having);
    }

    private Search readSearch(JsonNode node) {
        String text = node.path("query").asText("");
        JsonNode modeNode = node.has("mode") ? node.get("mode") : node.path("type");
        SearchMode mode = optionalEnum(SearchMode.class, modeNode, SearchMode.FULL_TEXT, "search");
        List<Double> embedding = new ArrayList<>();
        for (JsonNode element : elements(node, "embedding")) {
            if (!element.isNumber()) {
                error("search.embedding", "Embedding elements must be numbers");
                break;
            }
            embedding.add(element.asDouble());
        }
        Map<String, Double> boost = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = node.path("boost").fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            boost.put(entry.getKey(), entry.getValue().asDouble());
        }
        String vectorField = node.hasNonNull("vector_field") ? node.get("vector_field").asText() : null;
        return new Search(text, mode, texts(node, "fields"), vectorField, embedding, node.path("min_score").asDouble(0.0), boost);
    }

    @Nullable
    private Relation readRelation(JsonNode node) {
        String entity = requiredText(node, "entity");
        String localField = requiredText(node, "local_field");
        String foreignField = requiredText(node, "foreign_field");
        if (entity == null || localField == null || foreignField == null) {
            return null;
        }
        JsonNode typeNode = node.has("join_type") ? node.get("join_type") : node.path("type");
        JoinType joinType = optionalEnum(JoinType.class, typeNode, JoinType.INNER, entity);
        String alias = node.path("alias").asText(entity);
        return new Relation(entity, alias, joinType, localField, foreignField);
    }

    private Pagination readPagination(JsonNode node) {
        Integer pageSize = node.hasNonNull("page_size") ? node.get("page_size").asInt() : null;
        String cursor = node.hasNonNull("cursor") ? node.get("cursor").asText() : null;
        Integer offset = node.hasNonNull("offset") ? node.get("offset").asInt() : null;
        return new Pagination(pageSize, cursor, offset);
    }

    private QueryOptions readOptions(JsonNode node, JsonNode topLevelTimeout) {
        QueryOptions.Builder builder = QueryOptions.builder()
                .explain(node.path("explain").asBoolean(false))
                .countTotal(node.path("count_total").asBoolean(false))
                .distinct(node.path("distinct").asBoolean(false))
                .consistency(optionalEnum(Consistency.class, node.path("consistency"), Consistency.STRONG, "options.consistency"));
        JsonNode timeout = node.has("timeout_ms") ? node.get("timeout_ms") : topLevelTimeout;
        if (timeout != null && !timeout.isMissingNode() && !timeout.isNull()) {
            if (!timeout.canConvertToLong() || timeout.asLong() <= 0) {
                error("timeout_ms", "timeout_ms must be a positive integer");
            } else {
                builder.timeoutMillis(timeout.asLong());
            }
        }
        return builder.build();
    }

    @Nullable
    private String requiredText(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            error(name, "'" + name + "' is required and must be a non-empty string");
            return null;
        }
        return value.asText();
    }

    private List<String> texts(JsonNode node, String name) {
        List<String> result = new ArrayList<>();
        for (JsonNode element : elements(node, name)) {
            if (!element.isTextual()) {
                error(name, "'" + name + "' must contain strings only");
                continue;
            }
            result.add(element.asText());
        }
        return result;
    }

    private Iterable<JsonNode> elements(JsonNode node, String name) {
        JsonNode array = node.path(name);
        if (array.isMissingNode() || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            error(name, "'" + name + "' must be an array");
            return List.of();
        }
        return array;
    }

    @Nullable
    private <E extends Enum<E>> E enumValue(Class<E> type, String name, String subject) {
        try {
            return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            error(subject, "Unknown " + type.getSimpleName() + " '" + name + "'");
            return null;
        }
    }

    private <E extends Enum<E>> E optionalEnum(Class<E> type, JsonNode node, E defaultValue, String subject) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return defaultValue;
        }
        E value = enumValue(type, node.asText(), subject);
        return value == null ? defaultValue : value;
    }

    private void error(String subject, String message) {
        errors.add(QueryError.of(ErrorCode.SYNTAX_ERROR, subject, message));
    }
}
