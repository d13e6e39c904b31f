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

package com.tessera.psl;

import com.tessera.TestSchemas;
import com.tessera.common.error.ErrorCode;
import com.tessera.common.error.QueryError;
import com.tessera.common.model.JoinType;
import com.tessera.common.schema.FieldRef;
import com.tessera.common.schema.InMemorySchemaRegistry;
import com.tessera.planner.cqm.ResolvedRelation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ProjectionMatcherTest {
    private static final List<String> ALL_FIELDS = List.of(
            "attrs", "created_at", "customer_id", "embedding", "id", "items", "items[].price", "items[].sku",
            "items[].tags", "payment", "payment.card", "quantity", "shipping", "shipping.address",
            "shipping.address.city", "shipping.address.zip", "shipping.notes", "status", "total");

    private final ProjectionMatcher matcher = new ProjectionMatcher();
    private InMemorySchemaRegistry schema;

    @BeforeEach
    void setUp() {
        schema = TestSchemas.orders();
    }

    private ProjectionResult match(List<String> include, List<String> exclude) {
        return matcher.match("orders", include, exclude, schema);
    }

    private static List<String> paths(ProjectionResult result) {
        return result.fields().stream().map(FieldRef::path).collect(Collectors.toList());
    }

    private static QueryError singleError(ProjectionResult result) {
        assertFalse(result.isValid());
        assertEquals(1, result.errors().size(), () -> "errors: " + result.errors());
        return result.errors().get(0);
    }

    @Nested
    @DisplayName("expansion")
    class Expansion {

        @Test
        void shouldSelectEverythingWithoutIncludes() {
            ProjectionResult result = match(List.of(), List.of());
            assertTrue(result.isValid());
            assertEquals(ALL_FIELDS, paths(result));
            assertTrue(result.relations().isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"*", "**"})
        void shouldExpandWildcardsToTheWholeEntity(String pattern) {
            assertEquals(ALL_FIELDS, paths(match(List.of(pattern), List.of())));
        }

        @Test
        void shouldRetainAncestorsOfSelectedLeaves() {
            ProjectionResult result = match(List.of("shipping.address.city"), List.of());
            assertEquals(List.of("shipping", "shipping.address", "shipping.address.city"), paths(result));
        }

        @Test
        void shouldSelectEverythingBelowAContainer() {
            ProjectionResult result = match(List.of("items"), List.of());
            assertEquals(List.of("items", "items[].price", "items[].sku", "items[].tags"), paths(result));
        }

        @Test
        void shouldMatchLiteralAfterRecursiveWildcardAtAnyDepth() {
            ProjectionResult result = match(List.of("**.city"), List.of());
            assertEquals(List.of("shipping", "shipping.address", "shipping.address.city"), paths(result));
        }

        @Test
        void shouldSkipPositionsWhereTheRestOfAWildcardPatternDoesNotApply() {
            ProjectionResult result = match(List.of("shipping.*.city"), List.of());
            assertTrue(result.isValid());
            assertEquals(List.of("shipping", "shipping.address", "shipping.address.city"), paths(result));
        }

        @Test
        void shouldBeIndependentOfPatternOrder() {
            List<String> include = new ArrayList<>(List.of("status", "items[].sku", "shipping.*", "total"));
            ProjectionResult first = match(include, List.of("shipping.notes"));
            Collections.reverse(include);
            ProjectionResult second = match(include, List.of("shipping.notes"));

            assertEquals(paths(first), paths(second));
            assertEquals(first.fields(), second.fields());
        }

        @Test
        void shouldDropUnreadableFieldsSilently() {
            ProjectionResult result = matcher.match("orders", List.of(), List.of(), schema, field -> !field.pii());
            assertTrue(result.isValid());
            assertThat(paths(result)).doesNotContain("payment", "payment.card").hasSize(ALL_FIELDS.size() - 2);
        }
    }

    @Nested
    @DisplayName("include and exclude conflicts")
    class Conflicts {

        @Test
        void shouldLetExcludeWinTies() {
            assertTrue(match(List.of("status"), List.of("status")).fields().isEmpty());

            ProjectionResult result = match(List.of("shipping.*"), List.of("*.notes"));
            assertEquals(List.of("shipping", "shipping.address", "shipping.address.city", "shipping.address.zip"),
                    paths(result));
        }

        @Test
        void shouldLetMoreSpecificIncludeWin() {
            ProjectionResult result = match(List.of("shipping.notes"), List.of("*.notes"));
            assertEquals(List.of("shipping", "shipping.notes"), paths(result));

            result = match(List.of("payment.card", "status"), List.of("payment"));
            assertEquals(List.of("payment", "payment.card", "status"), paths(result));
        }

        @Test
        void shouldLetSpecificWildcardExcludeBeatItsInclude() {
            ProjectionResult result = match(List.of("shipping.*"), List.of("shipping.notes"));
            assertEquals(List.of("shipping", "shipping.address", "shipping.address.city", "shipping.address.zip"),
                    paths(result));
        }

        @Test
        void shouldLetLiteralIncludeBeatRecursiveExclude() {
            ProjectionResult result = match(List.of("shipping.notes"), List.of("**.notes"));
            assertEquals(List.of("shipping", "shipping.notes"), paths(result));
        }

        @Test
        void shouldExcludeNamedFieldAtAnyDepthFromDefaultSelection() {
            ProjectionResult result = match(List.of(), List.of("**.notes"));
            List<String> expected = new ArrayList<>(ALL_FIELDS);
            expected.remove("shipping.notes");
            assertEquals(expected, paths(result));

            result = match(List.of(), List.of("**.city"));
            assertThat(paths(result)).doesNotContain("shipping.address.city")
                    .contains("shipping", "shipping.address", "shipping.address.zip");
        }

        @Test
        void shouldResolveConflictsOnMapAndListFields() {
            assertEquals(List.of("status"), paths(match(List.of("attrs", "status"), List.of("attrs[*]"))));
            assertEquals(List.of("status"), paths(match(List.of("attrs", "status"), List.of("attrs['secret']"))));
            assertEquals(List.of("status"), paths(match(List.of("embedding", "status"), List.of("embedding[]"))));
            assertEquals(List.of("items", "items[].price", "items[].sku"),
                    paths(match(List.of("items"), List.of("items[].tags[]"))));
        }

        @Test
        void shouldSelectMapAndListFieldsThroughTheirSuffixes() {
            assertEquals(List.of("attrs"), paths(match(List.of("attrs[*]"), List.of())));
            assertEquals(List.of("attrs"), paths(match(List.of("attrs['color']"), List.of())));
            assertEquals(List.of("embedding"), paths(match(List.of("embedding[]"), List.of())));
            assertEquals(List.of("attrs"), paths(match(List.of("attrs[*]"), List.of("attrs"))));
        }

        @Test
        void shouldDropContainersWithoutSurvivingLeaves() {
            ProjectionResult result = match(List.of("**"), List.of("payment", "items"));
            assertThat(paths(result))
                    .doesNotContain("payment", "payment.card", "items", "items[].sku")
                    .contains("status", "shipping.address.city");
        }

        @Test
        void shouldUseTheBestScoringIncludePattern() {
            // "**" alone loses to the exclude, "items[].sku" beats it
            ProjectionResult result = match(List.of("**", "items[].sku"), List.of("items"));
            assertThat(paths(result)).contains("items", "items[].sku").doesNotContain("items[].price");
        }
    }

    @Nested
    @DisplayName("relations")
    class Relations {

        @Test
        void shouldCrossRelationNamedByLiteral() {
            ProjectionResult result = match(List.of("id", "customer.name"), List.of());

            assertEquals(List.of("customer.name", "id"), paths(result));
            assertEquals(1, result.relations().size());
            ResolvedRelation relation = result.relations().get(0);
            assertEquals("customer", relation.alias());
            assertEquals("customers", relation.entity());
            assertEquals(JoinType.LEFT, relation.joinType());
            assertFalse(relation.explicit());
            assertEquals("customer_id", relation.localKey().path());
            assertEquals("customer.id", relation.foreignKey().path());
        }

        @Test
        void shouldSelectRelatedEntityThroughRelationField() {
            ProjectionResult result = matcher.match("orders", List.of("customer"), List.of(), schema,
                    field -> !field.pii());
            assertEquals(List.of("customer.country", "customer.id", "customer.name"), paths(result));
        }

        @Test
        void shouldKeepFieldIdOfRelatedEntity() {
            ProjectionResult result = match(List.of("customer.country"), List.of());
            FieldRef country = result.fields().iterator().next();
            assertEquals("customers:country", country.fieldId());
            assertEquals("customers", country.entity());
        }

        @Test
        void shouldNeverCrossRelationsThroughWildcards() {
            ProjectionResult result = match(List.of("**"), List.of());
            assertTrue(result.relations().isEmpty());
            assertThat(paths(result)).noneMatch(path -> path.startsWith("customer."));
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void shouldReportUnknownFieldWhilePrefixIsConcrete() {
            QueryError error = singleError(match(List.of("nope"), List.of()));
            assertEquals(ErrorCode.UNKNOWN_FIELD, error.code());
            assertEquals("nope", error.subject());
            assertEquals(0, error.position());

            assertEquals(ErrorCode.UNKNOWN_FIELD, singleError(match(List.of("nope.*"), List.of())).code());
            assertEquals(ErrorCode.UNKNOWN_FIELD, singleError(match(List.of(), List.of("shipping.nope"))).code());
        }

        @Test
        void shouldNotReportMismatchesBelowWildcards() {
            ProjectionResult result = match(List.of("*.nope"), List.of());
            assertTrue(result.isValid());
            assertTrue(result.fields().isEmpty());
        }

        @ParameterizedTest
        @ValueSource(strings = {"status.length", "items.sku", "attrs.color", "id[]"})
        void shouldRejectInvalidTraversal(String pattern) {
            assertEquals(ErrorCode.INVALID_TRAVERSAL, singleError(match(List.of(pattern), List.of())).code());
        }

        @ParameterizedTest
        @ValueSource(strings = {"items[", "shipping..city", ""})
        void shouldRejectMalformedPatterns(String pattern) {
            assertEquals(ErrorCode.SYNTAX_ERROR, singleError(match(List.of(pattern), List.of())).code());
        }

        @Test
        void shouldEnforceStructuralLimits() {
            ProjectionMatcher strict = new ProjectionMatcher(new ProjectionLimits(2, 2, 1));

            ProjectionResult tooMany = strict.match("orders", List.of("id", "status"), List.of("total"), schema);
            assertEquals(ErrorCode.LIMIT_EXCEEDED, singleError(tooMany).code());

            ProjectionResult tooDeep = strict.match("orders", List.of("shipping.address.city"), List.of(), schema);
            assertEquals(ErrorCode.LIMIT_EXCEEDED, singleError(tooDeep).code());

            ProjectionResult tooRecursive = strict.match("orders", List.of("**.**"), List.of(), schema);
            QueryError error = singleError(tooRecursive);
            assertEquals(ErrorCode.LIMIT_EXCEEDED, error.code());
            assertEquals(1, error.position());
        }

        @Test
        void shouldReportEveryInvalidPattern() {
            ProjectionResult result = match(List.of("nope", "status.length"), List.of("missing"));
            assertEquals(3, result.errors().size());
            assertTrue(result.fields().isEmpty());
        }

        @Test
        void shouldRejectUnknownEntity() {
            ProjectionResult result = matcher.match("invoices", List.of(), List.of(), schema);
            assertEquals(ErrorCode.UNKNOWN_FIELD, singleError(result).code());
        }
    }
}
