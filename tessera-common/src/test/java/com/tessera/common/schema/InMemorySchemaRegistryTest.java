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

package com.tessera.common.schema;

import com.tessera.common.path.FieldPath;
import com.tessera.common.type.FieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySchemaRegistryTest {
    private InMemorySchemaRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemorySchemaRegistry(List.of(
                EntitySchema.of("orders",
                        SchemaField.builder("id", FieldType.IDENTIFIER).required().indexed().build(),
                        SchemaField.of("customer_id", FieldType.IDENTIFIER),
                        SchemaField.relation("customer", "customers", "customer_id", "id"),
                        SchemaField.builder("items", FieldType.arrayOf(FieldType.OBJECT)).children(
                                SchemaField.of("sku", FieldType.STRING),
                                SchemaField.of("quantity", FieldType.INT64)).build(),
                        SchemaField.of("attrs", FieldType.mapOf(FieldType.STRING)),
                        SchemaField.builder("billing", FieldType.OBJECT).pii().children(
                                SchemaField.of("card", FieldType.STRING)).build()),
                EntitySchema.of("customers",
                        SchemaField.of("id", FieldType.IDENTIFIER),
                        SchemaField.of("name", FieldType.STRING))));
    }

    private Optional<FieldRef> resolve(String path) {
        return registry.resolve("orders", FieldPath.parse(path));
    }

    @Test
    void shouldResolveNestedFields() {
        FieldRef id = resolve("id").orElseThrow();
        assertEquals("orders:id", id.fieldId());
        assertFalse(id.nullable());
        assertTrue(id.indexed());

        FieldRef sku = resolve("items[].sku").orElseThrow();
        assertEquals(FieldType.STRING, sku.fieldType());
        assertEquals("items[].sku", sku.path());
        assertEquals("sku", sku.fieldName());

        assertEquals(FieldType.STRING, resolve("attrs['color']").orElseThrow().fieldType());
        assertEquals(FieldType.STRING, resolve("attrs[*]").orElseThrow().fieldType());
    }

    @Test
    void shouldRequireExplicitContainerSuffixes() {
        assertTrue(resolve("items.sku").isEmpty());
        assertTrue(resolve("attrs.color").isEmpty());
        assertTrue(resolve("id[]").isEmpty());
        assertTrue(resolve("missing").isEmpty());
        assertTrue(registry.resolve("unknown", FieldPath.parse("id")).isEmpty());
    }

    @Test
    void shouldInheritPiiFromContainers() {
        assertTrue(resolve("billing").orElseThrow().pii());
        assertTrue(resolve("billing.card").orElseThrow().pii());
        assertFalse(resolve("items[].sku").orElseThrow().pii());
    }

    @Test
    void shouldListChildrenThroughLists() {
        List<String> paths = registry.children("orders", FieldPath.parse("items"))
                .stream().map(FieldRef::path).collect(Collectors.toList());
        assertEquals(List.of("items[].sku", "items[].quantity"), paths);
        assertEquals(6, registry.children("orders", FieldPath.ROOT).size());
        assertTrue(registry.children("orders", FieldPath.parse("id")).isEmpty());
    }

    @Test
    void shouldNotTraverseIntoRelationFields() {
        assertTrue(resolve("customer.name").isEmpty());
        assertTrue(registry.children("orders", FieldPath.parse("customer")).isEmpty());

        RelationDescriptor relation = registry.relation("orders", "orders:customer").orElseThrow();
        assertEquals("customers", relation.targetEntity());
        assertEquals("customer_id", relation.localKey());
        assertEquals("id", relation.foreignKey());
        assertTrue(registry.relation("customers", "orders:customer").isEmpty());
    }

    @Test
    void shouldIsolateSnapshotsFromUpdates() {
        SchemaView snapshot = registry.snapshot();
        registry.register(EntitySchema.of("customers", SchemaField.of("email", FieldType.STRING)));
        assertTrue(registry.remove("orders"));
        assertFalse(registry.remove("orders"));

        assertTrue(snapshot.hasEntity("orders"));
        assertTrue(snapshot.resolve("customers", FieldPath.parse("name")).isPresent());
        assertFalse(registry.hasEntity("orders"));
        assertTrue(registry.resolve("customers", FieldPath.parse("name")).isEmpty());
    }

    @Test
    void shouldRejectChildrenOnScalarFields() {
        assertThrows(IllegalArgumentException.class, () -> SchemaField.builder("name", FieldType.STRING)
                .children(SchemaField.of("x", FieldType.STRING)).build());
    }
}
