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

package com.tessera;

import com.tessera.common.schema.EntitySchema;
import com.tessera.common.schema.InMemorySchemaRegistry;
import com.tessera.common.schema.SchemaField;
import com.tessera.common.type.FieldType;

import java.util.List;

/**
 * Orders with a customer relation, nested items, a map of attributes and a pii payment block.
 */
public final class TestSchemas {

    private TestSchemas() {
    }

    public static InMemorySchemaRegistry orders() {
        return new InMemorySchemaRegistry(List.of(
                EntitySchema.of("orders",
                        SchemaField.builder("id", FieldType.IDENTIFIER).required().indexed().build(),
                        SchemaField.indexed("status", FieldType.STRING),
                        SchemaField.of("total", FieldType.FLOAT64),
                        SchemaField.of("quantity", FieldType.INT64),
                        SchemaField.of("created_at", FieldType.TIMESTAMP),
                        SchemaField.of("customer_id", FieldType.IDENTIFIER),
                        SchemaField.relation("customer", "customers", "customer_id", "id"),
                        SchemaField.builder("items", FieldType.arrayOf(FieldType.OBJECT)).children(
                                SchemaField.of("sku", FieldType.STRING),
                                SchemaField.of("price", FieldType.FLOAT64),
                                SchemaField.of("tags", FieldType.arrayOf(FieldType.STRING))).build(),
                        SchemaField.of("attrs", FieldType.mapOf(FieldType.STRING)),
                        SchemaField.object("shipping",
                                SchemaField.object("address",
                                        SchemaField.of("city", FieldType.STRING),
                                        SchemaField.of("zip", FieldType.STRING)),
                                SchemaField.of("notes", FieldType.STRING)),
                        SchemaField.builder("payment", FieldType.OBJECT).pii().children(
                                SchemaField.of("card", FieldType.STRING)).build(),
                        SchemaField.of("embedding", FieldType.arrayOf(FieldType.FLOAT32))),
                EntitySchema.of("customers",
                        SchemaField.builder("id", FieldType.IDENTIFIER).required().build(),
                        SchemaField.of("name", FieldType.STRING),
                        SchemaField.of("country", FieldType.STRING),
                        SchemaField.builder("password", FieldType.STRING).pii().build())));
    }
}
