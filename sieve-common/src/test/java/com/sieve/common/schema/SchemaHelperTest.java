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

package com.sieve.common.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SchemaHelperTest {

    private CollectionSchema newSchema() {
        return new CollectionSchema("books", List.of(
                FieldSchema.builder(100, "id", DataType.INT64).primaryKey(true).autoId(true).build(),
                FieldSchema.builder(101, "author", DataType.VARCHAR).partitionKey(true).build(),
                FieldSchema.builder(102, "embedding", DataType.FLOAT_VECTOR).build()
        ));
    }

    @Test
    @DisplayName("Fields should be found by name and by id")
    void shouldLookupFieldsByNameAndId() {
        SchemaHelper helper = new SchemaHelper(newSchema());

        assertEquals("books", helper.getCollectionName());
        assertEquals(101, helper.getFieldFromName("author").fieldId());
        assertEquals("embedding", helper.getFieldFromId(102).name());
    }

    @Test
    @DisplayName("Missing fields should raise FieldNotFoundException")
    void shouldThrowWhenFieldIsMissing() {
        SchemaHelper helper = new SchemaHelper(newSchema());

        FieldNotFoundException e = assertThrows(FieldNotFoundException.class, () -> helper.getFieldFromName("title"));
        assertEquals("title", e.getFieldName());
        assertEquals("field title not exist", e.getMessage());
        assertThrows(FieldNotFoundException.class, () -> helper.getFieldFromId(999));
    }

    @Test
    @DisplayName("Primary and partition keys should be detected")
    void shouldDetectKeyFields() {
        SchemaHelper helper = new SchemaHelper(newSchema());

        FieldSchema pk = helper.getPrimaryKeyField();
        assertEquals("id", pk.name());
        assertTrue(pk.isAutoId());
        assertTrue(helper.hasPartitionKey());
        assertEquals("author", helper.getPartitionKeyField().name());
    }

    @Test
    @DisplayName("Schema without primary key should raise SchemaException on lookup")
    void shouldThrowWhenPrimaryKeyIsMissing() {
        CollectionSchema schema = new CollectionSchema("empty", List.of(
                FieldSchema.builder(1, "title", DataType.VARCHAR).build()
        ));
        SchemaHelper helper = new SchemaHelper(schema);

        assertThrows(SchemaException.class, helper::getPrimaryKeyField);
        assertFalse(helper.hasPartitionKey());
        assertThrows(SchemaException.class, helper::getPartitionKeyField);
    }

    @Test
    @DisplayName("Duplicated field names should be rejected")
    void shouldRejectDuplicatedFieldNames() {
        CollectionSchema schema = new CollectionSchema("dup", List.of(
                FieldSchema.builder(1, "title", DataType.VARCHAR).build(),
                FieldSchema.builder(2, "title", DataType.INT64).build()
        ));

        assertThrows(SchemaException.class, () -> new SchemaHelper(schema));
    }

    @Test
    @DisplayName("Every field is loaded unless a loaded field set is given")
    void shouldReportLoadedFields() {
        SchemaHelper allLoaded = new SchemaHelper(newSchema());
        assertTrue(allLoaded.isFieldLoaded(102));
        assertFalse(allLoaded.isFieldLoaded(999));

        SchemaHelper partiallyLoaded = new SchemaHelper(newSchema(), Set.of(100L, 101L));
        assertTrue(partiallyLoaded.isFieldLoaded(101));
        assertFalse(partiallyLoaded.isFieldLoaded(102));
    }

    @Test
    @DisplayName("Data type predicates should classify types")
    void shouldClassifyDataTypes() {
        assertTrue(DataType.INT8.isIntegerType());
        assertTrue(DataType.DOUBLE.isFloatingType());
        assertTrue(DataType.VARCHAR.isStringType());
        assertTrue(DataType.SPARSE_FLOAT_VECTOR.isVectorType());
        assertTrue(DataType.INT8_VECTOR.isVectorType());
        assertFalse(DataType.ARRAY.isVectorType());
        assertFalse(DataType.JSON.isArithmeticType());
    }
}
