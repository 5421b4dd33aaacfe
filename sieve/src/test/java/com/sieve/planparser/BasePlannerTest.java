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

package com.sieve.planparser;

import com.sieve.common.schema.CollectionSchema;
import com.sieve.common.schema.DataType;
import com.sieve.common.schema.FieldSchema;
import com.sieve.common.schema.SchemaHelper;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;
import java.util.Set;

public class BasePlannerTest {
    protected static final String COLLECTION_NAME = "test_collection";

    protected static final long ID_FIELD_ID = 100;
    protected static final long AGE_FIELD_ID = 101;
    protected static final long SCORE_FIELD_ID = 102;
    protected static final long NAME_FIELD_ID = 103;
    protected static final long FLAG_FIELD_ID = 104;
    protected static final long TAGS_FIELD_ID = 105;
    protected static final long META_FIELD_ID = 106;
    protected static final long SMALL_FIELD_ID = 107;
    protected static final long NICKNAME_FIELD_ID = 108;
    protected static final long FLOAT_VECTOR_FIELD_ID = 200;

    protected static CollectionSchema newCollectionSchema(String name) {
        return new CollectionSchema(name, List.of(
                FieldSchema.builder(ID_FIELD_ID, "id", DataType.INT64).primaryKey(true).build(),
                FieldSchema.builder(AGE_FIELD_ID, "age", DataType.INT64).build(),
                FieldSchema.builder(SCORE_FIELD_ID, "score", DataType.DOUBLE).build(),
                FieldSchema.builder(NAME_FIELD_ID, "name", DataType.VARCHAR).partitionKey(true).build(),
                FieldSchema.builder(FLAG_FIELD_ID, "flag", DataType.BOOL).build(),
                FieldSchema.builder(TAGS_FIELD_ID, "tags", DataType.ARRAY).elementType(DataType.INT64).build(),
                FieldSchema.builder(META_FIELD_ID, "meta", DataType.JSON).build(),
                FieldSchema.builder(SMALL_FIELD_ID, "small", DataType.INT8).build(),
                FieldSchema.builder(NICKNAME_FIELD_ID, "nickname", DataType.VARCHAR).nullable(true).build(),
                FieldSchema.builder(FLOAT_VECTOR_FIELD_ID, "float_vector", DataType.FLOAT_VECTOR).build(),
                FieldSchema.builder(201, "binary_vector", DataType.BINARY_VECTOR).build(),
                FieldSchema.builder(202, "float16_vector", DataType.FLOAT16_VECTOR).build(),
                FieldSchema.builder(203, "bfloat16_vector", DataType.BFLOAT16_VECTOR).build(),
                FieldSchema.builder(204, "sparse_vector", DataType.SPARSE_FLOAT_VECTOR).build(),
                FieldSchema.builder(205, "int8_vector", DataType.INT8_VECTOR).build()
        ));
    }

    protected static SchemaHelper newSchemaHelper() {
        return new SchemaHelper(newCollectionSchema(COLLECTION_NAME));
    }

    protected static SchemaHelper newSchemaHelper(Set<Long> loadedFields) {
        return new SchemaHelper(newCollectionSchema(COLLECTION_NAME), loadedFields);
    }

    protected Config loadConfig() {
        return ConfigFactory.load("test.conf");
    }

    protected ExprCompiler newCompiler(ExprAnalyzer analyzer) {
        return new ExprCompiler(new ExprCache(loadConfig()), new ParserPool(), analyzer);
    }

    protected Planner newPlanner() {
        return Planner.create(loadConfig());
    }
}
