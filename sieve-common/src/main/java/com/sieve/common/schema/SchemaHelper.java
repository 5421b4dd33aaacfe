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

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * SchemaHelper provides indexed, read-only lookups over a {@link CollectionSchema}.
 * <p>
 * The loaded field set describes residency: a field is queryable only if its data is
 * currently available in memory. When no loaded field set is given, every field is
 * considered loaded.
 */
public class SchemaHelper {
    private final CollectionSchema schema;
    private final Map<String, FieldSchema> nameOffset = new HashMap<>();
    private final Map<Long, FieldSchema> idOffset = new HashMap<>();
    private final Set<Long> loadedFields;
    private FieldSchema primaryKeyField;
    private FieldSchema partitionKeyField;

    public SchemaHelper(CollectionSchema schema) {
        this(schema, null);
    }

    /**
     * Creates a helper for the given schema.
     *
     * @param schema       collection schema
     * @param loadedFields ids of the loaded fields, {@code null} means all fields are loaded
     * @throws SchemaException if the schema declares duplicate field names or ids, or more than one primary key
     */
    public SchemaHelper(CollectionSchema schema, Set<Long> loadedFields) {
        this.schema = schema;
        this.loadedFields = loadedFields == null ? null : Set.copyOf(loadedFields);
        for (FieldSchema field : schema.fields()) {
            if (nameOffset.putIfAbsent(field.name(), field) != null) {
                throw new SchemaException(String.format("duplicated field name: %s", field.name()));
            }
            if (idOffset.putIfAbsent(field.fieldId(), field) != null) {
                throw new SchemaException(String.format("duplicated field id: %d", field.fieldId()));
            }
            if (field.isPrimaryKey()) {
                if (primaryKeyField != null) {
                    throw new SchemaException("primary key is not unique");
                }
                primaryKeyField = field;
            }
            if (field.isPartitionKey()) {
                partitionKeyField = field;
            }
        }
    }

    public String getCollectionName() {
        return schema.name();
    }

    public CollectionSchema getSchema() {
        return schema;
    }

    /**
     * Returns the field with the given name.
     *
     * @throws FieldNotFoundException if the collection has no such field
     */
    public FieldSchema getFieldFromName(String name) {
        FieldSchema field = nameOffset.get(name);
        if (field == null) {
            throw new FieldNotFoundException(name);
        }
        return field;
    }

    /**
     * Returns the field with the given id.
     *
     * @throws FieldNotFoundException if the collection has no such field
     */
    public FieldSchema getFieldFromId(long fieldId) {
        FieldSchema field = idOffset.get(fieldId);
        if (field == null) {
            throw new FieldNotFoundException(Long.toString(fieldId));
        }
        return field;
    }

    public boolean isFieldLoaded(long fieldId) {
        if (loadedFields == null) {
            return idOffset.containsKey(fieldId);
        }
        return loadedFields.contains(fieldId);
    }

    /**
     * @throws SchemaException if the schema has no primary key
     */
    public FieldSchema getPrimaryKeyField() {
        if (primaryKeyField == null) {
            throw new SchemaException("failed to get primary key field: no primary in schema");
        }
        return primaryKeyField;
    }

    /**
     * @throws SchemaException if the schema has no partition key
     */
    public FieldSchema getPartitionKeyField() {
        if (partitionKeyField == null) {
            throw new SchemaException("failed to get partition key field: no partition key in schema");
        }
        return partitionKeyField;
    }

    public boolean hasPartitionKey() {
        return partitionKeyField != null;
    }
}
