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

import java.util.Objects;

/**
 * Describes a single field of a collection.
 *
 * @param fieldId        unique id of the field within its collection
 * @param name           field name used in expressions
 * @param dataType       declared data type
 * @param elementType    element type of an {@link DataType#ARRAY} field, {@link DataType#NONE} otherwise
 * @param isPrimaryKey   whether the field is the primary key
 * @param isAutoId       whether primary key values are generated by the server
 * @param isPartitionKey whether the field is the partition key
 * @param isNullable     whether the field accepts null values
 */
public record FieldSchema(long fieldId,
                          String name,
                          DataType dataType,
                          DataType elementType,
                          boolean isPrimaryKey,
                          boolean isAutoId,
                          boolean isPartitionKey,
                          boolean isNullable) {

    public FieldSchema {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(dataType, "dataType cannot be null");
        Objects.requireNonNull(elementType, "elementType cannot be null");
    }

    public static Builder builder(long fieldId, String name, DataType dataType) {
        return new Builder(fieldId, name, dataType);
    }

    public static class Builder {
        private final long fieldId;
        private final String name;
        private final DataType dataType;
        private DataType elementType = DataType.NONE;
        private boolean primaryKey;
        private boolean autoId;
        private boolean partitionKey;
        private boolean nullable;

        private Builder(long fieldId, String name, DataType dataType) {
            this.fieldId = fieldId;
            this.name = name;
            this.dataType = dataType;
        }

        public Builder elementType(DataType elementType) {
            this.elementType = elementType;
            return this;
        }

        public Builder primaryKey(boolean primaryKey) {
            this.primaryKey = primaryKey;
            return this;
        }

        public Builder autoId(boolean autoId) {
            this.autoId = autoId;
            return this;
        }

        public Builder partitionKey(boolean partitionKey) {
            this.partitionKey = partitionKey;
            return this;
        }

        public Builder nullable(boolean nullable) {
            this.nullable = nullable;
            return this;
        }

        public FieldSchema build() {
            return new FieldSchema(fieldId, name, dataType, elementType, primaryKey, autoId, partitionKey, nullable);
        }
    }
}
