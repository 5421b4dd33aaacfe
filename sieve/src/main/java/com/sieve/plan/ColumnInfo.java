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

package com.sieve.plan;

import com.sieve.common.schema.DataType;
import com.sieve.common.schema.FieldSchema;

/**
 * Column reference carried by the plan expressions.
 */
public record ColumnInfo(long fieldId,
                         DataType dataType,
                         boolean isPrimaryKey,
                         boolean isAutoId,
                         boolean isPartitionKey,
                         boolean isNullable,
                         DataType elementType) {

    public static ColumnInfo of(FieldSchema field) {
        return new ColumnInfo(
                field.fieldId(),
                field.dataType(),
                field.isPrimaryKey(),
                field.isAutoId(),
                field.isPartitionKey(),
                field.isNullable(),
                field.elementType()
        );
    }
}
