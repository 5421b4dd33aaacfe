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

/**
 * Data types a collection field may declare.
 */
public enum DataType {
    NONE,
    BOOL,
    INT8,
    INT16,
    INT32,
    INT64,
    FLOAT,
    DOUBLE,
    STRING,
    VARCHAR,
    ARRAY,
    JSON,
    BINARY_VECTOR,
    FLOAT_VECTOR,
    FLOAT16_VECTOR,
    BFLOAT16_VECTOR,
    SPARSE_FLOAT_VECTOR,
    INT8_VECTOR;

    public boolean isBoolType() {
        return this == BOOL;
    }

    public boolean isIntegerType() {
        return switch (this) {
            case INT8, INT16, INT32, INT64 -> true;
            default -> false;
        };
    }

    public boolean isFloatingType() {
        return this == FLOAT || this == DOUBLE;
    }

    public boolean isArithmeticType() {
        return isIntegerType() || isFloatingType();
    }

    public boolean isStringType() {
        return this == STRING || this == VARCHAR;
    }

    public boolean isVectorType() {
        return switch (this) {
            case BINARY_VECTOR, FLOAT_VECTOR, FLOAT16_VECTOR, BFLOAT16_VECTOR, SPARSE_FLOAT_VECTOR, INT8_VECTOR ->
                    true;
            default -> false;
        };
    }
}
