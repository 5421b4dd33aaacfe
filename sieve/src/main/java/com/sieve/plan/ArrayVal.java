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

import java.util.List;

/**
 * An array literal.
 *
 * @param elements    array elements
 * @param sameType    whether all elements share the same type
 * @param elementType the shared element type, {@link DataType#NONE} for empty or mixed arrays
 */
public record ArrayVal(List<GenericValue> elements, boolean sameType, DataType elementType) implements GenericValue {
    public ArrayVal {
        elements = List.copyOf(elements);
    }
}
