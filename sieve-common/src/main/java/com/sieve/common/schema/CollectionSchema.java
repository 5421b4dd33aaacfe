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

import java.util.List;
import java.util.Objects;

/**
 * Collection metadata handed over by the request layer.
 *
 * @param name   collection name, also used as a part of the expression cache key
 * @param fields field definitions in declaration order
 */
public record CollectionSchema(String name, List<FieldSchema> fields) {
    public CollectionSchema {
        Objects.requireNonNull(name, "name cannot be null");
        fields = List.copyOf(fields);
    }
}
