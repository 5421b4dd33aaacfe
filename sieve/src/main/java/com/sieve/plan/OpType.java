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

public enum OpType {
    GREATER_THAN,
    GREATER_EQUAL,
    LESS_THAN,
    LESS_EQUAL,
    EQUAL,
    NOT_EQUAL,
    PREFIX_MATCH,
    POSTFIX_MATCH,
    INNER_MATCH,
    MATCH;

    /**
     * Returns the operator that keeps the comparison true when its operands are swapped.
     */
    public OpType reverse() {
        return switch (this) {
            case GREATER_THAN -> LESS_THAN;
            case GREATER_EQUAL -> LESS_EQUAL;
            case LESS_THAN -> GREATER_THAN;
            case LESS_EQUAL -> GREATER_EQUAL;
            default -> this;
        };
    }
}
