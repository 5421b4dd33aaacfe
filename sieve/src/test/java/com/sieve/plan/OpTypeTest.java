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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OpTypeTest {

    @Test
    @DisplayName("Reversed operators should keep the comparison true with swapped operands")
    void shouldReverseOperators() {
        assertEquals(OpType.LESS_THAN, OpType.GREATER_THAN.reverse());
        assertEquals(OpType.GREATER_EQUAL, OpType.LESS_EQUAL.reverse());
        assertEquals(OpType.EQUAL, OpType.EQUAL.reverse());
    }
}
