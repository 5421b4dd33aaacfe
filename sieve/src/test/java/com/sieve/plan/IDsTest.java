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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IDsTest {

    @Test
    @DisplayName("Id lists should report their kind and size")
    void shouldReportKindAndSize() {
        IDs ints = IDs.ofInts(List.of(1L, 2L));
        assertEquals(IDs.IdField.INT_ID, ints.getIdField());
        assertEquals(2, ints.size());
        assertTrue(ints.getStrIds().isEmpty());

        IDs strings = IDs.ofStrings(List.of("a"));
        assertEquals(IDs.IdField.STR_ID, strings.getIdField());
        assertEquals(1, strings.size());

        IDs empty = IDs.empty();
        assertEquals(IDs.IdField.NONE, empty.getIdField());
        assertEquals(0, empty.size());
    }
}
