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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class HanNormalizerTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "age > 10",
            "name == \"abc\" and flag",
            "name like \"a\\\\%\"",
            "name == 'it\\'s'",
            "name == \"line\\nbreak\"",
            "trailing \\",
    })
    @DisplayName("ASCII-only input should not change")
    void shouldKeepAsciiInput(String input) {
        assertEquals(input, HanNormalizer.normalize(input));
    }

    @Test
    @DisplayName("Han code points should be escaped")
    void shouldEscapeHanCodePoints() {
        assertEquals("name == \"\\u4e2d\\u6587\"", HanNormalizer.normalize("name == \"中文\""));
    }

    @Test
    @DisplayName("Supplementary Han code points should use the long escape form")
    void shouldEscapeSupplementaryHanCodePoints() {
        String input = new StringBuilder().appendCodePoint(0x20000).toString();
        assertEquals("\\U00020000", HanNormalizer.normalize(input));
    }

    @Test
    @DisplayName("Non-Han, non-ASCII code points should pass through")
    void shouldKeepOtherScripts() {
        String input = "name == \"ñáé🔥かな\"";
        assertEquals(input, HanNormalizer.normalize(input));
    }

    @Test
    @DisplayName("Escaped characters should be copied verbatim")
    void shouldCopyEscapedCharacters() {
        assertEquals("\"\\\"\\u4e2d\"", HanNormalizer.normalize("\"\\\"中\""));
    }

    @Test
    @DisplayName("Unknown escape sequence should return the original input")
    void shouldReturnOriginalInputOnUnknownEscape() {
        String input = "name == \"中\\d\"";
        assertSame(input, HanNormalizer.normalize(input));
    }

    @Test
    @DisplayName("Normalizing twice should yield the same result")
    void shouldBeIdempotentOnItsOutput() {
        String once = HanNormalizer.normalize("name in [\"北京\", \"上海\"]");
        assertEquals(once, HanNormalizer.normalize(once));
    }
}
