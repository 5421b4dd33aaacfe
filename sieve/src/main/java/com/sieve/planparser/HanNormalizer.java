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

/**
 * Rewrites Han code points into ASCII escape sequences before lexing.
 * <p>
 * Escape sequences already present in the input are copied through verbatim. If a backslash
 * is followed by a character that is not a recognized escape character, the input is returned
 * unmodified.
 */
public final class HanNormalizer {

    private HanNormalizer() {
    }

    static boolean isEscapeChar(int ch) {
        return switch (ch) {
            case '\\', 'n', 't', 'r', 'f', '"', '\'' -> true;
            default -> false;
        };
    }

    static String formatUnicode(int codePoint) {
        if (Character.isSupplementaryCodePoint(codePoint)) {
            return String.format("\\U%08x", codePoint);
        }
        return String.format("\\u%04x", codePoint);
    }

    public static String normalize(String input) {
        StringBuilder builder = new StringBuilder(input.length() * 6);
        boolean skipCurrent = false;
        int index = 0;
        while (index < input.length()) {
            int codePoint = input.codePointAt(index);
            int next = index + Character.charCount(codePoint);
            if (skipCurrent) {
                builder.appendCodePoint(codePoint);
                skipCurrent = false;
            } else if (codePoint == '\\') {
                if (next < input.length() && !isEscapeChar(input.charAt(next))) {
                    return input;
                }
                skipCurrent = true;
                builder.append('\\');
            } else if (Character.UnicodeScript.of(codePoint) == Character.UnicodeScript.HAN) {
                builder.append(formatUnicode(codePoint));
            } else {
                builder.appendCodePoint(codePoint);
            }
            index = next;
        }
        return builder.toString();
    }
}
