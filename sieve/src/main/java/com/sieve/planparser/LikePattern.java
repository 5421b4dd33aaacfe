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

import com.sieve.plan.OpType;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates a like pattern into the cheapest matching operator.
 * <p>
 * {@code %} matches any sequence and {@code _} matches a single character; a backslash escapes them.
 * A pattern without wildcards becomes an equality, {@code abc%} a prefix match, {@code %abc} a postfix
 * match and {@code %abc%} an inner match. Any other pattern is kept as is for a full match.
 *
 * @param op      the operator to apply
 * @param operand literal operand, or the original pattern for {@link OpType#MATCH}
 */
record LikePattern(OpType op, String operand) {

    static LikePattern translate(String pattern) {
        StringBuilder literal = new StringBuilder();
        List<Integer> wildcards = new ArrayList<>();
        boolean onlyPercent = true;
        for (int index = 0; index < pattern.length(); index++) {
            char ch = pattern.charAt(index);
            if (ch == '\\' && index + 1 < pattern.length()) {
                char next = pattern.charAt(index + 1);
                if (next == '%' || next == '_' || next == '\\') {
                    literal.append(next);
                    index++;
                    continue;
                }
            }
            if (ch == '%' || ch == '_') {
                wildcards.add(index);
                onlyPercent &= ch == '%';
                continue;
            }
            literal.append(ch);
        }

        if (wildcards.isEmpty()) {
            return new LikePattern(OpType.EQUAL, literal.toString());
        }
        if (onlyPercent) {
            boolean leading = wildcards.get(0) == 0;
            boolean trailing = wildcards.get(wildcards.size() - 1) == pattern.length() - 1;
            if (wildcards.size() == 1 && trailing && !leading) {
                return new LikePattern(OpType.PREFIX_MATCH, literal.toString());
            }
            if (wildcards.size() == 1 && leading && !trailing) {
                return new LikePattern(OpType.POSTFIX_MATCH, literal.toString());
            }
            if (wildcards.size() == 2 && leading && trailing) {
                return new LikePattern(OpType.INNER_MATCH, literal.toString());
            }
        }
        return new LikePattern(OpType.MATCH, pattern);
    }
}
