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

/**
 * Node of a typed plan expression tree.
 * <p>
 * Expressions are immutable, a compiled tree can be shared between threads. Template placeholders
 * are represented by a variable name in place of a literal value until they are filled.
 */
public sealed interface Expr permits AlwaysTrueExpr, ColumnExpr, ValueExpr, UnaryRangeExpr, BinaryRangeExpr,
        CompareExpr, TermExpr, UnaryExpr, BinaryExpr, BinaryArithExpr, BinaryArithOpEvalRangeExpr, NullExpr {

    <R> R accept(ExprVisitor<R> visitor);
}
