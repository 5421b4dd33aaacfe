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

public interface ExprVisitor<R> {
    R visitAlwaysTrue(AlwaysTrueExpr expr);

    R visitColumn(ColumnExpr expr);

    R visitValue(ValueExpr expr);

    R visitUnaryRange(UnaryRangeExpr expr);

    R visitBinaryRange(BinaryRangeExpr expr);

    R visitCompare(CompareExpr expr);

    R visitTerm(TermExpr expr);

    R visitUnary(UnaryExpr expr);

    R visitBinary(BinaryExpr expr);

    R visitBinaryArith(BinaryArithExpr expr);

    R visitBinaryArithOpEvalRange(BinaryArithOpEvalRangeExpr expr);

    R visitNull(NullExpr expr);
}
