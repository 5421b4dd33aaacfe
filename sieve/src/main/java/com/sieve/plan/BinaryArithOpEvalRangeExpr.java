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

import javax.annotation.Nullable;

/**
 * {@code (column arithOp rightOperand) op value}, e.g. {@code age + 1 == 10}.
 */
public record BinaryArithOpEvalRangeExpr(ColumnInfo column,
                                         ArithOpType arithOp,
                                         GenericValue rightOperand,
                                         OpType op,
                                         @Nullable GenericValue value,
                                         @Nullable String valueTemplateVariableName) implements Expr {

    public BinaryArithOpEvalRangeExpr withValue(GenericValue value) {
        return new BinaryArithOpEvalRangeExpr(column, arithOp, rightOperand, op, value, null);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinaryArithOpEvalRange(this);
    }
}
