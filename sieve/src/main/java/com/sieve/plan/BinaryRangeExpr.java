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
 * {@code lower < column < upper} with per-bound inclusiveness.
 */
public record BinaryRangeExpr(ColumnInfo column,
                              boolean lowerInclusive,
                              boolean upperInclusive,
                              @Nullable GenericValue lowerValue,
                              @Nullable GenericValue upperValue,
                              @Nullable String lowerTemplateVariableName,
                              @Nullable String upperTemplateVariableName) implements Expr {

    public BinaryRangeExpr withBounds(GenericValue lowerValue, GenericValue upperValue) {
        return new BinaryRangeExpr(column, lowerInclusive, upperInclusive, lowerValue, upperValue, null, null);
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinaryRange(this);
    }
}
