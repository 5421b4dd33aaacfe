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
 * A constant, or a template placeholder when {@code templateVariableName} is set.
 */
public record ValueExpr(@Nullable GenericValue value, @Nullable String templateVariableName) implements Expr {

    public static ValueExpr of(GenericValue value) {
        return new ValueExpr(value, null);
    }

    public static ValueExpr template(String name) {
        return new ValueExpr(null, name);
    }

    public boolean isTemplate() {
        return templateVariableName != null;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitValue(this);
    }
}
