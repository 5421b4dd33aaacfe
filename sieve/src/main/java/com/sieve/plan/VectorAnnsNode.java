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
 * An approximate nearest neighbour search over a vector field.
 *
 * @param vectorType     element kind of the searched vector field
 * @param predicates     optional filter, {@code null} when the request has no filter expression
 * @param queryInfo      search parameters, passed through to the engine as is
 * @param placeholderTag tag of the placeholder that carries the query vectors
 * @param fieldId        id of the searched vector field
 */
public record VectorAnnsNode(VectorType vectorType,
                             @Nullable Expr predicates,
                             QueryInfo queryInfo,
                             String placeholderTag,
                             long fieldId) implements PlanNode {

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visitVectorAnns(this);
    }
}
