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

import java.util.Objects;

/**
 * A scan filtered by a predicate.
 *
 * @param predicates filter predicate
 * @param isCount    whether only the number of matching rows is requested
 * @param limit      maximum number of rows, zero means no limit
 */
public record QueryPlanNode(Expr predicates, boolean isCount, long limit) implements PlanNode {
    public QueryPlanNode {
        Objects.requireNonNull(predicates, "predicates cannot be null");
    }

    @Override
    public <R> R accept(PlanNodeVisitor<R> visitor) {
        return visitor.visitQuery(this);
    }
}
