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
 * Caller supplied search parameters. The planner never interprets them.
 *
 * @param topk           number of nearest neighbours to return
 * @param metricType     distance metric name
 * @param searchParams   index specific search parameters, serialized as JSON
 * @param roundDecimal   number of decimals to round distances to, -1 disables rounding
 * @param groupByFieldId id of the group-by field, -1 when the search is not grouped
 */
public record QueryInfo(long topk, String metricType, String searchParams, long roundDecimal, long groupByFieldId) {
}
