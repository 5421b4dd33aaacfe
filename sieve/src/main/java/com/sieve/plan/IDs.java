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

import java.util.List;

/**
 * A list of primary key values. Holds either integer ids or string ids, never both. An instance
 * built by {@link #empty()} holds none of them.
 */
public final class IDs {
    private final IdField idField;
    private final List<Long> intIds;
    private final List<String> strIds;

    private IDs(IdField idField, List<Long> intIds, List<String> strIds) {
        this.idField = idField;
        this.intIds = intIds;
        this.strIds = strIds;
    }

    public static IDs ofInts(List<Long> ids) {
        return new IDs(IdField.INT_ID, List.copyOf(ids), List.of());
    }

    public static IDs ofStrings(List<String> ids) {
        return new IDs(IdField.STR_ID, List.of(), List.copyOf(ids));
    }

    public static IDs empty() {
        return new IDs(IdField.NONE, List.of(), List.of());
    }

    public IdField getIdField() {
        return idField;
    }

    public List<Long> getIntIds() {
        return intIds;
    }

    public List<String> getStrIds() {
        return strIds;
    }

    public int size() {
        return switch (idField) {
            case INT_ID -> intIds.size();
            case STR_ID -> strIds.size();
            case NONE -> 0;
        };
    }

    public enum IdField {
        INT_ID,
        STR_ID,
        NONE
    }
}
