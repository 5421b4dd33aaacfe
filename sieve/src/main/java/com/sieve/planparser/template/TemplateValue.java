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

package com.sieve.planparser.template;

import com.sieve.common.schema.DataType;

import java.util.List;

/**
 * A typed literal supplied by the caller for a template placeholder such as {@code {age}}.
 */
public sealed interface TemplateValue permits TemplateValue.BoolValue, TemplateValue.Int64Value,
        TemplateValue.FloatValue, TemplateValue.StringValue, TemplateValue.ArrayValue {

    DataType dataType();

    static BoolValue of(boolean value) {
        return new BoolValue(value);
    }

    static Int64Value of(long value) {
        return new Int64Value(value);
    }

    static FloatValue of(double value) {
        return new FloatValue(value);
    }

    static StringValue of(String value) {
        return new StringValue(value);
    }

    record BoolValue(boolean value) implements TemplateValue {
        @Override
        public DataType dataType() {
            return DataType.BOOL;
        }
    }

    record Int64Value(long value) implements TemplateValue {
        @Override
        public DataType dataType() {
            return DataType.INT64;
        }
    }

    record FloatValue(double value) implements TemplateValue {
        @Override
        public DataType dataType() {
            return DataType.DOUBLE;
        }
    }

    record StringValue(String value) implements TemplateValue {
        @Override
        public DataType dataType() {
            return DataType.VARCHAR;
        }
    }

    /**
     * An array whose elements must all be of {@code elementType}. {@link DataType#JSON} allows mixed elements.
     */
    record ArrayValue(DataType elementType, List<TemplateValue> elements) implements TemplateValue {
        public ArrayValue {
            elements = List.copyOf(elements);
        }

        @Override
        public DataType dataType() {
            return DataType.ARRAY;
        }
    }
}
