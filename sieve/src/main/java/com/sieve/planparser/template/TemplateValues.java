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
import com.sieve.plan.ArrayVal;
import com.sieve.plan.BoolVal;
import com.sieve.plan.FloatVal;
import com.sieve.plan.GenericValue;
import com.sieve.plan.Int64Val;
import com.sieve.plan.StringVal;
import com.sieve.planparser.ExpressionSemanticException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts caller supplied template values into plan literals.
 */
public final class TemplateValues {

    private TemplateValues() {
    }

    /**
     * Converts the given template values, keyed by placeholder name.
     *
     * @throws ExpressionSemanticException if an array value holds an element of a type other than its declared element type
     */
    public static Map<String, GenericValue> unmarshal(Map<String, TemplateValue> values) {
        Map<String, GenericValue> result = new HashMap<>();
        if (values == null) {
            return result;
        }
        for (Map.Entry<String, TemplateValue> entry : values.entrySet()) {
            try {
                result.put(entry.getKey(), toGenericValue(entry.getValue()));
            } catch (ExpressionSemanticException e) {
                throw new ExpressionSemanticException(
                        String.format("failed to unmarshal template value {%s}: %s", entry.getKey(), e.getMessage()),
                        e
                );
            }
        }
        return result;
    }

    static GenericValue toGenericValue(TemplateValue value) {
        if (value == null) {
            throw new ExpressionSemanticException("value cannot be null");
        } else if (value instanceof TemplateValue.BoolValue v) {
            return new BoolVal(v.value());
        } else if (value instanceof TemplateValue.Int64Value v) {
            return new Int64Val(v.value());
        } else if (value instanceof TemplateValue.FloatValue v) {
            return new FloatVal(v.value());
        } else if (value instanceof TemplateValue.StringValue v) {
            if (v.value() == null) {
                throw new ExpressionSemanticException("string value cannot be null");
            }
            return new StringVal(v.value());
        }

        TemplateValue.ArrayValue array = (TemplateValue.ArrayValue) value;
        boolean mixed = array.elementType() == DataType.JSON;
        List<GenericValue> elements = new ArrayList<>();
        DataType sharedType = DataType.NONE;
        boolean sameType = true;
        for (TemplateValue element : array.elements()) {
            if (!mixed && element.dataType() != array.elementType()) {
                throw new ExpressionSemanticException(
                        String.format("array element of type %s does not match declared element type %s",
                                element.dataType(), array.elementType())
                );
            }
            if (sharedType == DataType.NONE) {
                sharedType = element.dataType();
            } else if (sharedType != element.dataType()) {
                sameType = false;
            }
            elements.add(toGenericValue(element));
        }
        return new ArrayVal(elements, sameType, sameType ? sharedType : DataType.NONE);
    }
}
