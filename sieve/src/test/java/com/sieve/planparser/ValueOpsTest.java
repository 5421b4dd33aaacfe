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

package com.sieve.planparser;

import com.sieve.common.schema.DataType;
import com.sieve.plan.ArrayVal;
import com.sieve.plan.BoolVal;
import com.sieve.plan.ColumnInfo;
import com.sieve.plan.FloatVal;
import com.sieve.plan.GenericValue;
import com.sieve.plan.Int64Val;
import com.sieve.plan.OpType;
import com.sieve.plan.StringVal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueOpsTest {

    @ParameterizedTest
    @CsvSource({
            "INT8, 127, true",
            "INT8, 128, false",
            "INT8, -128, true",
            "INT16, 32768, false",
            "INT32, 2147483647, true",
            "INT32, -2147483649, false",
            "INT64, 9223372036854775807, true"
    })
    @DisplayName("Integers should be range-checked against the field width")
    void shouldCheckIntegerRanges(DataType dataType, long value, boolean fits) {
        if (fits) {
            assertEquals(new Int64Val(value), ValueOps.castValue(dataType, new Int64Val(value)));
        } else {
            assertThrows(ExpressionSemanticException.class, () -> ValueOps.castValue(dataType, new Int64Val(value)));
        }
    }

    @Test
    @DisplayName("Integers should widen to floating fields but not the other way round")
    void shouldWidenIntegersOnly() {
        assertEquals(new FloatVal(3.0), ValueOps.castValue(DataType.FLOAT, new Int64Val(3)));
        ExpressionSemanticException e = assertThrows(
                ExpressionSemanticException.class,
                () -> ValueOps.castValue(DataType.INT64, new FloatVal(1.5))
        );
        assertEquals("cannot cast value to INT64, value is 1.5", e.getMessage());
    }

    @Test
    @DisplayName("JSON fields should accept any value")
    void shouldAcceptAnythingForJson() {
        GenericValue value = new StringVal("x");
        assertSame(value, ValueOps.castValue(DataType.JSON, value));
    }

    @Test
    @DisplayName("Array columns should require an array value")
    void shouldRequireArrayForArrayColumns() {
        ColumnInfo column = new ColumnInfo(1, DataType.ARRAY, false, false, false, false, DataType.INT16);
        assertThrows(ExpressionSemanticException.class, () -> ValueOps.castValue(column, new Int64Val(1)));

        ArrayVal value = new ArrayVal(List.of(new Int64Val(70000)), true, DataType.INT64);
        assertThrows(ExpressionSemanticException.class, () -> ValueOps.castValue(column, value));
    }

    @Test
    @DisplayName("Array literals should record whether their elements share a type")
    void shouldTrackArrayElementTypes() {
        ArrayVal same = ValueOps.newArray(List.of(new Int64Val(1), new Int64Val(2)));
        assertTrue(same.sameType());
        assertEquals(DataType.INT64, same.elementType());

        ArrayVal mixed = ValueOps.newArray(List.of(new Int64Val(1), new StringVal("a")));
        assertFalse(mixed.sameType());
        assertEquals(DataType.NONE, mixed.elementType());
    }

    @Test
    @DisplayName("Constants of different numeric types should compare by value")
    void shouldCompareMixedNumbers() {
        assertEquals(new BoolVal(true), ValueOps.compare(new Int64Val(1), new FloatVal(1.0), OpType.EQUAL));
        assertEquals(new BoolVal(true), ValueOps.compare(new StringVal("a"), new StringVal("b"), OpType.LESS_THAN));
        assertThrows(
                ExpressionSemanticException.class,
                () -> ValueOps.compare(new BoolVal(true), new BoolVal(false), OpType.GREATER_THAN)
        );
    }

    @Test
    @DisplayName("Vector types should never be comparable")
    void shouldNotCompareVectors() {
        assertFalse(ValueOps.canBeCompared(DataType.FLOAT_VECTOR, DataType.FLOAT_VECTOR));
        assertTrue(ValueOps.canBeCompared(DataType.INT8, DataType.DOUBLE));
        assertFalse(ValueOps.canBeCompared(DataType.JSON, DataType.ARRAY));
    }
}
