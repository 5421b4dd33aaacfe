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
import com.sieve.plan.BinaryArithOpEvalRangeExpr;
import com.sieve.plan.BinaryExpr;
import com.sieve.plan.BinaryRangeExpr;
import com.sieve.plan.Expr;
import com.sieve.plan.FloatVal;
import com.sieve.plan.GenericValue;
import com.sieve.plan.Int64Val;
import com.sieve.plan.StringVal;
import com.sieve.plan.TermExpr;
import com.sieve.plan.UnaryExpr;
import com.sieve.plan.UnaryRangeExpr;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExprValueFillerTest extends BasePlannerTest {
    private ExprCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = newCompiler(PlanVisitorImpl::analyze);
    }

    private Expr compile(String expr) {
        CompileResult result = compiler.compile(newSchemaHelper(), expr);
        return assertInstanceOf(CompileResult.Compiled.class, result).exprWithType().expr();
    }

    private static ArrayVal intArray(long... values) {
        List<GenericValue> elements = new ArrayList<>();
        for (long value : values) {
            elements.add(new Int64Val(value));
        }
        return new ArrayVal(elements, true, DataType.INT64);
    }

    @Test
    @DisplayName("Expression without placeholders should be returned as is")
    void shouldReturnSameTreeWithoutPlaceholders() {
        Expr expr = compile("age > 1 && name == \"x\"");
        assertSame(expr, ExprValueFiller.fill(expr, Map.of()));
    }

    @Test
    @DisplayName("Placeholder of a unary range should be replaced without touching the compiled tree")
    void shouldFillUnaryRange() {
        UnaryRangeExpr compiled = assertInstanceOf(UnaryRangeExpr.class, compile("age > {v}"));

        UnaryRangeExpr filled = assertInstanceOf(
                UnaryRangeExpr.class, ExprValueFiller.fill(compiled, Map.of("v", new Int64Val(5)))
        );

        assertEquals(new Int64Val(5), filled.value());
        assertNull(filled.templateVariableName());
        assertEquals(compiled.column(), filled.column());
        assertEquals(compiled.op(), filled.op());
        assertNull(compiled.value());
        assertEquals("v", compiled.templateVariableName());
    }

    @Test
    @DisplayName("Filled value should be converted to the field type")
    void shouldCastFilledValueToFieldType() {
        UnaryRangeExpr filled = assertInstanceOf(
                UnaryRangeExpr.class, ExprValueFiller.fill(compile("score > {v}"), Map.of("v", new Int64Val(1)))
        );
        assertEquals(new FloatVal(1.0), filled.value());
    }

    @Test
    @DisplayName("Filled value out of the field's range should be rejected")
    void shouldRejectValueOutOfRange() {
        Expr expr = compile("small > {v}");
        ExpressionSemanticException e = assertThrows(
                ExpressionSemanticException.class,
                () -> ExprValueFiller.fill(expr, Map.of("v", new Int64Val(300)))
        );
        assertEquals("template variable {v}: value 300 is out of range of INT8", e.getMessage());
    }

    @Test
    @DisplayName("Filled value of another type should be rejected")
    void shouldRejectValueOfAnotherType() {
        Expr expr = compile("name == {v}");
        ExpressionSemanticException e = assertThrows(
                ExpressionSemanticException.class,
                () -> ExprValueFiller.fill(expr, Map.of("v", new Int64Val(1)))
        );
        assertEquals("template variable {v}: cannot cast value to VARCHAR, value is 1", e.getMessage());
    }

    @Test
    @DisplayName("Missing placeholder value should be reported")
    void shouldRejectMissingValue() {
        Expr expr = compile("age > {v}");
        ExpressionSemanticException e = assertThrows(
                ExpressionSemanticException.class,
                () -> ExprValueFiller.fill(expr, Map.of("w", new Int64Val(1)))
        );
        assertEquals("the value of expression template variable name {v} is not found", e.getMessage());
    }

    @Test
    @DisplayName("Both bounds of a binary range should be filled")
    void shouldFillBinaryRange() {
        BinaryRangeExpr filled = assertInstanceOf(
                BinaryRangeExpr.class,
                ExprValueFiller.fill(compile("{lo} < age <= {hi}"), Map.of("lo", new Int64Val(1), "hi", new Int64Val(9)))
        );
        assertEquals(new Int64Val(1), filled.lowerValue());
        assertEquals(new Int64Val(9), filled.upperValue());
        assertNull(filled.lowerTemplateVariableName());
        assertNull(filled.upperTemplateVariableName());
        assertFalse(filled.lowerInclusive());
        assertTrue(filled.upperInclusive());
    }

    @Test
    @DisplayName("Only the templated bound of a binary range should change")
    void shouldKeepConstantBound() {
        BinaryRangeExpr filled = assertInstanceOf(
                BinaryRangeExpr.class,
                ExprValueFiller.fill(compile("1 < score < {hi}"), Map.of("hi", new Int64Val(9)))
        );
        assertEquals(new Int64Val(1), filled.lowerValue());
        assertEquals(new FloatVal(9.0), filled.upperValue());
    }

    @Test
    @DisplayName("Term placeholder should be replaced with the converted list")
    void shouldFillTerm() {
        TermExpr filled = assertInstanceOf(
                TermExpr.class, ExprValueFiller.fill(compile("score in {ids}"), Map.of("ids", intArray(1, 2)))
        );
        assertEquals(List.of(new FloatVal(1.0), new FloatVal(2.0)), filled.values());
        assertNull(filled.templateVariableName());
    }

    @Test
    @DisplayName("Term placeholder should require a list")
    void shouldRejectScalarTermValue() {
        Expr expr = compile("age in {ids}");
        ExpressionSemanticException e = assertThrows(
                ExpressionSemanticException.class,
                () -> ExprValueFiller.fill(expr, Map.of("ids", new Int64Val(1)))
        );
        assertEquals("the value of term expression template variable {ids} is not array", e.getMessage());
    }

    @Test
    @DisplayName("Negated term should be rebuilt around the filled child")
    void shouldFillUnderNegation() {
        UnaryExpr filled = assertInstanceOf(
                UnaryExpr.class, ExprValueFiller.fill(compile("age not in {ids}"), Map.of("ids", intArray(3)))
        );
        TermExpr term = assertInstanceOf(TermExpr.class, filled.child());
        assertEquals(List.of(new Int64Val(3)), term.values());
    }

    @Test
    @DisplayName("Array field placeholder should be converted to the element type")
    void shouldFillArrayFieldComparison() {
        UnaryRangeExpr filled = assertInstanceOf(
                UnaryRangeExpr.class, ExprValueFiller.fill(compile("tags == {t}"), Map.of("t", intArray(1)))
        );
        ArrayVal value = assertInstanceOf(ArrayVal.class, filled.value());
        assertEquals(DataType.INT64, value.elementType());
    }

    @Test
    @DisplayName("Arithmetic range placeholder should be filled with a number")
    void shouldFillBinaryArithOpEvalRange() {
        BinaryArithOpEvalRangeExpr filled = assertInstanceOf(
                BinaryArithOpEvalRangeExpr.class,
                ExprValueFiller.fill(compile("age + 1 > {v}"), Map.of("v", new Int64Val(10)))
        );
        assertEquals(new Int64Val(10), filled.value());
        assertNull(filled.valueTemplateVariableName());

        Expr expr = compile("age * 2 == {v}");
        ExpressionSemanticException e = assertThrows(
                ExpressionSemanticException.class,
                () -> ExprValueFiller.fill(expr, Map.of("v", new StringVal("x")))
        );
        assertEquals("template variable {v}: cannot cast value to INT64, value is x", e.getMessage());
    }

    @Test
    @DisplayName("Arithmetic range placeholder should be converted to the field type")
    void shouldCastBinaryArithOpEvalRangeValue() {
        BinaryArithOpEvalRangeExpr filled = assertInstanceOf(
                BinaryArithOpEvalRangeExpr.class,
                ExprValueFiller.fill(compile("score - 1 < {v}"), Map.of("v", new Int64Val(4)))
        );
        assertEquals(new FloatVal(4.0), filled.value());

        Expr expr = compile("small + 1 == {v}");
        ExpressionSemanticException e = assertThrows(
                ExpressionSemanticException.class,
                () -> ExprValueFiller.fill(expr, Map.of("v", new Int64Val(300)))
        );
        assertEquals("template variable {v}: value 300 is out of range of INT8", e.getMessage());
    }

    @Test
    @DisplayName("Arithmetic range placeholder on a JSON field should still require a number")
    void shouldRequireNumberForJsonArithmetic() {
        Expr expr = compile("meta + 1 == {v}");
        ExpressionSemanticException e = assertThrows(
                ExpressionSemanticException.class,
                () -> ExprValueFiller.fill(expr, Map.of("v", new StringVal("x")))
        );
        assertEquals("template variable {v}: arithmetic comparison requires a number, got VARCHAR", e.getMessage());
    }

    @Test
    @DisplayName("Unchanged sibling subtrees should be shared with the compiled tree")
    void shouldReuseUnchangedSubtrees() {
        BinaryExpr compiled = assertInstanceOf(BinaryExpr.class, compile("age > 1 && name == {n}"));

        BinaryExpr filled = assertInstanceOf(
                BinaryExpr.class, ExprValueFiller.fill(compiled, Map.of("n", new StringVal("x")))
        );

        assertNotSame(compiled, filled);
        assertSame(compiled.left(), filled.left());
        UnaryRangeExpr right = assertInstanceOf(UnaryRangeExpr.class, filled.right());
        assertEquals(new StringVal("x"), right.value());
    }
}
