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

import com.sieve.plan.AlwaysTrueExpr;
import com.sieve.plan.ArrayVal;
import com.sieve.plan.BinaryArithExpr;
import com.sieve.plan.BinaryArithOpEvalRangeExpr;
import com.sieve.plan.BinaryExpr;
import com.sieve.plan.BinaryRangeExpr;
import com.sieve.plan.ColumnExpr;
import com.sieve.plan.ColumnInfo;
import com.sieve.plan.CompareExpr;
import com.sieve.plan.Expr;
import com.sieve.plan.ExprVisitor;
import com.sieve.plan.GenericValue;
import com.sieve.plan.NullExpr;
import com.sieve.plan.TermExpr;
import com.sieve.plan.UnaryExpr;
import com.sieve.plan.UnaryRangeExpr;
import com.sieve.plan.ValueExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ExprValueFiller replaces the template placeholders of a compiled expression with the values
 * supplied by the caller.
 * <p>
 * Compiled expressions are shared through the {@link ExprCache}, so the filler never modifies its
 * input: it returns a copy in which every placeholder is replaced. Subtrees without placeholders are
 * reused as they are.
 */
public class ExprValueFiller implements ExprVisitor<Expr> {
    private final Map<String, GenericValue> values;

    private ExprValueFiller(Map<String, GenericValue> values) {
        this.values = values;
    }

    /**
     * Returns the given expression with all placeholders filled.
     *
     * @throws ExpressionSemanticException if a placeholder has no value or its value does not fit the place it is used
     */
    public static Expr fill(Expr expr, Map<String, GenericValue> values) {
        return expr.accept(new ExprValueFiller(values));
    }

    private GenericValue lookup(String name) {
        GenericValue value = values.get(name);
        if (value == null) {
            throw new ExpressionSemanticException(
                    String.format("the value of expression template variable name {%s} is not found", name)
            );
        }
        return value;
    }

    private GenericValue castFor(ColumnInfo column, String name) {
        GenericValue value = lookup(name);
        try {
            return ValueOps.castValue(column, value);
        } catch (ExpressionSemanticException e) {
            throw new ExpressionSemanticException(
                    String.format("template variable {%s}: %s", name, e.getMessage()), e
            );
        }
    }

    @Override
    public Expr visitAlwaysTrue(AlwaysTrueExpr expr) {
        return expr;
    }

    @Override
    public Expr visitColumn(ColumnExpr expr) {
        return expr;
    }

    @Override
    public Expr visitValue(ValueExpr expr) {
        if (!expr.isTemplate()) {
            return expr;
        }
        return ValueExpr.of(lookup(expr.templateVariableName()));
    }

    @Override
    public Expr visitUnaryRange(UnaryRangeExpr expr) {
        if (expr.templateVariableName() == null) {
            return expr;
        }
        return expr.withValue(castFor(expr.column(), expr.templateVariableName()));
    }

    @Override
    public Expr visitBinaryRange(BinaryRangeExpr expr) {
        if (expr.lowerTemplateVariableName() == null && expr.upperTemplateVariableName() == null) {
            return expr;
        }
        GenericValue lower = expr.lowerTemplateVariableName() == null
                ? expr.lowerValue()
                : castFor(expr.column(), expr.lowerTemplateVariableName());
        GenericValue upper = expr.upperTemplateVariableName() == null
                ? expr.upperValue()
                : castFor(expr.column(), expr.upperTemplateVariableName());
        return expr.withBounds(lower, upper);
    }

    @Override
    public Expr visitCompare(CompareExpr expr) {
        return expr;
    }

    @Override
    public Expr visitTerm(TermExpr expr) {
        String name = expr.templateVariableName();
        if (name == null) {
            return expr;
        }
        if (!(lookup(name) instanceof ArrayVal array)) {
            throw new ExpressionSemanticException(
                    String.format("the value of term expression template variable {%s} is not array", name)
            );
        }
        List<GenericValue> elements = new ArrayList<>();
        for (GenericValue element : array.elements()) {
            try {
                elements.add(ValueOps.castValue(expr.column().dataType(), element));
            } catch (ExpressionSemanticException e) {
                throw new ExpressionSemanticException(
                        String.format("template variable {%s}: %s", name, e.getMessage()), e
                );
            }
        }
        return expr.withValues(elements);
    }

    @Override
    public Expr visitUnary(UnaryExpr expr) {
        Expr child = expr.child().accept(this);
        if (child == expr.child()) {
            return expr;
        }
        return new UnaryExpr(expr.op(), child);
    }

    @Override
    public Expr visitBinary(BinaryExpr expr) {
        Expr left = expr.left().accept(this);
        Expr right = expr.right().accept(this);
        if (left == expr.left() && right == expr.right()) {
            return expr;
        }
        return new BinaryExpr(expr.op(), left, right);
    }

    @Override
    public Expr visitBinaryArith(BinaryArithExpr expr) {
        return expr;
    }

    @Override
    public Expr visitBinaryArithOpEvalRange(BinaryArithOpEvalRangeExpr expr) {
        String name = expr.valueTemplateVariableName();
        if (name == null) {
            return expr;
        }
        GenericValue value = castFor(expr.column(), name);
        if (!ValueOps.isNumber(value)) {
            throw new ExpressionSemanticException(
                    String.format("template variable {%s}: arithmetic comparison requires a number, got %s",
                            name, ValueOps.typeOf(value))
            );
        }
        return expr.withValue(value);
    }

    @Override
    public Expr visitNull(NullExpr expr) {
        return expr;
    }
}
