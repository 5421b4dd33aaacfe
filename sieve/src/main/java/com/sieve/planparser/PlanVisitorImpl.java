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
import com.sieve.common.schema.FieldNotFoundException;
import com.sieve.common.schema.FieldSchema;
import com.sieve.common.schema.SchemaHelper;
import com.sieve.plan.ArithOpType;
import com.sieve.plan.ArrayVal;
import com.sieve.plan.BinaryArithExpr;
import com.sieve.plan.BinaryArithOpEvalRangeExpr;
import com.sieve.plan.BinaryExpr;
import com.sieve.plan.BinaryRangeExpr;
import com.sieve.plan.BoolVal;
import com.sieve.plan.ColumnExpr;
import com.sieve.plan.ColumnInfo;
import com.sieve.plan.CompareExpr;
import com.sieve.plan.Expr;
import com.sieve.plan.FloatVal;
import com.sieve.plan.GenericValue;
import com.sieve.plan.Int64Val;
import com.sieve.plan.NullExpr;
import com.sieve.plan.OpType;
import com.sieve.plan.StringVal;
import com.sieve.plan.TermExpr;
import com.sieve.plan.UnaryExpr;
import com.sieve.plan.UnaryRangeExpr;
import com.sieve.plan.ValueExpr;
import com.sieve.planparser.grammar.PlanBaseVisitor;
import com.sieve.planparser.grammar.PlanParser;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * PlanVisitorImpl lowers a parse tree into a typed plan expression.
 * <p>
 * Field references are resolved against the collection schema, constant sub-expressions are
 * folded, and every operator is type-checked. The first violation is thrown as an
 * {@link ExpressionSemanticException}.
 */
public class PlanVisitorImpl extends PlanBaseVisitor<ExprWithType> {
    private final SchemaHelper schema;

    public PlanVisitorImpl(SchemaHelper schema) {
        this.schema = schema;
    }

    /**
     * The default {@link ExprAnalyzer}: a fresh visitor per compilation.
     */
    public static ExprWithType analyze(PlanParser.ExprContext ast, SchemaHelper schema) {
        return ast.accept(new PlanVisitorImpl(schema));
    }

    private static ExprWithType constant(GenericValue value) {
        return new ExprWithType(ValueOps.typeOf(value), ValueExpr.of(value));
    }

    private static GenericValue constantOf(ExprWithType expr) {
        if (expr.expr() instanceof ValueExpr value && !value.isTemplate()) {
            return value.value();
        }
        return null;
    }

    private static String templateOf(ExprWithType expr) {
        if (expr.expr() instanceof ValueExpr value && value.isTemplate()) {
            return value.templateVariableName();
        }
        return null;
    }

    private static ColumnInfo columnOf(ExprWithType expr) {
        if (expr.expr() instanceof ColumnExpr column) {
            return column.info();
        }
        return null;
    }

    private static OpType toOpType(Token op) {
        return switch (op.getType()) {
            case PlanParser.LT -> OpType.LESS_THAN;
            case PlanParser.LE -> OpType.LESS_EQUAL;
            case PlanParser.GT -> OpType.GREATER_THAN;
            case PlanParser.GE -> OpType.GREATER_EQUAL;
            case PlanParser.EQ -> OpType.EQUAL;
            case PlanParser.NE -> OpType.NOT_EQUAL;
            default -> throw new ExpressionSemanticException(String.format("unsupported operator: %s", op.getText()));
        };
    }

    private static ArithOpType toArithOpType(Token op) {
        return switch (op.getType()) {
            case PlanParser.ADD -> ArithOpType.ADD;
            case PlanParser.SUB -> ArithOpType.SUB;
            case PlanParser.MUL -> ArithOpType.MUL;
            case PlanParser.DIV -> ArithOpType.DIV;
            case PlanParser.MOD -> ArithOpType.MOD;
            default -> throw new ExpressionSemanticException(String.format("unsupported operator: %s", op.getText()));
        };
    }

    static long parseInteger(String text) {
        try {
            if (text.length() > 2 && (text.startsWith("0x") || text.startsWith("0X"))) {
                return Long.parseLong(text.substring(2), 16);
            }
            if (text.length() > 2 && (text.startsWith("0b") || text.startsWith("0B"))) {
                return Long.parseLong(text.substring(2), 2);
            }
            if (text.length() > 1 && text.startsWith("0")) {
                return Long.parseLong(text.substring(1), 8);
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ExpressionSemanticException(String.format("invalid integer: %s", text), e);
        }
    }

    /**
     * Strips the quotes of a string literal and resolves its escape sequences.
     */
    static String unquote(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder builder = new StringBuilder(body.length());
        int index = 0;
        while (index < body.length()) {
            char ch = body.charAt(index++);
            if (ch != '\\') {
                builder.append(ch);
                continue;
            }
            char escaped = body.charAt(index++);
            switch (escaped) {
                case 'a' -> builder.append('\u0007');
                case 'b' -> builder.append('\b');
                case 'f' -> builder.append('\f');
                case 'n' -> builder.append('\n');
                case 'r' -> builder.append('\r');
                case 't' -> builder.append('\t');
                case 'v' -> builder.append('\u000b');
                case 'u' -> {
                    builder.appendCodePoint(Integer.parseInt(body.substring(index, index + 4), 16));
                    index += 4;
                }
                case 'U' -> {
                    int codePoint = Integer.parseInt(body.substring(index, index + 8), 16);
                    if (!Character.isValidCodePoint(codePoint)) {
                        throw new ExpressionSemanticException(String.format("invalid code point in %s", literal));
                    }
                    builder.appendCodePoint(codePoint);
                    index += 8;
                }
                default -> builder.append(escaped);
            }
        }
        return builder.toString();
    }

    private ColumnInfo resolveColumn(String fieldName) {
        FieldSchema field;
        try {
            field = schema.getFieldFromName(fieldName);
        } catch (FieldNotFoundException e) {
            throw new ExpressionSemanticException(e.getMessage(), e);
        }
        return ColumnInfo.of(field);
    }

    private ExprWithType requireBool(ExprWithType expr, String operator) {
        if (!expr.dataType().isBoolType()) {
            throw new ExpressionSemanticException(
                    String.format("%s operation on non-boolean expression, data type: %s", operator, expr.dataType())
            );
        }
        return expr;
    }

    private void checkComparable(ColumnInfo column, DataType valueType, OpType op) {
        if (!ValueOps.canBeCompared(column.dataType(), valueType)) {
            throw new ExpressionSemanticException(
                    String.format("comparisons between %s and %s are not supported", column.dataType(), valueType)
            );
        }
        if (!ValueOps.supportsOperator(column.dataType(), op)) {
            throw new ExpressionSemanticException(
                    String.format("%s is not supported on %s fields", op, column.dataType())
            );
        }
    }

    @Override
    public ExprWithType visitInteger(PlanParser.IntegerContext ctx) {
        return constant(new Int64Val(parseInteger(ctx.IntegerConstant().getText())));
    }

    @Override
    public ExprWithType visitFloating(PlanParser.FloatingContext ctx) {
        return constant(new FloatVal(Double.parseDouble(ctx.FloatingConstant().getText())));
    }

    @Override
    public ExprWithType visitBoolean(PlanParser.BooleanContext ctx) {
        return constant(new BoolVal(Boolean.parseBoolean(ctx.BooleanConstant().getText())));
    }

    @Override
    public ExprWithType visitString(PlanParser.StringContext ctx) {
        return constant(new StringVal(unquote(ctx.StringLiteral().getText())));
    }

    @Override
    public ExprWithType visitIdentifier(PlanParser.IdentifierContext ctx) {
        ColumnInfo column = resolveColumn(ctx.Identifier().getText());
        return new ExprWithType(column.dataType(), new ColumnExpr(column));
    }

    @Override
    public ExprWithType visitTemplateVariable(PlanParser.TemplateVariableContext ctx) {
        return new ExprWithType(DataType.NONE, ValueExpr.template(ctx.Identifier().getText()));
    }

    @Override
    public ExprWithType visitParens(PlanParser.ParensContext ctx) {
        return ctx.expr().accept(this);
    }

    @Override
    public ExprWithType visitArray(PlanParser.ArrayContext ctx) {
        List<GenericValue> elements = new ArrayList<>();
        for (PlanParser.ExprContext element : ctx.expr()) {
            GenericValue value = constantOf(element.accept(this));
            if (value == null) {
                throw new ExpressionSemanticException(
                        String.format("array element must be a constant: %s", element.getText())
                );
            }
            elements.add(value);
        }
        return constant(ValueOps.newArray(elements));
    }

    @Override
    public ExprWithType visitEmptyArray(PlanParser.EmptyArrayContext ctx) {
        return constant(ValueOps.newArray(List.of()));
    }

    @Override
    public ExprWithType visitLike(PlanParser.LikeContext ctx) {
        ExprWithType left = ctx.expr().accept(this);
        ColumnInfo column = columnOf(left);
        if (column == null) {
            throw new ExpressionSemanticException("the left operand of like operation must be a field");
        }
        if (!column.dataType().isStringType() && column.dataType() != DataType.JSON) {
            throw new ExpressionSemanticException(
                    String.format("like operation on non-string field is unsupported, data type: %s", column.dataType())
            );
        }
        LikePattern pattern = LikePattern.translate(unquote(ctx.StringLiteral().getText()));
        Expr expr = new UnaryRangeExpr(column, pattern.op(), new StringVal(pattern.operand()), null);
        return new ExprWithType(DataType.BOOL, expr);
    }

    @Override
    public ExprWithType visitPower(PlanParser.PowerContext ctx) {
        GenericValue base = constantOf(ctx.expr(0).accept(this));
        GenericValue exponent = constantOf(ctx.expr(1).accept(this));
        if (base == null || exponent == null) {
            throw new ExpressionSemanticException("power can only apply on constants");
        }
        return constant(ValueOps.power(base, exponent));
    }

    @Override
    public ExprWithType visitUnary(PlanParser.UnaryContext ctx) {
        ExprWithType child = ctx.expr().accept(this);
        GenericValue value = constantOf(child);
        if (value == null) {
            throw new ExpressionSemanticException(
                    String.format("unary %s can only apply on constants", ctx.op.getText())
            );
        }
        if (ctx.op.getType() == PlanParser.SUB) {
            return constant(ValueOps.negate(value));
        }
        if (!ValueOps.isNumber(value)) {
            throw new ExpressionSemanticException(String.format("unary plus is not supported on %s", child.dataType()));
        }
        return child;
    }

    private ExprWithType arithmetic(ExprWithType left, ExprWithType right, ArithOpType op) {
        GenericValue leftValue = constantOf(left);
        GenericValue rightValue = constantOf(right);
        if (leftValue != null && rightValue != null) {
            return constant(ValueOps.arith(leftValue, rightValue, op));
        }

        ColumnInfo column = columnOf(left);
        GenericValue operand = rightValue;
        if (column == null && (op == ArithOpType.ADD || op == ArithOpType.MUL)) {
            column = columnOf(right);
            operand = leftValue;
        }
        if (column == null || operand == null) {
            throw new ExpressionSemanticException(
                    String.format("%s is only supported between a field and a constant", op)
            );
        }
        if (!column.dataType().isArithmeticType() && column.dataType() != DataType.JSON) {
            throw new ExpressionSemanticException(
                    String.format("%s is not supported on %s fields", op, column.dataType())
            );
        }
        if (!ValueOps.isNumber(operand)) {
            throw new ExpressionSemanticException(
                    String.format("%s is not supported between %s and %s", op, column.dataType(), ValueOps.typeOf(operand))
            );
        }
        if (op == ArithOpType.MOD && (operand instanceof FloatVal || column.dataType().isFloatingType())) {
            throw new ExpressionSemanticException("modulo can only apply on integer types");
        }
        DataType resultType = operand instanceof FloatVal ? DataType.DOUBLE : column.dataType();
        return new ExprWithType(resultType, new BinaryArithExpr(column, op, operand));
    }

    @Override
    public ExprWithType visitMulDivMod(PlanParser.MulDivModContext ctx) {
        return arithmetic(ctx.expr(0).accept(this), ctx.expr(1).accept(this), toArithOpType(ctx.op));
    }

    @Override
    public ExprWithType visitAddSub(PlanParser.AddSubContext ctx) {
        return arithmetic(ctx.expr(0).accept(this), ctx.expr(1).accept(this), toArithOpType(ctx.op));
    }

    @Override
    public ExprWithType visitTerm(PlanParser.TermContext ctx) {
        ColumnInfo column = columnOf(ctx.expr(0).accept(this));
        if (column == null) {
            throw new ExpressionSemanticException("the left operand of in operation must be a field");
        }
        if (column.dataType() == DataType.ARRAY || column.dataType().isVectorType()) {
            throw new ExpressionSemanticException(
                    String.format("in operation on %s field is unsupported", column.dataType())
            );
        }

        ExprWithType right = ctx.expr(1).accept(this);
        Expr term;
        String template = templateOf(right);
        if (template != null) {
            term = new TermExpr(column, List.of(), template);
        } else if (constantOf(right) instanceof ArrayVal array) {
            List<GenericValue> values = new ArrayList<>();
            for (GenericValue element : array.elements()) {
                try {
                    values.add(ValueOps.castValue(column.dataType(), element));
                } catch (ExpressionSemanticException e) {
                    throw new ExpressionSemanticException(
                            String.format("value '%s' in list cannot be casted to %s", ValueOps.format(element), column.dataType()),
                            e
                    );
                }
            }
            term = new TermExpr(column, values, null);
        } else {
            throw new ExpressionSemanticException("the right operand of in operation must be a list");
        }

        if (ctx.NOT() != null) {
            term = new UnaryExpr(UnaryExpr.UnaryOp.NOT, term);
        }
        return new ExprWithType(DataType.BOOL, term);
    }

    @Override
    public ExprWithType visitIsNull(PlanParser.IsNullContext ctx) {
        ColumnInfo column = columnOf(ctx.expr().accept(this));
        if (column == null) {
            throw new ExpressionSemanticException("is null operation can only apply on fields");
        }
        NullExpr.NullOp op = ctx.NOT() == null ? NullExpr.NullOp.IS_NULL : NullExpr.NullOp.IS_NOT_NULL;
        return new ExprWithType(DataType.BOOL, new NullExpr(column, op));
    }

    private ExprWithType range(String fieldName,
                               ExprWithType lower,
                               boolean lowerInclusive,
                               ExprWithType upper,
                               boolean upperInclusive) {
        ColumnInfo column = resolveColumn(fieldName);
        if (!column.dataType().isArithmeticType() && !column.dataType().isStringType() && column.dataType() != DataType.JSON) {
            throw new ExpressionSemanticException(
                    String.format("range operation on %s field is unsupported", column.dataType())
            );
        }

        GenericValue lowerValue = constantOf(lower);
        GenericValue upperValue = constantOf(upper);
        String lowerTemplate = templateOf(lower);
        String upperTemplate = templateOf(upper);
        if ((lowerValue == null && lowerTemplate == null) || (upperValue == null && upperTemplate == null)) {
            throw new ExpressionSemanticException("range bounds must be constants");
        }
        if (lowerValue != null) {
            checkComparable(column, lower.dataType(), OpType.GREATER_THAN);
        }
        if (upperValue != null) {
            checkComparable(column, upper.dataType(), OpType.LESS_THAN);
        }
        Expr expr = new BinaryRangeExpr(
                column,
                lowerInclusive,
                upperInclusive,
                lowerValue,
                upperValue,
                lowerTemplate,
                upperTemplate
        );
        return new ExprWithType(DataType.BOOL, expr);
    }

    @Override
    public ExprWithType visitRange(PlanParser.RangeContext ctx) {
        return range(
                ctx.Identifier().getText(),
                ctx.expr(0).accept(this),
                ctx.op1.getType() == PlanParser.LE,
                ctx.expr(1).accept(this),
                ctx.op2.getType() == PlanParser.LE
        );
    }

    @Override
    public ExprWithType visitReverseRange(PlanParser.ReverseRangeContext ctx) {
        return range(
                ctx.Identifier().getText(),
                ctx.expr(1).accept(this),
                ctx.op2.getType() == PlanParser.GE,
                ctx.expr(0).accept(this),
                ctx.op1.getType() == PlanParser.GE
        );
    }

    private ExprWithType comparison(ExprWithType left, ExprWithType right, OpType op) {
        GenericValue leftValue = constantOf(left);
        GenericValue rightValue = constantOf(right);
        if (leftValue != null && rightValue != null) {
            return constant(ValueOps.compare(leftValue, rightValue, op));
        }

        ColumnInfo leftColumn = columnOf(left);
        ColumnInfo rightColumn = columnOf(right);
        if (leftColumn != null && rightColumn != null) {
            checkComparable(leftColumn, rightColumn.dataType(), op);
            return new ExprWithType(DataType.BOOL, new CompareExpr(leftColumn, rightColumn, op));
        }

        // Keep the field on the left-hand side.
        if (leftColumn == null && !(left.expr() instanceof BinaryArithExpr)) {
            if (rightColumn != null || right.expr() instanceof BinaryArithExpr) {
                return comparison(right, left, op.reverse());
            }
            throw new ExpressionSemanticException("comparison is only supported between a field and a constant or another field");
        }

        GenericValue value = constantOf(right);
        String template = templateOf(right);
        if (value == null && template == null) {
            throw new ExpressionSemanticException("comparison is only supported between a field and a constant or another field");
        }

        if (left.expr() instanceof BinaryArithExpr arith) {
            if (value != null) {
                checkComparable(arith.column(), right.dataType(), op);
            }
            Expr expr = new BinaryArithOpEvalRangeExpr(arith.column(), arith.op(), arith.rightOperand(), op, value, template);
            return new ExprWithType(DataType.BOOL, expr);
        }

        if (value != null) {
            checkComparable(leftColumn, right.dataType(), op);
            if (leftColumn.dataType() == DataType.ARRAY) {
                value = ValueOps.castValue(leftColumn, value);
            }
        } else if (leftColumn.dataType().isVectorType() || !ValueOps.supportsOperator(leftColumn.dataType(), op)) {
            throw new ExpressionSemanticException(
                    String.format("%s is not supported on %s fields", op, leftColumn.dataType())
            );
        }
        return new ExprWithType(DataType.BOOL, new UnaryRangeExpr(leftColumn, op, value, template));
    }

    @Override
    public ExprWithType visitRelational(PlanParser.RelationalContext ctx) {
        return comparison(ctx.expr(0).accept(this), ctx.expr(1).accept(this), toOpType(ctx.op));
    }

    @Override
    public ExprWithType visitEquality(PlanParser.EqualityContext ctx) {
        return comparison(ctx.expr(0).accept(this), ctx.expr(1).accept(this), toOpType(ctx.op));
    }

    @Override
    public ExprWithType visitLogicalNot(PlanParser.LogicalNotContext ctx) {
        ExprWithType child = requireBool(ctx.expr().accept(this), "not");
        if (constantOf(child) instanceof BoolVal value) {
            return constant(new BoolVal(!value.value()));
        }
        return new ExprWithType(DataType.BOOL, new UnaryExpr(UnaryExpr.UnaryOp.NOT, child.expr()));
    }

    private ExprWithType logical(ExprWithType left, ExprWithType right, BinaryExpr.BinaryOp op, String operator) {
        requireBool(left, operator);
        requireBool(right, operator);
        if (constantOf(left) instanceof BoolVal l && constantOf(right) instanceof BoolVal r) {
            boolean result = op == BinaryExpr.BinaryOp.LOGICAL_AND ? l.value() && r.value() : l.value() || r.value();
            return constant(new BoolVal(result));
        }
        return new ExprWithType(DataType.BOOL, new BinaryExpr(op, left.expr(), right.expr()));
    }

    @Override
    public ExprWithType visitLogicalAnd(PlanParser.LogicalAndContext ctx) {
        return logical(ctx.expr(0).accept(this), ctx.expr(1).accept(this), BinaryExpr.BinaryOp.LOGICAL_AND, "and");
    }

    @Override
    public ExprWithType visitLogicalOr(PlanParser.LogicalOrContext ctx) {
        return logical(ctx.expr(0).accept(this), ctx.expr(1).accept(this), BinaryExpr.BinaryOp.LOGICAL_OR, "or");
    }
}
