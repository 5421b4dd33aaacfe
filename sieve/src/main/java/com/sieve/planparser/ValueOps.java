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
import com.sieve.plan.ArithOpType;
import com.sieve.plan.ArrayVal;
import com.sieve.plan.BoolVal;
import com.sieve.plan.ColumnInfo;
import com.sieve.plan.FloatVal;
import com.sieve.plan.GenericValue;
import com.sieve.plan.Int64Val;
import com.sieve.plan.OpType;
import com.sieve.plan.StringVal;

import java.util.ArrayList;
import java.util.List;

/**
 * Type rules and constant arithmetic over {@link GenericValue}s.
 */
final class ValueOps {

    private ValueOps() {
    }

    static DataType typeOf(GenericValue value) {
        if (value instanceof BoolVal) {
            return DataType.BOOL;
        } else if (value instanceof Int64Val) {
            return DataType.INT64;
        } else if (value instanceof FloatVal) {
            return DataType.DOUBLE;
        } else if (value instanceof StringVal) {
            return DataType.VARCHAR;
        }
        return DataType.ARRAY;
    }

    static String format(GenericValue value) {
        if (value instanceof BoolVal val) {
            return Boolean.toString(val.value());
        } else if (value instanceof Int64Val val) {
            return Long.toString(val.value());
        } else if (value instanceof FloatVal val) {
            return Double.toString(val.value());
        } else if (value instanceof StringVal val) {
            return val.value();
        }
        List<String> items = new ArrayList<>();
        for (GenericValue element : ((ArrayVal) value).elements()) {
            items.add(format(element));
        }
        return items.toString();
    }

    static ArrayVal newArray(List<GenericValue> elements) {
        DataType elementType = DataType.NONE;
        boolean sameType = true;
        for (GenericValue element : elements) {
            DataType type = typeOf(element);
            if (elementType == DataType.NONE) {
                elementType = type;
            } else if (elementType != type) {
                sameType = false;
            }
        }
        return new ArrayVal(elements, sameType, sameType ? elementType : DataType.NONE);
    }

    private static void checkRange(DataType dataType, long value, long min, long max) {
        if (value < min || value > max) {
            throw new ExpressionSemanticException(String.format("value %d is out of range of %s", value, dataType));
        }
    }

    /**
     * Converts a value into the representation stored for a field of the given type.
     *
     * @throws ExpressionSemanticException if the value cannot be represented by the type
     */
    static GenericValue castValue(DataType dataType, GenericValue value) {
        if (dataType.isIntegerType() && value instanceof Int64Val val) {
            switch (dataType) {
                case INT8 -> checkRange(dataType, val.value(), Byte.MIN_VALUE, Byte.MAX_VALUE);
                case INT16 -> checkRange(dataType, val.value(), Short.MIN_VALUE, Short.MAX_VALUE);
                case INT32 -> checkRange(dataType, val.value(), Integer.MIN_VALUE, Integer.MAX_VALUE);
                default -> {
                }
            }
            return value;
        }
        if (dataType.isFloatingType()) {
            if (value instanceof Int64Val val) {
                return new FloatVal((double) val.value());
            }
            if (value instanceof FloatVal) {
                return value;
            }
        }
        if (dataType.isBoolType() && value instanceof BoolVal) {
            return value;
        }
        if (dataType.isStringType() && value instanceof StringVal) {
            return value;
        }
        if (dataType == DataType.JSON) {
            return value;
        }
        throw new ExpressionSemanticException(
                String.format("cannot cast value to %s, value is %s", dataType, format(value))
        );
    }

    /**
     * Converts a value for the given column. Array columns take array values whose elements are
     * converted to the column's element type.
     */
    static GenericValue castValue(ColumnInfo column, GenericValue value) {
        if (column.dataType() == DataType.ARRAY) {
            if (!(value instanceof ArrayVal array)) {
                throw new ExpressionSemanticException(
                        String.format("cannot cast value to %s, value is %s", DataType.ARRAY, format(value))
                );
            }
            List<GenericValue> elements = new ArrayList<>();
            for (GenericValue element : array.elements()) {
                elements.add(castValue(column.elementType(), element));
            }
            return new ArrayVal(elements, true, column.elementType());
        }
        return castValue(column.dataType(), value);
    }

    /**
     * Returns true if a field of the given type can be compared with a value of the given type.
     */
    static boolean canBeCompared(DataType fieldType, DataType valueType) {
        if (fieldType == DataType.JSON || valueType == DataType.JSON) {
            return valueType != DataType.ARRAY;
        }
        if (fieldType.isArithmeticType()) {
            return valueType.isArithmeticType();
        }
        if (fieldType.isStringType()) {
            return valueType.isStringType();
        }
        return fieldType == valueType && !fieldType.isVectorType();
    }

    /**
     * Returns true if an operator keeps its meaning for operands of the given type.
     */
    static boolean supportsOperator(DataType dataType, OpType op) {
        if (dataType.isBoolType() || dataType == DataType.ARRAY) {
            return op == OpType.EQUAL || op == OpType.NOT_EQUAL;
        }
        return true;
    }

    private static int compareValues(GenericValue left, GenericValue right, OpType op) {
        if (left instanceof Int64Val l && right instanceof Int64Val r) {
            return Long.compare(l.value(), r.value());
        }
        if (isNumber(left) && isNumber(right)) {
            return Double.compare(toDouble(left), toDouble(right));
        }
        if (left instanceof StringVal l && right instanceof StringVal r) {
            return l.value().compareTo(r.value());
        }
        if (left instanceof BoolVal l && right instanceof BoolVal r && (op == OpType.EQUAL || op == OpType.NOT_EQUAL)) {
            return Boolean.compare(l.value(), r.value());
        }
        throw new ExpressionSemanticException(
                String.format("comparisons between %s and %s are not supported", typeOf(left), typeOf(right))
        );
    }

    static BoolVal compare(GenericValue left, GenericValue right, OpType op) {
        int result = compareValues(left, right, op);
        return switch (op) {
            case GREATER_THAN -> new BoolVal(result > 0);
            case GREATER_EQUAL -> new BoolVal(result >= 0);
            case LESS_THAN -> new BoolVal(result < 0);
            case LESS_EQUAL -> new BoolVal(result <= 0);
            case EQUAL -> new BoolVal(result == 0);
            case NOT_EQUAL -> new BoolVal(result != 0);
            default -> throw new ExpressionSemanticException(String.format("unsupported comparison operator: %s", op));
        };
    }

    static boolean isNumber(GenericValue value) {
        return value instanceof Int64Val || value instanceof FloatVal;
    }

    static double toDouble(GenericValue value) {
        if (value instanceof Int64Val val) {
            return val.value();
        }
        return ((FloatVal) value).value();
    }

    static GenericValue arith(GenericValue left, GenericValue right, ArithOpType op) {
        if (!isNumber(left) || !isNumber(right)) {
            throw new ExpressionSemanticException(
                    String.format("%s is not supported between %s and %s", op, typeOf(left), typeOf(right))
            );
        }
        if (left instanceof Int64Val l && right instanceof Int64Val r) {
            return switch (op) {
                case ADD -> new Int64Val(l.value() + r.value());
                case SUB -> new Int64Val(l.value() - r.value());
                case MUL -> new Int64Val(l.value() * r.value());
                case DIV -> {
                    if (r.value() == 0) {
                        throw new ExpressionSemanticException("cannot divide by zero");
                    }
                    yield new Int64Val(l.value() / r.value());
                }
                case MOD -> {
                    if (r.value() == 0) {
                        throw new ExpressionSemanticException("cannot modulo by zero");
                    }
                    yield new Int64Val(l.value() % r.value());
                }
            };
        }
        double l = toDouble(left);
        double r = toDouble(right);
        return switch (op) {
            case ADD -> new FloatVal(l + r);
            case SUB -> new FloatVal(l - r);
            case MUL -> new FloatVal(l * r);
            case DIV -> {
                if (r == 0) {
                    throw new ExpressionSemanticException("cannot divide by zero");
                }
                yield new FloatVal(l / r);
            }
            case MOD -> throw new ExpressionSemanticException("modulo can only apply on integer types");
        };
    }

    static GenericValue power(GenericValue base, GenericValue exponent) {
        if (!isNumber(base) || !isNumber(exponent)) {
            throw new ExpressionSemanticException(
                    String.format("power can only apply on numbers, got %s and %s", typeOf(base), typeOf(exponent))
            );
        }
        return new FloatVal(Math.pow(toDouble(base), toDouble(exponent)));
    }

    static GenericValue negate(GenericValue value) {
        if (value instanceof Int64Val val) {
            return new Int64Val(-val.value());
        }
        if (value instanceof FloatVal val) {
            return new FloatVal(-val.value());
        }
        throw new ExpressionSemanticException(String.format("unary minus is not supported on %s", typeOf(value)));
    }
}
