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

import com.sieve.common.schema.FieldSchema;
import com.sieve.common.schema.SchemaException;
import com.sieve.common.schema.SchemaHelper;
import com.sieve.plan.ColumnExpr;
import com.sieve.plan.ColumnInfo;
import com.sieve.plan.Expr;
import com.sieve.plan.GenericValue;
import com.sieve.plan.IDs;
import com.sieve.plan.Int64Val;
import com.sieve.plan.PlanNode;
import com.sieve.plan.QueryInfo;
import com.sieve.plan.QueryPlanNode;
import com.sieve.plan.StringVal;
import com.sieve.plan.TermExpr;
import com.sieve.plan.VectorAnnsNode;
import com.sieve.plan.VectorType;
import com.sieve.planparser.template.TemplateValue;
import com.sieve.planparser.template.TemplateValues;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Planner builds the plans consumed by the execution engine from filter expressions.
 * <p>
 * A process is expected to create a single Planner at startup; its expression cache and parser pool
 * are shared by all requests and all collections. Every method is safe to call concurrently.
 */
public class Planner {
    /**
     * Tag of the placeholder that carries the query vectors of a search request.
     */
    public static final String PLACEHOLDER_TAG = "$0";
    private static final Logger LOGGER = LoggerFactory.getLogger(Planner.class);
    private final ExprCompiler compiler;

    public Planner(ExprCompiler compiler) {
        this.compiler = compiler;
    }

    /**
     * Creates a planner with a fresh expression cache configured by the given configuration.
     */
    public static Planner create(Config config) {
        ExprCompiler compiler = new ExprCompiler(new ExprCache(config), new ParserPool(), PlanVisitorImpl::analyze);
        return new Planner(compiler);
    }

    /**
     * Compiles an expression into a boolean predicate and fills its template placeholders.
     *
     * @param schema         schema of the target collection
     * @param expr           filter expression, the empty string matches everything
     * @param templateValues values of the template placeholders used by the expression, may be {@code null}
     * @return the predicate
     * @throws PlanCompileException if the expression is malformed, does not type-check or is not a boolean expression
     */
    public Expr parseExpr(SchemaHelper schema, String expr, Map<String, TemplateValue> templateValues) {
        CompileResult result = compiler.compile(schema, expr);
        if (result instanceof CompileResult.Failed failed) {
            throw failed.error().rewrap(
                    String.format("cannot parse expression: %s, error: %s", expr, failed.error().getMessage())
            );
        }

        ExprWithType predicate = ((CompileResult.Compiled) result).exprWithType();
        if (!predicate.canBeExecuted()) {
            throw new ExpressionSemanticException(
                    String.format("predicate is not a boolean expression: %s, data type: %s", expr, predicate.dataType())
            );
        }

        Map<String, GenericValue> values = TemplateValues.unmarshal(templateValues);
        return ExprValueFiller.fill(predicate.expr(), values);
    }

    /**
     * Checks that the given string is a bare field reference and hands the column expression to the checker.
     *
     * @throws PlanCompileException if the identifier cannot be compiled or is not a bare field reference
     */
    public void validateIdentifier(SchemaHelper schema, String identifier, ExprChecker checker) {
        CompileResult result = compiler.compile(schema, identifier);
        if (result instanceof CompileResult.Failed failed) {
            throw failed.error().rewrap(
                    String.format("cannot parse identifier: %s, error: %s", identifier, failed.error().getMessage())
            );
        }

        Expr expr = ((CompileResult.Compiled) result).exprWithType().expr();
        if (!(expr instanceof ColumnExpr)) {
            throw new ExpressionSemanticException(String.format("cannot parse identifier: %s", identifier));
        }
        checker.check(expr);
    }

    /**
     * Builds a scan plan filtered by the given expression.
     */
    public PlanNode createRetrievePlan(SchemaHelper schema, String expr, Map<String, TemplateValue> templateValues) {
        Expr predicate = parseExpr(schema, expr, templateValues);
        return new QueryPlanNode(predicate, false, 0);
    }

    /**
     * Builds a vector search plan over the given vector field, optionally filtered by an expression.
     *
     * @param schema          schema of the target collection
     * @param expr            filter expression, the empty string means no filter
     * @param vectorFieldName name of the searched vector field
     * @param queryInfo       search parameters, passed through as is
     * @param templateValues  values of the template placeholders used by the expression, may be {@code null}
     * @throws PlanCompileException         if the filter expression cannot be compiled
     * @throws SchemaException              if the field does not exist, is not loaded or is not a vector field
     * @throws UnmappedVectorTypeException if the field's vector type has no plan counterpart
     */
    public PlanNode createSearchPlan(SchemaHelper schema,
                                     String expr,
                                     String vectorFieldName,
                                     QueryInfo queryInfo,
                                     Map<String, TemplateValue> templateValues) {
        Expr predicate = null;
        FieldSchema vectorField;
        try {
            if (!expr.isEmpty()) {
                predicate = parseExpr(schema, expr, templateValues);
            }
            vectorField = schema.getFieldFromName(vectorFieldName);
        } catch (PlanCompileException | SchemaException e) {
            LOGGER.info("Failed to create search plan: {}", e.getMessage());
            throw e;
        }

        if (!schema.isFieldLoaded(vectorField.fieldId())) {
            throw new FieldNotLoadedException(vectorFieldName);
        }
        if (!vectorField.dataType().isVectorType()) {
            throw new SchemaException(String.format("field (%s) to search is not of vector data type", vectorFieldName));
        }

        VectorType vectorType = switch (vectorField.dataType()) {
            case BINARY_VECTOR -> VectorType.BINARY_VECTOR;
            case FLOAT_VECTOR -> VectorType.FLOAT_VECTOR;
            case FLOAT16_VECTOR -> VectorType.FLOAT16_VECTOR;
            case BFLOAT16_VECTOR -> VectorType.BFLOAT16_VECTOR;
            case SPARSE_FLOAT_VECTOR -> VectorType.SPARSE_FLOAT_VECTOR;
            default -> {
                LOGGER.error("Invalid vector data type: {}", vectorField.dataType());
                throw new UnmappedVectorTypeException(vectorField.dataType());
            }
        };
        return new VectorAnnsNode(vectorType, predicate, queryInfo, PLACEHOLDER_TAG, vectorField.fieldId());
    }

    /**
     * Builds a plan that fetches the rows with the given primary keys.
     * <p>
     * The plan's limit is the number of ids. An {@link IDs#empty()} id list yields a plan with no
     * values and a zero limit.
     */
    public static PlanNode createRequeryPlan(FieldSchema pkField, IDs ids) {
        List<GenericValue> values = new ArrayList<>();
        switch (ids.getIdField()) {
            case INT_ID -> {
                for (long id : ids.getIntIds()) {
                    values.add(new Int64Val(id));
                }
            }
            case STR_ID -> {
                for (String id : ids.getStrIds()) {
                    values.add(new StringVal(id));
                }
            }
            case NONE -> {
            }
        }

        ColumnInfo column = new ColumnInfo(
                pkField.fieldId(),
                pkField.dataType(),
                true,
                pkField.isAutoId(),
                pkField.isPartitionKey(),
                pkField.isNullable(),
                pkField.elementType()
        );
        return new QueryPlanNode(new TermExpr(column, values, null), false, values.size());
    }
}
