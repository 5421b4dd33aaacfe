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
import com.sieve.common.schema.SchemaHelper;
import com.sieve.plan.AlwaysTrueExpr;
import com.sieve.planparser.grammar.PlanLexer;
import com.sieve.planparser.grammar.PlanParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ExprCompiler turns an expression string into a {@link CompileResult}.
 * <p>
 * The pipeline probes the {@link ExprCache} first. On a miss, the expression is normalized,
 * tokenized, parsed and handed to the {@link ExprAnalyzer}; the first failing stage ends the
 * compilation. Both successful and failed outcomes are stored in the cache.
 */
public class ExprCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExprCompiler.class);

    private final ExprCache cache;
    private final ParserPool pool;
    private final ExprAnalyzer analyzer;

    public ExprCompiler(ExprCache cache, ParserPool pool, ExprAnalyzer analyzer) {
        this.cache = cache;
        this.pool = pool;
        this.analyzer = analyzer;
    }

    static ExprWithType alwaysTrue() {
        return new ExprWithType(DataType.BOOL, new AlwaysTrueExpr());
    }

    /**
     * Compiles the expression against the given schema, or returns the cached outcome of a previous compilation.
     */
    public CompileResult compile(SchemaHelper schema, String expr) {
        String collectionName = schema.getCollectionName();
        CompileResult result = cache.get(collectionName, expr);
        if (result != null) {
            return result;
        }
        LOGGER.debug("Expression cache miss, collection: {}, expr: {}", collectionName, expr);
        result = compileUncached(schema, expr);
        cache.put(collectionName, expr, result);
        return result;
    }

    CompileResult compileUncached(SchemaHelper schema, String expr) {
        if (expr.isEmpty()) {
            return new CompileResult.Compiled(alwaysTrue());
        }

        String normalized = HanNormalizer.normalize(expr);
        SyntaxErrorListener listener = new SyntaxErrorListener();

        PlanLexer lexer = pool.acquireLexer(CharStreams.fromString(normalized), listener);
        if (listener.hasError()) {
            return new CompileResult.Failed(listener.getError());
        }

        PlanParser parser = pool.acquireParser(lexer, listener);
        if (listener.hasError()) {
            return new CompileResult.Failed(listener.getError());
        }

        PlanParser.ExprContext ast = parser.expr();
        if (listener.hasError()) {
            return new CompileResult.Failed(listener.getError());
        }

        if (parser.getCurrentToken().getType() != Token.EOF) {
            LOGGER.info("Invalid expression: {}", expr);
            return new CompileResult.Failed(new ExpressionSyntaxException(String.format("invalid expression: %s", expr)));
        }

        // The parse tree does not depend on the lexer and the parser anymore.
        pool.release(lexer);
        pool.release(parser);

        try {
            return new CompileResult.Compiled(analyzer.analyze(ast, schema));
        } catch (PlanCompileException e) {
            return new CompileResult.Failed(e);
        }
    }
}
