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

import com.sieve.planparser.grammar.PlanLexer;
import com.sieve.planparser.grammar.PlanParser;
import org.antlr.v4.runtime.ANTLRErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.atn.ATNState;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * ParserPool keeps the generated lexers and parsers for reuse across compilations.
 * <p>
 * An instance is handed back through {@code release} only after a compilation that completed
 * without errors; instances that observed an error are dropped and left to the garbage collector.
 * The pool is unbounded: it grows to the number of concurrently running compilations and never shrinks.
 */
public class ParserPool {
    private final ConcurrentLinkedQueue<PlanLexer> lexers = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<PlanParser> parsers = new ConcurrentLinkedQueue<>();
    private final AtomicLong createdLexers = new AtomicLong();
    private final AtomicLong createdParsers = new AtomicLong();

    /**
     * Returns a lexer over the given input, reporting its errors to the given listener only.
     */
    public PlanLexer acquireLexer(CharStream input, ANTLRErrorListener listener) {
        PlanLexer lexer = lexers.poll();
        if (lexer == null) {
            lexer = new PlanLexer(input);
            createdLexers.incrementAndGet();
        } else {
            lexer.setInputStream(input);
        }
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        return lexer;
    }

    /**
     * Returns a parser over the tokens of the given lexer, reporting its errors to the given listener only.
     */
    public PlanParser acquireParser(PlanLexer lexer, ANTLRErrorListener listener) {
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        PlanParser parser = parsers.poll();
        if (parser == null) {
            parser = new PlanParser(tokens);
            parser.setBuildParseTree(true);
            createdParsers.incrementAndGet();
        } else {
            parser.setTokenStream(tokens);
            // reset() keeps the last ATN state, the next root context would inherit it as its invoking state.
            parser.setState(ATNState.INVALID_STATE_NUMBER);
        }
        parser.removeErrorListeners();
        parser.addErrorListener(listener);
        return parser;
    }

    public void release(PlanLexer lexer) {
        lexers.offer(lexer);
    }

    public void release(PlanParser parser) {
        parsers.offer(parser);
    }

    public int idleLexers() {
        return lexers.size();
    }

    public int idleParsers() {
        return parsers.size();
    }

    public long createdLexers() {
        return createdLexers.get();
    }

    public long createdParsers() {
        return createdParsers.get();
    }
}
