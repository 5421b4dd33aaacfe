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

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.sieve.common.MissingConfigException;
import com.typesafe.config.Config;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * ExprCache maps a (collection name, raw expression) pair to the outcome of its compilation.
 * <p>
 * Failed compilations are cached as well, so a recurring malformed expression is not parsed again
 * until its entry expires. The key does not cover the schema content: a schema change under the
 * same collection name is not visible until the entry's time-to-live lapses.
 * <p>
 * The cache is bounded and evicts the least recently used entries at capacity. It is meant to be
 * created once per process and shared by all compilations.
 */
public class ExprCache {
    public static final String MAX_SIZE_PATH = "plan_parser.expr_cache.max_size";
    public static final String TTL_PATH = "plan_parser.expr_cache.ttl";

    private final Cache<Key, CompileResult> cache;

    public ExprCache(Config config) {
        this(readMaxSize(config), readTtl(config), Ticker.systemTicker());
    }

    public ExprCache(long maxSize, Duration ttl, Ticker ticker) {
        this.cache = CacheBuilder.newBuilder()
                .concurrencyLevel(1)
                .maximumSize(maxSize)
                .expireAfterWrite(ttl.toNanos(), TimeUnit.NANOSECONDS)
                .ticker(ticker)
                .build();
    }

    private static long readMaxSize(Config config) {
        if (!config.hasPath(MAX_SIZE_PATH)) {
            throw new MissingConfigException(MAX_SIZE_PATH + " is missing in configuration");
        }
        return config.getLong(MAX_SIZE_PATH);
    }

    private static Duration readTtl(Config config) {
        if (!config.hasPath(TTL_PATH)) {
            throw new MissingConfigException(TTL_PATH + " is missing in configuration");
        }
        return config.getDuration(TTL_PATH);
    }

    /**
     * Returns the cached outcome or {@code null} if the pair has not been compiled recently.
     */
    public CompileResult get(String collectionName, String expr) {
        return cache.getIfPresent(new Key(collectionName, expr));
    }

    public void put(String collectionName, String expr, CompileResult result) {
        cache.put(new Key(collectionName, expr), result);
    }

    public long size() {
        cache.cleanUp();
        return cache.size();
    }

    record Key(String collectionName, String expr) {
        Key {
            Objects.requireNonNull(collectionName, "collectionName cannot be null");
            Objects.requireNonNull(expr, "expr cannot be null");
        }
    }
}
