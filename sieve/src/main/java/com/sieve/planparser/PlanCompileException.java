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

import com.sieve.common.SieveException;

/**
 * Base class of the errors produced while compiling an expression. Instances are cached together
 * with successful compilations, so they are never thrown twice: callers throw a copy created by
 * {@link #rewrap(String)} instead.
 */
public abstract class PlanCompileException extends SieveException {
    protected PlanCompileException(String message) {
        super(message);
    }

    protected PlanCompileException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates a new exception of the same kind with the given message, having this one as its cause.
     */
    public abstract PlanCompileException rewrap(String message);
}
