/*
 * Copyright 2012-2017 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.arakelian.cirjson;

import org.immutables.value.Value;

import com.arakelian.cirjson.exc.StreamConstraintsException;
import com.google.common.base.Preconditions;

/**
 * Limits applied by generators.
 */
@Value.Immutable(copy = false)
public abstract class StreamWriteConstraints {
    public static final int DEFAULT_MAX_DEPTH = 500;

    private static final StreamWriteConstraints DEFAULTS = ImmutableStreamWriteConstraints.builder().build();

    public static StreamWriteConstraints defaults() {
        return DEFAULTS;
    }

    @Value.Check
    protected void check() {
        Preconditions.checkArgument(getMaxNestingDepth() >= 0, "Cannot set maxNestingDepth to a negative value");
    }

    @Value.Default
    public int getMaxNestingDepth() {
        return DEFAULT_MAX_DEPTH;
    }

    /**
     * Checks the current nesting depth.
     *
     * @param depth
     *            depth after starting a new array or object
     * @throws StreamConstraintsException
     *             if nesting is too deep
     */
    public final void validateNestingDepth(final int depth) throws StreamConstraintsException {
        if (depth > getMaxNestingDepth()) {
            throw new StreamConstraintsException(
                    String.format(
                            "Document nesting depth (%d) exceeds the maximum allowed "
                                    + "(%d, from `StreamWriteConstraints.getMaxNestingDepth()`)",
                            depth,
                            getMaxNestingDepth()));
        }
    }
}
