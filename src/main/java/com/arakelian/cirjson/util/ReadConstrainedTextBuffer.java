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

package com.arakelian.cirjson.util;

import com.arakelian.cirjson.StreamReadConstraints;
import com.arakelian.cirjson.exc.StreamConstraintsException;

/**
 * {@link TextBuffer} used by parsers, which enforces
 * {@link StreamReadConstraints#getMaxStringLength()}.
 */
public final class ReadConstrainedTextBuffer extends TextBuffer {
    private final StreamReadConstraints streamReadConstraints;

    public ReadConstrainedTextBuffer(
            final StreamReadConstraints streamReadConstraints,
            final BufferRecycler bufferRecycler) {
        super(bufferRecycler);
        this.streamReadConstraints = streamReadConstraints;
    }

    @Override
    protected void validateStringLength(final int length) throws StreamConstraintsException {
        streamReadConstraints.validateStringLength(length);
    }
}
