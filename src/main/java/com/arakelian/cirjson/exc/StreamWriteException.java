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

package com.arakelian.cirjson.exc;

import com.arakelian.cirjson.CirJsonGenerator;

/**
 * Thrown when a generator is asked to write output that would not be valid CirJSON, for example a
 * value inside an object without a preceding property name, or an unbalanced end marker.
 */
public class StreamWriteException extends CirJsonProcessingException {
    private static final long serialVersionUID = 1L;

    protected transient CirJsonGenerator processor;

    public StreamWriteException(final CirJsonGenerator g, final String msg) {
        this(g, msg, null);
    }

    public StreamWriteException(final CirJsonGenerator g, final String msg, final Throwable cause) {
        super(msg, null, cause);
        this.processor = g;
    }

    @Override
    public CirJsonGenerator getProcessor() {
        return processor;
    }
}
