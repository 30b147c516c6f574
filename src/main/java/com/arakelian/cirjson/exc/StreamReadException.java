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

import com.arakelian.cirjson.CirJsonLocation;
import com.arakelian.cirjson.CirJsonParser;

/**
 * Thrown when input is not valid CirJSON, for example an unexpected character, a malformed escape
 * or number, a duplicate property name or a missing container identifier.
 */
public class StreamReadException extends CirJsonProcessingException {
    private static final long serialVersionUID = 1L;

    protected transient CirJsonParser processor;

    public StreamReadException(final CirJsonParser p, final String msg) {
        this(p, msg, p != null ? p.currentLocation() : null, null);
    }

    public StreamReadException(final CirJsonParser p, final String msg, final CirJsonLocation location) {
        this(p, msg, location, null);
    }

    public StreamReadException(
            final CirJsonParser p,
            final String msg,
            final CirJsonLocation location,
            final Throwable cause) {
        super(msg, location, cause);
        this.processor = p;
    }

    public StreamReadException(final CirJsonParser p, final String msg, final Throwable cause) {
        this(p, msg, p != null ? p.currentLocation() : null, cause);
    }

    @Override
    public CirJsonParser getProcessor() {
        return processor;
    }

    /**
     * Replaces the parser reference; used when an exception crosses a parser delegate.
     *
     * @param p
     *            parser to report as the source
     * @return this exception
     */
    public StreamReadException withParser(final CirJsonParser p) {
        this.processor = p;
        return this;
    }
}
