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

import java.io.IOException;

/**
 * Wraps an {@link IOException} thrown by the underlying input or output so that transport
 * failures reach callers as a {@link CirJsonProcessingException}.
 */
public class CirJsonIOException extends CirJsonProcessingException {
    private static final long serialVersionUID = 1L;

    /**
     * Wraps the given exception, unless it already is a {@link CirJsonProcessingException}.
     *
     * @param e
     *            exception thrown by the underlying stream
     * @return exception to throw
     */
    public static CirJsonProcessingException wrap(final IOException e) {
        if (e instanceof CirJsonProcessingException) {
            return (CirJsonProcessingException) e;
        }
        return new CirJsonIOException(e);
    }

    public CirJsonIOException(final IOException cause) {
        super(cause.getMessage(), cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
