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

/**
 * Thrown when a configured processing limit is exceeded, for example maximum string length or
 * maximum nesting depth.
 */
public class StreamConstraintsException extends CirJsonProcessingException {
    private static final long serialVersionUID = 1L;

    public StreamConstraintsException(final String msg) {
        super(msg);
    }

    public StreamConstraintsException(final String msg, final CirJsonLocation location) {
        super(msg, location);
    }
}
