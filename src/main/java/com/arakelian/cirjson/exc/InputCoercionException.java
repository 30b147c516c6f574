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

import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.CirJsonToken;

/**
 * Thrown when a numeric accessor is called on a value that cannot be represented by the requested
 * type, for example {@code getIntValue()} on a value outside the 32-bit range.
 */
public class InputCoercionException extends StreamReadException {
    private static final long serialVersionUID = 1L;

    private final CirJsonToken inputType;

    private final Class<?> targetType;

    public InputCoercionException(
            final CirJsonParser p,
            final String msg,
            final CirJsonToken inputType,
            final Class<?> targetType) {
        super(p, msg);
        this.inputType = inputType;
        this.targetType = targetType;
    }

    public CirJsonToken getInputType() {
        return inputType;
    }

    public Class<?> getTargetType() {
        return targetType;
    }
}
