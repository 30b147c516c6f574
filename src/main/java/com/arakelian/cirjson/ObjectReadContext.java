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

import java.io.IOException;

/**
 * Callback used by {@link CirJsonParser#readValueAs(Class)} to turn the value at the current
 * position into an application object. A data binding layer supplies the implementation.
 */
public interface ObjectReadContext {
    public static ObjectReadContext empty() {
        return Empty.INSTANCE;
    }

    /**
     * Reads the value starting at the parser's current token.
     *
     * @param p
     *            parser positioned at the first token of the value
     * @param type
     *            type of value to produce
     * @param <T>
     *            value type
     * @return value read, may be null
     * @throws IOException
     *             if the value cannot be read
     */
    public <T> T readValue(CirJsonParser p, Class<T> type) throws IOException;

    final class Empty implements ObjectReadContext {
        static final Empty INSTANCE = new Empty();

        private Empty() {
        }

        @Override
        public <T> T readValue(final CirJsonParser p, final Class<T> type) {
            throw new UnsupportedOperationException(
                    "No ObjectReadContext configured, cannot read value of type " + type.getName());
        }
    }
}
