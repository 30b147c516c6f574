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

import com.arakelian.cirjson.io.CharacterEscapes;

/**
 * Callback used by {@link CirJsonGenerator#writeObject(Object)} for values the generator cannot
 * write by itself. A data binding layer supplies the implementation.
 */
public interface ObjectWriteContext {
    public static ObjectWriteContext empty() {
        return Empty.INSTANCE;
    }

    /**
     * Returns the character escapes for generators created with this context, or null to use the
     * factory's.
     *
     * @return character escapes, may be null
     */
    public default CharacterEscapes getCharacterEscapes() {
        return null;
    }

    /**
     * Returns the pretty printer to use for generators created with this context, or null.
     *
     * @return pretty printer, may be null
     */
    public default PrettyPrinter getPrettyPrinter() {
        return null;
    }

    public void writeValue(CirJsonGenerator g, Object value) throws IOException;

    final class Empty implements ObjectWriteContext {
        static final Empty INSTANCE = new Empty();

        private Empty() {
        }

        @Override
        public void writeValue(final CirJsonGenerator g, final Object value) {
            throw new UnsupportedOperationException(
                    "No ObjectWriteContext configured, cannot write value of type " + value.getClass().getName());
        }
    }
}
