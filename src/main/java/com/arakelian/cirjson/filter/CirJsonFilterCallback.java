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

package com.arakelian.cirjson.filter;

import java.io.IOException;

/**
 * Callback interface for receiving notifications during CirJSON filtering. Implementations can
 * inject custom content at the start and end of objects that are written to the output, by
 * writing to {@link CirJsonFilter#getGenerator()}.
 */
public interface CirJsonFilterCallback {
    /**
     * Called immediately after the start of an object and its identifier are written to the
     * output.
     *
     * @param filter the filter currently processing the CirJSON
     * @throws IOException if an I/O error occurs
     */
    @SuppressWarnings("unused")
    public default void afterStartObject(final CirJsonFilter filter) throws IOException {
    }

    /**
     * Called immediately before the end of an object is written to the output.
     *
     * @param filter the filter currently processing the CirJSON
     * @throws IOException if an I/O error occurs
     */
    @SuppressWarnings("unused")
    public default void beforeEndObject(final CirJsonFilter filter) throws IOException {
    }
}
