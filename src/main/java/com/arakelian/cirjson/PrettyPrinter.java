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
 * Hooks a generator calls at each structural point, so that white space and separators can be
 * customized. Implementations write through the generator's raw methods.
 */
public interface PrettyPrinter {
    public void beforeArrayValues(CirJsonGenerator g) throws IOException;

    public void beforeObjectEntries(CirJsonGenerator g) throws IOException;

    public void writeArrayValueSeparator(CirJsonGenerator g) throws IOException;

    public void writeEndArray(CirJsonGenerator g, int nrOfValues) throws IOException;

    public void writeEndObject(CirJsonGenerator g, int nrOfEntries) throws IOException;

    public void writeObjectEntrySeparator(CirJsonGenerator g) throws IOException;

    public void writeObjectNameValueSeparator(CirJsonGenerator g) throws IOException;

    public void writeRootValueSeparator(CirJsonGenerator g) throws IOException;

    public void writeStartArray(CirJsonGenerator g) throws IOException;

    public void writeStartObject(CirJsonGenerator g) throws IOException;
}
