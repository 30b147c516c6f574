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

import java.io.IOException;

import com.arakelian.cirjson.CirJsonGenerator;
import com.arakelian.cirjson.PrettyPrinter;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Pretty printer that puts every array element and object entry on its own line, indented by
 * two spaces per nesting level, with a space on both sides of the colon.
 *
 * <p>
 * Instances keep track of the current nesting level, so each generator needs its own; see
 * {@link #createInstance()}.
 * </p>
 */
public class DefaultPrettyPrinter implements PrettyPrinter {
    public static final String DEFAULT_INDENT = "  ";

    public static final String DEFAULT_ROOT_VALUE_SEPARATOR = " ";

    private final String indent;

    private final String rootValueSeparator;

    private int nesting;

    public DefaultPrettyPrinter() {
        this(DEFAULT_INDENT, DEFAULT_ROOT_VALUE_SEPARATOR);
    }

    public DefaultPrettyPrinter(final String indent, final String rootValueSeparator) {
        this.indent = Preconditions.checkNotNull(indent);
        this.rootValueSeparator = rootValueSeparator;
    }

    @Override
    public void beforeArrayValues(final CirJsonGenerator g) throws IOException {
        // newline already written by writeStartArray
    }

    @Override
    public void beforeObjectEntries(final CirJsonGenerator g) throws IOException {
        // newline already written by writeStartObject
    }

    public DefaultPrettyPrinter createInstance() {
        return new DefaultPrettyPrinter(indent, rootValueSeparator);
    }

    public int getNesting() {
        return nesting;
    }

    @Override
    public void writeArrayValueSeparator(final CirJsonGenerator g) throws IOException {
        g.writeRaw(',');
        nextLine(g);
    }

    @Override
    public void writeEndArray(final CirJsonGenerator g, final int nrOfValues) throws IOException {
        nesting--;
        nextLine(g);
        g.writeRaw(']');
    }

    @Override
    public void writeEndObject(final CirJsonGenerator g, final int nrOfEntries) throws IOException {
        nesting--;
        nextLine(g);
        g.writeRaw('}');
    }

    @Override
    public void writeObjectEntrySeparator(final CirJsonGenerator g) throws IOException {
        g.writeRaw(',');
        nextLine(g);
    }

    @Override
    public void writeObjectNameValueSeparator(final CirJsonGenerator g) throws IOException {
        g.writeRaw(" : ");
    }

    @Override
    public void writeRootValueSeparator(final CirJsonGenerator g) throws IOException {
        if (rootValueSeparator != null) {
            g.writeRaw(rootValueSeparator);
        }
    }

    @Override
    public void writeStartArray(final CirJsonGenerator g) throws IOException {
        g.writeRaw('[');
        nesting++;
        nextLine(g);
    }

    @Override
    public void writeStartObject(final CirJsonGenerator g) throws IOException {
        g.writeRaw('{');
        nesting++;
        nextLine(g);
    }

    private void nextLine(final CirJsonGenerator g) throws IOException {
        g.writeRaw('\n');
        if (nesting > 0 && !indent.isEmpty()) {
            g.writeRaw(Strings.repeat(indent, nesting));
        }
    }
}
