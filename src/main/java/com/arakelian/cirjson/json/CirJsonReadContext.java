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

package com.arakelian.cirjson.json;

import com.arakelian.cirjson.CirJsonLocation;
import com.arakelian.cirjson.CirJsonParser;
import com.arakelian.cirjson.TokenStreamContext;
import com.arakelian.cirjson.exc.StreamReadException;
import com.arakelian.cirjson.io.ContentReference;

/**
 * Read-side nesting context. Besides the current name and index it records where the container
 * started and the identifier read from its first entry.
 */
public final class CirJsonReadContext extends TokenStreamContext {
    public static CirJsonReadContext createRootContext(final DuplicateDetector dups) {
        return new CirJsonReadContext(null, 0, dups, TYPE_ROOT, 1, 0);
    }

    public static CirJsonReadContext createRootContext(
            final int lineNr,
            final int colNr,
            final DuplicateDetector dups) {
        return new CirJsonReadContext(null, 0, dups, TYPE_ROOT, lineNr, colNr);
    }

    private final CirJsonReadContext parent;

    /** Reused for sibling containers **/
    private CirJsonReadContext child;

    private DuplicateDetector dups;

    private String currentName;

    private Object currentValue;

    private String containerId;

    private int lineNr;

    private int columnNr;

    public CirJsonReadContext(
            final CirJsonReadContext parent,
            final int nestingDepth,
            final DuplicateDetector dups,
            final int type,
            final int lineNr,
            final int columnNr) {
        super(type, -1);
        this.parent = parent;
        this.nestingDepth = nestingDepth;
        this.dups = dups;
        this.lineNr = lineNr;
        this.columnNr = columnNr;
    }

    @Override
    public void assignCurrentValue(final Object value) {
        currentValue = value;
    }

    public CirJsonReadContext clearAndGetParent() {
        currentValue = null;
        return parent;
    }

    public CirJsonReadContext createChildArrayContext(final int line, final int col) {
        CirJsonReadContext ctx = child;
        if (ctx == null) {
            child = ctx = new CirJsonReadContext(this, nestingDepth + 1, dups == null ? null : dups.child(),
                    TYPE_ARRAY, line, col);
        } else {
            ctx.reset(TYPE_ARRAY, line, col);
        }
        return ctx;
    }

    public CirJsonReadContext createChildObjectContext(final int line, final int col) {
        CirJsonReadContext ctx = child;
        if (ctx == null) {
            child = ctx = new CirJsonReadContext(this, nestingDepth + 1, dups == null ? null : dups.child(),
                    TYPE_OBJECT, line, col);
        } else {
            ctx.reset(TYPE_OBJECT, line, col);
        }
        return ctx;
    }

    @Override
    public Object currentValue() {
        return currentValue;
    }

    /**
     * Advances to the next entry and reports whether a comma separator must precede it.
     *
     * @return true if a separator is required
     */
    public boolean expectComma() {
        final int ix = ++index;
        return type != TYPE_ROOT && ix > 0;
    }

    /**
     * Returns the identifier of this container, or null until it has been read.
     *
     * @return container identifier
     */
    public String getContainerId() {
        return containerId;
    }

    @Override
    public String getCurrentName() {
        return currentName;
    }

    public DuplicateDetector getDupDetector() {
        return dups;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public CirJsonReadContext getParent() {
        return parent;
    }

    @Override
    public boolean hasCurrentName() {
        return currentName != null;
    }

    public boolean hasContainerId() {
        return containerId != null;
    }

    private void reset(final int newType, final int line, final int col) {
        type = newType;
        index = -1;
        lineNr = line;
        columnNr = col;
        currentName = null;
        currentValue = null;
        containerId = null;
        if (dups != null) {
            dups.reset();
        }
    }

    public void setContainerId(final String id) {
        this.containerId = id;
    }

    public void setCurrentName(final String name) throws StreamReadException {
        currentName = name;
        if (dups != null && dups.isDuplicate(name)) {
            final Object src = dups.getSource();
            throw new StreamReadException(src instanceof CirJsonParser ? (CirJsonParser) src : null,
                    "Duplicate Object property \"" + name + "\"");
        }
    }

    @Override
    public CirJsonLocation startLocation(final ContentReference reference) {
        return new CirJsonLocation(reference, -1L, -1L, lineNr, columnNr);
    }

    public CirJsonReadContext withDupDetector(final DuplicateDetector dups) {
        this.dups = dups;
        return this;
    }
}
